package intake;

import java.util.Objects;

/**
 * Natural key of a message: the origin channel plus the origin-assigned message id.
 *
 * @param sourceId  origin channel or archive identifier
 * @param messageId id assigned by the origin, unique within {@code sourceId}
 */
public record MessageIdentity(String sourceId, String messageId) {
  public MessageIdentity {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(messageId, "messageId");
  }

  @Override
  public String toString() {
    return sourceId + "/" + messageId;
  }
}
