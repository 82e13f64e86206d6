package intake.queue;

import java.util.Objects;

/**
 * Proof of a claim. Ack and nack only act on a delivery while its current claim id
 * still equals {@code claimId}; once a claim expires and the entry is reclaimed, old
 * tokens are stale.
 *
 * @param groupName consumer group
 * @param entrySeq  queue position
 * @param claimId   id of the claim that produced this token
 */
public record DeliveryToken(String groupName, long entrySeq, String claimId) {
  public DeliveryToken {
    Objects.requireNonNull(groupName, "groupName");
    Objects.requireNonNull(claimId, "claimId");
  }
}
