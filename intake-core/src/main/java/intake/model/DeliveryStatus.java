package intake.model;

/**
 * Status of one entry for one consumer group. The numeric code is what the
 * stores persist.
 */
public enum DeliveryStatus {
  NEW(0),
  DONE(1),
  RETRY(2),
  DEAD(3);

  private final int code;

  DeliveryStatus(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }

  public static DeliveryStatus fromCode(int code) {
    for (DeliveryStatus status : values()) {
      if (status.code == code) {
        return status;
      }
    }
    throw new IllegalArgumentException("Unknown delivery status code: " + code);
  }
}
