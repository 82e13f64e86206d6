package intake;

/**
 * Thrown when the message store or the media store rejects a write. The envelope
 * being processed is nacked and retried.
 */
public class StoreUnavailableException extends IntakeException {
  public StoreUnavailableException(String message) {
    super(message);
  }

  public StoreUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
