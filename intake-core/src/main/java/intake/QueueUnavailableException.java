package intake;

/**
 * Thrown when the durable queue cannot be reached. Enqueue callers receive it
 * synchronously; workers log it and keep claiming.
 */
public class QueueUnavailableException extends IntakeException {
  public QueueUnavailableException(String message, Throwable cause) {
    super(message, cause);
  }
}
