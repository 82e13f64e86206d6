package intake;

/**
 * Root of the unchecked exceptions raised by the intake pipeline.
 */
public class IntakeException extends RuntimeException {
  public IntakeException(String message) {
    super(message);
  }

  public IntakeException(String message, Throwable cause) {
    super(message, cause);
  }
}
