package intake.util;

/** Helpers for turning failures into stored error strings. */
public final class ErrorMessages {
  public static final int MAX_ERROR_LENGTH = 4000;

  private ErrorMessages() {}

  /**
   * Describes a failure as {@code SimpleClassName: message}, walking to the root cause
   * when the top-level exception only wraps another one.
   */
  public static String describe(Throwable failure) {
    if (failure == null) {
      return null;
    }
    Throwable t = failure;
    while (t.getMessage() == null && t.getCause() != null && t.getCause() != t) {
      t = t.getCause();
    }
    String message = t.getMessage();
    String text = message == null
        ? t.getClass().getSimpleName()
        : t.getClass().getSimpleName() + ": " + message;
    return truncate(text);
  }

  public static String truncate(String error) {
    if (error == null || error.length() <= MAX_ERROR_LENGTH) {
      return error;
    }
    return error.substring(0, MAX_ERROR_LENGTH);
  }
}
