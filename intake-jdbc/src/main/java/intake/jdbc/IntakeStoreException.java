package intake.jdbc;

import intake.IntakeException;

/**
 * Unchecked wrapper for JDBC and serialization errors raised by the JDBC stores.
 */
public final class IntakeStoreException extends IntakeException {
  public IntakeStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
