package intake;

/**
 * Thrown when the thread waiting on an enrichment fan-out is interrupted. The
 * delivery being processed must not be acknowledged.
 */
public class EnrichmentInterruptedException extends IntakeException {
  public EnrichmentInterruptedException(String message, Throwable cause) {
    super(message, cause);
  }
}
