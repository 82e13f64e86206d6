package intake;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Thrown when every enrichment sub-service failed for a message. Unlike a partial
 * failure this counts as a processing attempt failure and triggers a nack.
 */
public class TotalEnrichmentFailureException extends IntakeException {
  private final Map<String, String> failures;

  public TotalEnrichmentFailureException(Map<String, String> failures) {
    super("all enrichment services failed: " + failures);
    this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
  }

  /** Sub-service name to failure description. */
  public Map<String, String> failures() {
    return failures;
  }
}
