package intake.enrich;

import intake.model.EnrichmentRecord;
import intake.model.EnrichmentState;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * What the orchestrator produced for one message.
 *
 * @param record   the merged record, or {@code null} when every sub-service failed
 * @param failures sub-service name to failure description, in sub-service order
 */
public record EnrichmentOutcome(EnrichmentRecord record, Map<String, String> failures) {
  public EnrichmentOutcome {
    failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    if (record == null && failures.size() < SubService.values().length) {
      throw new IllegalArgumentException("record may only be absent when every sub-service failed");
    }
  }

  public Set<String> failedServices() {
    return failures.keySet();
  }

  public boolean totalFailure() {
    return record == null;
  }

  /** FULL or PARTIAL; only meaningful when {@link #totalFailure()} is false. */
  public EnrichmentState state() {
    return failures.isEmpty() ? EnrichmentState.FULL : EnrichmentState.PARTIAL;
  }
}
