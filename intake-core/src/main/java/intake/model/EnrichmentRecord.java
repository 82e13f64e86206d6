package intake.model;

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregated enrichment output. A component is {@code null} when its sub-service
 * failed; the record itself is never built when every component failed.
 */
public record EnrichmentRecord(
    Classification classification,
    ExtractedEntities entities,
    List<GeoLocation> geolocations,
    Map<String, Double> engagement
) {
  public EnrichmentRecord {
    geolocations = geolocations == null ? null : List.copyOf(geolocations);
    engagement = engagement == null ? null : Collections.unmodifiableMap(new TreeMap<>(engagement));
  }
}
