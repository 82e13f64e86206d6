package intake.spi;

import java.util.Map;

/**
 * One enrichment sub-service (classifier, entity extractor, geolocator, engagement
 * calculator). Implementations may block; the orchestrator bounds every call with a
 * timeout.
 *
 * @param <T> the result type
 */
@FunctionalInterface
public interface EnrichmentService<T> {

  /**
   * @param text     message text as received, never {@code null}
   * @param metadata raw envelope metadata
   * @return the result; {@code null} counts as a malformed response
   * @throws Exception on any service error
   */
  T invoke(String text, Map<String, String> metadata) throws Exception;
}
