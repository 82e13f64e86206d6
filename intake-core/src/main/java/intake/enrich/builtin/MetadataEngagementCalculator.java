package intake.enrich.builtin;

import intake.spi.EnrichmentService;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Engagement statistics from origin counters in the envelope metadata
 * ({@code views}, {@code forwards}, {@code replies}, {@code reactions}).
 *
 * <p>Missing counters count as zero. Rates are relative to views and are zero when
 * there are no views. A counter that is not a non-negative integer fails the call.
 */
public final class MetadataEngagementCalculator implements EnrichmentService<Map<String, Double>> {
  public static final String VIEWS = "views";
  public static final String FORWARDS = "forwards";
  public static final String REPLIES = "replies";
  public static final String REACTIONS = "reactions";

  @Override
  public Map<String, Double> invoke(String text, Map<String, String> metadata) {
    long views = counter(metadata, VIEWS);
    long forwards = counter(metadata, FORWARDS);
    long replies = counter(metadata, REPLIES);
    long reactions = counter(metadata, REACTIONS);

    Map<String, Double> stats = new LinkedHashMap<>();
    stats.put(VIEWS, (double) views);
    stats.put(FORWARDS, (double) forwards);
    stats.put(REPLIES, (double) replies);
    stats.put(REACTIONS, (double) reactions);
    stats.put("forward_rate", rate(forwards, views));
    stats.put("reaction_rate", rate(reactions, views));
    stats.put("engagement_rate", rate(forwards + replies + reactions, views));
    return stats;
  }

  private static long counter(Map<String, String> metadata, String key) {
    String raw = metadata == null ? null : metadata.get(key);
    if (raw == null || raw.isBlank()) {
      return 0L;
    }
    long value;
    try {
      value = Long.parseLong(raw.strip());
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("metadata " + key + " is not a number: " + raw, e);
    }
    if (value < 0) {
      throw new IllegalArgumentException("metadata " + key + " is negative: " + raw);
    }
    return value;
  }

  private static double rate(long numerator, long views) {
    return views == 0 ? 0.0 : (double) numerator / views;
  }
}
