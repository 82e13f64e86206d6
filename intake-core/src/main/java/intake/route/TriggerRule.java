package intake.route;

import java.util.List;
import java.util.Locale;
import java.util.Objects;

/**
 * Sends messages containing any of {@code triggers} to {@code targetPartition}.
 * Lower priority values are evaluated first.
 *
 * @param priority        evaluation order, ascending
 * @param targetPartition destination partition
 * @param triggers        phrases, matched case-insensitively as substrings of the
 *                        normalized text; checked in declaration order
 */
public record TriggerRule(int priority, String targetPartition, List<String> triggers) {
  public TriggerRule {
    Objects.requireNonNull(targetPartition, "targetPartition");
    if (targetPartition.isBlank()) {
      throw new IllegalArgumentException("targetPartition cannot be blank");
    }
    triggers = List.copyOf(triggers);
    if (triggers.isEmpty()) {
      throw new IllegalArgumentException("rule for " + targetPartition + " has no triggers");
    }
    for (String trigger : triggers) {
      if (trigger.isBlank()) {
        throw new IllegalArgumentException("blank trigger in rule for " + targetPartition);
      }
    }
  }

  public static TriggerRule of(int priority, String targetPartition, String... triggers) {
    return new TriggerRule(priority, targetPartition, List.of(triggers));
  }

  /** First trigger found in {@code matchText} (already lowercased), or {@code null}. */
  String firstMatch(String matchText) {
    for (String trigger : triggers) {
      if (matchText.contains(trigger.toLowerCase(Locale.ROOT))) {
        return trigger;
      }
    }
    return null;
  }
}
