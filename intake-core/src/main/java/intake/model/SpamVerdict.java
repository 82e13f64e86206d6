package intake.model;

import java.util.List;
import java.util.Objects;

/**
 * Outcome of the spam gate.
 *
 * @param spam         whether the message was rejected
 * @param confidence   confidence in {@code spam}, in [0, 1]
 * @param matchedRules ids of every rule that matched, in evaluation order
 */
public record SpamVerdict(boolean spam, double confidence, List<String> matchedRules) {
  public SpamVerdict {
    if (confidence < 0.0 || confidence > 1.0 || Double.isNaN(confidence)) {
      throw new IllegalArgumentException("confidence must be in [0, 1]: " + confidence);
    }
    matchedRules = List.copyOf(Objects.requireNonNull(matchedRules, "matchedRules"));
  }

  public static SpamVerdict clean() {
    return new SpamVerdict(false, 1.0, List.of());
  }
}
