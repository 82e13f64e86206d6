package intake.spam;

import intake.model.SpamVerdict;
import intake.registry.RuleRegistry;
import intake.registry.RuleSnapshot;
import intake.util.TextNormalizer;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Single-pass spam gate.
 *
 * <p>Every rule of the current snapshot is evaluated in order and every match is
 * reported. The first matching rule whose weight reaches the threshold decides: the
 * message is spam with that weight as confidence. Without such a rule the message is
 * clean, with confidence {@code 1 - max(weight of matched rules)}.
 *
 * <p>Pure apart from reading the registry; the same text, metadata and rule version
 * always give the same verdict.
 */
public final class SpamFilter {
  private final RuleRegistry<SpamRuleSet> rules;

  public SpamFilter(RuleRegistry<SpamRuleSet> rules) {
    this.rules = Objects.requireNonNull(rules, "rules");
  }

  public SpamVerdict check(String text, Map<String, String> metadata) {
    RuleSnapshot<SpamRuleSet> snapshot = rules.current();
    String normalized = TextNormalizer.normalize(text);
    Map<String, String> meta = metadata == null ? Map.of() : metadata;

    List<String> matched = new ArrayList<>();
    SpamRule decisive = null;
    double strongestPartial = 0.0;
    for (SpamRule rule : snapshot.rules().rules()) {
      if (!rule.matches(normalized, meta)) {
        continue;
      }
      matched.add(rule.id());
      if (decisive == null && rule.weight() >= snapshot.rules().threshold()) {
        decisive = rule;
      } else if (rule.weight() < snapshot.rules().threshold()) {
        strongestPartial = Math.max(strongestPartial, rule.weight());
      }
    }
    if (decisive != null) {
      return new SpamVerdict(true, decisive.weight(), matched);
    }
    return new SpamVerdict(false, 1.0 - strongestPartial, matched);
  }
}
