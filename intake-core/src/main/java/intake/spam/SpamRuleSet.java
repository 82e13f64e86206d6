package intake.spam;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Ordered spam rules with a decision threshold. Immutable; swap versions through a
 * {@link intake.registry.RuleRegistry}.
 *
 * @param rules     evaluated in order
 * @param threshold minimum rule weight that marks a message as spam, in (0, 1]
 */
public record SpamRuleSet(List<SpamRule> rules, double threshold) {
  public static final double DEFAULT_THRESHOLD = 0.85;

  public SpamRuleSet {
    rules = List.copyOf(rules);
    if (!(threshold > 0.0 && threshold <= 1.0)) {
      throw new IllegalArgumentException("threshold must be in (0, 1]: " + threshold);
    }
    Set<String> ids = new HashSet<>();
    for (SpamRule rule : rules) {
      if (!ids.add(rule.id())) {
        throw new IllegalArgumentException("duplicate spam rule id: " + rule.id());
      }
    }
  }

  /**
   * Built-in rules for Telegram-style channel spam: payment card numbers, donation
   * appeals and runs of money emojis reject a message outright; promotional links only
   * lower the confidence that it is clean.
   */
  public static SpamRuleSet defaults() {
    return new SpamRuleSet(List.of(
        SpamRule.regex("card_numbers", "\\b\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}[\\s-]?\\d{4}\\b", 0.95),
        SpamRule.regex("donation_keywords",
            "\\b(донат|donate|підтримайте|support us|поддержите|донатить)\\b", 0.9),
        SpamRule.regex("excessive_emojis", "(💰|💳|🔥){3,}", 0.85),
        SpamRule.regex("promo_links", "(t\\.me/\\+|bit\\.ly/|tinyurl\\.com/)", 0.4)
    ), DEFAULT_THRESHOLD);
  }
}
