package intake.spring.boot;

import intake.route.RoutingTable;
import intake.route.TriggerRule;
import intake.spam.SpamRule;
import intake.spam.SpamRuleSet;

import java.util.List;
import java.util.Map;

/**
 * Builds rule snapshots from {@link IntakeProperties}. Empty rule lists fall back to
 * the built-in defaults.
 */
final class IntakeRules {

  private IntakeRules() {}

  static SpamRuleSet spamRules(IntakeProperties.Spam spam) {
    if (spam.getRules().isEmpty()) {
      return new SpamRuleSet(SpamRuleSet.defaults().rules(), spam.getThreshold());
    }
    List<SpamRule> rules = spam.getRules().stream()
        .map(IntakeRules::spamRule)
        .toList();
    return new SpamRuleSet(rules, spam.getThreshold());
  }

  static RoutingTable routingTable(IntakeProperties.Routing routing) {
    RoutingTable defaults = RoutingTable.defaults();
    List<TriggerRule> rules = routing.getRules().isEmpty() ? defaults.rules()
        : routing.getRules().stream()
            .map(r -> new TriggerRule(r.getPriority(), r.getTargetPartition(), r.getTriggers()))
            .toList();
    Map<String, String> topics = routing.getTopicPartitions().isEmpty()
        ? defaults.topicPartitions() : routing.getTopicPartitions();
    return new RoutingTable(rules, topics, routing.getDefaultPartition());
  }

  private static SpamRule spamRule(IntakeProperties.SpamRuleConfig config) {
    if (config.getPattern() == null || config.getPattern().isBlank()) {
      throw new IllegalArgumentException("intake.spam.rules: rule " + config.getId() + " has no pattern");
    }
    if (config.getMetadataKey() != null && !config.getMetadataKey().isBlank()) {
      return SpamRule.onMetadata(config.getId(), config.getMetadataKey(), config.getPattern(), config.getWeight());
    }
    return SpamRule.regex(config.getId(), config.getPattern(), config.getWeight());
  }
}
