package intake.route;

import intake.model.RoutingDecision;
import intake.registry.RuleRegistry;
import intake.registry.RuleSnapshot;
import intake.util.TextNormalizer;

import java.time.Clock;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Maps a message to exactly one partition.
 *
 * <ol>
 *   <li>Trigger rules, by ascending priority. The first rule with a trigger contained
 *       in the normalized text wins.</li>
 *   <li>Otherwise the first declared topic mapping whose topic the classifier
 *       assigned.</li>
 *   <li>Otherwise the default partition.</li>
 * </ol>
 *
 * <p>Decisions depend only on the text, the topics and the rule snapshot, never on
 * arrival order or concurrent state.
 */
public final class MessageRouter {
  private final RuleRegistry<RoutingTable> table;
  private final Clock clock;

  public MessageRouter(RuleRegistry<RoutingTable> table) {
    this(table, Clock.systemUTC());
  }

  public MessageRouter(RuleRegistry<RoutingTable> table, Clock clock) {
    this.table = Objects.requireNonNull(table, "table");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  public RoutingDecision route(String text, Set<String> topics) {
    RuleSnapshot<RoutingTable> snapshot = table.current();
    RoutingTable rules = snapshot.rules();
    String matchText = TextNormalizer.forMatching(text);

    for (TriggerRule rule : rules.rules()) {
      String trigger = rule.firstMatch(matchText);
      if (trigger != null) {
        return decision(rule.targetPartition(), trigger, snapshot);
      }
    }
    if (topics != null && !topics.isEmpty()) {
      for (Map.Entry<String, String> mapping : rules.topicPartitions().entrySet()) {
        if (topics.contains(mapping.getKey())) {
          return decision(mapping.getValue(), null, snapshot);
        }
      }
    }
    return decision(rules.defaultPartition(), null, snapshot);
  }

  private RoutingDecision decision(String partition, String trigger, RuleSnapshot<RoutingTable> snapshot) {
    return new RoutingDecision(partition, trigger, snapshot.version(), clock.instant());
  }
}
