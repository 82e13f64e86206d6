package intake.route;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Immutable routing configuration.
 *
 * <p>Trigger rules are kept sorted by priority; rules with equal priority keep their
 * declaration order. Topic mappings are consulted in declaration order, so when a
 * message carries several mapped topics the first declared mapping wins.
 *
 * @param rules            trigger rules, sorted by priority
 * @param topicPartitions  topic label to partition, in declaration order
 * @param defaultPartition partition for messages nothing else matched
 */
public record RoutingTable(List<TriggerRule> rules, Map<String, String> topicPartitions, String defaultPartition) {
  public static final String DEFAULT_PARTITION = "messages_general";

  public RoutingTable {
    List<TriggerRule> sorted = new ArrayList<>(rules);
    sorted.sort(Comparator.comparingInt(TriggerRule::priority));
    rules = List.copyOf(sorted);
    topicPartitions = Collections.unmodifiableMap(new LinkedHashMap<>(topicPartitions));
    Objects.requireNonNull(defaultPartition, "defaultPartition");
    if (defaultPartition.isBlank()) {
      throw new IllegalArgumentException("defaultPartition cannot be blank");
    }
  }

  public static RoutingTable defaults() {
    Map<String, String> topics = new LinkedHashMap<>();
    topics.put("combat", "messages_combat");
    topics.put("equipment", "messages_equipment");
    topics.put("civilian", "messages_civilian");
    topics.put("diplomatic", "messages_diplomatic");
    topics.put("general", DEFAULT_PARTITION);
    return new RoutingTable(List.of(
        TriggerRule.of(1, "messages_strikes", "missile strike", "airstrike", "air raid", "ракетний удар", "обстріл"),
        TriggerRule.of(2, "messages_casualties", "casualties", "killed", "wounded", "загинули", "поранені"),
        TriggerRule.of(3, "messages_movements", "convoy", "troop movement", "redeploy", "колона"),
        TriggerRule.of(4, "messages_equipment", "HIMARS", "ATACMS", "Leopard", "Bradley", "Storm Shadow", "F-16"),
        TriggerRule.of(5, "messages_drones", "shahed", "drone", "UAV", "дрон", "FPV")
    ), topics, DEFAULT_PARTITION);
  }
}
