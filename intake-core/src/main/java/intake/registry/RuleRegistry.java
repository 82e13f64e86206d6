package intake.registry;

import java.time.Clock;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;
import java.util.logging.Logger;

/**
 * Holds the current version of a reloadable rule set (spam rules, routing table).
 *
 * <p>Readers call {@link #current()} once per message and use that snapshot for the
 * whole decision, so a concurrent {@link #reload} never produces a decision that mixes
 * two versions. Reloads swap the snapshot atomically; no restart is needed.
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * RuleRegistry<RoutingTable> routing = new RuleRegistry<>("routing", RoutingTable.defaults());
 * MessageRouter router = new MessageRouter(routing);
 * ...
 * routing.reload(loadFromConfig());  // picked up by the next message
 * }</pre>
 *
 * @param <T> immutable rule-set type
 */
public final class RuleRegistry<T> {
  private static final Logger logger = Logger.getLogger(RuleRegistry.class.getName());

  private final String name;
  private final Clock clock;
  private final AtomicReference<RuleSnapshot<T>> current;
  private final Consumer<T> validator;

  public RuleRegistry(String name, T initialRules) {
    this(name, initialRules, rules -> {}, Clock.systemUTC());
  }

  /**
   * @param validator rejects a rule set by throwing {@link IllegalArgumentException};
   *                  runs before every publish, including the initial one
   */
  public RuleRegistry(String name, T initialRules, Consumer<T> validator, Clock clock) {
    this.name = Objects.requireNonNull(name, "name");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.validator = Objects.requireNonNull(validator, "validator");
    validator.accept(Objects.requireNonNull(initialRules, "initialRules"));
    this.current = new AtomicReference<>(new RuleSnapshot<>(1L, initialRules, clock.instant()));
  }

  public String name() {
    return name;
  }

  public RuleSnapshot<T> current() {
    return current.get();
  }

  /**
   * Publishes a new rule set. An invalid rule set leaves the current one in place.
   *
   * @return the published snapshot
   * @throws IllegalArgumentException if the validator rejects the rule set
   */
  public RuleSnapshot<T> reload(T rules) {
    Objects.requireNonNull(rules, "rules");
    validator.accept(rules);
    RuleSnapshot<T> next = current.updateAndGet(
        prev -> new RuleSnapshot<>(prev.version() + 1, rules, clock.instant()));
    logger.info("Reloaded " + name + " rules, now at version " + next.version());
    return next;
  }
}
