package intake.registry;

import java.time.Instant;
import java.util.Objects;

/**
 * One immutable version of a rule set.
 *
 * @param version  increases by one on every reload, starting at 1
 * @param rules    the rule set
 * @param loadedAt when this version was published
 */
public record RuleSnapshot<T>(long version, T rules, Instant loadedAt) {
  public RuleSnapshot {
    Objects.requireNonNull(rules, "rules");
    Objects.requireNonNull(loadedAt, "loadedAt");
  }
}
