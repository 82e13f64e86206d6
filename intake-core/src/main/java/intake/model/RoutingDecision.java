package intake.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Where a message goes. Equality covers the partition, the matched trigger and the
 * rule-set version; {@code decidedAt} is informational only, so re-routing the same
 * input against the same rules yields an equal decision.
 */
public final class RoutingDecision {
  private final String targetPartition;
  private final String matchedTrigger;
  private final long rulesVersion;
  private final Instant decidedAt;

  public RoutingDecision(String targetPartition, String matchedTrigger, long rulesVersion, Instant decidedAt) {
    this.targetPartition = Objects.requireNonNull(targetPartition, "targetPartition");
    this.matchedTrigger = matchedTrigger;
    this.rulesVersion = rulesVersion;
    this.decidedAt = Objects.requireNonNull(decidedAt, "decidedAt");
  }

  public String targetPartition() {
    return targetPartition;
  }

  /** The trigger that selected the partition, or {@code null} for topic and default routing. */
  public String matchedTrigger() {
    return matchedTrigger;
  }

  public long rulesVersion() {
    return rulesVersion;
  }

  public Instant decidedAt() {
    return decidedAt;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof RoutingDecision other)) return false;
    return rulesVersion == other.rulesVersion
        && targetPartition.equals(other.targetPartition)
        && Objects.equals(matchedTrigger, other.matchedTrigger);
  }

  @Override
  public int hashCode() {
    return Objects.hash(targetPartition, matchedTrigger, rulesVersion);
  }

  @Override
  public String toString() {
    return "RoutingDecision{partition=" + targetPartition
        + ", trigger=" + matchedTrigger
        + ", rulesVersion=" + rulesVersion + '}';
  }
}
