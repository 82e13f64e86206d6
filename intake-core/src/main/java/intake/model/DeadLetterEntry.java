package intake.model;

import intake.MessageEnvelope;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * An envelope that exhausted its retries, with every attempt that led here.
 *
 * @param id             dead-letter id (ULID)
 * @param groupName      consumer group whose retries were exhausted
 * @param entrySeq       original queue position
 * @param envelope       the envelope as enqueued
 * @param attemptHistory every failed attempt, oldest first
 * @param promotedAt     when the entry was dead-lettered
 */
public record DeadLetterEntry(
    String id,
    String groupName,
    long entrySeq,
    MessageEnvelope envelope,
    List<AttemptRecord> attemptHistory,
    Instant promotedAt
) {
  public DeadLetterEntry {
    Objects.requireNonNull(id, "id");
    Objects.requireNonNull(groupName, "groupName");
    Objects.requireNonNull(envelope, "envelope");
    attemptHistory = List.copyOf(attemptHistory);
    Objects.requireNonNull(promotedAt, "promotedAt");
  }

  /** The most recent failure, or {@code null} if the history is empty. */
  public String lastError() {
    return attemptHistory.isEmpty() ? null : attemptHistory.get(attemptHistory.size() - 1).error();
  }
}
