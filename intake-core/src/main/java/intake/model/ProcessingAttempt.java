package intake.model;

import java.time.Instant;

/**
 * Retry bookkeeping for one entry within one consumer group.
 *
 * @param groupName      consumer group
 * @param entrySeq       queue position
 * @param attemptCount   failed attempts so far
 * @param lastError      most recent failure description, or {@code null}
 * @param firstClaimedAt first claim time, or {@code null} if never claimed
 * @param status         current delivery status
 */
public record ProcessingAttempt(
    String groupName,
    long entrySeq,
    int attemptCount,
    String lastError,
    Instant firstClaimedAt,
    DeliveryStatus status
) {}
