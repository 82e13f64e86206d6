package intake.model;

import intake.MessageEnvelope;

import java.time.Instant;

/**
 * A delivery row as returned by a claim: the entry joined with its per-group state.
 *
 * @param groupName      consumer group that holds the claim
 * @param entrySeq       monotonically increasing queue position
 * @param claimId        id of the claim that locked this row
 * @param attempts       failed processing attempts recorded so far
 * @param firstClaimedAt when any worker of the group first claimed the entry
 * @param envelope       the message payload
 */
public record PendingDelivery(
    String groupName,
    long entrySeq,
    String claimId,
    int attempts,
    Instant firstClaimedAt,
    MessageEnvelope envelope
) {}
