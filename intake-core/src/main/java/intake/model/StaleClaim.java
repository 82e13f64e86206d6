package intake.model;

import java.time.Instant;

/** A claim whose holder has not acked or nacked within the claim timeout. */
public record StaleClaim(
    String groupName,
    long entrySeq,
    String claimId,
    String lockedBy,
    Instant lockedAt
) {}
