package intake.model;

import java.time.Instant;

/**
 * One failed processing attempt, kept until the entry is acked or dead-lettered.
 *
 * @param attemptNumber 1-based attempt number
 * @param error         failure description
 * @param failedAt      when the nack was recorded
 */
public record AttemptRecord(int attemptNumber, String error, Instant failedAt) {}
