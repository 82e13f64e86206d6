package intake.queue;

import java.time.Duration;

/**
 * Computes how long a nacked delivery waits before it becomes claimable again.
 *
 * @see ExponentialBackoffRetryPolicy
 */
@FunctionalInterface
public interface RetryPolicy {

    /**
     * @param attempts failed attempts recorded so far, 1-based
     * @return non-negative delay
     */
    Duration delayAfter(int attempts);

    /** Makes retries claimable immediately. Used by tests. */
    static RetryPolicy immediate() {
        return attempts -> Duration.ZERO;
    }
}
