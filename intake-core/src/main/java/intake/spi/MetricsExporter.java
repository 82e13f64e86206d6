package intake.spi;

import intake.model.EnrichmentState;

/**
 * Observability hook for pipeline counters and timings.
 *
 * <p>{@link #NOOP} discards everything. {@code intake-micrometer} bridges to Micrometer.
 */
public interface MetricsExporter {

    MetricsExporter NOOP = new Noop();

    /** An envelope became durable in the queue. */
    void incrementEnqueued();

    /** A worker claimed {@code count} deliveries. */
    void incrementClaimed(int count);

    /** A delivery was acked. */
    void incrementAcked();

    /** A nack scheduled another attempt. */
    void incrementRetryScheduled();

    /** A nack exceeded the retry bound and moved the envelope to the dead-letter store. */
    void incrementDeadLettered();

    /** The claim reaper released an expired claim. */
    void incrementReclaimed();

    /** The spam gate rejected a message. */
    void incrementSpam();

    /**
     * A message was enriched and stored.
     *
     * @param state FULL or PARTIAL
     */
    void incrementEnriched(EnrichmentState state);

    /**
     * An enrichment sub-service failed for one message after its retry.
     *
     * @param service sub-service name
     */
    default void incrementSubServiceFailure(String service) {
    }

    /**
     * Records the wall time spent processing one envelope, success or not.
     *
     * @param durationMs non-negative duration
     */
    default void recordProcessingTimeMs(long durationMs) {
    }

    /** No-op implementation. */
    final class Noop implements MetricsExporter {
        @Override
        public void incrementEnqueued() {
        }

        @Override
        public void incrementClaimed(int count) {
        }

        @Override
        public void incrementAcked() {
        }

        @Override
        public void incrementRetryScheduled() {
        }

        @Override
        public void incrementDeadLettered() {
        }

        @Override
        public void incrementReclaimed() {
        }

        @Override
        public void incrementSpam() {
        }

        @Override
        public void incrementEnriched(EnrichmentState state) {
        }
    }
}
