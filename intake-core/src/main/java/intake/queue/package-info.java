/**
 * The durable queue and its retry machinery.
 *
 * <h2>Delivery lifecycle (per consumer group)</h2>
 * <pre>
 *   enqueue ──▶ NEW ──claim──▶ claimed ──ack──▶ DONE
 *                ▲                │
 *                │              nack / claim expired
 *                │                ▼
 *              RETRY ◀── attempts ≤ maxRetries
 *                                 │ attempts &gt; maxRetries
 *                                 ▼
 *                               DEAD  (+ dead-letter entry with full attempt history)
 * </pre>
 *
 * <p>A claim is identified by a claim id carried in the {@link intake.queue.DeliveryToken}.
 * Acks and nacks with a token whose claim id no longer matches are ignored, which is
 * what makes a late ack from a worker whose claim already expired harmless.
 *
 * @see intake.queue.DurableMessageQueue
 * @see intake.queue.ClaimReaper
 */
package intake.queue;
