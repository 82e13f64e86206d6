/**
 * Durable ingestion pipeline for scraped channel messages.
 *
 * <h2>Flow</h2>
 * <ol>
 *   <li>An upstream scraper hands a {@link intake.MessageEnvelope} to
 *       {@link intake.queue.MessageQueue#enqueue}. The call returns once the entry is
 *       durable.</li>
 *   <li>Workers of a {@link intake.worker.WorkerPool} claim batches per consumer group.
 *       Each claimed envelope runs through the spam gate, media archiving, enrichment,
 *       routing and an idempotent upsert keyed by ({@code sourceId}, {@code messageId}).</li>
 *   <li>Success acks the delivery. Any failure nacks it; the retry count grows and the
 *       entry becomes claimable again after a backoff delay. Once the retry bound is
 *       exceeded the entry is moved to the dead-letter store together with its full
 *       attempt history.</li>
 * </ol>
 *
 * <p>Delivery is at-least-once. Exactly-once storage follows from the upsert, not from
 * the queue.
 *
 * <h2>Wiring</h2>
 * {@link intake.IntakePipeline} assembles the queue, workers, claim reaper and purge
 * scheduler behind one {@link java.lang.AutoCloseable}. Spring Boot users get the same
 * wiring from {@code intake-spring-boot-starter}.
 */
package intake;
