package intake.queue;

import intake.MessageEnvelope;
import intake.model.DeadLetterEntry;
import intake.model.ProcessingAttempt;

import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * Durable, ordered, at-least-once queue with per-consumer-group delivery tracking.
 *
 * <p>Every registered group sees every entry enqueued after it was created. Within a
 * group an entry is handed to at most one worker at a time; it is redelivered when the
 * worker nacks it or its claim expires.
 */
public interface MessageQueue {

  /**
   * Appends an envelope. Returns once the entry is durable.
   *
   * @return the queue position, strictly increasing
   * @throws intake.QueueUnavailableException if the queue cannot be reached
   */
  long enqueue(MessageEnvelope envelope);

  /**
   * Registers a consumer group. Idempotent.
   *
   * @param fromStart whether the group also receives entries enqueued before it existed
   * @return {@code true} if the group was created by this call
   */
  boolean createGroup(String groupName, boolean fromStart);

  /**
   * Claims up to {@code maxBatch} deliveries, waiting up to {@code blockTimeout} for
   * entries to become available.
   *
   * @return claimed deliveries in entry order; empty on timeout or interrupt
   * @throws intake.QueueUnavailableException if the queue cannot be reached
   */
  List<Delivery> claim(String groupName, String workerId, int maxBatch, Duration blockTimeout);

  /**
   * Marks a delivery processed. Never redelivered to the same group afterwards.
   *
   * @return {@code false} if the token was stale
   */
  boolean ack(DeliveryToken token);

  /**
   * Records a failed attempt. The retry count grows by exactly one; past the retry
   * bound the envelope is dead-lettered with its attempt history.
   */
  NackResult nack(DeliveryToken token, String error);

  /** Current retry bookkeeping of a delivery. */
  Optional<ProcessingAttempt> attempt(DeliveryToken token);

  /**
   * Puts a dead-lettered envelope back on the queue as a new entry delivered only to
   * the group that dead-lettered it, and removes the dead letter in the same
   * transaction. Groups that already processed the envelope do not see it again.
   *
   * @return the new queue position; empty if the dead letter was already replayed or
   *     discarded
   * @throws intake.QueueUnavailableException if the queue cannot be reached; the dead
   *     letter is kept
   */
  OptionalLong requeueDeadLetter(DeadLetterEntry deadLetter);
}
