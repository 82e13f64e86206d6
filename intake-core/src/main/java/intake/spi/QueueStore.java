package intake.spi;

import intake.MessageEnvelope;
import intake.model.AttemptRecord;
import intake.model.PendingDelivery;
import intake.model.ProcessingAttempt;
import intake.model.StaleClaim;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Persistence contract behind {@link intake.queue.DurableMessageQueue}.
 *
 * <p>The queue keeps one entry row per enqueued envelope and one delivery row per
 * (consumer group, entry). Delivery rows move NEW → DONE, NEW → RETRY → DONE, or
 * NEW/RETRY → DEAD. A row is claimed while {@code locked_by} is set; every mutation
 * of a claimed row is guarded by its {@code claim_id} so a stale token cannot touch a
 * row that has since been reclaimed.
 *
 * <p>All methods receive an explicit {@link Connection}; the caller owns the
 * transaction. Implementations live in {@code intake-jdbc}.
 */
public interface QueueStore {

  /**
   * Inserts an entry and returns its queue position.
   *
   * @param conn       connection inside the enqueue transaction
   * @param envelope   payload
   * @param enqueuedAt enqueue time
   * @return the new, strictly increasing entry sequence
   */
  long insertEntry(Connection conn, MessageEnvelope envelope, Instant enqueuedAt);

  /**
   * Creates a NEW delivery row for every registered consumer group.
   *
   * @return number of delivery rows created
   */
  int fanOut(Connection conn, long entrySeq, Instant availableAt);

  /**
   * Creates a NEW delivery row for a single consumer group.
   *
   * @return 1, or 0 when the group is not registered
   */
  int insertDelivery(Connection conn, String groupName, long entrySeq, Instant availableAt);

  /**
   * Registers a consumer group if it does not exist yet.
   *
   * @param fromStart when {@code true}, deliveries are created for every entry already
   *                  in the queue; otherwise the group only sees later entries
   * @return {@code true} if the group was created by this call
   */
  boolean createGroup(Connection conn, String groupName, boolean fromStart, Instant now);

  /**
   * Claims up to {@code limit} available delivery rows of a group for a worker.
   *
   * <p>A row is available when it is NEW or RETRY, unlocked, and its
   * {@code available_at} is not in the future. Claimed rows get {@code locked_by},
   * {@code locked_at} and {@code claim_id} set, and {@code first_claimed_at} if it was
   * empty. Rows are returned in entry order.
   */
  List<PendingDelivery> claim(Connection conn, String groupName, String workerId,
      String claimId, Instant now, int limit);

  /**
   * Marks a claimed row DONE and releases its lock.
   *
   * @return rows updated: 0 when the claim id no longer matches
   */
  int markDone(Connection conn, String groupName, long entrySeq, String claimId, Instant now);

  /**
   * Increments the attempt count of a claimed row, stores the error and appends an
   * attempt record. The row stays locked.
   *
   * @return the new attempt count, or {@code -1} when the claim id no longer matches
   */
  int recordFailure(Connection conn, String groupName, long entrySeq, String claimId,
      String error, Instant now);

  /** Releases the lock and sets status RETRY with the next availability time. */
  int markRetry(Connection conn, String groupName, long entrySeq, Instant nextAt);

  /** Releases the lock and sets status DEAD. */
  int markDead(Connection conn, String groupName, long entrySeq, Instant now);

  /** Attempt records of one delivery, oldest first. */
  List<AttemptRecord> attemptHistory(Connection conn, String groupName, long entrySeq);

  /** Deletes the attempt records of one delivery. */
  int deleteAttempts(Connection conn, String groupName, long entrySeq);

  /** Loads the envelope stored with an entry. */
  Optional<MessageEnvelope> loadEnvelope(Connection conn, long entrySeq);

  /** Retry bookkeeping for one delivery, if the row exists. */
  Optional<ProcessingAttempt> attempt(Connection conn, String groupName, long entrySeq);

  /**
   * Finds claimed rows locked at or before {@code lockedBefore}, oldest first.
   */
  List<StaleClaim> findStaleClaims(Connection conn, Instant lockedBefore, int limit);

  /** Number of NEW or RETRY rows of a group, locked or not. */
  int countPending(Connection conn, String groupName);

  /**
   * Deletes up to {@code limit} DONE delivery rows finished before {@code before},
   * and entries that no longer have any delivery row.
   *
   * @return number of delivery rows deleted
   */
  int purgeDone(Connection conn, Instant before, int limit);
}
