package intake.queue;

import com.github.f4b6a3.ulid.UlidCreator;
import intake.MessageEnvelope;
import intake.QueueUnavailableException;
import intake.model.AttemptRecord;
import intake.model.DeadLetterEntry;
import intake.model.PendingDelivery;
import intake.model.ProcessingAttempt;
import intake.model.StaleClaim;
import intake.spi.ConnectionProvider;
import intake.spi.DeadLetterStore;
import intake.spi.MetricsExporter;
import intake.spi.QueueStore;
import intake.util.ErrorMessages;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link MessageQueue} backed by a relational database through a {@link QueueStore}.
 *
 * <p>Enqueue writes the entry and one delivery row per consumer group in one
 * transaction. Claims run as a single transaction per batch; within this process a
 * per-group lock serializes them, and the store's conditional updates keep separate
 * processes from claiming the same row. Nack records the failure, then either
 * schedules a retry through the {@link RetryPolicy} or, once the attempt count exceeds
 * {@code maxRetries}, writes a {@link DeadLetterEntry} and marks the delivery DEAD,
 * again in one transaction.
 *
 * <p>A dead letter is replayed by deleting it and enqueueing its envelope for the
 * dead-lettering group alone, in one transaction.
 *
 * <p>With {@code maxRetries = N} an envelope is processed at most {@code N + 1} times
 * per group and its dead-letter history holds exactly {@code N + 1} records.
 *
 * <p>Create instances via {@link #builder()}. Thread-safe.
 */
public final class DurableMessageQueue implements MessageQueue {
  private static final Logger logger = Logger.getLogger(DurableMessageQueue.class.getName());

  private final ConnectionProvider connectionProvider;
  private final QueueStore queueStore;
  private final DeadLetterStore deadLetterStore;
  private final RetryPolicy retryPolicy;
  private final int maxRetries;
  private final long pollIntervalNanos;
  private final MetricsExporter metrics;
  private final Clock clock;

  private final ConcurrentHashMap<String, ReentrantLock> claimLocks = new ConcurrentHashMap<>();
  private final ReentrantLock signalLock = new ReentrantLock();
  private final Condition entriesAvailable = signalLock.newCondition();

  private DurableMessageQueue(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(builder.queueStore, "queueStore");
    this.deadLetterStore = Objects.requireNonNull(builder.deadLetterStore, "deadLetterStore");
    this.retryPolicy = builder.retryPolicy != null
        ? builder.retryPolicy
        : new ExponentialBackoffRetryPolicy(Duration.ofMillis(200), Duration.ofMinutes(1));
    if (builder.maxRetries < 0) {
      throw new IllegalArgumentException("maxRetries must be >= 0");
    }
    this.maxRetries = builder.maxRetries;
    if (builder.pollInterval.isZero() || builder.pollInterval.isNegative()) {
      throw new IllegalArgumentException("pollInterval must be positive");
    }
    this.pollIntervalNanos = builder.pollInterval.toNanos();
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public int maxRetries() {
    return maxRetries;
  }

  @Override
  public long enqueue(MessageEnvelope envelope) {
    Objects.requireNonNull(envelope, "envelope");
    Instant now = clock.instant();
    long seq = inTransaction("enqueue " + envelope.identity(), conn -> {
      long entrySeq = queueStore.insertEntry(conn, envelope, now);
      int groups = queueStore.fanOut(conn, entrySeq, now);
      if (groups == 0) {
        logger.fine("Entry " + entrySeq + " enqueued with no consumer group registered");
      }
      return entrySeq;
    });
    metrics.incrementEnqueued();
    signalAvailable();
    return seq;
  }

  @Override
  public boolean createGroup(String groupName, boolean fromStart) {
    requireGroup(groupName);
    boolean created = inTransaction("create group " + groupName,
        conn -> queueStore.createGroup(conn, groupName, fromStart, clock.instant()));
    if (created) {
      logger.info("Created consumer group " + groupName + (fromStart ? " from start" : ""));
      signalAvailable();
    }
    return created;
  }

  @Override
  public List<Delivery> claim(String groupName, String workerId, int maxBatch, Duration blockTimeout) {
    requireGroup(groupName);
    Objects.requireNonNull(workerId, "workerId");
    if (maxBatch <= 0) {
      throw new IllegalArgumentException("maxBatch must be > 0");
    }
    long deadline = System.nanoTime() + Math.max(0L, blockTimeout.toNanos());
    while (true) {
      List<Delivery> claimed = claimOnce(groupName, workerId, maxBatch);
      if (!claimed.isEmpty()) {
        return claimed;
      }
      long remaining = deadline - System.nanoTime();
      if (remaining <= 0 || !awaitAvailable(Math.min(remaining, pollIntervalNanos))) {
        return List.of();
      }
    }
  }

  private List<Delivery> claimOnce(String groupName, String workerId, int maxBatch) {
    ReentrantLock groupLock = claimLocks.computeIfAbsent(groupName, g -> new ReentrantLock());
    String claimId = UlidCreator.getMonotonicUlid().toString();
    List<PendingDelivery> rows;
    groupLock.lock();
    try {
      rows = inTransaction("claim for group " + groupName,
          conn -> queueStore.claim(conn, groupName, workerId, claimId, clock.instant(), maxBatch));
    } finally {
      groupLock.unlock();
    }
    if (rows.isEmpty()) {
      return List.of();
    }
    metrics.incrementClaimed(rows.size());
    List<Delivery> deliveries = new ArrayList<>(rows.size());
    for (PendingDelivery row : rows) {
      deliveries.add(new Delivery(
          new DeliveryToken(row.groupName(), row.entrySeq(), row.claimId()),
          row.envelope(), row.attempts()));
    }
    return deliveries;
  }

  @Override
  public boolean ack(DeliveryToken token) {
    Objects.requireNonNull(token, "token");
    boolean acked = inTransaction("ack " + token, conn -> {
      int updated = queueStore.markDone(conn, token.groupName(), token.entrySeq(),
          token.claimId(), clock.instant());
      if (updated == 0) {
        return false;
      }
      queueStore.deleteAttempts(conn, token.groupName(), token.entrySeq());
      return true;
    });
    if (acked) {
      metrics.incrementAcked();
    } else {
      logger.warning("Ignoring ack with stale token " + token);
    }
    return acked;
  }

  @Override
  public NackResult nack(DeliveryToken token, String error) {
    Objects.requireNonNull(token, "token");
    String storedError = ErrorMessages.truncate(error == null ? "unknown error" : error);
    NackResult result = inTransaction("nack " + token, conn -> settleFailure(conn, token, storedError));
    switch (result) {
      case STALE_TOKEN -> logger.warning("Ignoring nack with stale token " + token);
      case RETRY_SCHEDULED -> {
        metrics.incrementRetryScheduled();
        signalAvailable();
      }
      case DEAD_LETTERED -> {
        metrics.incrementDeadLettered();
        logger.log(Level.SEVERE, "Entry " + token.entrySeq() + " of group " + token.groupName()
            + " dead-lettered after " + (maxRetries + 1) + " attempts; last error: " + storedError);
      }
    }
    return result;
  }

  private NackResult settleFailure(Connection conn, DeliveryToken token, String error) {
    Instant now = clock.instant();
    String group = token.groupName();
    long seq = token.entrySeq();
    int attempts = queueStore.recordFailure(conn, group, seq, token.claimId(), error, now);
    if (attempts < 0) {
      return NackResult.STALE_TOKEN;
    }
    if (attempts > maxRetries) {
      List<AttemptRecord> history = queueStore.attemptHistory(conn, group, seq);
      MessageEnvelope envelope = queueStore.loadEnvelope(conn, seq)
          .orElseThrow(() -> new IllegalStateException("Entry " + seq + " has no stored envelope"));
      deadLetterStore.insert(conn, new DeadLetterEntry(
          UlidCreator.getMonotonicUlid().toString(), group, seq, envelope, history, now));
      queueStore.markDead(conn, group, seq, now);
      queueStore.deleteAttempts(conn, group, seq);
      return NackResult.DEAD_LETTERED;
    }
    Instant nextAt = now.plus(retryPolicy.delayAfter(attempts));
    queueStore.markRetry(conn, group, seq, nextAt);
    return NackResult.RETRY_SCHEDULED;
  }

  @Override
  public Optional<ProcessingAttempt> attempt(DeliveryToken token) {
    Objects.requireNonNull(token, "token");
    return inTransaction("read attempt " + token,
        conn -> queueStore.attempt(conn, token.groupName(), token.entrySeq()));
  }

  @Override
  public OptionalLong requeueDeadLetter(DeadLetterEntry deadLetter) {
    Objects.requireNonNull(deadLetter, "deadLetter");
    Instant now = clock.instant();
    String group = deadLetter.groupName();
    OptionalLong seq = inTransaction("replay dead letter " + deadLetter.id(), conn -> {
      // the delete takes the row lock, so concurrent replays of one id enqueue once
      if (deadLetterStore.delete(conn, deadLetter.id()) == 0) {
        return OptionalLong.empty();
      }
      long entrySeq = queueStore.insertEntry(conn, deadLetter.envelope(), now);
      if (queueStore.insertDelivery(conn, group, entrySeq, now) == 0) {
        throw new IllegalStateException("Consumer group " + group + " is not registered");
      }
      return OptionalLong.of(entrySeq);
    });
    if (seq.isPresent()) {
      metrics.incrementEnqueued();
      signalAvailable();
    }
    return seq;
  }

  /**
   * Nacks every claim held longer than {@code claimTimeout}. The nack counts as a
   * failed attempt, so a worker that keeps crashing on one envelope still drives it
   * to the dead-letter store.
   *
   * @return number of claims released
   */
  public int reclaimExpired(Duration claimTimeout, int limit) {
    Instant lockedBefore = clock.instant().minus(claimTimeout);
    List<StaleClaim> stale = inTransaction("find stale claims",
        conn -> queueStore.findStaleClaims(conn, lockedBefore, limit));
    int released = 0;
    for (StaleClaim claim : stale) {
      String error = "claim expired: held by " + claim.lockedBy() + " since " + claim.lockedAt();
      NackResult result = nack(new DeliveryToken(claim.groupName(), claim.entrySeq(), claim.claimId()), error);
      if (result != NackResult.STALE_TOKEN) {
        released++;
        metrics.incrementReclaimed();
      }
    }
    if (released > 0) {
      logger.warning("Released " + released + " expired claim(s)");
    }
    return released;
  }

  /** Number of NEW or RETRY deliveries of a group. */
  public int pendingCount(String groupName) {
    requireGroup(groupName);
    return inTransaction("count pending", conn -> queueStore.countPending(conn, groupName));
  }

  private void signalAvailable() {
    signalLock.lock();
    try {
      entriesAvailable.signalAll();
    } finally {
      signalLock.unlock();
    }
  }

  /** Returns {@code false} if interrupted. */
  private boolean awaitAvailable(long nanos) {
    signalLock.lock();
    try {
      entriesAvailable.await(nanos, TimeUnit.NANOSECONDS);
      return true;
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    } finally {
      signalLock.unlock();
    }
  }

  private <T> T inTransaction(String action, TxWork<T> work) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(false);
      try {
        T result = work.execute(conn);
        conn.commit();
        return result;
      } catch (SQLException | RuntimeException e) {
        conn.rollback();
        throw e;
      }
    } catch (SQLException | RuntimeException e) {
      if (e instanceof IllegalArgumentException iae) {
        throw iae;
      }
      throw new QueueUnavailableException("Failed to " + action, e);
    }
  }

  private static void requireGroup(String groupName) {
    Objects.requireNonNull(groupName, "groupName");
    if (groupName.isBlank()) {
      throw new IllegalArgumentException("groupName cannot be blank");
    }
  }

  @FunctionalInterface
  private interface TxWork<T> {
    T execute(Connection conn) throws SQLException;
  }

  /** Builder for {@link DurableMessageQueue}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private QueueStore queueStore;
    private DeadLetterStore deadLetterStore;
    private RetryPolicy retryPolicy;
    private int maxRetries = 3;
    private Duration pollInterval = Duration.ofMillis(100);
    private MetricsExporter metrics;
    private Clock clock;

    private Builder() {}

    /**
     * <b>Required.</b>
     *
     * @param connectionProvider source of JDBC connections
     * @return this builder
     */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder queueStore(QueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /** <b>Required.</b> Receives envelopes whose retries are exhausted. */
    public Builder deadLetterStore(DeadLetterStore deadLetterStore) {
      this.deadLetterStore = deadLetterStore;
      return this;
    }

    /** Optional. Defaults to exponential backoff from 200 ms capped at one minute. */
    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /**
     * Retries allowed after the first failed attempt.
     *
     * <p>Optional. Defaults to {@code 3}. Must be &ge; 0.
     *
     * @param maxRetries retry bound
     * @return this builder
     */
    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    /**
     * How often a blocked claim re-checks the store when no local enqueue wakes it.
     * Entries enqueued by other processes and retries coming due are picked up at
     * this granularity.
     *
     * <p>Optional. Defaults to 100 ms.
     */
    public Builder pollInterval(Duration pollInterval) {
      this.pollInterval = Objects.requireNonNull(pollInterval, "pollInterval");
      return this;
    }

    /** Optional. Defaults to {@link MetricsExporter#NOOP}. */
    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    /** Optional. Defaults to the UTC system clock. */
    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public DurableMessageQueue build() {
      return new DurableMessageQueue(this);
    }
  }
}
