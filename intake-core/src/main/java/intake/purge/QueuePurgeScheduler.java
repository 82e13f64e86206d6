package intake.purge;

import intake.spi.ConnectionProvider;
import intake.spi.QueueStore;
import intake.util.DaemonThreadFactory;

import java.sql.Connection;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Deletes acked deliveries older than a retention period, together with queue
 * entries no group still references. DEAD deliveries are kept; their envelopes live on
 * in the dead-letter store until an operator acts.
 *
 * <p>Each cycle deletes in batches until a batch comes back short. Each batch uses its
 * own auto-committed connection to keep lock times short.
 */
public final class QueuePurgeScheduler implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(QueuePurgeScheduler.class.getName());

  private final ConnectionProvider connectionProvider;
  private final QueueStore queueStore;
  private final Duration retention;
  private final int batchSize;
  private final Duration interval;
  private final Clock clock;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> purgeTask;
  private volatile boolean closed;

  private QueuePurgeScheduler(Builder builder) {
    this.connectionProvider = Objects.requireNonNull(builder.connectionProvider, "connectionProvider");
    this.queueStore = Objects.requireNonNull(builder.queueStore, "queueStore");
    if (builder.retention.isNegative()) {
      throw new IllegalArgumentException("retention must be >= 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.interval.isZero() || builder.interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    this.retention = builder.retention;
    this.batchSize = builder.batchSize;
    this.interval = builder.interval;
    this.clock = builder.clock != null ? builder.clock : Clock.systemUTC();
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("QueuePurgeScheduler has been closed");
    }
    if (purgeTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("intake-purge-"));
    long seconds = Math.max(1L, interval.toSeconds());
    purgeTask = scheduler.scheduleWithFixedDelay(this::runOnce, seconds, seconds, TimeUnit.SECONDS);
  }

  /**
   * Runs one purge cycle.
   *
   * @return delivery rows deleted
   */
  public long runOnce() {
    if (closed) {
      return 0;
    }
    long total = 0;
    try {
      Instant cutoff = clock.instant().minus(retention);
      int deleted;
      do {
        deleted = purgeBatch(cutoff);
        total += deleted;
      } while (deleted >= batchSize);
      if (total > 0) {
        logger.log(Level.INFO, "Purged {0} acked deliveries older than {1}", new Object[]{total, cutoff});
      }
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Purge cycle failed", e);
    }
    return total;
  }

  private int purgeBatch(Instant cutoff) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return queueStore.purgeDone(conn, cutoff, batchSize);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to obtain connection for purge", e);
      return 0;
    }
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (purgeTask != null) {
      purgeTask.cancel(false);
      purgeTask = null;
    }
    if (scheduler != null) {
      scheduler.shutdownNow();
      try {
        scheduler.awaitTermination(5, TimeUnit.SECONDS);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }

  /** Builder for {@link QueuePurgeScheduler}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private QueueStore queueStore;
    private Duration retention = Duration.ofDays(7);
    private int batchSize = 500;
    private Duration interval = Duration.ofHours(1);
    private Clock clock;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder connectionProvider(ConnectionProvider connectionProvider) {
      this.connectionProvider = connectionProvider;
      return this;
    }

    /** <b>Required.</b> */
    public Builder queueStore(QueueStore queueStore) {
      this.queueStore = queueStore;
      return this;
    }

    /** How long acked deliveries are kept. Defaults to seven days. */
    public Builder retention(Duration retention) {
      this.retention = Objects.requireNonNull(retention, "retention");
      return this;
    }

    /** Rows deleted per batch. Defaults to 500. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** Delay between cycles, rounded to whole seconds. Defaults to one hour. */
    public Builder interval(Duration interval) {
      this.interval = Objects.requireNonNull(interval, "interval");
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    public QueuePurgeScheduler build() {
      return new QueuePurgeScheduler(this);
    }
  }
}
