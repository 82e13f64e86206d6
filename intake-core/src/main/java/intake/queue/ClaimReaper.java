package intake.queue;

import intake.util.DaemonThreadFactory;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodically releases claims whose worker died or stalled.
 *
 * <p>A claim older than {@code claimTimeout} is nacked with
 * {@code "claim expired: held by <worker> since <time>"}, which counts toward the
 * retry bound. Any worker of the group may then claim the entry again.
 *
 * <p>Create instances via {@link #builder()}; call {@link #start()} to schedule.
 */
public final class ClaimReaper implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(ClaimReaper.class.getName());

  private final DurableMessageQueue queue;
  private final Duration claimTimeout;
  private final Duration interval;
  private final int batchSize;

  private ScheduledExecutorService scheduler;
  private volatile ScheduledFuture<?> reapTask;
  private volatile boolean closed;

  private ClaimReaper(Builder builder) {
    this.queue = Objects.requireNonNull(builder.queue, "queue");
    this.claimTimeout = Objects.requireNonNull(builder.claimTimeout, "claimTimeout");
    this.interval = Objects.requireNonNull(builder.interval, "interval");
    if (claimTimeout.isZero() || claimTimeout.isNegative()) {
      throw new IllegalArgumentException("claimTimeout must be positive");
    }
    if (interval.isZero() || interval.isNegative()) {
      throw new IllegalArgumentException("interval must be positive");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    this.batchSize = builder.batchSize;
  }

  public static Builder builder() {
    return new Builder();
  }

  public synchronized void start() {
    if (closed) {
      throw new IllegalStateException("ClaimReaper has been closed");
    }
    if (reapTask != null) {
      return;
    }
    scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("intake-reaper-"));
    long ms = interval.toMillis();
    reapTask = scheduler.scheduleWithFixedDelay(this::runOnce, ms, ms, TimeUnit.MILLISECONDS);
  }

  /**
   * Releases expired claims in batches until a batch comes back short.
   *
   * @return total claims released
   */
  public int runOnce() {
    if (closed) {
      return 0;
    }
    int total = 0;
    try {
      int released;
      do {
        released = queue.reclaimExpired(claimTimeout, batchSize);
        total += released;
      } while (released >= batchSize && !closed);
    } catch (RuntimeException e) {
      logger.log(Level.SEVERE, "Claim reaper cycle failed", e);
    }
    return total;
  }

  @Override
  public synchronized void close() {
    closed = true;
    if (reapTask != null) {
      reapTask.cancel(false);
      reapTask = null;
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

  /** Builder for {@link ClaimReaper}. */
  public static final class Builder {
    private DurableMessageQueue queue;
    private Duration claimTimeout = Duration.ofMinutes(5);
    private Duration interval = Duration.ofSeconds(30);
    private int batchSize = 100;

    private Builder() {}

    /** <b>Required.</b> */
    public Builder queue(DurableMessageQueue queue) {
      this.queue = queue;
      return this;
    }

    /** How long a claim may be held. Defaults to five minutes. */
    public Builder claimTimeout(Duration claimTimeout) {
      this.claimTimeout = claimTimeout;
      return this;
    }

    /** Delay between reaper cycles. Defaults to 30 seconds. */
    public Builder interval(Duration interval) {
      this.interval = interval;
      return this;
    }

    /** Claims released per store round trip. Defaults to 100. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public ClaimReaper build() {
      return new ClaimReaper(this);
    }
  }
}
