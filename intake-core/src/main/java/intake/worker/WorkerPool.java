package intake.worker;

import intake.QueueUnavailableException;
import intake.queue.Delivery;
import intake.queue.MessageQueue;
import intake.queue.NackResult;
import intake.util.DaemonThreadFactory;
import intake.util.ErrorMessages;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Fixed set of workers that claim from one consumer group and process what they claim.
 *
 * <p>Each worker loops: claim up to {@code batchSize} deliveries (blocking up to
 * {@code blockTimeout}), process each with its own {@link MessageProcessor}, ack on
 * success and nack with the error description on any failure. Queue outages are
 * logged and the loop keeps going.
 *
 * <p>Workers start when the pool is built. {@link #close()} stops claiming, lets each
 * worker finish the envelope in hand, nacks the rest of its batch so other workers can
 * pick them up, and waits up to {@code drainTimeout} before interrupting.
 *
 * @see WorkerPool.Builder
 */
public final class WorkerPool implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(WorkerPool.class.getName());

  static final String SHUTDOWN_ERROR = "worker shutting down before processing";

  private final String consumerGroup;
  private final int batchSize;
  private final Duration blockTimeout;
  private final long drainTimeoutMs;
  private final ExecutorService workers;
  private final List<WorkerDependencies> dependencies;
  private final AtomicBoolean running = new AtomicBoolean(true);
  private final AtomicLong processed = new AtomicLong();
  private final AtomicLong failed = new AtomicLong();

  private WorkerPool(Builder builder) {
    WorkerDependencies.Factory factory = Objects.requireNonNull(builder.dependencies, "dependencies");
    this.consumerGroup = Objects.requireNonNull(builder.consumerGroup, "consumerGroup");
    if (builder.workerCount <= 0) {
      throw new IllegalArgumentException("workerCount must be > 0");
    }
    if (builder.batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    if (builder.blockTimeout.isNegative()) {
      throw new IllegalArgumentException("blockTimeout must be >= 0");
    }
    this.batchSize = builder.batchSize;
    this.blockTimeout = builder.blockTimeout;
    this.drainTimeoutMs = builder.drainTimeout.toMillis();
    String prefix = builder.workerIdPrefix != null
        ? builder.workerIdPrefix
        : "worker-" + UUID.randomUUID().toString().substring(0, 8) + "-";

    List<WorkerDependencies> deps = new ArrayList<>(builder.workerCount);
    for (int i = 0; i < builder.workerCount; i++) {
      deps.add(Objects.requireNonNull(factory.create(i), "dependencies for worker " + i));
    }
    this.dependencies = List.copyOf(deps);

    this.workers = Executors.newFixedThreadPool(builder.workerCount, new DaemonThreadFactory("intake-worker-"));
    for (int i = 0; i < builder.workerCount; i++) {
      String workerId = prefix + (i + 1);
      WorkerDependencies workerDeps = dependencies.get(i);
      workers.submit(() -> workerLoop(workerId, workerDeps));
    }
    logger.info("Started " + builder.workerCount + " worker(s) on group " + consumerGroup);
  }

  public static Builder builder() {
    return new Builder();
  }

  /** Envelopes processed and acked since start. */
  public long processedCount() {
    return processed.get();
  }

  /** Processing attempts that ended in a nack since start. */
  public long failedCount() {
    return failed.get();
  }

  private void workerLoop(String workerId, WorkerDependencies deps) {
    MessageQueue queue = deps.queue();
    MessageProcessor processor = new MessageProcessor(deps);
    while (running.get() && !Thread.currentThread().isInterrupted()) {
      List<Delivery> batch;
      try {
        batch = queue.claim(consumerGroup, workerId, batchSize, blockTimeout);
      } catch (QueueUnavailableException e) {
        logger.log(Level.WARNING, "Claim failed for " + workerId + "; retrying", e);
        pause();
        continue;
      } catch (RuntimeException e) {
        logger.log(Level.SEVERE, "Unexpected claim error in " + workerId, e);
        pause();
        continue;
      }
      for (int i = 0; i < batch.size(); i++) {
        if (!running.get()) {
          releaseRemaining(queue, batch.subList(i, batch.size()));
          break;
        }
        handle(workerId, queue, processor, deps, batch.get(i));
      }
    }
  }

  private void handle(String workerId, MessageQueue queue, MessageProcessor processor,
      WorkerDependencies deps, Delivery delivery) {
    long start = System.nanoTime();
    try {
      processor.process(delivery.envelope());
      settleAck(queue, delivery);
      processed.incrementAndGet();
    } catch (Exception e) {
      failed.incrementAndGet();
      String error = ErrorMessages.describe(e);
      logger.log(Level.WARNING, workerId + " failed " + delivery.envelope().identity()
          + " (attempt " + (delivery.attempts() + 1) + "): " + error, e);
      // JDBC drivers may refuse work on an interrupted thread; restore the flag after the nack
      boolean interrupted = Thread.interrupted();
      try {
        settleNack(queue, delivery, error);
      } finally {
        if (interrupted) {
          Thread.currentThread().interrupt();
        }
      }
    } finally {
      deps.metrics().recordProcessingTimeMs(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start));
    }
  }

  private void settleAck(MessageQueue queue, Delivery delivery) {
    try {
      queue.ack(delivery.token());
    } catch (QueueUnavailableException e) {
      // stored but not acked: the claim expires and the redelivery upserts the same content
      logger.log(Level.SEVERE, "Failed to ack " + delivery.token(), e);
    }
  }

  private void settleNack(MessageQueue queue, Delivery delivery, String error) {
    try {
      NackResult result = queue.nack(delivery.token(), error);
      if (result == NackResult.DEAD_LETTERED) {
        logger.severe("Dead-lettered " + delivery.envelope().identity() + ": " + error);
      }
    } catch (QueueUnavailableException e) {
      logger.log(Level.SEVERE, "Failed to nack " + delivery.token() + "; claim reaper will release it", e);
    }
  }

  private void releaseRemaining(MessageQueue queue, List<Delivery> remaining) {
    for (Delivery delivery : remaining) {
      settleNack(queue, delivery, SHUTDOWN_ERROR);
    }
  }

  private void pause() {
    try {
      Thread.sleep(Math.max(100L, blockTimeout.toMillis()));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /**
   * Stops claiming, waits for in-flight work within the drain timeout, then
   * interrupts whatever is left and closes the worker dependencies.
   */
  @Override
  public void close() {
    if (!running.compareAndSet(true, false)) {
      return;
    }
    workers.shutdown();
    try {
      if (!workers.awaitTermination(drainTimeoutMs + blockTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
        logger.warning("Drain timeout exceeded; interrupting workers of group " + consumerGroup);
        workers.shutdownNow();
        workers.awaitTermination(5, TimeUnit.SECONDS);
      }
    } catch (InterruptedException e) {
      workers.shutdownNow();
      Thread.currentThread().interrupt();
    }
    for (WorkerDependencies deps : dependencies) {
      deps.close();
    }
    logger.info("Worker pool for group " + consumerGroup + " stopped; processed=" + processed.get()
        + ", failed=" + failed.get());
  }

  /** Builder for {@link WorkerPool}. */
  public static final class Builder {
    private WorkerDependencies.Factory dependencies;
    private String consumerGroup;
    private int workerCount = 4;
    private int batchSize = 10;
    private Duration blockTimeout = Duration.ofSeconds(2);
    private Duration drainTimeout = Duration.ofSeconds(5);
    private String workerIdPrefix;

    private Builder() {}

    /**
     * Creates the dependency bundle of each worker.
     *
     * <p><b>Required.</b>
     *
     * @param dependencies per-worker factory
     * @return this builder
     */
    public Builder dependencies(WorkerDependencies.Factory dependencies) {
      this.dependencies = dependencies;
      return this;
    }

    /** <b>Required.</b> The group must already exist in the queue. */
    public Builder consumerGroup(String consumerGroup) {
      this.consumerGroup = consumerGroup;
      return this;
    }

    /** Optional. Defaults to {@code 4}. */
    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    /** Deliveries claimed per round trip. Optional. Defaults to {@code 10}. */
    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    /** How long an empty claim waits. Optional. Defaults to two seconds. */
    public Builder blockTimeout(Duration blockTimeout) {
      this.blockTimeout = Objects.requireNonNull(blockTimeout, "blockTimeout");
      return this;
    }

    /** Optional. Defaults to five seconds. */
    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = Objects.requireNonNull(drainTimeout, "drainTimeout");
      return this;
    }

    /**
     * Prefix of the worker ids recorded on claims, e.g. the host or pod name.
     *
     * <p>Optional. Defaults to {@code worker-<random>-}.
     */
    public Builder workerIdPrefix(String workerIdPrefix) {
      this.workerIdPrefix = workerIdPrefix;
      return this;
    }

    public WorkerPool build() {
      return new WorkerPool(this);
    }
  }
}
