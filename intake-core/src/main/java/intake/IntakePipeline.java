package intake;

import intake.dead.DeadLetterManager;
import intake.enrich.EnrichmentOrchestrator;
import intake.purge.QueuePurgeScheduler;
import intake.queue.ClaimReaper;
import intake.queue.DurableMessageQueue;
import intake.queue.MessageQueue;
import intake.queue.RetryPolicy;
import intake.registry.RuleRegistry;
import intake.route.MessageRouter;
import intake.route.RoutingTable;
import intake.spam.SpamFilter;
import intake.spam.SpamRuleSet;
import intake.spi.ConnectionProvider;
import intake.spi.DeadLetterStore;
import intake.spi.MediaFetcher;
import intake.spi.MediaStore;
import intake.spi.MessageStore;
import intake.spi.MetricsExporter;
import intake.spi.QueueStore;
import intake.worker.WorkerDependencies;
import intake.worker.WorkerPool;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Wires the durable queue, the worker pool, the claim reaper and the optional purge
 * scheduler into one {@link AutoCloseable} unit.
 *
 * <h2>Example</h2>
 * <pre>{@code
 * try (IntakePipeline pipeline = IntakePipeline.builder()
 *     .connectionProvider(connections)
 *     .queueStore(JdbcQueueStores.detect(dataSource))
 *     .messageStore(JdbcMessageStores.detect(dataSource))
 *     .deadLetterStore(new JdbcDeadLetterStore())
 *     .mediaStore(new FileSystemMediaStore(Path.of("/var/lib/intake/media")))
 *     .mediaFetcher(new HttpMediaFetcher(Duration.ofSeconds(30), 50_000_000))
 *     .build()) {
 *   pipeline.queue().enqueue(envelope);
 * }
 * }</pre>
 *
 * <p>With {@link Builder#startWorkers(boolean) startWorkers(false)} only the queue is
 * wired, for processes that enqueue but never process.
 */
public final class IntakePipeline implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(IntakePipeline.class.getName());

  private final DurableMessageQueue queue;
  private final DeadLetterManager deadLetters;
  private final WorkerPool workerPool;
  private final ClaimReaper claimReaper;
  private final QueuePurgeScheduler purgeScheduler;
  private final MetricsExporter metrics;

  private IntakePipeline(DurableMessageQueue queue, DeadLetterManager deadLetters, WorkerPool workerPool,
      ClaimReaper claimReaper, QueuePurgeScheduler purgeScheduler, MetricsExporter metrics) {
    this.queue = queue;
    this.deadLetters = deadLetters;
    this.workerPool = workerPool;
    this.claimReaper = claimReaper;
    this.purgeScheduler = purgeScheduler;
    this.metrics = metrics;
  }

  public static Builder builder() {
    return new Builder();
  }

  public MessageQueue queue() {
    return queue;
  }

  public DeadLetterManager deadLetters() {
    return deadLetters;
  }

  /** The worker pool, or {@code null} when workers were not started. */
  public WorkerPool workerPool() {
    return workerPool;
  }

  /**
   * Shuts down in order: purge scheduler, claim reaper, worker pool. Failures are
   * collected and rethrown after every component had its chance to close.
   */
  @Override
  public void close() {
    RuntimeException first = null;
    for (AutoCloseable component : new AutoCloseable[]{purgeScheduler, claimReaper, workerPool,
        metrics instanceof AutoCloseable c ? c : null}) {
      if (component == null) {
        continue;
      }
      try {
        component.close();
      } catch (Exception e) {
        RuntimeException re = e instanceof RuntimeException r ? r : new IntakeException("Close failed", e);
        if (first == null) first = re; else first.addSuppressed(re);
      }
    }
    if (first != null) {
      throw first;
    }
  }

  /** Builder for {@link IntakePipeline}. */
  public static final class Builder {
    private ConnectionProvider connectionProvider;
    private QueueStore queueStore;
    private MessageStore messageStore;
    private DeadLetterStore deadLetterStore;
    private MediaStore mediaStore;
    private MediaFetcher mediaFetcher;
    private RuleRegistry<SpamRuleSet> spamRules;
    private RuleRegistry<RoutingTable> routingRules;
    private Supplier<EnrichmentOrchestrator> enrichment;
    private MetricsExporter metrics;
    private RetryPolicy retryPolicy;
    private String consumerGroup = "intake-workers";
    private boolean startWorkers = true;
    private int workerCount = 4;
    private int batchSize = 10;
    private int maxRetries = 3;
    private Duration blockTimeout = Duration.ofSeconds(2);
    private Duration drainTimeout = Duration.ofSeconds(5);
    private Duration claimTimeout = Duration.ofMinutes(5);
    private Duration reaperInterval = Duration.ofSeconds(30);
    private Duration subServiceTimeout = Duration.ofSeconds(5);
    private Duration overallEnrichmentTimeout = Duration.ofSeconds(15);
    private Duration purgeRetention;
    private Duration purgeInterval = Duration.ofHours(1);
    private int purgeBatchSize = 500;
    private boolean retrySubServices = true;
    private String workerIdPrefix;
    private final AtomicBoolean built = new AtomicBoolean(false);

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

    /** <b>Required</b> when workers are started. */
    public Builder messageStore(MessageStore messageStore) {
      this.messageStore = messageStore;
      return this;
    }

    /** <b>Required.</b> */
    public Builder deadLetterStore(DeadLetterStore deadLetterStore) {
      this.deadLetterStore = deadLetterStore;
      return this;
    }

    /** <b>Required</b> when workers are started. */
    public Builder mediaStore(MediaStore mediaStore) {
      this.mediaStore = mediaStore;
      return this;
    }

    /** <b>Required</b> when workers are started. */
    public Builder mediaFetcher(MediaFetcher mediaFetcher) {
      this.mediaFetcher = mediaFetcher;
      return this;
    }

    /** Optional. Defaults to {@link SpamRuleSet#defaults()}. */
    public Builder spamRules(RuleRegistry<SpamRuleSet> spamRules) {
      this.spamRules = spamRules;
      return this;
    }

    /** Optional. Defaults to {@link RoutingTable#defaults()}. */
    public Builder routingRules(RuleRegistry<RoutingTable> routingRules) {
      this.routingRules = routingRules;
      return this;
    }

    /**
     * Creates the enrichment orchestrator of each worker. Called once per worker.
     *
     * <p>Optional. Defaults to an orchestrator over the built-in sub-services with the
     * configured timeouts.
     */
    public Builder enrichment(Supplier<EnrichmentOrchestrator> enrichment) {
      this.enrichment = enrichment;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public Builder retryPolicy(RetryPolicy retryPolicy) {
      this.retryPolicy = retryPolicy;
      return this;
    }

    /** Defaults to {@code intake-workers}. Created on build if missing. */
    public Builder consumerGroup(String consumerGroup) {
      this.consumerGroup = consumerGroup;
      return this;
    }

    /** Defaults to {@code true}. */
    public Builder startWorkers(boolean startWorkers) {
      this.startWorkers = startWorkers;
      return this;
    }

    public Builder workerCount(int workerCount) {
      this.workerCount = workerCount;
      return this;
    }

    public Builder batchSize(int batchSize) {
      this.batchSize = batchSize;
      return this;
    }

    public Builder maxRetries(int maxRetries) {
      this.maxRetries = maxRetries;
      return this;
    }

    public Builder blockTimeout(Duration blockTimeout) {
      this.blockTimeout = blockTimeout;
      return this;
    }

    public Builder drainTimeout(Duration drainTimeout) {
      this.drainTimeout = drainTimeout;
      return this;
    }

    public Builder claimTimeout(Duration claimTimeout) {
      this.claimTimeout = claimTimeout;
      return this;
    }

    public Builder reaperInterval(Duration reaperInterval) {
      this.reaperInterval = reaperInterval;
      return this;
    }

    public Builder subServiceTimeout(Duration subServiceTimeout) {
      this.subServiceTimeout = subServiceTimeout;
      return this;
    }

    public Builder overallEnrichmentTimeout(Duration overallEnrichmentTimeout) {
      this.overallEnrichmentTimeout = overallEnrichmentTimeout;
      return this;
    }

    /** Whether a failed sub-service call is retried once. Defaults to {@code true}. */
    public Builder retrySubServices(boolean retrySubServices) {
      this.retrySubServices = retrySubServices;
      return this;
    }

    /** Enables purging of acked deliveries older than {@code retention}. Off by default. */
    public Builder purgeRetention(Duration retention) {
      this.purgeRetention = retention;
      return this;
    }

    public Builder purgeInterval(Duration purgeInterval) {
      this.purgeInterval = purgeInterval;
      return this;
    }

    public Builder purgeBatchSize(int purgeBatchSize) {
      this.purgeBatchSize = purgeBatchSize;
      return this;
    }

    public Builder workerIdPrefix(String workerIdPrefix) {
      this.workerIdPrefix = workerIdPrefix;
      return this;
    }

    public IntakePipeline build() {
      if (!built.compareAndSet(false, true)) {
        throw new IllegalStateException("build() already called on this builder");
      }
      Objects.requireNonNull(connectionProvider, "connectionProvider");
      Objects.requireNonNull(queueStore, "queueStore");
      Objects.requireNonNull(deadLetterStore, "deadLetterStore");
      MetricsExporter m = metrics != null ? metrics : MetricsExporter.NOOP;

      DurableMessageQueue queue = DurableMessageQueue.builder()
          .connectionProvider(connectionProvider)
          .queueStore(queueStore)
          .deadLetterStore(deadLetterStore)
          .retryPolicy(retryPolicy)
          .maxRetries(maxRetries)
          .metrics(m)
          .build();
      DeadLetterManager deadLetters = new DeadLetterManager(connectionProvider, deadLetterStore, queue);

      if (!startWorkers) {
        return new IntakePipeline(queue, deadLetters, null, null, null, m);
      }

      Objects.requireNonNull(messageStore, "messageStore");
      Objects.requireNonNull(mediaStore, "mediaStore");
      Objects.requireNonNull(mediaFetcher, "mediaFetcher");
      queue.createGroup(consumerGroup, true);

      SpamFilter spamFilter = new SpamFilter(
          spamRules != null ? spamRules : new RuleRegistry<>("spam", SpamRuleSet.defaults()));
      MessageRouter router = new MessageRouter(
          routingRules != null ? routingRules : new RuleRegistry<>("routing", RoutingTable.defaults()));
      Supplier<EnrichmentOrchestrator> orchestrators = enrichment != null ? enrichment
          : () -> EnrichmentOrchestrator.builder()
              .subServiceTimeout(subServiceTimeout)
              .overallTimeout(overallEnrichmentTimeout)
              .retrySubServices(retrySubServices)
              .metrics(m)
              .build();

      WorkerPool workerPool = WorkerPool.builder()
          .consumerGroup(consumerGroup)
          .workerCount(workerCount)
          .batchSize(batchSize)
          .blockTimeout(blockTimeout)
          .drainTimeout(drainTimeout)
          .workerIdPrefix(workerIdPrefix)
          .dependencies(index -> new WorkerDependencies(queue, connectionProvider, messageStore,
              mediaStore, mediaFetcher, spamFilter, orchestrators.get(), router, m))
          .build();

      ClaimReaper reaper = ClaimReaper.builder()
          .queue(queue)
          .claimTimeout(claimTimeout)
          .interval(reaperInterval)
          .build();
      reaper.start();

      QueuePurgeScheduler purge = null;
      if (purgeRetention != null) {
        purge = QueuePurgeScheduler.builder()
            .connectionProvider(connectionProvider)
            .queueStore(queueStore)
            .retention(purgeRetention)
            .batchSize(purgeBatchSize)
            .interval(purgeInterval)
            .build();
        purge.start();
      }
      logger.info("Intake pipeline started: group=" + consumerGroup + ", workers=" + workerCount
          + ", maxRetries=" + maxRetries);
      return new IntakePipeline(queue, deadLetters, workerPool, reaper, purge, m);
    }
  }
}
