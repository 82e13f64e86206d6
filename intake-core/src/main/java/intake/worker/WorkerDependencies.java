package intake.worker;

import intake.enrich.EnrichmentOrchestrator;
import intake.queue.MessageQueue;
import intake.route.MessageRouter;
import intake.spam.SpamFilter;
import intake.spi.ConnectionProvider;
import intake.spi.MediaFetcher;
import intake.spi.MediaStore;
import intake.spi.MessageStore;
import intake.spi.MetricsExporter;

import java.util.Objects;

/**
 * Everything one worker talks to. Built once per worker when the pool starts and
 * passed into its loop; workers share nothing mutable through this bundle unless the
 * factory hands out the same instances on purpose.
 */
public record WorkerDependencies(
    MessageQueue queue,
    ConnectionProvider connectionProvider,
    MessageStore messageStore,
    MediaStore mediaStore,
    MediaFetcher mediaFetcher,
    SpamFilter spamFilter,
    EnrichmentOrchestrator enrichment,
    MessageRouter router,
    MetricsExporter metrics
) implements AutoCloseable {
  public WorkerDependencies {
    Objects.requireNonNull(queue, "queue");
    Objects.requireNonNull(connectionProvider, "connectionProvider");
    Objects.requireNonNull(messageStore, "messageStore");
    Objects.requireNonNull(mediaStore, "mediaStore");
    Objects.requireNonNull(mediaFetcher, "mediaFetcher");
    Objects.requireNonNull(spamFilter, "spamFilter");
    Objects.requireNonNull(enrichment, "enrichment");
    Objects.requireNonNull(router, "router");
    metrics = metrics == null ? MetricsExporter.NOOP : metrics;
  }

  /** Releases the enrichment executor. */
  @Override
  public void close() {
    enrichment.close();
  }

  /** Creates the bundle for worker number {@code workerIndex} (0-based). */
  @FunctionalInterface
  public interface Factory {
    WorkerDependencies create(int workerIndex);
  }
}
