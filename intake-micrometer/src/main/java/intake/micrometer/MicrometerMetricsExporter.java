package intake.micrometer;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import intake.model.EnrichmentState;
import intake.spi.MetricsExporter;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Micrometer-based implementation of {@link MetricsExporter}.
 *
 * <h3>Counters</h3>
 * <ul>
 *   <li>{@code intake.queue.enqueued} - envelopes enqueued</li>
 *   <li>{@code intake.queue.claimed} - deliveries handed to workers</li>
 *   <li>{@code intake.queue.acked} - deliveries completed</li>
 *   <li>{@code intake.queue.retried} - nacks that scheduled a retry</li>
 *   <li>{@code intake.queue.dead} - deliveries moved to the dead-letter store</li>
 *   <li>{@code intake.queue.reclaimed} - expired claims released by the reaper</li>
 *   <li>{@code intake.messages.spam} - messages rejected by the spam gate</li>
 *   <li>{@code intake.messages.enriched} - stored messages, tagged {@code state}</li>
 *   <li>{@code intake.enrichment.failures} - sub-service failures, tagged {@code service}</li>
 * </ul>
 *
 * <h3>Timers</h3>
 * <ul>
 *   <li>{@code intake.processing.time} - wall time of one message through the pipeline</li>
 * </ul>
 *
 * @see MetricsExporter
 */
public final class MicrometerMetricsExporter implements MetricsExporter, AutoCloseable {

  private final MeterRegistry registry;
  private final String namePrefix;
  private final Counter enqueued;
  private final Counter claimed;
  private final Counter acked;
  private final Counter retried;
  private final Counter dead;
  private final Counter reclaimed;
  private final Counter spam;
  private final Map<EnrichmentState, Counter> enriched = new EnumMap<>(EnrichmentState.class);
  private final Map<String, Counter> subServiceFailures = new ConcurrentHashMap<>();
  private final Timer processingTime;
  private volatile boolean closed;

  /**
   * Creates an exporter with the default metric name prefix {@code "intake"}.
   */
  public MicrometerMetricsExporter(MeterRegistry registry) {
    this(registry, "intake");
  }

  /**
   * @param registry   the Micrometer meter registry
   * @param namePrefix prefix for all meter names (e.g. {@code "osint.intake"})
   */
  public MicrometerMetricsExporter(MeterRegistry registry, String namePrefix) {
    Objects.requireNonNull(registry, "registry");
    Objects.requireNonNull(namePrefix, "namePrefix");
    if (namePrefix.isEmpty()) {
      throw new IllegalArgumentException("namePrefix must not be empty");
    }
    if (namePrefix.endsWith(".")) {
      throw new IllegalArgumentException("namePrefix must not end with '.'");
    }

    this.registry = registry;
    this.namePrefix = namePrefix;
    this.enqueued = Counter.builder(namePrefix + ".queue.enqueued")
        .description("Envelopes enqueued")
        .register(registry);
    this.claimed = Counter.builder(namePrefix + ".queue.claimed")
        .description("Deliveries claimed by workers")
        .register(registry);
    this.acked = Counter.builder(namePrefix + ".queue.acked")
        .description("Deliveries acknowledged")
        .register(registry);
    this.retried = Counter.builder(namePrefix + ".queue.retried")
        .description("Deliveries scheduled for retry")
        .register(registry);
    this.dead = Counter.builder(namePrefix + ".queue.dead")
        .description("Deliveries moved to the dead-letter store")
        .register(registry);
    this.reclaimed = Counter.builder(namePrefix + ".queue.reclaimed")
        .description("Expired claims released")
        .register(registry);
    this.spam = Counter.builder(namePrefix + ".messages.spam")
        .description("Messages rejected as spam")
        .register(registry);
    for (EnrichmentState state : EnrichmentState.values()) {
      enriched.put(state, Counter.builder(namePrefix + ".messages.enriched")
          .description("Messages stored, by enrichment state")
          .tag("state", state.name().toLowerCase(Locale.ROOT))
          .register(registry));
    }
    this.processingTime = Timer.builder(namePrefix + ".processing.time")
        .description("Time to process one message")
        .register(registry);
  }

  @Override
  public void incrementEnqueued() {
    if (closed) return;
    enqueued.increment();
  }

  @Override
  public void incrementClaimed(int count) {
    if (closed) return;
    claimed.increment(count);
  }

  @Override
  public void incrementAcked() {
    if (closed) return;
    acked.increment();
  }

  @Override
  public void incrementRetryScheduled() {
    if (closed) return;
    retried.increment();
  }

  @Override
  public void incrementDeadLettered() {
    if (closed) return;
    dead.increment();
  }

  @Override
  public void incrementReclaimed() {
    if (closed) return;
    reclaimed.increment();
  }

  @Override
  public void incrementSpam() {
    if (closed) return;
    spam.increment();
  }

  @Override
  public void incrementEnriched(EnrichmentState state) {
    if (closed) return;
    enriched.get(state).increment();
  }

  @Override
  public void incrementSubServiceFailure(String service) {
    if (closed) return;
    subServiceFailures.computeIfAbsent(service, s -> Counter.builder(namePrefix + ".enrichment.failures")
        .description("Enrichment sub-service failures")
        .tag("service", s)
        .register(registry))
        .increment();
  }

  @Override
  public void recordProcessingTimeMs(long durationMs) {
    if (closed) return;
    processingTime.record(Duration.ofMillis(durationMs));
  }

  /**
   * Removes all meters registered by this exporter from the registry.
   */
  @Override
  public void close() {
    closed = true;
    List<Meter> meters = new ArrayList<>(List.of(enqueued, claimed, acked, retried, dead,
        reclaimed, spam, processingTime));
    meters.addAll(enriched.values());
    meters.addAll(subServiceFailures.values());
    RuntimeException first = null;
    for (Meter meter : meters) {
      try {
        registry.remove(meter);
      } catch (RuntimeException e) {
        if (first == null) first = e; else first.addSuppressed(e);
      }
    }
    if (first != null) throw first;
  }
}
