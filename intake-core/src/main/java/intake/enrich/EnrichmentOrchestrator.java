package intake.enrich;

import intake.EnrichmentInterruptedException;
import intake.enrich.builtin.CoordinateGeolocator;
import intake.enrich.builtin.KeywordTopicClassifier;
import intake.enrich.builtin.MetadataEngagementCalculator;
import intake.enrich.builtin.RegexEntityExtractor;
import intake.model.Classification;
import intake.model.EnrichmentRecord;
import intake.model.ExtractedEntities;
import intake.model.GeoLocation;
import intake.spi.EnrichmentService;
import intake.spi.MetricsExporter;
import intake.util.DaemonThreadFactory;
import intake.util.ErrorMessages;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Calls the four enrichment sub-services concurrently and merges their results.
 *
 * <p>Each call is bounded by {@code subServiceTimeout} and retried at most once. The
 * whole fan-out is bounded by {@code overallTimeout}; sub-services still running when
 * it expires count as failed. A sub-service that fails, times out or returns
 * {@code null} leaves its part of the record empty and is reported in
 * {@link EnrichmentOutcome#failures()}. When all four fail there is no record at all.
 * An interrupted caller gets an {@link EnrichmentInterruptedException} instead of an
 * outcome.
 *
 * <p>Sub-services left unset in the builder fall back to the built-in
 * implementations in {@link intake.enrich.builtin}.
 *
 * <p>Instances are thread-safe. Closing shuts down the executor if the orchestrator
 * created it.
 */
public final class EnrichmentOrchestrator implements AutoCloseable {
  private static final Logger logger = Logger.getLogger(EnrichmentOrchestrator.class.getName());

  private final EnrichmentService<Classification> classifier;
  private final EnrichmentService<ExtractedEntities> entityExtractor;
  private final EnrichmentService<List<GeoLocation>> geolocator;
  private final EnrichmentService<Map<String, Double>> engagement;
  private final ExecutorService executor;
  private final boolean ownsExecutor;
  private final long subServiceTimeoutMs;
  private final long overallTimeoutMs;
  private final int maxCalls;
  private final MetricsExporter metrics;

  private EnrichmentOrchestrator(Builder builder) {
    this.classifier = builder.classifier != null ? builder.classifier : new KeywordTopicClassifier();
    this.entityExtractor = builder.entityExtractor != null ? builder.entityExtractor : new RegexEntityExtractor();
    this.geolocator = builder.geolocator != null ? builder.geolocator : new CoordinateGeolocator();
    this.engagement = builder.engagement != null ? builder.engagement : new MetadataEngagementCalculator();

    if (builder.subServiceTimeout.isZero() || builder.subServiceTimeout.isNegative()) {
      throw new IllegalArgumentException("subServiceTimeout must be positive");
    }
    if (builder.overallTimeout.compareTo(builder.subServiceTimeout) < 0) {
      throw new IllegalArgumentException("overallTimeout must be >= subServiceTimeout");
    }
    this.subServiceTimeoutMs = builder.subServiceTimeout.toMillis();
    this.overallTimeoutMs = builder.overallTimeout.toMillis();
    this.maxCalls = builder.retrySubServices ? 2 : 1;
    this.metrics = builder.metrics != null ? builder.metrics : MetricsExporter.NOOP;

    if (builder.executor != null) {
      this.executor = builder.executor;
      this.ownsExecutor = false;
    } else {
      this.executor = Executors.newCachedThreadPool(new DaemonThreadFactory("intake-enrich-"));
      this.ownsExecutor = true;
    }
  }

  public static Builder builder() {
    return new Builder();
  }

  public EnrichmentOutcome enrich(String text) {
    return enrich(text, Map.of());
  }

  /**
   * Runs all sub-services against {@code text} exactly as received, so that location
   * spans index into the stored message body.
   *
   * @throws EnrichmentInterruptedException if the calling thread is interrupted while
   *     waiting; the interrupt flag is left set and no partial outcome is produced
   */
  public EnrichmentOutcome enrich(String text, Map<String, String> metadata) {
    String body = text == null ? "" : text;
    Map<String, String> meta = metadata == null ? Map.of() : metadata;

    CompletableFuture<SubResult<Classification>> classification = call(classifier, body, meta);
    CompletableFuture<SubResult<ExtractedEntities>> entities = call(entityExtractor, body, meta);
    CompletableFuture<SubResult<List<GeoLocation>>> geo = call(geolocator, body, meta);
    CompletableFuture<SubResult<Map<String, Double>>> stats = call(engagement, body, meta);

    try {
      CompletableFuture.allOf(classification, entities, geo, stats).get(overallTimeoutMs, TimeUnit.MILLISECONDS);
    } catch (TimeoutException e) {
      logger.warning("Enrichment exceeded overall timeout of " + overallTimeoutMs + " ms");
    } catch (InterruptedException e) {
      for (CompletableFuture<?> future : List.of(classification, entities, geo, stats)) {
        future.cancel(true);
      }
      Thread.currentThread().interrupt();
      throw new EnrichmentInterruptedException("Enrichment interrupted before sub-services completed", e);
    } catch (ExecutionException e) {
      // every stage is mapped to a SubResult, so this only happens on a bug
      throw new IllegalStateException("Enrichment stage completed exceptionally", e.getCause());
    }

    Map<String, String> failures = new LinkedHashMap<>();
    Classification c = collect(SubService.CLASSIFICATION, classification, failures);
    ExtractedEntities ent = collect(SubService.ENTITIES, entities, failures);
    List<GeoLocation> locations = collect(SubService.GEOLOCATION, geo, failures);
    Map<String, Double> engagementStats = collect(SubService.ENGAGEMENT, stats, failures);

    if (failures.size() == SubService.values().length) {
      return new EnrichmentOutcome(null, failures);
    }
    return new EnrichmentOutcome(new EnrichmentRecord(c, ent, locations, engagementStats), failures);
  }

  private <T> T collect(SubService service, CompletableFuture<SubResult<T>> future, Map<String, String> failures) {
    SubResult<T> result = future.getNow(null);
    if (result == null) {
      future.cancel(true);
      result = new SubResult.Failure<>("overall enrichment timeout exceeded", 0);
    }
    if (result instanceof SubResult.Success<T> success) {
      return success.value();
    }
    SubResult.Failure<T> failure = (SubResult.Failure<T>) result;
    failures.put(service.serviceName(), failure.error());
    metrics.incrementSubServiceFailure(service.serviceName());
    logger.log(Level.FINE, "Sub-service {0} failed after {1} call(s): {2}",
        new Object[]{service.serviceName(), failure.calls(), failure.error()});
    return null;
  }

  private <T> CompletableFuture<SubResult<T>> call(EnrichmentService<T> service, String text, Map<String, String> meta) {
    CompletableFuture<SubResult<T>> first = attempt(service, text, meta)
        .<SubResult<T>>thenApply(value -> new SubResult.Success<>(value, 1));
    if (maxCalls == 1) {
      return first.exceptionally(error -> new SubResult.Failure<>(describe(error), 1));
    }
    return first.exceptionallyCompose(firstError -> attempt(service, text, meta)
        .<SubResult<T>>thenApply(value -> new SubResult.Success<>(value, 2))
        .exceptionally(secondError -> new SubResult.Failure<>(describe(secondError), 2)));
  }

  private <T> CompletableFuture<T> attempt(EnrichmentService<T> service, String text, Map<String, String> meta) {
    CompletableFuture<T> result = new CompletableFuture<>();
    Runnable call = () -> {
      try {
        T value = service.invoke(text, meta);
        if (value == null) {
          result.completeExceptionally(new IllegalStateException("malformed response: null result"));
        } else {
          result.complete(value);
        }
      } catch (Throwable t) {
        result.completeExceptionally(t);
      }
    };
    final Future<?> task;
    try {
      task = executor.submit(call);
    } catch (RejectedExecutionException e) {
      result.completeExceptionally(e);
      return result;
    }
    result.orTimeout(subServiceTimeoutMs, TimeUnit.MILLISECONDS)
        .whenComplete((value, error) -> {
          if (error instanceof TimeoutException) {
            task.cancel(true);
          }
        });
    return result;
  }

  private String describe(Throwable error) {
    Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
    if (cause instanceof TimeoutException) {
      return "timed out after " + subServiceTimeoutMs + " ms";
    }
    return ErrorMessages.describe(cause);
  }

  @Override
  public void close() {
    if (!ownsExecutor) {
      return;
    }
    executor.shutdownNow();
    try {
      executor.awaitTermination(5, TimeUnit.SECONDS);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
    }
  }

  /** Builder for {@link EnrichmentOrchestrator}. */
  public static final class Builder {
    private EnrichmentService<Classification> classifier;
    private EnrichmentService<ExtractedEntities> entityExtractor;
    private EnrichmentService<List<GeoLocation>> geolocator;
    private EnrichmentService<Map<String, Double>> engagement;
    private ExecutorService executor;
    private Duration subServiceTimeout = Duration.ofSeconds(5);
    private Duration overallTimeout = Duration.ofSeconds(15);
    private boolean retrySubServices = true;
    private MetricsExporter metrics;

    private Builder() {}

    public Builder classifier(EnrichmentService<Classification> classifier) {
      this.classifier = classifier;
      return this;
    }

    public Builder entityExtractor(EnrichmentService<ExtractedEntities> entityExtractor) {
      this.entityExtractor = entityExtractor;
      return this;
    }

    public Builder geolocator(EnrichmentService<List<GeoLocation>> geolocator) {
      this.geolocator = geolocator;
      return this;
    }

    public Builder engagement(EnrichmentService<Map<String, Double>> engagement) {
      this.engagement = engagement;
      return this;
    }

    /**
     * Executor for sub-service calls. The orchestrator does not shut down an executor
     * it was given.
     *
     * <p>Optional. Defaults to a private cached pool of daemon threads.
     */
    public Builder executor(ExecutorService executor) {
      this.executor = executor;
      return this;
    }

    /** Per-call timeout. Defaults to five seconds. */
    public Builder subServiceTimeout(Duration subServiceTimeout) {
      this.subServiceTimeout = Objects.requireNonNull(subServiceTimeout, "subServiceTimeout");
      return this;
    }

    /** Bound on the whole fan-out, retries included. Defaults to 15 seconds. */
    public Builder overallTimeout(Duration overallTimeout) {
      this.overallTimeout = Objects.requireNonNull(overallTimeout, "overallTimeout");
      return this;
    }

    /** Whether a failed sub-service call is retried once. Defaults to {@code true}. */
    public Builder retrySubServices(boolean retrySubServices) {
      this.retrySubServices = retrySubServices;
      return this;
    }

    public Builder metrics(MetricsExporter metrics) {
      this.metrics = metrics;
      return this;
    }

    public EnrichmentOrchestrator build() {
      return new EnrichmentOrchestrator(this);
    }
  }
}
