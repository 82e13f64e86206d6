package intake.enrich;

import intake.EnrichmentInterruptedException;
import intake.model.Classification;
import intake.model.EnrichmentState;
import intake.model.ExtractedEntities;
import intake.model.GeoLocation;
import intake.model.Sentiment;
import intake.spi.EnrichmentService;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static org.junit.jupiter.api.Assertions.*;

class EnrichmentOrchestratorTest {

  private static final EnrichmentService<Classification> CLASSIFIER =
      (text, meta) -> new Classification(50, Set.of("combat"), Sentiment.NEUTRAL);
  private static final EnrichmentService<ExtractedEntities> ENTITIES =
      (text, meta) -> ExtractedEntities.none();
  private static final EnrichmentService<List<GeoLocation>> GEO =
      (text, meta) -> List.of(new GeoLocation(48.5, 37.9, 0, 10));
  private static final EnrichmentService<Map<String, Double>> ENGAGEMENT =
      (text, meta) -> Map.of("views", 10.0);

  private final List<EnrichmentOrchestrator> created = new ArrayList<>();
  private final CountDownLatch release = new CountDownLatch(1);

  @AfterEach
  void tearDown() {
    release.countDown();
    created.forEach(EnrichmentOrchestrator::close);
  }

  private EnrichmentOrchestrator.Builder builder() {
    return EnrichmentOrchestrator.builder()
        .classifier(CLASSIFIER)
        .entityExtractor(ENTITIES)
        .geolocator(GEO)
        .engagement(ENGAGEMENT)
        .subServiceTimeout(Duration.ofMillis(300))
        .overallTimeout(Duration.ofSeconds(2));
  }

  private EnrichmentOrchestrator build(EnrichmentOrchestrator.Builder builder) {
    EnrichmentOrchestrator orchestrator = builder.build();
    created.add(orchestrator);
    return orchestrator;
  }

  private EnrichmentService<List<GeoLocation>> hanging() {
    return (text, meta) -> {
      release.await(30, TimeUnit.SECONDS);
      return List.of();
    };
  }

  @Test
  void allSubServicesSucceed() {
    EnrichmentOutcome outcome = build(builder()).enrich("text");

    assertFalse(outcome.totalFailure());
    assertEquals(EnrichmentState.FULL, outcome.state());
    assertTrue(outcome.failedServices().isEmpty());
    assertEquals(50, outcome.record().classification().osintScore());
    assertEquals(1, outcome.record().geolocations().size());
    assertEquals(10.0, outcome.record().engagement().get("views"));
  }

  @Test
  void oneFailureGivesPartialRecord() {
    EnrichmentOutcome outcome = build(builder()
        .geolocator((text, meta) -> {
          throw new IllegalStateException("geocoder down");
        })).enrich("text");

    assertEquals(EnrichmentState.PARTIAL, outcome.state());
    assertEquals(Set.of("geolocation"), outcome.failedServices());
    assertEquals("IllegalStateException: geocoder down", outcome.failures().get("geolocation"));
    assertNull(outcome.record().geolocations());
    assertNotNull(outcome.record().classification());
    assertNotNull(outcome.record().entities());
    assertNotNull(outcome.record().engagement());
  }

  @Test
  void everyFailureIsTotal() {
    EnrichmentService<Classification> failingClassifier = (t, m) -> {
      throw new RuntimeException("a");
    };
    EnrichmentService<ExtractedEntities> failingEntities = (t, m) -> {
      throw new RuntimeException("b");
    };
    EnrichmentService<List<GeoLocation>> failingGeo = (t, m) -> {
      throw new RuntimeException("c");
    };
    EnrichmentService<Map<String, Double>> failingEngagement = (t, m) -> {
      throw new RuntimeException("d");
    };
    EnrichmentOutcome outcome = build(builder()
        .classifier(failingClassifier)
        .entityExtractor(failingEntities)
        .geolocator(failingGeo)
        .engagement(failingEngagement)).enrich("text");

    assertTrue(outcome.totalFailure());
    assertNull(outcome.record());
    assertEquals(List.of("classification", "entities", "geolocation", "engagement"),
        new ArrayList<>(outcome.failedServices()));
  }

  @Test
  void failedCallIsRetriedOnce() {
    AtomicInteger calls = new AtomicInteger();
    EnrichmentOutcome outcome = build(builder()
        .classifier((text, meta) -> {
          if (calls.incrementAndGet() == 1) {
            throw new RuntimeException("transient");
          }
          return new Classification(70, Set.of("equipment"), Sentiment.POSITIVE);
        })).enrich("text");

    assertEquals(2, calls.get());
    assertEquals(EnrichmentState.FULL, outcome.state());
    assertEquals(70, outcome.record().classification().osintScore());
  }

  @Test
  void persistentFailureCallsAtMostTwice() {
    AtomicInteger calls = new AtomicInteger();
    EnrichmentOutcome outcome = build(builder()
        .classifier((text, meta) -> {
          calls.incrementAndGet();
          throw new RuntimeException("always");
        })).enrich("text");

    assertEquals(2, calls.get());
    assertEquals(Set.of("classification"), outcome.failedServices());
  }

  @Test
  void retriesCanBeDisabled() {
    AtomicInteger calls = new AtomicInteger();
    build(builder()
        .retrySubServices(false)
        .classifier((text, meta) -> {
          calls.incrementAndGet();
          throw new RuntimeException("always");
        })).enrich("text");

    assertEquals(1, calls.get());
  }

  @Test
  void slowSubServiceTimesOut() {
    long start = System.nanoTime();
    EnrichmentOutcome outcome = build(builder().geolocator(hanging())).enrich("text");
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertEquals(EnrichmentState.PARTIAL, outcome.state());
    assertEquals("timed out after 300 ms", outcome.failures().get("geolocation"));
    assertTrue(elapsedMs < 2000, "took " + elapsedMs + " ms");
  }

  @Test
  void overallTimeoutBoundsTheFanOut() {
    long start = System.nanoTime();
    EnrichmentOutcome outcome = build(builder()
        .subServiceTimeout(Duration.ofMillis(400))
        .overallTimeout(Duration.ofMillis(500))
        .geolocator(hanging())).enrich("text");
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertEquals(Set.of("geolocation"), outcome.failedServices());
    assertTrue(elapsedMs < 1500, "took " + elapsedMs + " ms");
  }

  @Test
  void nullResultIsMalformed() {
    EnrichmentOutcome outcome = build(builder().entityExtractor((text, meta) -> null)).enrich("text");

    assertEquals(Set.of("entities"), outcome.failedServices());
    assertTrue(outcome.failures().get("entities").contains("malformed response"));
  }

  @Test
  void subServicesRunConcurrently() {
    CountDownLatch bothStarted = new CountDownLatch(2);
    EnrichmentService<Classification> classifier = (text, meta) -> {
      bothStarted.countDown();
      assertTrue(bothStarted.await(1, TimeUnit.SECONDS));
      return new Classification(1, Set.of("general"), Sentiment.UNKNOWN);
    };
    EnrichmentService<ExtractedEntities> entities = (text, meta) -> {
      bothStarted.countDown();
      assertTrue(bothStarted.await(1, TimeUnit.SECONDS));
      return ExtractedEntities.none();
    };

    EnrichmentOutcome outcome = build(builder()
        .subServiceTimeout(Duration.ofSeconds(2))
        .overallTimeout(Duration.ofSeconds(5))
        .retrySubServices(false)
        .classifier(classifier)
        .entityExtractor(entities)).enrich("text");

    assertEquals(EnrichmentState.FULL, outcome.state());
  }

  @Test
  void builtInServicesUsedByDefault() {
    EnrichmentOutcome outcome = build(EnrichmentOrchestrator.builder())
        .enrich("HIMARS strike near Bakhmut at 48.5952, 38.0003", Map.of("views", "1000", "forwards", "50"));

    assertEquals(EnrichmentState.FULL, outcome.state());
    assertTrue(outcome.record().classification().topics().contains("equipment"));
    assertTrue(outcome.record().entities().locations().contains("Bakhmut"));
    assertEquals(1, outcome.record().geolocations().size());
    assertEquals(0.05, outcome.record().engagement().get("forward_rate"), 1e-9);
  }

  @Test
  void subServicesSeeTheTextAsReceived() {
    String text = "Strike reported\n\n  near 48.5923, 37.9998 today";
    List<String> seen = new ArrayList<>();
    EnrichmentOutcome outcome = build(EnrichmentOrchestrator.builder()
        .classifier((t, meta) -> {
          synchronized (seen) {
            seen.add(t);
          }
          return new Classification(1, Set.of("general"), Sentiment.UNKNOWN);
        })).enrich(text);

    assertEquals(List.of(text), seen);
    GeoLocation g = outcome.record().geolocations().get(0);
    assertEquals("48.5923, 37.9998", text.substring(g.spanStart(), g.spanEnd()));
  }

  @Test
  void interruptedCallerGetsNoOutcome() throws Exception {
    EnrichmentOrchestrator orchestrator = build(builder()
        .subServiceTimeout(Duration.ofSeconds(5))
        .overallTimeout(Duration.ofSeconds(10))
        .geolocator(hanging()));
    AtomicReference<Throwable> thrown = new AtomicReference<>();
    AtomicBoolean flagKept = new AtomicBoolean();
    Thread caller = new Thread(() -> {
      try {
        orchestrator.enrich("text");
      } catch (Throwable t) {
        thrown.set(t);
        flagKept.set(Thread.currentThread().isInterrupted());
      }
    });
    caller.start();
    Thread.sleep(200);
    caller.interrupt();
    caller.join(5000);

    assertFalse(caller.isAlive());
    assertInstanceOf(EnrichmentInterruptedException.class, thrown.get());
    assertTrue(flagKept.get());
  }

  @Test
  void overallTimeoutMustCoverSubServiceTimeout() {
    assertThrows(IllegalArgumentException.class, () -> EnrichmentOrchestrator.builder()
        .subServiceTimeout(Duration.ofSeconds(5))
        .overallTimeout(Duration.ofSeconds(1))
        .build());
  }
}
