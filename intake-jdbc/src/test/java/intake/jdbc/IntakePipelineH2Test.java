package intake.jdbc;

import intake.IntakePipeline;
import intake.MessageEnvelope;
import intake.jdbc.dead.JdbcDeadLetterStore;
import intake.jdbc.message.H2MessageStore;
import intake.jdbc.queue.H2QueueStore;
import intake.media.FileSystemMediaStore;
import intake.media.MediaFetchException;
import intake.model.DeadLetterEntry;
import intake.model.EnrichmentState;
import intake.model.StoredMessage;
import intake.queue.RetryPolicy;
import intake.spi.MediaFetcher;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.sql.Connection;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.*;

class IntakePipelineH2Test {

  @TempDir
  Path mediaRoot;

  private JdbcDataSource dataSource;
  private final H2MessageStore messageStore = new H2MessageStore();

  @BeforeEach
  void setUp() {
    dataSource = H2Databases.create();
  }

  private IntakePipeline.Builder pipeline(MediaFetcher fetcher) {
    return IntakePipeline.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .queueStore(new H2QueueStore())
        .messageStore(messageStore)
        .deadLetterStore(new JdbcDeadLetterStore())
        .mediaStore(new FileSystemMediaStore(mediaRoot))
        .mediaFetcher(fetcher)
        .retryPolicy(RetryPolicy.immediate())
        .workerCount(2)
        .blockTimeout(Duration.ofMillis(50))
        .drainTimeout(Duration.ofSeconds(2));
  }

  private StoredMessage stored(MessageEnvelope envelope) throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      return messageStore.find(conn, envelope.identity()).orElse(null);
    }
  }

  private int storedCount() {
    try (Connection conn = dataSource.getConnection()) {
      return messageStore.count(conn);
    } catch (Exception e) {
      throw new IllegalStateException(e);
    }
  }

  private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
    long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(15);
    while (!condition.getAsBoolean()) {
      if (System.nanoTime() > deadline) {
        fail("condition not met within 15s");
      }
      Thread.sleep(25);
    }
  }

  @Test
  void messagesFlowFromQueueToStore() throws Exception {
    MessageEnvelope strike = MessageEnvelope.builder("channel_a", 100)
        .text("Missile strike on Kharkiv at 49.9935, 36.2304")
        .mediaRef("https://cdn.example/strike.jpg")
        .metadata("views", "5000")
        .metadata("forwards", "250")
        .build();
    MessageEnvelope spam = MessageEnvelope.builder("channel_a", 101)
        .text("Donate now: 4149 4390 1234 5678")
        .mediaRef("https://cdn.example/promo.jpg")
        .build();
    MessageEnvelope quiet = MessageEnvelope.builder("channel_b", 7)
        .text("Evacuation of civilians from Kherson continues")
        .build();

    try (IntakePipeline pipeline = pipeline(ref -> ref.getBytes(StandardCharsets.UTF_8)).build()) {
      pipeline.queue().enqueue(strike);
      pipeline.queue().enqueue(spam);
      pipeline.queue().enqueue(quiet);
      awaitCondition(() -> storedCount() == 3);
    }

    StoredMessage storedStrike = stored(strike);
    assertEquals(EnrichmentState.FULL, storedStrike.enrichmentState());
    assertEquals("messages_strikes", storedStrike.routing().targetPartition());
    assertTrue(storedStrike.enrichment().entities().locations().contains("Kharkiv"));
    assertEquals(1, storedStrike.enrichment().geolocations().size());
    assertEquals(0.05, storedStrike.enrichment().engagement().get("forward_rate"), 1e-9);
    assertEquals(1, storedStrike.mediaHashes().size());
    assertEquals("image/jpeg", storedStrike.media().get(0).mimeType());
    assertTrue(new FileSystemMediaStore(mediaRoot).exists(storedStrike.mediaHashes().get(0)));

    StoredMessage storedSpam = stored(spam);
    assertEquals(EnrichmentState.SPAM, storedSpam.enrichmentState());
    assertTrue(storedSpam.mediaHashes().isEmpty());

    assertEquals("messages_civilian", stored(quiet).routing().targetPartition());
  }

  @Test
  void failingMessageIsDeadLetteredAndCanBeReplayed() throws Exception {
    AtomicBoolean cdnUp = new AtomicBoolean(false);
    MediaFetcher fetcher = ref -> {
      if (!cdnUp.get()) {
        throw new MediaFetchException("Download of " + ref + " failed: status=503");
      }
      return new byte[] {1, 2, 3};
    };
    MessageEnvelope envelope = MessageEnvelope.builder("channel_a", 200)
        .text("Drone footage from the front")
        .mediaRef("https://cdn.example/video.mp4")
        .build();

    try (IntakePipeline pipeline = pipeline(fetcher).maxRetries(2).build()) {
      pipeline.queue().enqueue(envelope);
      awaitCondition(() -> pipeline.deadLetters().count(null) == 1);

      DeadLetterEntry dead = pipeline.deadLetters().list(null, 10).get(0);
      assertEquals(envelope, dead.envelope());
      assertEquals(3, dead.attemptHistory().size());
      assertTrue(dead.lastError().contains("status=503"));
      assertNull(stored(envelope));

      cdnUp.set(true);
      assertTrue(pipeline.deadLetters().replay(dead.id()));
      awaitCondition(() -> storedCount() == 1);
      assertEquals(0, pipeline.deadLetters().count(null));
    }
    assertEquals("messages_drones", stored(envelope).routing().targetPartition());
  }

  @Test
  void producerOnlyPipelineDoesNotProcess() throws Exception {
    try (IntakePipeline pipeline = pipeline(ref -> new byte[0]).startWorkers(false).build()) {
      assertNull(pipeline.workerPool());
      pipeline.queue().createGroup("intake-workers", true);
      pipeline.queue().enqueue(MessageEnvelope.builder("channel_a", 1).text("hello").build());

      Thread.sleep(200);
      assertEquals(0, storedCount());
    }
  }

  @Test
  void builderCanOnlyBuildOnce() {
    IntakePipeline.Builder builder = pipeline(ref -> new byte[0]).startWorkers(false);
    try (IntakePipeline ignored = builder.build()) {
      assertThrows(IllegalStateException.class, builder::build);
    }
  }

  @Test
  void storedMessagesAreListedByPartition() throws Exception {
    try (IntakePipeline pipeline = pipeline(ref -> new byte[0]).build()) {
      for (int i = 0; i < 3; i++) {
        pipeline.queue().enqueue(MessageEnvelope.builder("channel_c", i).text("Shahed drones over Odesa").build());
      }
      awaitCondition(() -> storedCount() == 3);
    }
    try (Connection conn = dataSource.getConnection()) {
      List<StoredMessage> drones = messageStore.findByPartition(conn, "messages_drones", 10);
      assertEquals(3, drones.size());
    }
  }
}
