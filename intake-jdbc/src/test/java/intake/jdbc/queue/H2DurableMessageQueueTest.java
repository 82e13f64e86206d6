package intake.jdbc.queue;

import intake.MessageEnvelope;
import intake.jdbc.DataSourceConnectionProvider;
import intake.jdbc.H2Databases;
import intake.jdbc.dead.JdbcDeadLetterStore;
import intake.model.DeadLetterEntry;
import intake.model.DeliveryStatus;
import intake.model.ProcessingAttempt;
import intake.queue.ClaimReaper;
import intake.queue.Delivery;
import intake.queue.DurableMessageQueue;
import intake.queue.NackResult;
import intake.queue.RetryPolicy;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.OptionalLong;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class H2DurableMessageQueueTest {
  private static final String GROUP = "workers";

  private JdbcDataSource dataSource;
  private final JdbcDeadLetterStore deadLetterStore = new JdbcDeadLetterStore();

  @BeforeEach
  void setUp() {
    dataSource = H2Databases.create();
  }

  private DurableMessageQueue queue(int maxRetries, RetryPolicy retryPolicy) {
    return DurableMessageQueue.builder()
        .connectionProvider(new DataSourceConnectionProvider(dataSource))
        .queueStore(new H2QueueStore())
        .deadLetterStore(deadLetterStore)
        .maxRetries(maxRetries)
        .retryPolicy(retryPolicy)
        .pollInterval(Duration.ofMillis(20))
        .build();
  }

  private DurableMessageQueue queue() {
    DurableMessageQueue queue = queue(3, RetryPolicy.immediate());
    queue.createGroup(GROUP, true);
    return queue;
  }

  private static MessageEnvelope envelope(long messageId) {
    return MessageEnvelope.builder("channel_a", messageId)
        .text("message " + messageId)
        .mediaRef("https://cdn.example/" + messageId + ".jpg")
        .metadata("views", "100")
        .postedAt(Instant.parse("2024-02-24T04:00:00Z"))
        .build();
  }

  private List<DeadLetterEntry> deadLetters() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      return deadLetterStore.list(conn, null, 100);
    }
  }

  @Test
  void claimsInEnqueueOrderWithEnvelopeIntact() {
    DurableMessageQueue queue = queue();
    long first = queue.enqueue(envelope(1));
    long second = queue.enqueue(envelope(2));
    long third = queue.enqueue(envelope(3));
    assertTrue(first < second && second < third);

    List<Delivery> claimed = queue.claim(GROUP, "w1", 10, Duration.ZERO);

    assertEquals(List.of(first, second, third), claimed.stream().map(d -> d.token().entrySeq()).toList());
    assertEquals(envelope(1), claimed.get(0).envelope());
    assertEquals(0, claimed.get(0).attempts());
  }

  @Test
  void claimedDeliveriesAreNotHandedOutTwice() {
    DurableMessageQueue queue = queue();
    queue.enqueue(envelope(1));
    queue.enqueue(envelope(2));

    List<Delivery> a = queue.claim(GROUP, "w1", 1, Duration.ZERO);
    List<Delivery> b = queue.claim(GROUP, "w2", 10, Duration.ZERO);
    List<Delivery> c = queue.claim(GROUP, "w3", 10, Duration.ZERO);

    assertEquals(1, a.size());
    assertEquals(1, b.size());
    assertNotEquals(a.get(0).token().entrySeq(), b.get(0).token().entrySeq());
    assertTrue(c.isEmpty());
  }

  @Test
  void ackedDeliveryIsNeverRedelivered() {
    DurableMessageQueue queue = queue();
    queue.enqueue(envelope(1));
    Delivery delivery = queue.claim(GROUP, "w1", 1, Duration.ZERO).get(0);

    assertTrue(queue.ack(delivery.token()));
    assertFalse(queue.ack(delivery.token()));

    assertTrue(queue.claim(GROUP, "w1", 10, Duration.ZERO).isEmpty());
    assertEquals(0, queue.pendingCount(GROUP));
    assertEquals(DeliveryStatus.DONE, queue.attempt(delivery.token()).orElseThrow().status());
  }

  @Test
  void nackSchedulesRetryAndCountsTheAttempt() {
    DurableMessageQueue queue = queue();
    queue.enqueue(envelope(1));
    Delivery delivery = queue.claim(GROUP, "w1", 1, Duration.ZERO).get(0);

    assertEquals(NackResult.RETRY_SCHEDULED, queue.nack(delivery.token(), "IOException: reset"));

    ProcessingAttempt attempt = queue.attempt(delivery.token()).orElseThrow();
    assertEquals(1, attempt.attemptCount());
    assertEquals("IOException: reset", attempt.lastError());
    assertEquals(DeliveryStatus.RETRY, attempt.status());
    assertNotNull(attempt.firstClaimedAt());

    Delivery redelivered = queue.claim(GROUP, "w2", 1, Duration.ZERO).get(0);
    assertEquals(delivery.token().entrySeq(), redelivered.token().entrySeq());
    assertEquals(1, redelivered.attempts());
    assertNotEquals(delivery.token().claimId(), redelivered.token().claimId());
  }

  @Test
  void retryWaitsForBackoff() {
    DurableMessageQueue queue = queue(3, attempts -> Duration.ofMinutes(10));
    queue.createGroup(GROUP, true);
    queue.enqueue(envelope(1));
    Delivery delivery = queue.claim(GROUP, "w1", 1, Duration.ZERO).get(0);

    queue.nack(delivery.token(), "boom");

    assertTrue(queue.claim(GROUP, "w1", 1, Duration.ofMillis(50)).isEmpty());
    assertEquals(1, queue.pendingCount(GROUP));
  }

  @Test
  void exhaustedRetriesMoveEnvelopeToDeadLetters() throws Exception {
    DurableMessageQueue queue = queue();
    long seq = queue.enqueue(envelope(7));

    NackResult last = null;
    for (int i = 1; i <= 4; i++) {
      Delivery delivery = queue.claim(GROUP, "w1", 1, Duration.ZERO).get(0);
      assertEquals(i - 1, delivery.attempts());
      last = queue.nack(delivery.token(), "failure " + i);
    }

    assertEquals(NackResult.DEAD_LETTERED, last);
    assertTrue(queue.claim(GROUP, "w1", 1, Duration.ZERO).isEmpty());
    assertEquals(0, queue.pendingCount(GROUP));

    List<DeadLetterEntry> dead = deadLetters();
    assertEquals(1, dead.size());
    DeadLetterEntry entry = dead.get(0);
    assertEquals(GROUP, entry.groupName());
    assertEquals(seq, entry.entrySeq());
    assertEquals(envelope(7), entry.envelope());
    assertEquals(4, entry.attemptHistory().size());
    assertEquals(List.of(1, 2, 3, 4), entry.attemptHistory().stream().map(a -> a.attemptNumber()).toList());
    assertEquals("failure 4", entry.lastError());
  }

  @Test
  void zeroRetriesDeadLettersOnFirstFailure() throws Exception {
    DurableMessageQueue queue = queue(0, RetryPolicy.immediate());
    queue.createGroup(GROUP, true);
    queue.enqueue(envelope(1));
    Delivery delivery = queue.claim(GROUP, "w1", 1, Duration.ZERO).get(0);

    assertEquals(NackResult.DEAD_LETTERED, queue.nack(delivery.token(), "fatal"));
    assertEquals(1, deadLetters().get(0).attemptHistory().size());
  }

  @Test
  void staleTokenIsIgnored() {
    DurableMessageQueue queue = queue();
    queue.enqueue(envelope(1));
    Delivery delivery = queue.claim(GROUP, "w1", 1, Duration.ZERO).get(0);
    queue.nack(delivery.token(), "first");
    Delivery again = queue.claim(GROUP, "w2", 1, Duration.ZERO).get(0);

    assertEquals(NackResult.STALE_TOKEN, queue.nack(delivery.token(), "late"));
    assertFalse(queue.ack(delivery.token()));

    assertEquals(1, queue.attempt(again.token()).orElseThrow().attemptCount());
    assertTrue(queue.ack(again.token()));
  }

  @Test
  void everyGroupGetsItsOwnDelivery() {
    DurableMessageQueue queue = queue();
    queue.createGroup("archivers", true);
    queue.enqueue(envelope(1));

    Delivery toWorkers = queue.claim(GROUP, "w1", 1, Duration.ZERO).get(0);
    queue.ack(toWorkers.token());

    List<Delivery> toArchivers = queue.claim("archivers", "a1", 1, Duration.ZERO);
    assertEquals(1, toArchivers.size());
    assertEquals(toWorkers.token().entrySeq(), toArchivers.get(0).token().entrySeq());
  }

  @Test
  void replayReachesOnlyTheDeadLetteringGroup() throws Exception {
    DurableMessageQueue queue = queue(0, RetryPolicy.immediate());
    queue.createGroup(GROUP, true);
    queue.createGroup("archivers", true);
    queue.enqueue(envelope(1));

    Delivery archived = queue.claim("archivers", "a1", 1, Duration.ZERO).get(0);
    assertTrue(queue.ack(archived.token()));
    Delivery failed = queue.claim(GROUP, "w1", 1, Duration.ZERO).get(0);
    assertEquals(NackResult.DEAD_LETTERED, queue.nack(failed.token(), "fatal"));
    DeadLetterEntry dead = deadLetters().get(0);

    OptionalLong replayed = queue.requeueDeadLetter(dead);

    assertTrue(replayed.isPresent());
    assertTrue(deadLetters().isEmpty());
    assertTrue(queue.claim("archivers", "a1", 10, Duration.ZERO).isEmpty());
    List<Delivery> again = queue.claim(GROUP, "w1", 10, Duration.ZERO);
    assertEquals(1, again.size());
    assertEquals(replayed.getAsLong(), again.get(0).token().entrySeq());
    assertEquals(envelope(1), again.get(0).envelope());
    assertEquals(0, again.get(0).attempts());
  }

  @Test
  void deadLetterIsReplayedAtMostOnce() throws Exception {
    DurableMessageQueue queue = queue(0, RetryPolicy.immediate());
    queue.createGroup(GROUP, true);
    queue.enqueue(envelope(1));
    Delivery failed = queue.claim(GROUP, "w1", 1, Duration.ZERO).get(0);
    queue.nack(failed.token(), "fatal");
    DeadLetterEntry dead = deadLetters().get(0);

    assertTrue(queue.requeueDeadLetter(dead).isPresent());
    assertTrue(queue.requeueDeadLetter(dead).isEmpty());

    assertEquals(1, queue.claim(GROUP, "w1", 10, Duration.ZERO).size());
  }

  @Test
  void groupCreatedLateSeesOnlyLaterEntriesUnlessFromStart() {
    DurableMessageQueue queue = queue();
    queue.enqueue(envelope(1));

    assertTrue(queue.createGroup("late", false));
    assertTrue(queue.createGroup("replaying", true));
    assertFalse(queue.createGroup("late", true));
    long later = queue.enqueue(envelope(2));

    assertEquals(List.of(later),
        queue.claim("late", "w", 10, Duration.ZERO).stream().map(d -> d.token().entrySeq()).toList());
    assertEquals(2, queue.claim("replaying", "w", 10, Duration.ZERO).size());
  }

  @Test
  void blockingClaimTimesOutWhenEmpty() {
    DurableMessageQueue queue = queue();

    long start = System.nanoTime();
    List<Delivery> claimed = queue.claim(GROUP, "w1", 10, Duration.ofMillis(150));
    long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);

    assertTrue(claimed.isEmpty());
    assertTrue(elapsedMs >= 100, "returned after " + elapsedMs + " ms");
  }

  @Test
  void blockingClaimWakesUpOnEnqueue() throws Exception {
    DurableMessageQueue queue = queue();

    CompletableFuture<List<Delivery>> waiting =
        CompletableFuture.supplyAsync(() -> queue.claim(GROUP, "w1", 10, Duration.ofSeconds(5)));
    Thread.sleep(100);
    queue.enqueue(envelope(1));

    assertEquals(1, waiting.get(5, TimeUnit.SECONDS).size());
  }

  @Test
  void reaperReleasesExpiredClaimsAsFailedAttempts() throws Exception {
    DurableMessageQueue queue = queue();
    queue.enqueue(envelope(1));
    Delivery abandoned = queue.claim(GROUP, "crashed-worker", 1, Duration.ZERO).get(0);
    Thread.sleep(20);

    ClaimReaper reaper = ClaimReaper.builder()
        .queue(queue)
        .claimTimeout(Duration.ofMillis(1))
        .interval(Duration.ofHours(1))
        .build();
    try {
      assertEquals(1, reaper.runOnce());
      assertEquals(0, reaper.runOnce());
    } finally {
      reaper.close();
    }

    ProcessingAttempt attempt = queue.attempt(abandoned.token()).orElseThrow();
    assertEquals(1, attempt.attemptCount());
    assertTrue(attempt.lastError().startsWith("claim expired: held by crashed-worker since "));
    assertFalse(queue.ack(abandoned.token()));
    assertEquals(1, queue.claim(GROUP, "w2", 1, Duration.ZERO).size());
  }

  @Test
  void unexpiredClaimsAreLeftAlone() {
    DurableMessageQueue queue = queue();
    queue.enqueue(envelope(1));
    queue.claim(GROUP, "w1", 1, Duration.ZERO);

    assertEquals(0, queue.reclaimExpired(Duration.ofMinutes(5), 100));
  }

  @Test
  void longErrorsAreTruncated() {
    DurableMessageQueue queue = queue();
    queue.enqueue(envelope(1));
    Delivery delivery = queue.claim(GROUP, "w1", 1, Duration.ZERO).get(0);

    queue.nack(delivery.token(), "x".repeat(10_000));

    assertEquals(4000, queue.attempt(delivery.token()).orElseThrow().lastError().length());
  }
}
