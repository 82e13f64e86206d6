package intake.jdbc.message;

import intake.MessageEnvelope;
import intake.jdbc.H2Databases;
import intake.model.Classification;
import intake.model.EnrichmentRecord;
import intake.model.EnrichmentState;
import intake.model.ExtractedEntities;
import intake.model.GeoLocation;
import intake.model.MediaFile;
import intake.model.RoutingDecision;
import intake.model.Sentiment;
import intake.model.SpamVerdict;
import intake.model.StoredMessage;
import org.h2.jdbcx.JdbcDataSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.sql.Connection;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class H2MessageStoreTest {
  private static final Instant ROUTED_AT = Instant.parse("2024-05-01T12:00:00Z");

  private JdbcDataSource dataSource;
  private final H2MessageStore store = new H2MessageStore();

  @BeforeEach
  void setUp() {
    dataSource = H2Databases.create();
  }

  private static MessageEnvelope envelope(long id, String text) {
    return MessageEnvelope.builder("channel_a", id)
        .text(text)
        .mediaRef("https://cdn.example/" + id + ".jpg")
        .metadata("views", "1200")
        .postedAt(Instant.parse("2024-05-01T11:59:00Z"))
        .build();
  }

  private static StoredMessage enriched(MessageEnvelope envelope, String partition) {
    EnrichmentRecord record = new EnrichmentRecord(
        new Classification(65, Set.of("combat", "equipment"), Sentiment.NEGATIVE),
        new ExtractedEntities(Set.of("Syrskyi"), Set.of("NATO"), Set.of("Bakhmut"), Set.of("93rd Brigade")),
        List.of(new GeoLocation(48.5952, 38.0003, 10, 26)),
        Map.of("views", 1200.0, "forward_rate", 0.05));
    return new StoredMessage(envelope, SpamVerdict.clean(), record, EnrichmentState.FULL, Set.of(),
        new RoutingDecision(partition, "HIMARS", 3, ROUTED_AT),
        List.of(MediaFile.of("a".repeat(64), 2048, "image/jpeg")));
  }

  @Test
  void roundTripsEveryField() throws Exception {
    StoredMessage message = enriched(envelope(1, "HIMARS strike near Bakhmut"), "messages_equipment");

    try (Connection conn = dataSource.getConnection()) {
      store.upsert(conn, message);
      StoredMessage loaded = store.find(conn, message.identity()).orElseThrow();

      assertEquals(message.envelope(), loaded.envelope());
      assertEquals(message.spamVerdict(), loaded.spamVerdict());
      assertEquals(message.enrichment(), loaded.enrichment());
      assertEquals(EnrichmentState.FULL, loaded.enrichmentState());
      assertEquals(message.routing(), loaded.routing());
      assertEquals(ROUTED_AT, loaded.routing().decidedAt());
      assertEquals(message.media(), loaded.media());
      assertEquals("photo", loaded.media().get(0).mediaType());
    }
  }

  @Test
  void upsertReplacesInsteadOfDuplicating() throws Exception {
    MessageEnvelope envelope = envelope(2, "Convoy moving north");
    StoredMessage first = new StoredMessage(envelope, SpamVerdict.clean(),
        enriched(envelope, "x").enrichment(), EnrichmentState.PARTIAL, Set.of("geolocation"),
        new RoutingDecision("messages_movements", "convoy", 1, ROUTED_AT), List.of());
    StoredMessage second = enriched(envelope, "messages_movements");

    try (Connection conn = dataSource.getConnection()) {
      store.upsert(conn, first);
      store.upsert(conn, second);
      store.upsert(conn, second);

      assertEquals(1, store.count(conn));
      StoredMessage loaded = store.find(conn, envelope.identity()).orElseThrow();
      assertEquals(EnrichmentState.FULL, loaded.enrichmentState());
      assertTrue(loaded.failedServices().isEmpty());
    }
  }

  @Test
  void spamRowHasNoEnrichmentOrRouting() throws Exception {
    MessageEnvelope envelope = envelope(3, "Donate 4149439012345678");
    StoredMessage spam = StoredMessage.spam(envelope, new SpamVerdict(true, 0.95, List.of("card_numbers")));

    try (Connection conn = dataSource.getConnection()) {
      store.upsert(conn, spam);
      StoredMessage loaded = store.find(conn, envelope.identity()).orElseThrow();

      assertTrue(loaded.spamVerdict().spam());
      assertEquals(List.of("card_numbers"), loaded.spamVerdict().matchedRules());
      assertEquals(EnrichmentState.SPAM, loaded.enrichmentState());
      assertNull(loaded.enrichment());
      assertNull(loaded.routing());
    }
  }

  @Test
  void partialEnrichmentKeepsMissingComponentsAbsent() throws Exception {
    MessageEnvelope envelope = envelope(4, "Quiet night");
    EnrichmentRecord partial = new EnrichmentRecord(
        new Classification(10, Set.of("general"), Sentiment.NEUTRAL), null, null, Map.of("views", 1.0));
    StoredMessage message = new StoredMessage(envelope, SpamVerdict.clean(), partial, EnrichmentState.PARTIAL,
        Set.of("entities", "geolocation"), new RoutingDecision("messages_general", null, 1, ROUTED_AT), null);

    try (Connection conn = dataSource.getConnection()) {
      store.upsert(conn, message);
      StoredMessage loaded = store.find(conn, envelope.identity()).orElseThrow();

      assertNull(loaded.enrichment().entities());
      assertNull(loaded.enrichment().geolocations());
      assertEquals(Set.of("entities", "geolocation"), loaded.failedServices());
      assertNull(loaded.routing().matchedTrigger());
    }
  }

  @Test
  void findsByPartition() throws Exception {
    try (Connection conn = dataSource.getConnection()) {
      store.upsert(conn, enriched(envelope(5, "a"), "messages_strikes"));
      store.upsert(conn, enriched(envelope(6, "b"), "messages_strikes"));
      store.upsert(conn, enriched(envelope(7, "c"), "messages_general"));

      assertEquals(2, store.findByPartition(conn, "messages_strikes", 10).size());
      assertEquals(1, store.findByPartition(conn, "messages_strikes", 1).size());
      assertTrue(store.findByPartition(conn, "messages_drones", 10).isEmpty());
    }
  }
}
