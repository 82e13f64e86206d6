package intake.jdbc.message;

import com.fasterxml.jackson.core.type.TypeReference;
import intake.MessageEnvelope;
import intake.MessageIdentity;
import intake.jdbc.DialectStore;
import intake.jdbc.JdbcTemplate;
import intake.jdbc.JsonCodec;
import intake.model.EnrichmentRecord;
import intake.model.EnrichmentState;
import intake.model.MediaFile;
import intake.model.RoutingDecision;
import intake.model.SpamVerdict;
import intake.model.StoredMessage;
import intake.spi.MessageStore;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC message store. Subclasses supply the dialect's upsert statement; column
 * order is fixed by {@link #COLUMNS}. Register custom implementations via
 * {@code META-INF/services/intake.jdbc.message.AbstractJdbcMessageStore}.
 *
 * @see JdbcMessageStores
 */
public abstract class AbstractJdbcMessageStore implements MessageStore, DialectStore {
  protected static final String TABLE = "intake_message";

  protected static final List<String> COLUMNS = List.of(
      "source_id", "message_id", "body", "media_refs", "raw_metadata", "posted_at",
      "is_spam", "spam_confidence", "spam_rules", "enrichment", "enrichment_state",
      "failed_services", "target_partition", "matched_trigger", "rules_version", "routed_at",
      "media", "stored_at");

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
  private static final TypeReference<List<MediaFile>> MEDIA_LIST = new TypeReference<>() {};

  private final JsonCodec jsonCodec;

  protected AbstractJdbcMessageStore() {
    this(JsonCodec.getDefault());
  }

  protected AbstractJdbcMessageStore(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  public abstract AbstractJdbcMessageStore withJsonCodec(JsonCodec jsonCodec);

  /**
   * Insert-or-replace statement keyed on ({@code source_id}, {@code message_id}) with
   * one placeholder per entry of {@link #COLUMNS}, in order.
   */
  protected abstract String upsertSql();

  protected static String placeholders() {
    return String.join(",", COLUMNS.stream().map(c -> "?").toList());
  }

  @Override
  public void upsert(Connection conn, StoredMessage message) {
    MessageEnvelope env = message.envelope();
    SpamVerdict verdict = message.spamVerdict();
    RoutingDecision routing = message.routing();
    JdbcTemplate.update(conn, upsertSql(),
        env.sourceId(),
        env.messageId(),
        env.text(),
        jsonCodec.toJson(env.mediaRefs()),
        jsonCodec.toJson(env.rawMetadata()),
        JdbcTemplate.timestamp(env.postedAt()),
        verdict.spam(),
        verdict.confidence(),
        jsonCodec.toJson(verdict.matchedRules()),
        message.enrichment() == null ? null : jsonCodec.toJson(message.enrichment()),
        message.enrichmentState().name(),
        jsonCodec.toJson(message.failedServices()),
        routing == null ? null : routing.targetPartition(),
        routing == null ? null : routing.matchedTrigger(),
        routing == null ? null : routing.rulesVersion(),
        routing == null ? null : JdbcTemplate.timestamp(routing.decidedAt()),
        jsonCodec.toJson(message.media()),
        JdbcTemplate.timestamp(Instant.now()));
  }

  @Override
  public Optional<StoredMessage> find(Connection conn, MessageIdentity identity) {
    String sql = "SELECT " + String.join(", ", COLUMNS) + " FROM " + TABLE +
        " WHERE source_id=? AND message_id=?";
    return JdbcTemplate.queryOne(conn, sql, this::mapMessage, identity.sourceId(), identity.messageId());
  }

  @Override
  public int count(Connection conn) {
    return JdbcTemplate.queryInt(conn, "SELECT COUNT(*) FROM " + TABLE);
  }

  /** Messages routed to one partition, most recently stored first. */
  public List<StoredMessage> findByPartition(Connection conn, String partition, int limit) {
    String sql = "SELECT " + String.join(", ", COLUMNS) + " FROM " + TABLE +
        " WHERE target_partition=? ORDER BY stored_at DESC, source_id, message_id LIMIT ?";
    return JdbcTemplate.query(conn, sql, this::mapMessage, partition, limit);
  }

  private StoredMessage mapMessage(ResultSet rs) throws SQLException {
    MessageEnvelope envelope = MessageEnvelope.builder(rs.getString("source_id"), rs.getString("message_id"))
        .text(rs.getString("body"))
        .mediaRefs(jsonCodec.fromJson(rs.getString("media_refs"), STRING_LIST))
        .rawMetadata(jsonCodec.fromJson(rs.getString("raw_metadata"), STRING_MAP))
        .postedAt(JdbcTemplate.instant(rs, "posted_at"))
        .build();
    SpamVerdict verdict = new SpamVerdict(
        rs.getBoolean("is_spam"),
        rs.getDouble("spam_confidence"),
        jsonCodec.fromJson(rs.getString("spam_rules"), STRING_LIST));
    String partition = rs.getString("target_partition");
    RoutingDecision routing = partition == null ? null : new RoutingDecision(
        partition,
        rs.getString("matched_trigger"),
        rs.getLong("rules_version"),
        JdbcTemplate.instant(rs, "routed_at"));
    return new StoredMessage(
        envelope,
        verdict,
        jsonCodec.fromJson(rs.getString("enrichment"), EnrichmentRecord.class),
        EnrichmentState.valueOf(rs.getString("enrichment_state")),
        new LinkedHashSet<>(jsonCodec.fromJson(rs.getString("failed_services"), STRING_LIST)),
        routing,
        jsonCodec.fromJson(rs.getString("media"), MEDIA_LIST));
  }
}
