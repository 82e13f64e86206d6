package intake.jdbc.dead;

import com.fasterxml.jackson.core.type.TypeReference;
import intake.MessageEnvelope;
import intake.jdbc.JdbcTemplate;
import intake.jdbc.JsonCodec;
import intake.model.AttemptRecord;
import intake.model.DeadLetterEntry;
import intake.spi.DeadLetterStore;
import intake.util.ErrorMessages;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Dead-letter store in plain SQL that runs unchanged on H2 and PostgreSQL. The
 * attempt history is kept as a JSON array next to a copy of the envelope, so the entry
 * survives purging of the queue tables.
 */
public final class JdbcDeadLetterStore implements DeadLetterStore {
  private static final String TABLE = "intake_dead_letter";
  private static final String COLUMNS =
      "dead_letter_id, group_name, entry_seq, source_id, message_id, body, media_refs, " +
      "raw_metadata, posted_at, attempt_history, last_error, promoted_at";

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};
  private static final TypeReference<List<AttemptRecord>> HISTORY = new TypeReference<>() {};

  private final JsonCodec jsonCodec;

  public JdbcDeadLetterStore() {
    this(JsonCodec.getDefault());
  }

  public JdbcDeadLetterStore(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  @Override
  public void insert(Connection conn, DeadLetterEntry entry) {
    MessageEnvelope env = entry.envelope();
    JdbcTemplate.update(conn,
        "INSERT INTO " + TABLE + " (" + COLUMNS + ") VALUES (?,?,?,?,?,?,?,?,?,?,?,?)",
        entry.id(),
        entry.groupName(),
        entry.entrySeq(),
        env.sourceId(),
        env.messageId(),
        env.text(),
        jsonCodec.toJson(env.mediaRefs()),
        jsonCodec.toJson(env.rawMetadata()),
        JdbcTemplate.timestamp(env.postedAt()),
        jsonCodec.toJson(entry.attemptHistory()),
        ErrorMessages.truncate(entry.lastError()),
        JdbcTemplate.timestamp(entry.promotedAt()));
  }

  @Override
  public Optional<DeadLetterEntry> find(Connection conn, String id) {
    return JdbcTemplate.queryOne(conn,
        "SELECT " + COLUMNS + " FROM " + TABLE + " WHERE dead_letter_id=?", this::mapEntry, id);
  }

  @Override
  public List<DeadLetterEntry> list(Connection conn, String sourceId, int limit) {
    if (sourceId == null) {
      return JdbcTemplate.query(conn,
          "SELECT " + COLUMNS + " FROM " + TABLE + " ORDER BY promoted_at, dead_letter_id LIMIT ?",
          this::mapEntry, limit);
    }
    return JdbcTemplate.query(conn,
        "SELECT " + COLUMNS + " FROM " + TABLE +
        " WHERE source_id=? ORDER BY promoted_at, dead_letter_id LIMIT ?",
        this::mapEntry, sourceId, limit);
  }

  @Override
  public int count(Connection conn, String sourceId) {
    if (sourceId == null) {
      return JdbcTemplate.queryInt(conn, "SELECT COUNT(*) FROM " + TABLE);
    }
    return JdbcTemplate.queryInt(conn, "SELECT COUNT(*) FROM " + TABLE + " WHERE source_id=?", sourceId);
  }

  @Override
  public int delete(Connection conn, String id) {
    return JdbcTemplate.update(conn, "DELETE FROM " + TABLE + " WHERE dead_letter_id=?", id);
  }

  private DeadLetterEntry mapEntry(ResultSet rs) throws SQLException {
    MessageEnvelope envelope = MessageEnvelope.builder(rs.getString("source_id"), rs.getString("message_id"))
        .text(rs.getString("body"))
        .mediaRefs(jsonCodec.fromJson(rs.getString("media_refs"), STRING_LIST))
        .rawMetadata(jsonCodec.fromJson(rs.getString("raw_metadata"), STRING_MAP))
        .postedAt(JdbcTemplate.instant(rs, "posted_at"))
        .build();
    return new DeadLetterEntry(
        rs.getString("dead_letter_id"),
        rs.getString("group_name"),
        rs.getLong("entry_seq"),
        envelope,
        jsonCodec.fromJson(rs.getString("attempt_history"), HISTORY),
        JdbcTemplate.instant(rs, "promoted_at"));
  }
}
