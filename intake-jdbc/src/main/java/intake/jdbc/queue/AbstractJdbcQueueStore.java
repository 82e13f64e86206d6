package intake.jdbc.queue;

import com.fasterxml.jackson.core.type.TypeReference;
import intake.MessageEnvelope;
import intake.jdbc.DialectStore;
import intake.jdbc.JdbcTemplate;
import intake.jdbc.JsonCodec;
import intake.model.AttemptRecord;
import intake.model.DeliveryStatus;
import intake.model.PendingDelivery;
import intake.model.ProcessingAttempt;
import intake.model.StaleClaim;
import intake.spi.QueueStore;
import intake.util.ErrorMessages;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Base JDBC queue store with portable SQL implementations.
 *
 * <p>Subclasses override {@link #claim} and {@link #insertEntry} where the database
 * offers something better. Register custom implementations via
 * {@code META-INF/services/intake.jdbc.queue.AbstractJdbcQueueStore}.
 *
 * @see JdbcQueueStores
 */
public abstract class AbstractJdbcQueueStore implements QueueStore, DialectStore {
  protected static final String ENTRY_TABLE = "intake_entry";
  protected static final String GROUP_TABLE = "intake_group";
  protected static final String DELIVERY_TABLE = "intake_delivery";
  protected static final String ATTEMPT_TABLE = "intake_attempt";

  protected static final String PENDING_STATUS_IN =
      "(" + DeliveryStatus.NEW.code() + "," + DeliveryStatus.RETRY.code() + ")";

  protected static final String DELIVERY_COLUMNS =
      "d.group_name, d.entry_seq, d.claim_id, d.attempts, d.first_claimed_at, " +
      "e.source_id, e.message_id, e.body, e.media_refs, e.raw_metadata, e.posted_at";

  private static final TypeReference<List<String>> STRING_LIST = new TypeReference<>() {};
  private static final TypeReference<Map<String, String>> STRING_MAP = new TypeReference<>() {};

  private final JsonCodec jsonCodec;

  protected AbstractJdbcQueueStore() {
    this(JsonCodec.getDefault());
  }

  protected AbstractJdbcQueueStore(JsonCodec jsonCodec) {
    this.jsonCodec = Objects.requireNonNull(jsonCodec, "jsonCodec");
  }

  /** Returns a store of the same dialect that encodes JSON columns with {@code jsonCodec}. */
  public abstract AbstractJdbcQueueStore withJsonCodec(JsonCodec jsonCodec);

  protected JsonCodec jsonCodec() {
    return jsonCodec;
  }

  @Override
  public long insertEntry(Connection conn, MessageEnvelope envelope, Instant enqueuedAt) {
    String sql = "INSERT INTO " + ENTRY_TABLE +
        " (source_id, message_id, body, media_refs, raw_metadata, posted_at, enqueued_at)" +
        " VALUES (?,?,?,?,?,?,?)";
    return JdbcTemplate.insertReturningKey(conn, sql, entryParams(envelope, enqueuedAt));
  }

  protected Object[] entryParams(MessageEnvelope envelope, Instant enqueuedAt) {
    return new Object[] {
        envelope.sourceId(), envelope.messageId(), envelope.text(),
        jsonCodec.toJson(envelope.mediaRefs()), jsonCodec.toJson(envelope.rawMetadata()),
        JdbcTemplate.timestamp(envelope.postedAt()), JdbcTemplate.timestamp(enqueuedAt)};
  }

  @Override
  public int fanOut(Connection conn, long entrySeq, Instant availableAt) {
    String sql = "INSERT INTO " + DELIVERY_TABLE +
        " (group_name, entry_seq, status, attempts, available_at)" +
        " SELECT group_name, ?, " + DeliveryStatus.NEW.code() + ", 0, ? FROM " + GROUP_TABLE;
    return JdbcTemplate.update(conn, sql, entrySeq, JdbcTemplate.timestamp(availableAt));
  }

  @Override
  public int insertDelivery(Connection conn, String groupName, long entrySeq, Instant availableAt) {
    String sql = "INSERT INTO " + DELIVERY_TABLE +
        " (group_name, entry_seq, status, attempts, available_at)" +
        " SELECT group_name, ?, " + DeliveryStatus.NEW.code() + ", 0, ? FROM " + GROUP_TABLE +
        " WHERE group_name=?";
    return JdbcTemplate.update(conn, sql, entrySeq, JdbcTemplate.timestamp(availableAt), groupName);
  }

  @Override
  public boolean createGroup(Connection conn, String groupName, boolean fromStart, Instant now) {
    int existing = JdbcTemplate.queryInt(conn,
        "SELECT COUNT(*) FROM " + GROUP_TABLE + " WHERE group_name=?", groupName);
    if (existing > 0) {
      return false;
    }
    JdbcTemplate.update(conn,
        "INSERT INTO " + GROUP_TABLE + " (group_name, created_at) VALUES (?,?)",
        groupName, JdbcTemplate.timestamp(now));
    if (fromStart) {
      String backfill = "INSERT INTO " + DELIVERY_TABLE +
          " (group_name, entry_seq, status, attempts, available_at)" +
          " SELECT ?, entry_seq, " + DeliveryStatus.NEW.code() + ", 0, ? FROM " + ENTRY_TABLE;
      JdbcTemplate.update(conn, backfill, groupName, JdbcTemplate.timestamp(now));
    }
    return true;
  }

  @Override
  public List<PendingDelivery> claim(Connection conn, String groupName, String workerId,
      String claimId, Instant now, int limit) {
    // Truncate to millis so stored value matches query (DB may drop nanos)
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String claimSql = "UPDATE " + DELIVERY_TABLE +
        " SET locked_by=?, locked_at=?, claim_id=?, first_claimed_at=COALESCE(first_claimed_at, ?)" +
        " WHERE group_name=? AND locked_by IS NULL AND status IN " + PENDING_STATUS_IN +
        " AND entry_seq IN (" +
        "SELECT entry_seq FROM " + DELIVERY_TABLE +
        " WHERE group_name=? AND status IN " + PENDING_STATUS_IN +
        " AND locked_by IS NULL AND available_at <= ? ORDER BY entry_seq LIMIT ?)";
    int updated = JdbcTemplate.update(conn, claimSql,
        workerId, JdbcTemplate.timestamp(nowMs), claimId, JdbcTemplate.timestamp(nowMs),
        groupName, groupName, JdbcTemplate.timestamp(now), limit);
    if (updated == 0) return List.of();
    return selectClaimed(conn, groupName, claimId);
  }

  /**
   * Selects the rows locked by one claim, in entry order. Shared by subclasses that
   * claim in two phases (UPDATE then SELECT).
   */
  protected List<PendingDelivery> selectClaimed(Connection conn, String groupName, String claimId) {
    String sql = "SELECT " + DELIVERY_COLUMNS +
        " FROM " + DELIVERY_TABLE + " d JOIN " + ENTRY_TABLE + " e ON e.entry_seq = d.entry_seq" +
        " WHERE d.group_name=? AND d.claim_id=? AND d.locked_by IS NOT NULL ORDER BY d.entry_seq";
    return JdbcTemplate.query(conn, sql, this::mapPending, groupName, claimId);
  }

  protected PendingDelivery mapPending(ResultSet rs) throws SQLException {
    return new PendingDelivery(
        rs.getString("group_name"),
        rs.getLong("entry_seq"),
        rs.getString("claim_id"),
        rs.getInt("attempts"),
        JdbcTemplate.instant(rs, "first_claimed_at"),
        mapEnvelope(rs));
  }

  protected MessageEnvelope mapEnvelope(ResultSet rs) throws SQLException {
    return MessageEnvelope.builder(rs.getString("source_id"), rs.getString("message_id"))
        .text(rs.getString("body"))
        .mediaRefs(jsonCodec.fromJson(rs.getString("media_refs"), STRING_LIST))
        .rawMetadata(jsonCodec.fromJson(rs.getString("raw_metadata"), STRING_MAP))
        .postedAt(JdbcTemplate.instant(rs, "posted_at"))
        .build();
  }

  @Override
  public int markDone(Connection conn, String groupName, long entrySeq, String claimId, Instant now) {
    String sql = "UPDATE " + DELIVERY_TABLE +
        " SET status=" + DeliveryStatus.DONE.code() +
        ", done_at=?, locked_by=NULL, locked_at=NULL, claim_id=NULL" +
        " WHERE group_name=? AND entry_seq=? AND claim_id=? AND locked_by IS NOT NULL" +
        " AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(now), groupName, entrySeq, claimId);
  }

  @Override
  public int recordFailure(Connection conn, String groupName, long entrySeq, String claimId,
      String error, Instant now) {
    String truncated = ErrorMessages.truncate(error);
    String sql = "UPDATE " + DELIVERY_TABLE + " SET attempts=attempts+1, last_error=?" +
        " WHERE group_name=? AND entry_seq=? AND claim_id=? AND locked_by IS NOT NULL" +
        " AND status IN " + PENDING_STATUS_IN;
    int updated = JdbcTemplate.update(conn, sql, truncated, groupName, entrySeq, claimId);
    if (updated == 0) {
      return -1;
    }
    int attempts = JdbcTemplate.queryInt(conn,
        "SELECT attempts FROM " + DELIVERY_TABLE + " WHERE group_name=? AND entry_seq=?",
        groupName, entrySeq);
    JdbcTemplate.update(conn,
        "INSERT INTO " + ATTEMPT_TABLE + " (group_name, entry_seq, attempt_number, error, failed_at)" +
        " VALUES (?,?,?,?,?)",
        groupName, entrySeq, attempts, truncated, JdbcTemplate.timestamp(now));
    return attempts;
  }

  @Override
  public int markRetry(Connection conn, String groupName, long entrySeq, Instant nextAt) {
    String sql = "UPDATE " + DELIVERY_TABLE +
        " SET status=" + DeliveryStatus.RETRY.code() +
        ", available_at=?, locked_by=NULL, locked_at=NULL, claim_id=NULL" +
        " WHERE group_name=? AND entry_seq=? AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(nextAt), groupName, entrySeq);
  }

  @Override
  public int markDead(Connection conn, String groupName, long entrySeq, Instant now) {
    String sql = "UPDATE " + DELIVERY_TABLE +
        " SET status=" + DeliveryStatus.DEAD.code() +
        ", done_at=?, locked_by=NULL, locked_at=NULL, claim_id=NULL" +
        " WHERE group_name=? AND entry_seq=? AND status IN " + PENDING_STATUS_IN;
    return JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(now), groupName, entrySeq);
  }

  @Override
  public List<AttemptRecord> attemptHistory(Connection conn, String groupName, long entrySeq) {
    String sql = "SELECT attempt_number, error, failed_at FROM " + ATTEMPT_TABLE +
        " WHERE group_name=? AND entry_seq=? ORDER BY attempt_number";
    return JdbcTemplate.query(conn, sql,
        rs -> new AttemptRecord(rs.getInt("attempt_number"), rs.getString("error"),
            JdbcTemplate.instant(rs, "failed_at")),
        groupName, entrySeq);
  }

  @Override
  public int deleteAttempts(Connection conn, String groupName, long entrySeq) {
    return JdbcTemplate.update(conn,
        "DELETE FROM " + ATTEMPT_TABLE + " WHERE group_name=? AND entry_seq=?", groupName, entrySeq);
  }

  @Override
  public Optional<MessageEnvelope> loadEnvelope(Connection conn, long entrySeq) {
    String sql = "SELECT source_id, message_id, body, media_refs, raw_metadata, posted_at FROM " +
        ENTRY_TABLE + " WHERE entry_seq=?";
    return JdbcTemplate.queryOne(conn, sql, this::mapEnvelope, entrySeq);
  }

  @Override
  public Optional<ProcessingAttempt> attempt(Connection conn, String groupName, long entrySeq) {
    String sql = "SELECT group_name, entry_seq, attempts, last_error, first_claimed_at, status FROM " +
        DELIVERY_TABLE + " WHERE group_name=? AND entry_seq=?";
    return JdbcTemplate.queryOne(conn, sql,
        rs -> new ProcessingAttempt(
            rs.getString("group_name"),
            rs.getLong("entry_seq"),
            rs.getInt("attempts"),
            rs.getString("last_error"),
            JdbcTemplate.instant(rs, "first_claimed_at"),
            DeliveryStatus.fromCode(rs.getInt("status"))),
        groupName, entrySeq);
  }

  @Override
  public List<StaleClaim> findStaleClaims(Connection conn, Instant lockedBefore, int limit) {
    String sql = "SELECT group_name, entry_seq, claim_id, locked_by, locked_at FROM " + DELIVERY_TABLE +
        " WHERE locked_by IS NOT NULL AND status IN " + PENDING_STATUS_IN +
        " AND locked_at <= ? ORDER BY locked_at, entry_seq LIMIT ?";
    return JdbcTemplate.query(conn, sql,
        rs -> new StaleClaim(
            rs.getString("group_name"),
            rs.getLong("entry_seq"),
            rs.getString("claim_id"),
            rs.getString("locked_by"),
            JdbcTemplate.instant(rs, "locked_at")),
        JdbcTemplate.timestamp(lockedBefore), limit);
  }

  @Override
  public int countPending(Connection conn, String groupName) {
    return JdbcTemplate.queryInt(conn,
        "SELECT COUNT(*) FROM " + DELIVERY_TABLE + " WHERE group_name=? AND status IN " + PENDING_STATUS_IN,
        groupName);
  }

  @Override
  public int purgeDone(Connection conn, Instant before, int limit) {
    String sql = "DELETE FROM " + DELIVERY_TABLE + " WHERE (group_name, entry_seq) IN (" +
        "SELECT group_name, entry_seq FROM " + DELIVERY_TABLE +
        " WHERE status=" + DeliveryStatus.DONE.code() + " AND done_at < ? ORDER BY done_at LIMIT ?)";
    int deleted = JdbcTemplate.update(conn, sql, JdbcTemplate.timestamp(before), limit);
    JdbcTemplate.update(conn,
        "DELETE FROM " + ENTRY_TABLE + " WHERE enqueued_at < ? AND NOT EXISTS (" +
        "SELECT 1 FROM " + DELIVERY_TABLE + " d WHERE d.entry_seq = " + ENTRY_TABLE + ".entry_seq)",
        JdbcTemplate.timestamp(before));
    return deleted;
  }
}
