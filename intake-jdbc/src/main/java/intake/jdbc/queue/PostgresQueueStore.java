package intake.jdbc.queue;

import intake.MessageEnvelope;
import intake.jdbc.JdbcTemplate;
import intake.jdbc.JsonCodec;
import intake.model.DeliveryStatus;
import intake.model.PendingDelivery;

import java.sql.Connection;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;

/**
 * PostgreSQL queue store.
 *
 * <p>Claims with {@code FOR UPDATE SKIP LOCKED}, so workers in different processes
 * never block on each other's rows.
 */
public final class PostgresQueueStore extends AbstractJdbcQueueStore {

  public PostgresQueueStore() {
    super();
  }

  public PostgresQueueStore(JsonCodec jsonCodec) {
    super(jsonCodec);
  }

  @Override
  public AbstractJdbcQueueStore withJsonCodec(JsonCodec jsonCodec) {
    return new PostgresQueueStore(jsonCodec);
  }

  @Override
  public String name() {
    return "postgresql";
  }

  @Override
  public List<String> jdbcUrlPrefixes() {
    return List.of("jdbc:postgresql:");
  }

  @Override
  public long insertEntry(Connection conn, MessageEnvelope envelope, Instant enqueuedAt) {
    String sql = "INSERT INTO " + ENTRY_TABLE +
        " (source_id, message_id, body, media_refs, raw_metadata, posted_at, enqueued_at)" +
        " VALUES (?,?,?,?,?,?,?) RETURNING entry_seq";
    return JdbcTemplate.queryOne(conn, sql, rs -> rs.getLong(1), entryParams(envelope, enqueuedAt))
        .orElseThrow(() -> new IllegalStateException("INSERT returned no entry_seq"));
  }

  @Override
  public boolean createGroup(Connection conn, String groupName, boolean fromStart, Instant now) {
    int inserted = JdbcTemplate.update(conn,
        "INSERT INTO " + GROUP_TABLE + " (group_name, created_at) VALUES (?,?)" +
        " ON CONFLICT (group_name) DO NOTHING",
        groupName, JdbcTemplate.timestamp(now));
    if (inserted == 0) {
      return false;
    }
    if (fromStart) {
      JdbcTemplate.update(conn,
          "INSERT INTO " + DELIVERY_TABLE + " (group_name, entry_seq, status, attempts, available_at)" +
          " SELECT ?, entry_seq, " + DeliveryStatus.NEW.code() + ", 0, ? FROM " + ENTRY_TABLE,
          groupName, JdbcTemplate.timestamp(now));
    }
    return true;
  }

  @Override
  public List<PendingDelivery> claim(Connection conn, String groupName, String workerId,
      String claimId, Instant now, int limit) {
    Instant nowMs = now.truncatedTo(ChronoUnit.MILLIS);
    String sql = "UPDATE " + DELIVERY_TABLE +
        " SET locked_by=?, locked_at=?, claim_id=?, first_claimed_at=COALESCE(first_claimed_at, ?)" +
        " WHERE group_name=? AND entry_seq IN (" +
        "SELECT entry_seq FROM " + DELIVERY_TABLE +
        " WHERE group_name=? AND status IN " + PENDING_STATUS_IN +
        " AND locked_by IS NULL AND available_at <= ? ORDER BY entry_seq LIMIT ?" +
        " FOR UPDATE SKIP LOCKED)";
    int updated = JdbcTemplate.update(conn, sql,
        workerId, JdbcTemplate.timestamp(nowMs), claimId, JdbcTemplate.timestamp(nowMs),
        groupName, groupName, JdbcTemplate.timestamp(now), limit);
    if (updated == 0) return List.of();
    return selectClaimed(conn, groupName, claimId);
  }
}
