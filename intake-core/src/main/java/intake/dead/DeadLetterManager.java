package intake.dead;

import intake.model.DeadLetterEntry;
import intake.queue.MessageQueue;
import intake.spi.ConnectionProvider;
import intake.spi.DeadLetterStore;

import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operator facade over the dead-letter store: inspect, replay or discard entries.
 *
 * <p>Replay hands the entry to {@link MessageQueue#requeueDeadLetter}: the envelope
 * comes back as a new entry for the group that dead-lettered it, and the dead letter
 * is removed in the same transaction. Stored results stay correct because message
 * writes are upserts.
 */
public final class DeadLetterManager {
  private static final Logger logger = Logger.getLogger(DeadLetterManager.class.getName());

  private final ConnectionProvider connectionProvider;
  private final DeadLetterStore deadLetterStore;
  private final MessageQueue queue;

  public DeadLetterManager(ConnectionProvider connectionProvider, DeadLetterStore deadLetterStore,
      MessageQueue queue) {
    this.connectionProvider = Objects.requireNonNull(connectionProvider, "connectionProvider");
    this.deadLetterStore = Objects.requireNonNull(deadLetterStore, "deadLetterStore");
    this.queue = Objects.requireNonNull(queue, "queue");
  }

  /**
   * Lists dead letters, oldest first.
   *
   * @param sourceId source filter, {@code null} for all
   * @param limit    maximum entries
   */
  public List<DeadLetterEntry> list(String sourceId, int limit) {
    try (Connection conn = connectionProvider.getConnection()) {
      return deadLetterStore.list(conn, sourceId, limit);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to list dead letters", e);
      return List.of();
    }
  }

  public Optional<DeadLetterEntry> find(String id) {
    try (Connection conn = connectionProvider.getConnection()) {
      return deadLetterStore.find(conn, id);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to load dead letter " + id, e);
      return Optional.empty();
    }
  }

  public int count(String sourceId) {
    try (Connection conn = connectionProvider.getConnection()) {
      return deadLetterStore.count(conn, sourceId);
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to count dead letters", e);
      return 0;
    }
  }

  /**
   * Re-enqueues a dead letter for its consumer group and removes it.
   *
   * @return {@code true} if the entry existed and was replayed by this call
   * @throws intake.QueueUnavailableException if the envelope could not be re-enqueued;
   *         the dead letter is kept in that case
   */
  public boolean replay(String id) {
    Optional<DeadLetterEntry> entry = find(id);
    if (entry.isEmpty()) {
      return false;
    }
    OptionalLong seq = queue.requeueDeadLetter(entry.get());
    if (seq.isEmpty()) {
      logger.fine("Dead letter " + id + " was removed concurrently");
      return false;
    }
    logger.info("Replayed dead letter " + id + " (" + entry.get().envelope().identity()
        + ") to group " + entry.get().groupName() + " as entry " + seq.getAsLong());
    return true;
  }

  /**
   * Replays every dead letter of a source (or all sources), in batches.
   *
   * @return number of entries replayed
   */
  public int replayAll(String sourceId, int batchSize) {
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be > 0");
    }
    int total = 0;
    List<DeadLetterEntry> batch;
    do {
      batch = list(sourceId, batchSize);
      int replayed = 0;
      for (DeadLetterEntry entry : batch) {
        if (replay(entry.id())) {
          replayed++;
        }
      }
      total += replayed;
      if (replayed == 0) {
        break;
      }
    } while (batch.size() >= batchSize);
    return total;
  }

  /** Deletes a dead letter without replaying it. */
  public boolean discard(String id) {
    try (Connection conn = connectionProvider.getConnection()) {
      conn.setAutoCommit(true);
      return deadLetterStore.delete(conn, id) > 0;
    } catch (SQLException e) {
      logger.log(Level.SEVERE, "Failed to delete dead letter " + id, e);
      return false;
    }
  }
}
