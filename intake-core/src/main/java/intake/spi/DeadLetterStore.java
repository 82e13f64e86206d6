package intake.spi;

import intake.model.DeadLetterEntry;

import java.sql.Connection;
import java.util.List;
import java.util.Optional;

/**
 * Holding area for envelopes whose retries are exhausted. Entries stay until an
 * operator replays or discards them.
 */
public interface DeadLetterStore {

  /** Inserts an entry; called inside the same transaction that marks the delivery DEAD. */
  void insert(Connection conn, DeadLetterEntry entry);

  Optional<DeadLetterEntry> find(Connection conn, String id);

  /**
   * Lists entries, oldest first.
   *
   * @param sourceId filter on the envelope source, or {@code null} for all
   * @param limit    maximum rows
   */
  List<DeadLetterEntry> list(Connection conn, String sourceId, int limit);

  int count(Connection conn, String sourceId);

  int delete(Connection conn, String id);
}
