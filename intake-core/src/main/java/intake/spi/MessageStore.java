package intake.spi;

import intake.MessageIdentity;
import intake.model.StoredMessage;

import java.sql.Connection;
import java.util.Optional;

/**
 * Keyed store of processed messages. Writes are upserts on
 * ({@code sourceId}, {@code messageId}): storing the same message twice leaves one row
 * holding the later content.
 */
public interface MessageStore {

  void upsert(Connection conn, StoredMessage message);

  Optional<StoredMessage> find(Connection conn, MessageIdentity identity);

  int count(Connection conn);
}
