package intake.spi;

/**
 * Content-addressed blob store for media attached to messages.
 *
 * <p>The address of a blob is the lowercase hex SHA-256 of its bytes. Storing bytes
 * that are already present is a no-op, so at most one physical copy of any content
 * exists.
 */
public interface MediaStore {

  /**
   * Stores bytes and returns their content hash.
   *
   * @throws intake.StoreUnavailableException if the store rejects the write
   */
  String put(byte[] content);

  boolean exists(String contentHash);
}
