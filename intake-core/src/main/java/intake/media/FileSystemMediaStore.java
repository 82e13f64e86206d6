package intake.media;

import intake.StoreUnavailableException;
import intake.spi.MediaStore;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.Objects;
import java.util.logging.Logger;

/**
 * {@link MediaStore} on a local directory, laid out as
 * {@code <root>/ab/cd/<sha256>} where {@code ab} and {@code cd} are the first two byte
 * pairs of the hash.
 *
 * <p>Writes go to a temporary file in the target directory and are then moved into
 * place, so readers never see a partial blob and concurrent writers of the same
 * content converge on one file.
 */
public final class FileSystemMediaStore implements MediaStore {
  private static final Logger logger = Logger.getLogger(FileSystemMediaStore.class.getName());

  private final Path root;

  public FileSystemMediaStore(Path root) {
    this.root = Objects.requireNonNull(root, "root");
  }

  @Override
  public String put(byte[] content) {
    Objects.requireNonNull(content, "content");
    String hash = ContentHash.sha256(content);
    Path target = pathFor(hash);
    if (Files.exists(target)) {
      return hash;
    }
    try {
      Files.createDirectories(target.getParent());
      Path tmp = Files.createTempFile(target.getParent(), hash, ".tmp");
      try {
        Files.write(tmp, content);
        moveIntoPlace(tmp, target);
      } finally {
        Files.deleteIfExists(tmp);
      }
    } catch (IOException | UncheckedIOException e) {
      throw new StoreUnavailableException("Failed to store media " + hash + " under " + root, e);
    }
    logger.fine("Stored media " + hash + " (" + content.length + " bytes)");
    return hash;
  }

  private static void moveIntoPlace(Path tmp, Path target) throws IOException {
    try {
      Files.move(tmp, target, StandardCopyOption.ATOMIC_MOVE);
    } catch (FileAlreadyExistsException e) {
      // same content written concurrently
    } catch (AtomicMoveNotSupportedException e) {
      if (!Files.exists(target)) {
        Files.move(tmp, target);
      }
    }
  }

  @Override
  public boolean exists(String contentHash) {
    return ContentHash.isValid(contentHash) && Files.exists(pathFor(contentHash));
  }

  /** Location of a blob; the file may not exist. */
  public Path pathFor(String contentHash) {
    if (!ContentHash.isValid(contentHash)) {
      throw new IllegalArgumentException("not a sha256 hex digest: " + contentHash);
    }
    return root.resolve(contentHash.substring(0, 2))
        .resolve(contentHash.substring(2, 4))
        .resolve(contentHash);
  }
}
