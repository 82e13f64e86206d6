package intake.media;

import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.regex.Pattern;

/** SHA-256 content addresses. */
public final class ContentHash {
  private static final Pattern VALID = Pattern.compile("[0-9a-f]{64}");

  private ContentHash() {}

  /** Lowercase hex SHA-256 of {@code content}. */
  public static String sha256(byte[] content) {
    try {
      MessageDigest digest = MessageDigest.getInstance("SHA-256");
      return HexFormat.of().formatHex(digest.digest(content));
    } catch (NoSuchAlgorithmException e) {
      throw new IllegalStateException("SHA-256 not available", e);
    }
  }

  public static boolean isValid(String hash) {
    return hash != null && VALID.matcher(hash).matches();
  }
}
