package intake.model;

import java.util.Locale;
import java.util.Objects;

/**
 * One archived attachment of a stored message.
 *
 * @param contentHash hex SHA-256 of the bytes, also the media store key
 * @param sizeBytes   length of the content
 * @param mimeType    MIME type reported by the source or guessed from the reference
 * @param mediaType   {@code photo}, {@code video}, {@code audio} or {@code document}
 */
public record MediaFile(String contentHash, long sizeBytes, String mimeType, String mediaType) {
  public MediaFile {
    Objects.requireNonNull(contentHash, "contentHash");
    Objects.requireNonNull(mimeType, "mimeType");
    Objects.requireNonNull(mediaType, "mediaType");
    if (sizeBytes < 0) {
      throw new IllegalArgumentException("sizeBytes must be >= 0");
    }
  }

  public static MediaFile of(String contentHash, long sizeBytes, String mimeType) {
    return new MediaFile(contentHash, sizeBytes, mimeType, mediaTypeOf(mimeType));
  }

  static String mediaTypeOf(String mimeType) {
    String mime = mimeType.toLowerCase(Locale.ROOT);
    if (mime.startsWith("image/")) {
      return "photo";
    }
    if (mime.startsWith("video/")) {
      return "video";
    }
    if (mime.startsWith("audio/")) {
      return "audio";
    }
    return "document";
  }
}
