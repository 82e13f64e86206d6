package intake.media;

import java.net.URI;
import java.net.URLConnection;
import java.util.Locale;
import java.util.Objects;

/**
 * Downloaded media bytes together with their MIME type.
 *
 * @param content  the media bytes
 * @param mimeType lower-case MIME type without parameters
 */
public record FetchedMedia(byte[] content, String mimeType) {
  public static final String UNKNOWN_MIME_TYPE = "application/octet-stream";

  public FetchedMedia {
    Objects.requireNonNull(content, "content");
    mimeType = mimeType == null || mimeType.isBlank() ? UNKNOWN_MIME_TYPE : bareMimeType(mimeType);
  }

  /** Guesses the MIME type from the file name at the end of {@code mediaRef}. */
  public static String guessMimeType(String mediaRef) {
    String name = mediaRef;
    try {
      String path = URI.create(mediaRef).getPath();
      if (path != null && !path.isEmpty()) {
        name = path;
      }
    } catch (IllegalArgumentException e) {
      // not a URI, guess from the raw reference
    }
    String guessed = URLConnection.guessContentTypeFromName(name);
    return guessed == null ? UNKNOWN_MIME_TYPE : guessed;
  }

  static String bareMimeType(String contentType) {
    int semicolon = contentType.indexOf(';');
    String bare = semicolon < 0 ? contentType : contentType.substring(0, semicolon);
    bare = bare.trim().toLowerCase(Locale.ROOT);
    return bare.isEmpty() ? UNKNOWN_MIME_TYPE : bare;
  }
}
