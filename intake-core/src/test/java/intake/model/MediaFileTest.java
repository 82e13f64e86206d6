package intake.model;

import intake.media.FetchedMedia;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MediaFileTest {

  @Test
  void mediaTypeFollowsMimePrefix() {
    assertEquals("photo", MediaFile.of("h", 1, "image/png").mediaType());
    assertEquals("video", MediaFile.of("h", 1, "video/mp4").mediaType());
    assertEquals("audio", MediaFile.of("h", 1, "audio/ogg").mediaType());
    assertEquals("document", MediaFile.of("h", 1, "application/pdf").mediaType());
  }

  @Test
  void negativeSizeIsRejected() {
    assertThrows(IllegalArgumentException.class, () -> MediaFile.of("h", -1, "image/png"));
  }

  @Test
  void mimeTypeIsGuessedFromThePathOnly() {
    assertEquals("image/jpeg", FetchedMedia.guessMimeType("https://cdn.example/p/photo.jpg?sig=abc.exe"));
    assertEquals(FetchedMedia.UNKNOWN_MIME_TYPE, FetchedMedia.guessMimeType("https://cdn.example/blob"));
  }

  @Test
  void contentTypeParametersAreDropped() {
    assertEquals("text/plain", new FetchedMedia(new byte[0], "Text/Plain; charset=UTF-8").mimeType());
    assertEquals(FetchedMedia.UNKNOWN_MIME_TYPE, new FetchedMedia(new byte[0], " ").mimeType());
  }
}
