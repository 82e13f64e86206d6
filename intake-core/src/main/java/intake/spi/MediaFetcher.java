package intake.spi;

import intake.media.FetchedMedia;

/**
 * Downloads the bytes behind a media reference carried in an envelope.
 */
@FunctionalInterface
public interface MediaFetcher {

  /**
   * @param mediaRef reference as supplied by the scraper, typically a URL
   * @return the media bytes
   * @throws intake.media.MediaFetchException when the media cannot be retrieved
   */
  byte[] fetch(String mediaRef);

  /**
   * Downloads the media with its MIME type. The default guesses the type from the
   * file name in the reference.
   *
   * @throws intake.media.MediaFetchException when the media cannot be retrieved
   */
  default FetchedMedia download(String mediaRef) {
    return new FetchedMedia(fetch(mediaRef), FetchedMedia.guessMimeType(mediaRef));
  }
}
