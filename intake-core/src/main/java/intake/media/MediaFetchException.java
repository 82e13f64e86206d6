package intake.media;

import intake.IntakeException;

/** A media reference could not be downloaded. The envelope is nacked and retried. */
public class MediaFetchException extends IntakeException {
  public MediaFetchException(String message) {
    super(message);
  }

  public MediaFetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
