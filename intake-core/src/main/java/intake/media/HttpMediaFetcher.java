package intake.media;

import intake.spi.MediaFetcher;

import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import java.util.OptionalLong;

/**
 * Downloads media over HTTP(S) with {@link HttpClient}. Non-2xx responses and bodies
 * larger than {@code maxBytes} fail the fetch; at most {@code maxBytes + 1} bytes are
 * ever read. The MIME type comes from {@code Content-Type}, falling back to the file
 * name in the reference.
 */
public final class HttpMediaFetcher implements MediaFetcher {
  private static final int MAX_ARRAY_SIZE = Integer.MAX_VALUE - 8;

  private final HttpClient httpClient;
  private final Duration timeout;
  private final long maxBytes;

  public HttpMediaFetcher(Duration timeout, long maxBytes) {
    this(HttpClient.newBuilder()
        .connectTimeout(timeout)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build(), timeout, maxBytes);
  }

  public HttpMediaFetcher(HttpClient httpClient, Duration timeout, long maxBytes) {
    this.httpClient = Objects.requireNonNull(httpClient, "httpClient");
    this.timeout = Objects.requireNonNull(timeout, "timeout");
    if (maxBytes <= 0) {
      throw new IllegalArgumentException("maxBytes must be > 0");
    }
    this.maxBytes = maxBytes;
  }

  @Override
  public byte[] fetch(String mediaRef) {
    return download(mediaRef).content();
  }

  @Override
  public FetchedMedia download(String mediaRef) {
    URI uri;
    try {
      uri = URI.create(mediaRef);
    } catch (IllegalArgumentException e) {
      throw new MediaFetchException("Invalid media reference: " + mediaRef, e);
    }
    if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
      throw new MediaFetchException("Unsupported media reference scheme: " + mediaRef);
    }
    HttpRequest request = HttpRequest.newBuilder(uri).timeout(timeout).GET().build();
    HttpResponse<InputStream> response;
    try {
      response = httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());
    } catch (IOException e) {
      throw new MediaFetchException("Failed to download " + mediaRef, e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new MediaFetchException("Interrupted while downloading " + mediaRef, e);
    }
    // closing the body before it is fully read aborts the transfer
    try (InputStream body = response.body()) {
      if (response.statusCode() < 200 || response.statusCode() >= 300) {
        throw new MediaFetchException("Download of " + mediaRef + " failed: status=" + response.statusCode());
      }
      OptionalLong declared = response.headers().firstValueAsLong("Content-Length");
      if (declared.isPresent() && declared.getAsLong() > maxBytes) {
        throw new MediaFetchException("Media " + mediaRef + " declares " + declared.getAsLong()
            + " bytes, limit is " + maxBytes);
      }
      byte[] content = body.readNBytes((int) Math.min(maxBytes + 1, MAX_ARRAY_SIZE));
      if (content.length > maxBytes) {
        throw new MediaFetchException("Media " + mediaRef + " exceeds " + maxBytes + " bytes");
      }
      String mimeType = response.headers().firstValue("Content-Type")
          .orElseGet(() -> FetchedMedia.guessMimeType(mediaRef));
      return new FetchedMedia(content, mimeType);
    } catch (IOException e) {
      throw new MediaFetchException("Failed to read " + mediaRef, e);
    }
  }
}
