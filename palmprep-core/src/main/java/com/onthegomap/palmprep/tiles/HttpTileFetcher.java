package com.onthegomap.palmprep.tiles;

import static com.google.common.net.HttpHeaders.USER_AGENT;

import com.onthegomap.palmprep.config.PalmPrepConfig;
import com.onthegomap.palmprep.util.FileUtils;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Downloads tiles from {@link TileGrid#url(TileKey)} over HTTP.
 * <p>
 * Only status {@code 200} counts as success. Connection errors, timeouts and server errors are retried up to
 * {@link PalmPrepConfig#httpRetries()} times with a linearly growing wait; any other status fails right away.
 */
public class HttpTileFetcher implements TileFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpTileFetcher.class);
  private static final int HTTP_OK = 200;

  private final TileGrid grid;
  private final Duration timeout;
  private final int retries;
  private final Duration retryWait;
  private final String userAgent;
  private final HttpClient client;

  HttpTileFetcher(TileGrid grid, Duration timeout, int retries, Duration retryWait, String userAgent) {
    this.grid = grid;
    this.timeout = timeout;
    this.retries = retries;
    this.retryWait = retryWait;
    this.userAgent = userAgent;
    this.client = HttpClient.newBuilder()
      .connectTimeout(timeout)
      .followRedirects(HttpClient.Redirect.NORMAL)
      .build();
  }

  public static HttpTileFetcher create(TileGrid grid, PalmPrepConfig config) {
    return new HttpTileFetcher(grid, config.httpTimeout(), config.httpRetries(), config.httpRetryWait(),
      config.httpUserAgent());
  }

  @Override
  public void fetch(TileKey tile, Path destination) throws AcquisitionFailure {
    String url = grid.url(tile);
    Path tmp = destination.resolveSibling(destination.getFileName() + ".part");
    FileUtils.createParentDirectories(destination);
    AcquisitionFailure failure = null;
    for (int attempt = 0; attempt <= retries; attempt++) {
      if (attempt > 0) {
        LOGGER.debug("Retrying {} after: {}", url, failure.getMessage());
        retrySleep(attempt);
      }
      try {
        int status = download(url, tmp);
        if (status == HTTP_OK) {
          FileUtils.move(tmp, destination);
          LOGGER.debug("Downloaded {} to {}", url, destination);
          return;
        }
        FileUtils.deleteFile(tmp);
        failure = new AcquisitionFailure(tile.name(), "Bad response: " + status + " from " + url);
        if (!isRetryable(status)) {
          throw failure;
        }
      } catch (IOException e) {
        FileUtils.deleteFile(tmp);
        failure = new AcquisitionFailure(tile.name(), "Error downloading " + url + ": " + e, e);
      }
    }
    LOGGER.debug("Exhausted {} retries for {}", retries, url);
    throw failure;
  }

  private static boolean isRetryable(int status) {
    return status == 408 || status == 429 || status >= 500;
  }

  /** Downloads {@code url} into {@code destination} and returns the HTTP status code. */
  int download(String url, Path destination) throws IOException {
    var request = HttpRequest.newBuilder(URI.create(url))
      .timeout(timeout)
      .header(USER_AGENT, userAgent)
      .GET()
      .build();
    try {
      HttpResponse<Path> response = client.send(request, HttpResponse.BodyHandlers.ofFile(destination));
      return response.statusCode();
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException("Interrupted downloading " + url, e);
    }
  }

  protected void retrySleep(int attempt) {
    try {
      Thread.sleep(retryWait.multipliedBy(attempt).toMillis());
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new IllegalStateException(e);
    }
  }
}
