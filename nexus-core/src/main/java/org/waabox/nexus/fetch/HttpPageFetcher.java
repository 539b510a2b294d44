package org.waabox.nexus.fetch;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.nexus.RetryPolicy;

/**
 * {@link PageFetcher} over HTTP, using {@code java.net.http.HttpClient}.
 *
 * <p>Page URLs are {@code {baseUrl}/{collection}-page-{n}.json} and
 * document URLs {@code {baseUrl}/{name}.json}. A page body must be either
 * a JSON array of records or an object with an {@code items} array.
 *
 * <p>An HTTP 404 is reported as {@link PageStatus#NOT_FOUND} without
 * retrying. Network errors, other non-2xx statuses, malformed JSON and
 * unexpected root shapes are retried following the {@link RetryPolicy}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class HttpPageFetcher implements PageFetcher {

  /** The class logger. */
  private static final Logger log =
      LoggerFactory.getLogger(HttpPageFetcher.class);

  /** HTTP 404 Not Found status code. */
  private static final int HTTP_NOT_FOUND = 404;

  /** Shared ObjectMapper for tree model operations. */
  private static final ObjectMapper MAPPER = new ObjectMapper();

  /** The client used for every request. */
  private final HttpClient client;

  /** The base URL, without trailing slash. */
  private final String baseUrl;

  /** The timeout of a single request. */
  private final Duration requestTimeout;

  /** The retry policy applied to every page. */
  private final RetryPolicy retryPolicy;

  /**
   * Creates a new fetcher.
   *
   * @param theClient         the HTTP client, never null
   * @param theBaseUrl        the source base URL, never null
   * @param theRequestTimeout the per-request timeout, never null
   * @param theRetryPolicy    the retry policy, never null
   */
  public HttpPageFetcher(final HttpClient theClient, final String theBaseUrl,
      final Duration theRequestTimeout, final RetryPolicy theRetryPolicy) {
    client = Objects.requireNonNull(theClient, "client must not be null");
    Objects.requireNonNull(theBaseUrl, "baseUrl must not be null");
    baseUrl = theBaseUrl.endsWith("/")
        ? theBaseUrl.substring(0, theBaseUrl.length() - 1) : theBaseUrl;
    requestTimeout = Objects.requireNonNull(theRequestTimeout,
        "requestTimeout must not be null");
    retryPolicy = Objects.requireNonNull(theRetryPolicy,
        "retryPolicy must not be null");
  }

  /**
   * Creates a fetcher with a default HTTP client.
   *
   * @param baseUrl        the source base URL, never null
   * @param requestTimeout the per-request timeout, never null
   * @param retryPolicy    the retry policy, never null
   *
   * @return a new fetcher, never null
   */
  public static HttpPageFetcher create(final String baseUrl,
      final Duration requestTimeout, final RetryPolicy retryPolicy) {
    final HttpClient client = HttpClient.newBuilder()
        .connectTimeout(requestTimeout)
        .followRedirects(HttpClient.Redirect.NORMAL)
        .build();
    return new HttpPageFetcher(client, baseUrl, requestTimeout, retryPolicy);
  }

  /** {@inheritDoc} */
  @Override
  public PageResult fetch(final String collection, final int pageIndex) {
    Objects.requireNonNull(collection, "collection must not be null");
    final String label = collection + "-page-" + pageIndex;
    final Attempt attempt = fetchWithRetry(pageUrl(collection, pageIndex),
        label);
    switch (attempt.status) {
      case OK:
        return PageResult.ok(collection, pageIndex, attempt.items);
      case NOT_FOUND:
        return PageResult.notFound(collection, pageIndex);
      default:
        return PageResult.unavailable(collection, pageIndex);
    }
  }

  /** {@inheritDoc} */
  @Override
  public Optional<List<JsonNode>> fetchDocument(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    final Attempt attempt = fetchWithRetry(baseUrl + "/" + name + ".json",
        name);
    if (attempt.status != PageStatus.OK) {
      return Optional.empty();
    }
    return Optional.of(attempt.items);
  }

  /**
   * Builds the URL of a page.
   *
   * @param collection the collection name, never null
   * @param pageIndex  the page index
   *
   * @return the page URL, never null
   */
  public String pageUrl(final String collection, final int pageIndex) {
    return baseUrl + "/" + collection + "-page-" + pageIndex + ".json";
  }

  /**
   * Sleeps between attempts.
   *
   * @param delay the time to sleep, never null
   *
   * @return false if the thread was interrupted
   */
  protected boolean pause(final Duration delay) {
    try {
      Thread.sleep(delay.toMillis());
      return true;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private Attempt fetchWithRetry(final String url, final String label) {
    final HttpRequest request = HttpRequest.newBuilder()
        .uri(URI.create(url))
        .timeout(requestTimeout)
        .header("Accept", "application/json")
        .GET()
        .build();

    final int maxAttempts = retryPolicy.maxAttempts();
    for (int attempt = 0; attempt < maxAttempts; attempt++) {
      try {
        final HttpResponse<byte[]> response = client.send(request,
            HttpResponse.BodyHandlers.ofByteArray());
        final int status = response.statusCode();
        if (status == HTTP_NOT_FOUND) {
          log.debug("{} not found at {}", label, url);
          return new Attempt(PageStatus.NOT_FOUND, List.of());
        }
        if (status < 200 || status > 299) {
          throw new IOException("Unexpected HTTP status " + status);
        }
        final List<JsonNode> items = extractItems(response.body());
        log.debug("Fetched {} ({} items)", label, items.size());
        return new Attempt(PageStatus.OK, items);
      } catch (final IOException e) {
        log.debug("Fetching {} failed, attempt {}/{}: {}", label,
            attempt + 1, maxAttempts, e.getMessage());
      } catch (final InterruptedException e) {
        Thread.currentThread().interrupt();
        log.warn("Interrupted while fetching {}", label);
        return new Attempt(PageStatus.UNAVAILABLE, List.of());
      }

      if (attempt < maxAttempts - 1
          && !pause(retryPolicy.delayAfter(attempt))) {
        log.warn("Interrupted while backing off on {}", label);
        return new Attempt(PageStatus.UNAVAILABLE, List.of());
      }
    }
    log.warn("Skipping {} after {} failed attempts", label, maxAttempts);
    return new Attempt(PageStatus.UNAVAILABLE, List.of());
  }

  /**
   * Parses a page body and returns its records.
   *
   * @param body the raw body, never null
   *
   * @return the records, never null
   *
   * @throws IOException if the body is not JSON or has an unexpected shape
   */
  static List<JsonNode> extractItems(final byte[] body) throws IOException {
    final JsonNode root = MAPPER.readTree(body);
    final JsonNode items;
    if (root != null && root.isArray()) {
      items = root;
    } else if (root != null && root.isObject()
        && root.path("items").isArray()) {
      items = root.get("items");
    } else {
      throw new IOException("Unexpected root format: expected an array or"
          + " an object with an 'items' array");
    }
    final List<JsonNode> result = new ArrayList<>(items.size());
    items.forEach(result::add);
    return result;
  }

  /** The outcome of one retried request. */
  private static final class Attempt {

    /** The outcome status. */
    private final PageStatus status;

    /** The parsed records. */
    private final List<JsonNode> items;

    private Attempt(final PageStatus theStatus, final List<JsonNode> theItems) {
      status = theStatus;
      items = theItems;
    }
  }
}
