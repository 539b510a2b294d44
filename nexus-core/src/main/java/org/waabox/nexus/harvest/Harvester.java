package org.waabox.nexus.harvest;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.nexus.NexusException;
import org.waabox.nexus.fetch.PageFetcher;
import org.waabox.nexus.fetch.PageResult;
import org.waabox.nexus.fetch.PageStatus;
import org.waabox.nexus.metrics.NexusMetrics;

/**
 * Fetches every page of a collection and merges them into one result.
 *
 * <p>Two pagination modes are supported:
 * <ul>
 *   <li>{@link #harvest(String, int)} fans the pages of a known page count
 *       out over a bounded worker pool.</li>
 *   <li>{@link #harvestUntilExhausted(String)} walks pages one at a time,
 *       pausing with jitter between them, until the source reports a page
 *       as not found. Meant for sources that throttle aggressively or whose
 *       page count is not known in advance.</li>
 * </ul>
 *
 * <p>Pages that fail after every retry are left out and reported in the
 * result; they never fail the harvest. Merging is done in page order after
 * every page completed, deduplicating records by id (the lowest page
 * wins), so the result does not depend on completion order or on the
 * worker count.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Harvester {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Harvester.class);

  /** Consecutive unavailable pages after which a sequential walk stops. */
  private static final int MAX_CONSECUTIVE_FAILURES = 3;

  /** Upper bound of pages walked sequentially. */
  private static final int MAX_SEQUENTIAL_PAGES = 10_000;

  /** The fetcher used for every page. */
  private final PageFetcher fetcher;

  /** The maximum number of in-flight page fetches. */
  private final int concurrency;

  /** The pause between two pages of a sequential walk. */
  private final Duration sequentialPause;

  /** The metrics reporter. */
  private final NexusMetrics metrics;

  /**
   * Creates a new harvester.
   *
   * @param theFetcher         the page fetcher, never null
   * @param theConcurrency     the worker pool size, greater than zero
   * @param theSequentialPause the base pause between sequential pages,
   *                           never null
   * @param theMetrics         the metrics reporter, never null
   */
  public Harvester(final PageFetcher theFetcher, final int theConcurrency,
      final Duration theSequentialPause, final NexusMetrics theMetrics) {
    fetcher = Objects.requireNonNull(theFetcher, "fetcher must not be null");
    if (theConcurrency <= 0) {
      throw new IllegalArgumentException(
          "concurrency must be greater than 0, got: " + theConcurrency);
    }
    concurrency = theConcurrency;
    sequentialPause = Objects.requireNonNull(theSequentialPause,
        "sequentialPause must not be null");
    metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
  }

  /**
   * Fetches pages {@code 1..totalPages} of a collection concurrently.
   *
   * @param collection the collection name, never null
   * @param totalPages the number of pages, not negative
   *
   * @return the merged result, never null
   *
   * @throws NexusException if the calling thread is interrupted
   */
  public HarvestResult harvest(final String collection,
      final int totalPages) {
    Objects.requireNonNull(collection, "collection must not be null");
    if (totalPages < 0) {
      throw new IllegalArgumentException(
          "totalPages must not be negative, got: " + totalPages);
    }
    final long start = System.nanoTime();
    final Map<Integer, PageResult> pages = new TreeMap<>();
    if (totalPages == 0) {
      return merge(collection, pages, start);
    }

    final int workers = Math.min(concurrency, totalPages);
    final ExecutorService pool = Executors.newFixedThreadPool(workers,
        workerFactory(collection));
    try {
      final List<Future<PageResult>> futures = new ArrayList<>(totalPages);
      for (int page = 1; page <= totalPages; page++) {
        final int pageIndex = page;
        futures.add(pool.submit(() -> fetcher.fetch(collection, pageIndex)));
      }
      for (int i = 0; i < futures.size(); i++) {
        final int pageIndex = i + 1;
        pages.put(pageIndex, await(collection, pageIndex, futures.get(i)));
      }
    } finally {
      pool.shutdownNow();
    }
    return merge(collection, pages, start);
  }

  /**
   * Fetches the pages of a collection one at a time until the source
   * reports a page as not found.
   *
   * <p>The walk also stops after three consecutive unavailable pages, so a
   * source that went away does not keep it running.
   *
   * @param collection the collection name, never null
   *
   * @return the merged result, never null
   */
  public HarvestResult harvestUntilExhausted(final String collection) {
    Objects.requireNonNull(collection, "collection must not be null");
    final long start = System.nanoTime();
    final Map<Integer, PageResult> pages = new TreeMap<>();
    int consecutiveFailures = 0;

    for (int page = 1; page <= MAX_SEQUENTIAL_PAGES; page++) {
      final PageResult result = fetcher.fetch(collection, page);
      if (result.status() == PageStatus.NOT_FOUND) {
        log.info("Collection '{}' exhausted at page {}", collection, page);
        break;
      }
      pages.put(page, result);
      consecutiveFailures = result.isOk() ? 0 : consecutiveFailures + 1;
      if (consecutiveFailures >= MAX_CONSECUTIVE_FAILURES) {
        log.warn("Collection '{}': {} consecutive pages unavailable, "
            + "stopping at page {}", collection, consecutiveFailures, page);
        break;
      }
      if (!pauseWithJitter()) {
        log.warn("Collection '{}': interrupted at page {}", collection, page);
        break;
      }
    }
    return merge(collection, pages, start);
  }

  private PageResult await(final String collection, final int pageIndex,
      final Future<PageResult> future) {
    try {
      return future.get();
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new NexusException("Harvest of '" + collection
          + "' interrupted", e);
    } catch (final ExecutionException e) {
      log.warn("Collection '{}': page {} failed: {}", collection, pageIndex,
          e.getCause() == null ? e.getMessage() : e.getCause().getMessage());
      return PageResult.unavailable(collection, pageIndex);
    }
  }

  private boolean pauseWithJitter() {
    if (sequentialPause.isZero()) {
      return true;
    }
    final long base = sequentialPause.toMillis();
    final long jitter = ThreadLocalRandom.current().nextLong(base / 2 + 1);
    try {
      Thread.sleep(base + jitter);
      return true;
    } catch (final InterruptedException e) {
      Thread.currentThread().interrupt();
      return false;
    }
  }

  private HarvestResult merge(final String collection,
      final Map<Integer, PageResult> pages, final long startNanos) {
    final Map<String, JsonNode> byId = new TreeMap<>();
    final SortedSet<Integer> fetched = new TreeSet<>();
    final SortedSet<Integer> failed = new TreeSet<>();

    for (final Map.Entry<Integer, PageResult> entry : pages.entrySet()) {
      final PageResult page = entry.getValue();
      if (!page.isOk()) {
        failed.add(entry.getKey());
        metrics.pageUnavailable(collection, entry.getKey());
        continue;
      }
      fetched.add(entry.getKey());
      for (final JsonNode record : page.items()) {
        final String id = record.path("id").asText("");
        if (!id.isBlank()) {
          byId.putIfAbsent(id, record);
        }
      }
    }

    final long durationMs = (System.nanoTime() - startNanos) / 1_000_000;
    if (!failed.isEmpty()) {
      log.warn("Collection '{}': {} page(s) dropped after retries: {}",
          collection, failed.size(), failed);
    }
    log.info("Collection '{}' harvested: {} pages, {} records in {}ms",
        collection, fetched.size(), byId.size(), durationMs);
    metrics.harvestCompleted(collection, fetched.size(), failed.size(),
        byId.size(), durationMs);

    return new HarvestResult(collection, new ArrayList<>(byId.values()),
        fetched, failed);
  }

  private static ThreadFactory workerFactory(
      final String collection) {
    final AtomicInteger counter = new AtomicInteger();
    return r -> {
      final Thread thread = new Thread(r,
          "nexus-harvest-" + collection + "-" + counter.incrementAndGet());
      thread.setDaemon(true);
      return thread;
    };
  }
}
