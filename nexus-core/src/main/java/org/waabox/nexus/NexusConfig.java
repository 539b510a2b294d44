package org.waabox.nexus;

import java.time.Duration;
import java.util.Objects;

/**
 * Configuration of the nexus engine: where the source lives, how it is
 * paged and how hard it may be hit.
 *
 * <p>Instances are immutable. Start from {@link #create()} or
 * {@link #create(String)} and derive variants with the {@code with}
 * methods.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NexusConfig {

  /** The default source base URL. */
  public static final String DEFAULT_BASE_URL = "https://raw.githubusercontent"
      + ".com/robiningelbrecht/wca-rest-api/master/api";

  /** The upper bound of the worker pool. */
  public static final int MAX_CONCURRENCY = 32;

  /** The default worker pool size. */
  private static final int DEFAULT_CONCURRENCY = 20;

  /** The default number of competitor pages. */
  private static final int DEFAULT_COMPETITOR_PAGES = 268;

  /** The default number of competition pages. */
  private static final int DEFAULT_COMPETITION_PAGES = 18;

  /** The default per-request timeout. */
  private static final Duration DEFAULT_REQUEST_TIMEOUT =
      Duration.ofSeconds(60);

  /** The default pause between sequential pages. */
  private static final Duration DEFAULT_SEQUENTIAL_PAUSE =
      Duration.ofMillis(100);

  /** The default number of background bootstrap attempts. */
  private static final int DEFAULT_BOOTSTRAP_ATTEMPTS = 3;

  /** The source base URL. */
  private final String baseUrl;

  /** The competitor collection name. */
  private final String competitorCollection;

  /** The competition collection name. */
  private final String competitionCollection;

  /** The country document name. */
  private final String countriesDocument;

  /** The competitor page count, 0 to walk until exhausted. */
  private final int competitorPages;

  /** The competition page count, 0 to walk until exhausted. */
  private final int competitionPages;

  /** The worker pool size. */
  private final int concurrency;

  /** The per-request timeout. */
  private final Duration requestTimeout;

  /** The retry policy of page fetches. */
  private final RetryPolicy retryPolicy;

  /** The pause between sequential pages. */
  private final Duration sequentialPause;

  /** How long a query waits for the first load. */
  private final Duration queryWaitTimeout;

  /** How many times the background loader tries to bootstrap. */
  private final int bootstrapAttempts;

  /** The name given to stored snapshots. */
  private final String snapshotName;

  /** Private constructor; use the static factory methods instead. */
  private NexusConfig(final String theBaseUrl,
      final String theCompetitorCollection,
      final String theCompetitionCollection,
      final String theCountriesDocument, final int theCompetitorPages,
      final int theCompetitionPages, final int theConcurrency,
      final Duration theRequestTimeout, final RetryPolicy theRetryPolicy,
      final Duration theSequentialPause, final Duration theQueryWaitTimeout,
      final int theBootstrapAttempts, final String theSnapshotName) {
    baseUrl = Objects.requireNonNull(theBaseUrl, "baseUrl must not be null");
    competitorCollection = Objects.requireNonNull(theCompetitorCollection,
        "competitorCollection must not be null");
    competitionCollection = Objects.requireNonNull(theCompetitionCollection,
        "competitionCollection must not be null");
    countriesDocument = Objects.requireNonNull(theCountriesDocument,
        "countriesDocument must not be null");
    competitorPages = requireNotNegative(theCompetitorPages,
        "competitorPages");
    competitionPages = requireNotNegative(theCompetitionPages,
        "competitionPages");
    if (theConcurrency <= 0) {
      throw new IllegalArgumentException(
          "concurrency must be greater than 0, got: " + theConcurrency);
    }
    concurrency = Math.min(theConcurrency, MAX_CONCURRENCY);
    requestTimeout = requirePositive(theRequestTimeout, "requestTimeout");
    retryPolicy = Objects.requireNonNull(theRetryPolicy,
        "retryPolicy must not be null");
    sequentialPause = requireNotNegative(theSequentialPause,
        "sequentialPause");
    queryWaitTimeout = requireNotNegative(theQueryWaitTimeout,
        "queryWaitTimeout");
    if (theBootstrapAttempts <= 0) {
      throw new IllegalArgumentException(
          "bootstrapAttempts must be greater than 0, got: "
              + theBootstrapAttempts);
    }
    bootstrapAttempts = theBootstrapAttempts;
    snapshotName = Objects.requireNonNull(theSnapshotName,
        "snapshotName must not be null");
  }

  /**
   * Creates a configuration for the default source.
   *
   * @return a new configuration, never null
   */
  public static NexusConfig create() {
    return create(DEFAULT_BASE_URL);
  }

  /**
   * Creates a configuration for the given source with default settings:
   * collections {@code persons} and {@code competitions}, document
   * {@code countries}, 268 and 18 pages, 20 workers, 60 second requests,
   * {@link RetryPolicy#defaultPolicy()} and queries that fail right away
   * while loading.
   *
   * @param baseUrl the source base URL, never null
   *
   * @return a new configuration, never null
   */
  public static NexusConfig create(final String baseUrl) {
    return new NexusConfig(baseUrl, "persons", "competitions", "countries",
        DEFAULT_COMPETITOR_PAGES, DEFAULT_COMPETITION_PAGES,
        DEFAULT_CONCURRENCY, DEFAULT_REQUEST_TIMEOUT,
        RetryPolicy.defaultPolicy(), DEFAULT_SEQUENTIAL_PAUSE, Duration.ZERO,
        DEFAULT_BOOTSTRAP_ATTEMPTS, "nexus");
  }

  /**
   * Returns a copy with other collection and document names.
   *
   * @param theCompetitors  the competitor collection, never null
   * @param theCompetitions the competition collection, never null
   * @param theCountries    the country document, never null
   *
   * @return a new configuration, never null
   */
  public NexusConfig withCollections(final String theCompetitors,
      final String theCompetitions, final String theCountries) {
    return new NexusConfig(baseUrl, theCompetitors, theCompetitions,
        theCountries, competitorPages, competitionPages, concurrency,
        requestTimeout, retryPolicy, sequentialPause, queryWaitTimeout,
        bootstrapAttempts, snapshotName);
  }

  /**
   * Returns a copy with other page counts; 0 walks the collection until
   * the source reports a missing page.
   *
   * @param theCompetitorPages  the competitor page count, not negative
   * @param theCompetitionPages the competition page count, not negative
   *
   * @return a new configuration, never null
   */
  public NexusConfig withPages(final int theCompetitorPages,
      final int theCompetitionPages) {
    return new NexusConfig(baseUrl, competitorCollection,
        competitionCollection, countriesDocument, theCompetitorPages,
        theCompetitionPages, concurrency, requestTimeout, retryPolicy,
        sequentialPause, queryWaitTimeout, bootstrapAttempts, snapshotName);
  }

  /**
   * Returns a copy with another worker pool size, capped at
   * {@value #MAX_CONCURRENCY}.
   *
   * @param theConcurrency the pool size, greater than zero
   *
   * @return a new configuration, never null
   */
  public NexusConfig withConcurrency(final int theConcurrency) {
    return new NexusConfig(baseUrl, competitorCollection,
        competitionCollection, countriesDocument, competitorPages,
        competitionPages, theConcurrency, requestTimeout, retryPolicy,
        sequentialPause, queryWaitTimeout, bootstrapAttempts, snapshotName);
  }

  /**
   * Returns a copy with other fetch timings.
   *
   * @param theRequestTimeout  the per-request timeout, positive
   * @param theRetryPolicy     the retry policy, never null
   * @param theSequentialPause the pause between sequential pages, not
   *                           negative
   *
   * @return a new configuration, never null
   */
  public NexusConfig withFetchTiming(final Duration theRequestTimeout,
      final RetryPolicy theRetryPolicy, final Duration theSequentialPause) {
    return new NexusConfig(baseUrl, competitorCollection,
        competitionCollection, countriesDocument, competitorPages,
        competitionPages, concurrency, theRequestTimeout, theRetryPolicy,
        theSequentialPause, queryWaitTimeout, bootstrapAttempts,
        snapshotName);
  }

  /**
   * Returns a copy with another query wait timeout.
   *
   * @param theQueryWaitTimeout how long queries wait for the first load,
   *                            not negative
   *
   * @return a new configuration, never null
   */
  public NexusConfig withQueryWaitTimeout(final Duration theQueryWaitTimeout) {
    return new NexusConfig(baseUrl, competitorCollection,
        competitionCollection, countriesDocument, competitorPages,
        competitionPages, concurrency, requestTimeout, retryPolicy,
        sequentialPause, theQueryWaitTimeout, bootstrapAttempts,
        snapshotName);
  }

  /**
   * Returns a copy with another number of background bootstrap attempts.
   *
   * @param theBootstrapAttempts the attempts, greater than zero
   *
   * @return a new configuration, never null
   */
  public NexusConfig withBootstrapAttempts(final int theBootstrapAttempts) {
    return new NexusConfig(baseUrl, competitorCollection,
        competitionCollection, countriesDocument, competitorPages,
        competitionPages, concurrency, requestTimeout, retryPolicy,
        sequentialPause, queryWaitTimeout, theBootstrapAttempts,
        snapshotName);
  }

  /**
   * Returns a copy with another snapshot name.
   *
   * @param theSnapshotName the name, never null
   *
   * @return a new configuration, never null
   */
  public NexusConfig withSnapshotName(final String theSnapshotName) {
    return new NexusConfig(baseUrl, competitorCollection,
        competitionCollection, countriesDocument, competitorPages,
        competitionPages, concurrency, requestTimeout, retryPolicy,
        sequentialPause, queryWaitTimeout, bootstrapAttempts,
        theSnapshotName);
  }

  /** @return the source base URL, never null */
  public String baseUrl() {
    return baseUrl;
  }

  /** @return the competitor collection name, never null */
  public String competitorCollection() {
    return competitorCollection;
  }

  /** @return the competition collection name, never null */
  public String competitionCollection() {
    return competitionCollection;
  }

  /** @return the country document name, never null */
  public String countriesDocument() {
    return countriesDocument;
  }

  /** @return the competitor page count, 0 to walk until exhausted */
  public int competitorPages() {
    return competitorPages;
  }

  /** @return the competition page count, 0 to walk until exhausted */
  public int competitionPages() {
    return competitionPages;
  }

  /** @return the worker pool size */
  public int concurrency() {
    return concurrency;
  }

  /** @return the per-request timeout, never null */
  public Duration requestTimeout() {
    return requestTimeout;
  }

  /** @return the retry policy of page fetches, never null */
  public RetryPolicy retryPolicy() {
    return retryPolicy;
  }

  /** @return the pause between sequential pages, never null */
  public Duration sequentialPause() {
    return sequentialPause;
  }

  /** @return how long a query waits for the first load, never null */
  public Duration queryWaitTimeout() {
    return queryWaitTimeout;
  }

  /** @return how many times the background loader tries to bootstrap */
  public int bootstrapAttempts() {
    return bootstrapAttempts;
  }

  /** @return the name given to stored snapshots, never null */
  public String snapshotName() {
    return snapshotName;
  }

  private static int requireNotNegative(final int value, final String name) {
    if (value < 0) {
      throw new IllegalArgumentException(
          name + " must not be negative, got: " + value);
    }
    return value;
  }

  private static Duration requireNotNegative(final Duration value,
      final String name) {
    Objects.requireNonNull(value, name + " must not be null");
    if (value.isNegative()) {
      throw new IllegalArgumentException(
          name + " must not be negative, got: " + value);
    }
    return value;
  }

  private static Duration requirePositive(final Duration value,
      final String name) {
    Objects.requireNonNull(value, name + " must not be null");
    if (value.isZero() || value.isNegative()) {
      throw new IllegalArgumentException(
          name + " must be positive, got: " + value);
    }
    return value;
  }
}
