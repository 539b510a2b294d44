package org.waabox.nexus;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.nexus.completionist.Category;
import org.waabox.nexus.completionist.CompletionistRecord;
import org.waabox.nexus.fetch.HttpPageFetcher;
import org.waabox.nexus.fetch.PageFetcher;
import org.waabox.nexus.harvest.HarvestResult;
import org.waabox.nexus.harvest.Harvester;
import org.waabox.nexus.harvest.RecordParser;
import org.waabox.nexus.harvest.RegionDirectory;
import org.waabox.nexus.index.RankMatch;
import org.waabox.nexus.metrics.NexusMetrics;
import org.waabox.nexus.metrics.NoopNexusMetrics;
import org.waabox.nexus.model.Competition;
import org.waabox.nexus.model.Competitor;
import org.waabox.nexus.model.HarvestSnapshot;
import org.waabox.nexus.model.ResultType;
import org.waabox.nexus.query.CompetitionFilter;
import org.waabox.nexus.query.EventComparator;
import org.waabox.nexus.query.EventComparison;
import org.waabox.nexus.query.NameSearch;
import org.waabox.nexus.snapshot.CborSnapshotSerializer;
import org.waabox.nexus.snapshot.SerializedSnapshot;
import org.waabox.nexus.snapshot.SnapshotSerializer;
import org.waabox.nexus.snapshot.SnapshotStore;

/**
 * The main entry point of the competitor data engine.
 *
 * <p>Nexus loads the competitor and competition collections, either from
 * the {@link SnapshotStore} or by harvesting the paginated source, derives
 * the rank, podium and completionist indices from them, and answers
 * queries against the result.
 *
 * <p>Loading is serialized by a single lock, so concurrent callers of
 * {@link #bootstrap()} never harvest twice. The derived state is published
 * through an atomic reference: a query sees either the whole previous
 * state or the whole new one. Queries issued before the first load
 * completes wait up to {@link NexusConfig#queryWaitTimeout()} and then
 * fail with {@link DataNotReadyException}.
 *
 * <p>Usage example:
 * <pre>{@code
 * Nexus nexus = Nexus.builder()
 *     .config(NexusConfig.create().withConcurrency(16))
 *     .snapshotStore(new FileSystemSnapshotStore(cacheDir))
 *     .build();
 *
 * nexus.start();
 * nexus.awaitReady(Duration.ofMinutes(5));
 *
 * Optional<RankLookup> first = nexus.lookupRank(List.of("world"), "333",
 *     ResultType.SINGLES, 1);
 * }</pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Nexus {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(Nexus.class);

  /** The page source. */
  private final PageFetcher fetcher;

  /** The optional snapshot store, may be null. */
  private final SnapshotStore snapshotStore;

  /** The snapshot serializer. */
  private final SnapshotSerializer<HarvestSnapshot> serializer;

  /** The engine configuration. */
  private final NexusConfig config;

  /** The metrics reporter. */
  private final NexusMetrics metrics;

  /** The clock stamping harvested snapshots. */
  private final Clock clock;

  /** The harvester. */
  private final Harvester harvester;

  /** The raw record parser. */
  private final RecordParser parser = new RecordParser();

  /** Serializes bootstrap and refresh. */
  private final ReentrantLock loadLock = new ReentrantLock();

  /** The published state, null until the first load. */
  private final AtomicReference<NexusState> current = new AtomicReference<>();

  /** Signals queries that a state is published. */
  private final ReadinessGate gate = new ReadinessGate();

  /** The generation counter of published states. */
  private final AtomicLong versionCounter = new AtomicLong();

  /** The last background load failure, null when none. */
  private final AtomicReference<Throwable> lastFailure =
      new AtomicReference<>();

  /** Whether this instance has been started. */
  private final AtomicBoolean started = new AtomicBoolean(false);

  /** Whether this instance has been stopped. */
  private final AtomicBoolean stopped = new AtomicBoolean(false);

  /** The background loader thread, null until started. */
  private volatile Thread loader;

  private Nexus(final PageFetcher theFetcher,
      final SnapshotStore theSnapshotStore,
      final SnapshotSerializer<HarvestSnapshot> theSerializer,
      final NexusConfig theConfig, final NexusMetrics theMetrics,
      final Clock theClock) {
    fetcher = theFetcher;
    snapshotStore = theSnapshotStore;
    serializer = theSerializer;
    config = theConfig;
    metrics = theMetrics;
    clock = theClock;
    harvester = new Harvester(theFetcher, theConfig.concurrency(),
        theConfig.sequentialPause(), theMetrics);
  }

  /**
   * Creates a new builder.
   *
   * @return a new builder, never null
   */
  public static Builder builder() {
    return new Builder();
  }

  /**
   * Starts loading in a single background daemon thread and returns
   * immediately.
   *
   * <p>The loader tries {@link #bootstrap()} up to
   * {@link NexusConfig#bootstrapAttempts()} times, backing off per the
   * configured retry policy. If every attempt fails, the engine stays not
   * ready and the cause is available from {@link #loadFailure()}.
   *
   * @throws IllegalStateException if already started or stopped
   */
  public void start() {
    if (stopped.get()) {
      throw new IllegalStateException("Cannot start after stop()");
    }
    if (!started.compareAndSet(false, true)) {
      throw new IllegalStateException("Nexus has already been started");
    }
    final Thread thread = new Thread(this::bootstrapInBackground,
        "nexus-loader");
    thread.setDaemon(true);
    loader = thread;
    thread.start();
    log.info("Background loader started");
  }

  /**
   * Loads the data once: from the snapshot store when it holds a usable
   * snapshot, otherwise by harvesting the source and saving the result.
   *
   * <p>Does nothing if a state is already published. Concurrent callers
   * block until the first one finishes.
   *
   * @throws NexusException if no competitor page could be fetched and no
   *                        snapshot was available
   */
  public void bootstrap() {
    loadLock.lock();
    try {
      if (current.get() != null) {
        return;
      }
      if (tryLoadFromSnapshotStore()) {
        return;
      }
      final HarvestSnapshot snapshot = harvestSnapshot();
      publish(snapshot, "harvest");
      saveSnapshotIfPossible(snapshot);
    } finally {
      loadLock.unlock();
    }
  }

  /**
   * Harvests the source again and replaces the published state.
   *
   * <p>The previous state keeps answering queries until the new one is
   * complete. The snapshot store is bypassed for reading and updated on
   * success.
   *
   * @throws NexusException if no competitor page could be fetched, in
   *                        which case the previous state stays published
   */
  public void refresh() {
    if (stopped.get()) {
      throw new IllegalStateException("Cannot refresh after stop()");
    }
    loadLock.lock();
    try {
      final HarvestSnapshot snapshot = harvestSnapshot();
      publish(snapshot, "harvest");
      saveSnapshotIfPossible(snapshot);
    } catch (final RuntimeException e) {
      metrics.loadFailed(e);
      throw e;
    } finally {
      loadLock.unlock();
    }
  }

  /**
   * Stops the background loader. Queries issued afterwards fail with
   * {@link DataNotReadyException}.
   */
  public void stop() {
    if (!stopped.compareAndSet(false, true)) {
      return;
    }
    final Thread thread = loader;
    if (thread != null) {
      thread.interrupt();
    }
    gate.markNotReady();
    log.info("Nexus stopped");
  }

  /**
   * Returns whether a state is published.
   *
   * @return true once the first load completed
   */
  public boolean isReady() {
    return gate.isReady();
  }

  /**
   * Waits for the first load to complete.
   *
   * @param timeout the maximum time to wait, never null
   *
   * @return true if ready, false on timeout or interruption
   */
  public boolean awaitReady(final Duration timeout) {
    return gate.waitReady(timeout);
  }

  /**
   * Returns the failure of the last background load, if it failed.
   *
   * @return the cause, or empty
   */
  public Optional<Throwable> loadFailure() {
    return Optional.ofNullable(lastFailure.get());
  }

  /**
   * Looks up who holds a rank.
   *
   * @param scopes     the scopes to merge, e.g. {@code world},
   *                   {@code europe} or {@code us}, never null
   * @param eventId    the event id, never null
   * @param type       the result type, never null
   * @param rankNumber the requested rank
   *
   * @return the rank holder, exact or the closest available rank with a
   *         note, or empty if the scopes have no rank for the event
   *
   * @throws DataNotReadyException if no state is published in time
   */
  public Optional<RankLookup> lookupRank(final List<String> scopes,
      final String eventId, final ResultType type, final int rankNumber) {
    final NexusState state = awaitState();
    return state.rankIndex().lookup(scopes, eventId, type, rankNumber)
        .flatMap(match -> toLookup(state, match));
  }

  /**
   * Looks up who holds a rank, with comma-joined scopes and the result
   * type given by its wire name.
   *
   * @param scopes     the comma-joined scopes, never null
   * @param eventId    the event id, never null
   * @param resultType {@code singles} or {@code averages}, never null
   * @param rankNumber the requested rank
   *
   * @return the rank holder, or empty if none
   *
   * @throws IllegalArgumentException if the result type is unknown
   * @throws DataNotReadyException    if no state is published in time
   */
  public Optional<RankLookup> lookupRank(final String scopes,
      final String eventId, final String resultType, final int rankNumber) {
    Objects.requireNonNull(scopes, "scopes must not be null");
    return lookupRank(List.of(scopes.split(",")), eventId,
        ResultType.fromWireName(resultType), rankNumber);
  }

  /**
   * Finds the competitors whose podium events are exactly the given set.
   *
   * @param eventIds the event ids, never null
   *
   * @return the competitors in id order, never null
   *
   * @throws DataNotReadyException if no state is published in time
   */
  public List<Competitor> findBySet(final Set<String> eventIds) {
    final NexusState state = awaitState();
    final List<Competitor> result = new ArrayList<>();
    for (final String id : state.podiumIndex().findBySet(eventIds)) {
      final Competitor competitor = state.competitorsById().get(id);
      if (competitor != null) {
        result.add(competitor);
      }
    }
    return result;
  }

  /**
   * Returns the podium counts of a competitor.
   *
   * @param competitorId the competitor id, never null
   *
   * @return event id to podium count, never null
   *
   * @throws DataNotReadyException if no state is published in time
   */
  public Map<String, Integer> podiumsOf(final String competitorId) {
    return awaitState().podiumIndex().podiumsOf(competitorId);
  }

  /**
   * Returns every completionist.
   *
   * @return the records, highest tier first, never null
   *
   * @throws DataNotReadyException if no state is published in time
   */
  public List<CompletionistRecord> listCompletionists() {
    return awaitState().completionists();
  }

  /**
   * Returns the completionists of one tier.
   *
   * @param category the tier, never null
   *
   * @return the records, by achievement date, never null
   *
   * @throws DataNotReadyException if no state is published in time
   */
  public List<CompletionistRecord> listCompletionists(
      final Category category) {
    Objects.requireNonNull(category, "category must not be null");
    final List<CompletionistRecord> result = new ArrayList<>();
    for (final CompletionistRecord record : awaitState().completionists()) {
      if (record.category() == category) {
        result.add(record);
      }
    }
    return result;
  }

  /**
   * Returns a competitor by id.
   *
   * @param competitorId the competitor id, never null
   *
   * @return the competitor, or empty if unknown
   *
   * @throws DataNotReadyException if no state is published in time
   */
  public Optional<Competitor> competitor(final String competitorId) {
    Objects.requireNonNull(competitorId, "competitorId must not be null");
    return Optional.ofNullable(
        awaitState().competitorsById().get(competitorId));
  }

  /**
   * Finds competitors by a fragment of their name.
   *
   * @param fragment the name fragment, never null
   *
   * @return at most 50 competitors in id order, never null
   *
   * @throws DataNotReadyException if no state is published in time
   */
  public List<Competitor> searchByName(final String fragment) {
    return NameSearch.search(awaitState().competitorsById().values(),
        fragment);
  }

  /**
   * Finds competitions by the events they hold, most recent first.
   *
   * @param eventIds the event ids, empty for the latest competitions,
   *                 never null
   * @param partial  true to match competitions holding at least the
   *                 events, false to match the exact set
   *
   * @return the competitions, never null
   *
   * @throws DataNotReadyException if no state is published in time
   */
  public List<Competition> findCompetitions(final Set<String> eventIds,
      final boolean partial) {
    return CompetitionFilter.find(awaitState().snapshot().competitions(),
        eventIds, partial);
  }

  /**
   * Finds the competitors who are faster in one event than in another.
   *
   * @param firstEvent  the event expected to be faster, never null
   * @param secondEvent the event expected to be slower, never null
   *
   * @return at most 100 comparisons, largest difference first, never null
   *
   * @throws DataNotReadyException if no state is published in time
   */
  public List<EventComparison> compareEvents(final String firstEvent,
      final String secondEvent) {
    return EventComparator.compare(awaitState().competitorsById().values(),
        firstEvent, secondEvent);
  }

  private NexusState awaitState() {
    final Duration timeout = config.queryWaitTimeout();
    if (!gate.waitReady(timeout)) {
      throw new DataNotReadyException(timeout);
    }
    final NexusState state = current.get();
    if (state == null) {
      throw new DataNotReadyException(timeout);
    }
    return state;
  }

  private Optional<RankLookup> toLookup(final NexusState state,
      final RankMatch match) {
    final Competitor competitor = state.competitorsById().get(
        match.holder().competitorId());
    if (competitor == null) {
      log.debug("Rank holder {} is not a known competitor",
          match.holder().competitorId());
      return Optional.empty();
    }
    return Optional.of(new RankLookup(match.requestedRank(),
        match.actualRank(), competitor, match.holder().result(),
        match.note()));
  }

  private void bootstrapInBackground() {
    final int maxAttempts = config.bootstrapAttempts();
    for (int attempt = 1; attempt <= maxAttempts; attempt++) {
      if (stopped.get()) {
        return;
      }
      try {
        bootstrap();
        lastFailure.set(null);
        return;
      } catch (final RuntimeException e) {
        lastFailure.set(e);
        metrics.loadFailed(e);
        if (attempt < maxAttempts) {
          log.warn("Bootstrap attempt {}/{} failed: {}", attempt,
              maxAttempts, e.getMessage());
          if (!sleepOrAbort(config.retryPolicy().delayAfter(attempt))) {
            return;
          }
        } else {
          log.error("All {} bootstrap attempts failed, data stays "
              + "unavailable", maxAttempts, e);
        }
      }
    }
  }

  /**
   * Sleeps for the given duration.
   *
   * @param backoff the duration to sleep, never null
   *
   * @return false if interrupted, with the interrupt flag restored
   */
  private boolean sleepOrAbort(final Duration backoff) {
    try {
      Thread.sleep(backoff.toMillis());
      return true;
    } catch (final InterruptedException ie) {
      Thread.currentThread().interrupt();
      log.error("Bootstrap interrupted");
      return false;
    }
  }

  /**
   * Attempts to publish the snapshot store content.
   *
   * <p>A snapshot that cannot be deserialized is deleted and treated as a
   * miss.
   *
   * @return true if a state was published from the store
   */
  private boolean tryLoadFromSnapshotStore() {
    if (snapshotStore == null) {
      return false;
    }
    final Optional<SerializedSnapshot> stored;
    try {
      stored = snapshotStore.load();
    } catch (final RuntimeException e) {
      log.warn("Snapshot store load failed: {}", e.getMessage());
      return false;
    }
    if (stored.isEmpty()) {
      log.info("No usable snapshot stored, harvesting the source");
      return false;
    }

    final HarvestSnapshot snapshot;
    try {
      snapshot = serializer.deserialize(stored.get().data());
    } catch (final RuntimeException e) {
      log.warn("Stored snapshot {} is unreadable, discarding it: {}",
          stored.get().hash(), e.getMessage());
      snapshotStore.delete();
      return false;
    }
    publish(snapshot, "cache");
    log.info("Loaded {} competitors and {} competitions from snapshot "
        + "created at {}", snapshot.competitors().size(),
        snapshot.competitions().size(), snapshot.createdAt());
    return true;
  }

  /**
   * Harvests every collection of the source.
   *
   * @return the snapshot, never null
   *
   * @throws NexusException if no competitor page could be fetched
   */
  private HarvestSnapshot harvestSnapshot() {
    final HarvestResult competitorPages = harvest(
        config.competitorCollection(), config.competitorPages());
    if (competitorPages.nothingFetched()) {
      throw new NexusException("No page of '"
          + config.competitorCollection() + "' could be fetched");
    }
    final HarvestResult competitionPages = harvest(
        config.competitionCollection(), config.competitionPages());
    if (competitionPages.nothingFetched()) {
      log.warn("No page of '{}' could be fetched, continuing without "
          + "competitions", config.competitionCollection());
    }

    final List<Competitor> competitors = new ArrayList<>();
    for (final JsonNode node : competitorPages.records()) {
      parser.parseCompetitor(node).ifPresent(competitors::add);
    }
    final List<Competition> competitions = new ArrayList<>();
    for (final JsonNode node : competitionPages.records()) {
      parser.parseCompetition(node).ifPresent(competitions::add);
    }

    final RegionDirectory regions = fetcher
        .fetchDocument(config.countriesDocument())
        .map(RegionDirectory::fromCountries)
        .orElseGet(() -> {
          log.warn("Document '{}' unavailable, continent scopes will be "
              + "empty", config.countriesDocument());
          return RegionDirectory.empty();
        });

    log.info("Harvested {} competitors, {} competitions, {} countries",
        competitors.size(), competitions.size(), regions.size());
    return new HarvestSnapshot(competitors, competitions, regions.asMap(),
        clock.instant());
  }

  private HarvestResult harvest(final String collection, final int pages) {
    return pages > 0
        ? harvester.harvest(collection, pages)
        : harvester.harvestUntilExhausted(collection);
  }

  /**
   * Builds the state of a snapshot and publishes it.
   *
   * <p>Must be called while holding the load lock.
   *
   * @param snapshot the snapshot, never null
   * @param source   the load source for metrics, never null
   */
  private void publish(final HarvestSnapshot snapshot, final String source) {
    final NexusState state = NexusState.build(snapshot,
        versionCounter.incrementAndGet());
    current.set(state);
    gate.markReady();
    metrics.snapshotLoaded(source);
    metrics.indexSizeReported("rank", state.rankIndex().size());
    metrics.indexSizeReported("podium", state.podiumIndex().size());
    metrics.indexSizeReported("completionist",
        state.completionists().size());
    log.info("Published state version {} from {}: {} rank entries, {} "
        + "podium holders, {} completionists", state.version(), source,
        state.rankIndex().size(), state.podiumIndex().size(),
        state.completionists().size());
  }

  private void saveSnapshotIfPossible(final HarvestSnapshot snapshot) {
    if (snapshotStore == null) {
      return;
    }
    try {
      final byte[] bytes = serializer.serialize(snapshot);
      snapshotStore.save(SerializedSnapshot.of(config.snapshotName(),
          serializer.formatVersion(), snapshot.createdAt(), bytes));
    } catch (final RuntimeException e) {
      log.warn("Could not save snapshot, next start will harvest again",
          e);
    }
  }

  /**
   * Builder for {@link Nexus} instances.
   *
   * <p>Defaults:
   * <ul>
   *   <li>config: {@link NexusConfig#create()}</li>
   *   <li>pageFetcher: an {@link HttpPageFetcher} built from the
   *       config</li>
   *   <li>snapshotStore: none</li>
   *   <li>serializer: {@link CborSnapshotSerializer}</li>
   *   <li>metrics: {@link NoopNexusMetrics}</li>
   *   <li>clock: the system UTC clock</li>
   * </ul>
   */
  public static final class Builder {

    /** The optional configuration. */
    private NexusConfig config;

    /** The optional page fetcher. */
    private PageFetcher pageFetcher;

    /** The optional snapshot store. */
    private SnapshotStore snapshotStore;

    /** The optional serializer. */
    private SnapshotSerializer<HarvestSnapshot> serializer;

    /** The optional metrics reporter. */
    private NexusMetrics metrics;

    /** The optional clock. */
    private Clock clock;

    /** Creates a new builder with default settings. */
    private Builder() {
    }

    /**
     * Sets the configuration.
     *
     * @param theConfig the configuration, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder config(final NexusConfig theConfig) {
      config = Objects.requireNonNull(theConfig, "config must not be null");
      return this;
    }

    /**
     * Sets the page source.
     *
     * @param thePageFetcher the page fetcher, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder pageFetcher(final PageFetcher thePageFetcher) {
      pageFetcher = Objects.requireNonNull(thePageFetcher,
          "pageFetcher must not be null");
      return this;
    }

    /**
     * Sets the snapshot store.
     *
     * <p>If not set, every start harvests the source.
     *
     * @param theSnapshotStore the snapshot store, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder snapshotStore(final SnapshotStore theSnapshotStore) {
      snapshotStore = Objects.requireNonNull(theSnapshotStore,
          "snapshotStore must not be null");
      return this;
    }

    /**
     * Sets the snapshot serializer.
     *
     * @param theSerializer the serializer, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder serializer(
        final SnapshotSerializer<HarvestSnapshot> theSerializer) {
      serializer = Objects.requireNonNull(theSerializer,
          "serializer must not be null");
      return this;
    }

    /**
     * Sets the metrics reporter.
     *
     * @param theMetrics the metrics reporter, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder metrics(final NexusMetrics theMetrics) {
      metrics = Objects.requireNonNull(theMetrics, "metrics must not be null");
      return this;
    }

    /**
     * Sets the clock stamping harvested snapshots.
     *
     * @param theClock the clock, never null
     *
     * @return this builder for chaining, never null
     */
    public Builder clock(final Clock theClock) {
      clock = Objects.requireNonNull(theClock, "clock must not be null");
      return this;
    }

    /**
     * Builds the engine. Any unset optional field gets its default.
     *
     * @return a new engine, never null
     */
    public Nexus build() {
      final NexusConfig resolvedConfig = config != null
          ? config : NexusConfig.create();
      final PageFetcher resolvedFetcher = pageFetcher != null
          ? pageFetcher
          : HttpPageFetcher.create(resolvedConfig.baseUrl(),
              resolvedConfig.requestTimeout(), resolvedConfig.retryPolicy());
      final SnapshotSerializer<HarvestSnapshot> resolvedSerializer =
          serializer != null ? serializer : new CborSnapshotSerializer();
      final NexusMetrics resolvedMetrics = metrics != null
          ? metrics : new NoopNexusMetrics();
      final Clock resolvedClock = clock != null ? clock : Clock.systemUTC();

      return new Nexus(resolvedFetcher, snapshotStore, resolvedSerializer,
          resolvedConfig, resolvedMetrics, resolvedClock);
    }
  }
}
