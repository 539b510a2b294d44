package org.waabox.nexus;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.waabox.nexus.completionist.CompletionistClassifier;
import org.waabox.nexus.completionist.CompletionistRecord;
import org.waabox.nexus.harvest.RegionDirectory;
import org.waabox.nexus.index.PodiumIndex;
import org.waabox.nexus.index.PodiumIndexBuilder;
import org.waabox.nexus.index.RankIndex;
import org.waabox.nexus.index.RankIndexBuilder;
import org.waabox.nexus.model.Competitor;
import org.waabox.nexus.model.HarvestSnapshot;

/**
 * Everything queries read, derived from one harvest snapshot.
 *
 * <p>A state is built completely before it is published and never
 * changes afterwards, so a reader holding it sees one consistent
 * generation of every index.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
final class NexusState {

  /** The raw collections. */
  private final HarvestSnapshot snapshot;

  /** The competitors by id, in id order. */
  private final Map<String, Competitor> competitorsById;

  /** The rank index. */
  private final RankIndex rankIndex;

  /** The podium index. */
  private final PodiumIndex podiumIndex;

  /** The completionists, highest tier first. */
  private final List<CompletionistRecord> completionists;

  /** The generation number. */
  private final long version;

  private NexusState(final HarvestSnapshot theSnapshot,
      final Map<String, Competitor> theCompetitors,
      final RankIndex theRankIndex, final PodiumIndex thePodiumIndex,
      final List<CompletionistRecord> theCompletionists,
      final long theVersion) {
    snapshot = theSnapshot;
    competitorsById = Collections.unmodifiableMap(theCompetitors);
    rankIndex = theRankIndex;
    podiumIndex = thePodiumIndex;
    completionists = theCompletionists;
    version = theVersion;
  }

  /**
   * Derives every index from a snapshot.
   *
   * @param snapshot the raw collections, never null
   * @param version  the generation number
   *
   * @return the state, never null
   */
  static NexusState build(final HarvestSnapshot snapshot, final long version) {
    Objects.requireNonNull(snapshot, "snapshot must not be null");

    final Map<String, Competitor> competitors = new LinkedHashMap<>();
    snapshot.competitors().stream()
        .sorted((a, b) -> a.id().compareTo(b.id()))
        .forEach(c -> competitors.putIfAbsent(c.id(), c));

    final RegionDirectory regions = RegionDirectory.of(
        snapshot.continentsByCountry());
    final List<Competitor> ordered = List.copyOf(competitors.values());

    return new NexusState(snapshot, competitors,
        new RankIndexBuilder(regions).build(ordered),
        new PodiumIndexBuilder().build(ordered),
        new CompletionistClassifier(snapshot.competitions())
            .classifyAll(ordered),
        version);
  }

  HarvestSnapshot snapshot() {
    return snapshot;
  }

  Map<String, Competitor> competitorsById() {
    return competitorsById;
  }

  RankIndex rankIndex() {
    return rankIndex;
  }

  PodiumIndex podiumIndex() {
    return podiumIndex;
  }

  List<CompletionistRecord> completionists() {
    return completionists;
  }

  long version() {
    return version;
  }
}
