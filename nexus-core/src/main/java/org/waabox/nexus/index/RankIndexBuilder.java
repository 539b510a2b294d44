package org.waabox.nexus.index;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import org.waabox.nexus.harvest.RegionDirectory;
import org.waabox.nexus.model.Competitor;
import org.waabox.nexus.model.RankEntry;
import org.waabox.nexus.model.ResultType;

/**
 * Builds a {@link RankIndex} from a competitor collection.
 *
 * <p>For every ranked single and average of every competitor, one entry is
 * inserted per published scope rank: world, continent and country. The
 * continent comes from the competitor's country through the
 * {@link RegionDirectory}; a competitor whose country has no continent is
 * left out of the continent scope only.
 *
 * <p>Competitors are processed in id order and the first holder of a key
 * is kept, so the same collection always yields the same index.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RankIndexBuilder {

  /** The scope name of world ranks. */
  public static final String WORLD = "world";

  /** The directory resolving continents. */
  private final RegionDirectory regions;

  /**
   * Creates a new builder.
   *
   * @param theRegions the region directory, never null
   */
  public RankIndexBuilder(final RegionDirectory theRegions) {
    regions = Objects.requireNonNull(theRegions, "regions must not be null");
  }

  /**
   * Builds the index.
   *
   * @param competitors the competitors, never null
   *
   * @return the rank index, never null
   */
  public RankIndex build(final List<Competitor> competitors) {
    Objects.requireNonNull(competitors, "competitors must not be null");

    final List<Competitor> ordered = new ArrayList<>(competitors);
    ordered.sort(Comparator.comparing(Competitor::id));

    final Map<String, Map<String, Map<ResultType,
        NavigableMap<Integer, RankHolder>>>> table = new TreeMap<>();

    for (final Competitor competitor : ordered) {
      final Optional<String> continent = regions.continentOf(
          competitor.country());
      final String country = competitor.country() == null
          ? null : competitor.country().toLowerCase(Locale.ROOT);

      for (final ResultType type : ResultType.values()) {
        for (final RankEntry entry : competitor.ranks(type)) {
          final RankHolder holder = new RankHolder(competitor.id(),
              entry.best());
          insert(table, WORLD, entry.eventId(), type, entry.worldRank(),
              holder);
          if (continent.isPresent()) {
            insert(table, continent.get(), entry.eventId(), type,
                entry.continentRank(), holder);
          }
          if (country != null) {
            insert(table, country, entry.eventId(), type,
                entry.countryRank(), holder);
          }
        }
      }
    }
    return new RankIndex(table);
  }

  private static void insert(final Map<String, Map<String, Map<ResultType,
      NavigableMap<Integer, RankHolder>>>> table, final String scope,
      final String eventId, final ResultType type, final Integer rank,
      final RankHolder holder) {
    if (rank == null || rank <= 0) {
      return;
    }
    table.computeIfAbsent(scope, s -> new TreeMap<>())
        .computeIfAbsent(eventId, e -> RankIndex.newTypeTable())
        .computeIfAbsent(type, t -> new TreeMap<>())
        .putIfAbsent(rank, holder);
  }
}
