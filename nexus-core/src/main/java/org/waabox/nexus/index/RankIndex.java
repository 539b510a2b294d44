package org.waabox.nexus.index;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import org.waabox.nexus.model.ResultType;

/**
 * An immutable lookup table: scope, event, result type and rank number to
 * the holder of that rank.
 *
 * <p>Scopes are lower-case: {@code world}, a continent name such as
 * {@code north_america}, or an ISO2 country code such as {@code us}.
 *
 * <p>Instances are built by {@link RankIndexBuilder} and are safe for
 * concurrent reads.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RankIndex {

  /** The fallback note template. */
  private static final String FALLBACK_NOTE = "Requested rank #%d not "
      + "available. Returning closest available rank #%d.";

  /** An index without entries. */
  private static final RankIndex EMPTY = new RankIndex(new TreeMap<>());

  /** scope, event, type, rank to holder. */
  private final Map<String, Map<String, Map<ResultType,
      NavigableMap<Integer, RankHolder>>>> table;

  /** The number of entries. */
  private final long size;

  RankIndex(final Map<String, Map<String, Map<ResultType,
      NavigableMap<Integer, RankHolder>>>> theTable) {
    table = theTable;
    long count = 0;
    for (final Map<String, Map<ResultType, NavigableMap<Integer, RankHolder>>>
        events : theTable.values()) {
      for (final Map<ResultType, NavigableMap<Integer, RankHolder>> types
          : events.values()) {
        for (final NavigableMap<Integer, RankHolder> ranks : types.values()) {
          count += ranks.size();
        }
      }
    }
    size = count;
  }

  /**
   * Returns an index without entries.
   *
   * @return the empty index, never null
   */
  public static RankIndex empty() {
    return EMPTY;
  }

  /**
   * Looks up a rank across one or more scopes given as a comma-joined
   * string, e.g. {@code "world"} or {@code "us,ca"}.
   *
   * @param scopes     the comma-joined scopes, never null
   * @param eventId    the event id, never null
   * @param type       the result type, never null
   * @param rankNumber the requested rank
   *
   * @return the match, or empty if no rank exists in the requested scopes
   *
   * @see #lookup(List, String, ResultType, int)
   */
  public Optional<RankMatch> lookup(final String scopes, final String eventId,
      final ResultType type, final int rankNumber) {
    Objects.requireNonNull(scopes, "scopes must not be null");
    return lookup(List.of(scopes.split(",")), eventId, type, rankNumber);
  }

  /**
   * Looks up a rank across one or more scopes.
   *
   * <p>The ranks of every requested scope are merged, later scopes taking
   * over a rank number present in an earlier one. Then:
   * <ol>
   *   <li>if the requested rank exists, it is returned as is;</li>
   *   <li>otherwise the highest available rank below it is returned;</li>
   *   <li>otherwise the smallest available rank is returned.</li>
   * </ol>
   * A fallback match carries a note naming both ranks.
   *
   * @param scopes     the scopes, in any case, never null
   * @param eventId    the event id, never null
   * @param type       the result type, never null
   * @param rankNumber the requested rank
   *
   * @return the match, or empty if no rank exists in the requested scopes
   */
  public Optional<RankMatch> lookup(final List<String> scopes,
      final String eventId, final ResultType type, final int rankNumber) {
    Objects.requireNonNull(scopes, "scopes must not be null");
    Objects.requireNonNull(eventId, "eventId must not be null");
    Objects.requireNonNull(type, "type must not be null");

    final NavigableMap<Integer, RankHolder> combined = new TreeMap<>();
    for (final String scope : scopes) {
      combined.putAll(ranks(scope, eventId, type));
    }
    if (combined.isEmpty()) {
      return Optional.empty();
    }

    final RankHolder exact = combined.get(rankNumber);
    if (exact != null) {
      return Optional.of(new RankMatch(rankNumber, rankNumber, exact, null));
    }
    final Integer floor = combined.floorKey(rankNumber);
    final int actual = floor != null ? floor : combined.firstKey();
    return Optional.of(new RankMatch(rankNumber, actual, combined.get(actual),
        String.format(Locale.ROOT, FALLBACK_NOTE, rankNumber, actual)));
  }

  /**
   * Returns the ranks of one scope, event and type.
   *
   * @param scope   the scope, in any case, never null
   * @param eventId the event id, never null
   * @param type    the result type, never null
   *
   * @return an unmodifiable rank to holder view, never null
   */
  public NavigableMap<Integer, RankHolder> ranks(final String scope,
      final String eventId, final ResultType type) {
    final String key = scope.trim().toLowerCase(Locale.ROOT);
    final NavigableMap<Integer, RankHolder> ranks = table
        .getOrDefault(key, Map.of())
        .getOrDefault(eventId, Map.of())
        .get(type);
    return ranks == null
        ? Collections.emptyNavigableMap()
        : Collections.unmodifiableNavigableMap(ranks);
  }

  /**
   * Returns every scope present in the index.
   *
   * @return the sorted scopes, never null
   */
  public List<String> scopes() {
    return List.copyOf(table.keySet());
  }

  /**
   * Returns every entry in key order: scope, event, type, then rank.
   *
   * @return the flattened entries, never null
   */
  public List<IndexedRank> entries() {
    final List<IndexedRank> entries = new ArrayList<>();
    table.forEach((scope, events) -> events.forEach((eventId, types) ->
        types.forEach((type, ranks) -> ranks.forEach((rank, holder) ->
            entries.add(new IndexedRank(scope, eventId, type, rank,
                holder))))));
    return entries;
  }

  /**
   * Returns the number of entries.
   *
   * @return the number of entries
   */
  public long size() {
    return size;
  }

  /**
   * Creates the per-event type table used while building.
   *
   * @return a new empty table, never null
   */
  static Map<ResultType, NavigableMap<Integer, RankHolder>> newTypeTable() {
    return new EnumMap<>(ResultType.class);
  }
}
