package org.waabox.nexus.model;

import java.util.Objects;

/**
 * A competitor's ranked personal best in one event for one result type.
 *
 * <p>Rank numbers are positive integers, or null when the source did not
 * publish a rank for that scope.
 *
 * @param eventId       the event id, never null
 * @param best          the best result value, in the event's native unit
 * @param worldRank     the world rank, may be null
 * @param continentRank the continent rank, may be null
 * @param countryRank   the country rank, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RankEntry(
    String eventId,
    int best,
    Integer worldRank,
    Integer continentRank,
    Integer countryRank
) {

  /** Validates the event id. */
  public RankEntry {
    Objects.requireNonNull(eventId, "eventId must not be null");
  }
}
