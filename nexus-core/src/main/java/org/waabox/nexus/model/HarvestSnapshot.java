package org.waabox.nexus.model;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * The raw collections produced by one harvest cycle.
 *
 * <p>This is the unit the cache persists; every derived index is rebuilt
 * from it.
 *
 * @param competitors         the competitors, sorted by id, never null
 * @param competitions        the competitions, sorted by id, never null
 * @param continentsByCountry lower-case ISO2 country code to continent
 *                            name, never null
 * @param createdAt           when the harvest completed, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record HarvestSnapshot(
    List<Competitor> competitors,
    List<Competition> competitions,
    Map<String, String> continentsByCountry,
    Instant createdAt
) {

  /** Validates the fields and copies the collections. */
  public HarvestSnapshot {
    competitors = List.copyOf(Objects.requireNonNull(competitors,
        "competitors must not be null"));
    competitions = List.copyOf(Objects.requireNonNull(competitions,
        "competitions must not be null"));
    continentsByCountry = Map.copyOf(Objects.requireNonNull(
        continentsByCountry, "continentsByCountry must not be null"));
    Objects.requireNonNull(createdAt, "createdAt must not be null");
  }

  /**
   * Returns the continent table in key order, for deterministic
   * serialization.
   *
   * @return a sorted copy of the continent table, never null
   */
  public Map<String, String> sortedContinents() {
    return new TreeMap<>(continentsByCountry);
  }
}
