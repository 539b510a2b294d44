package org.waabox.nexus.index;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.waabox.nexus.Fixtures.competitor;
import static org.waabox.nexus.Fixtures.rank;
import static org.waabox.nexus.Fixtures.worldRank;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Random;

import org.junit.jupiter.api.Test;
import org.waabox.nexus.harvest.RegionDirectory;
import org.waabox.nexus.model.Competitor;
import org.waabox.nexus.model.ResultType;

/**
 * Tests for {@link RankIndexBuilder} and lookups on {@link RankIndex}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class RankIndexBuilderTest {

  private static final RegionDirectory REGIONS = RegionDirectory.of(
      Map.of("US", "XN", "ES", "XE"));

  private final RankIndexBuilder builder = new RankIndexBuilder(REGIONS);

  private RankIndex sparseWorldIndex() {
    return builder.build(List.of(
        competitor("A", "US", List.of(worldRank("333", 1))),
        competitor("B", "US", List.of(worldRank("333", 3))),
        competitor("C", "ES", List.of(worldRank("333", 5))),
        competitor("D", "ES", List.of(worldRank("333", 9)))));
  }

  @Test
  void whenLookingUp_givenExistingRank_shouldReturnItWithoutNote() {
    final RankMatch match = sparseWorldIndex()
        .lookup("world", "333", ResultType.SINGLES, 5).orElseThrow();

    assertEquals(5, match.actualRank());
    assertEquals("C", match.holder().competitorId());
    assertEquals(1005, match.holder().result());
    assertTrue(match.exact());
    assertTrue(match.fallbackNote().isEmpty());
  }

  @Test
  void whenLookingUp_givenMissingRank_shouldFallBackToClosestLowerRank() {
    final RankMatch match = sparseWorldIndex()
        .lookup("world", "333", ResultType.SINGLES, 4).orElseThrow();

    assertEquals(4, match.requestedRank());
    assertEquals(3, match.actualRank());
    assertEquals("B", match.holder().competitorId());
    assertEquals("Requested rank #4 not available. Returning closest "
        + "available rank #3.", match.fallbackNote().orElseThrow());
  }

  @Test
  void whenLookingUp_givenRankBelowEveryKey_shouldReturnTheLowestRank() {
    final RankMatch match = sparseWorldIndex()
        .lookup("world", "333", ResultType.SINGLES, 0).orElseThrow();

    assertEquals(1, match.actualRank());
    assertFalse(match.exact());
  }

  @Test
  void whenLookingUp_givenRankAboveEveryKey_shouldReturnTheHighestRank() {
    final RankMatch match = sparseWorldIndex()
        .lookup("world", "333", ResultType.SINGLES, 100).orElseThrow();

    assertEquals(9, match.actualRank());
    assertEquals("D", match.holder().competitorId());
  }

  @Test
  void whenLookingUp_givenUnknownScopeOrEvent_shouldReturnEmpty() {
    final RankIndex index = sparseWorldIndex();

    assertTrue(index.lookup("asia", "333", ResultType.SINGLES, 1).isEmpty());
    assertTrue(index.lookup("world", "444", ResultType.SINGLES, 1).isEmpty());
    assertTrue(index.lookup("world", "333", ResultType.AVERAGES, 1)
        .isEmpty());
  }

  @Test
  void whenBuilding_givenCompetitorRanks_shouldFillEveryScope() {
    final RankIndex index = builder.build(List.of(
        competitor("A", "US", List.of(rank("333", 500, 10, 2, 1)))));

    assertEquals(List.of("north_america", "us", "world"), index.scopes());
    assertEquals(3, index.size());
    assertEquals("A", index.lookup(" US ", "333", ResultType.SINGLES, 1)
        .orElseThrow().holder().competitorId());
    assertEquals(2, index.ranks("North_America", "333", ResultType.SINGLES)
        .firstKey());
  }

  @Test
  void whenBuilding_givenUnmappedCountry_shouldSkipTheContinentScope() {
    final RankIndex index = builder.build(List.of(
        competitor("A", "JP", List.of(rank("333", 500, 10, 2, 1)))));

    assertEquals(List.of("jp", "world"), index.scopes());
  }

  @Test
  void whenBuilding_givenNoCountry_shouldOnlyIndexTheWorld() {
    final RankIndex index = builder.build(List.of(
        competitor("A", null, List.of(rank("333", 500, 10, 2, 1)))));

    assertEquals(List.of("world"), index.scopes());
  }

  @Test
  void whenBuilding_givenTwoHoldersOfOneRank_shouldKeepTheLowestId() {
    final RankIndex index = builder.build(List.of(
        competitor("Z", "US", List.of(worldRank("333", 1))),
        competitor("M", "US", List.of(worldRank("333", 1)))));

    assertEquals("M", index.lookup("world", "333", ResultType.SINGLES, 1)
        .orElseThrow().holder().competitorId());
  }

  @Test
  void whenBuilding_givenShuffledInput_shouldProduceTheSameIndex() {
    final List<Competitor> competitors = new ArrayList<>();
    for (int i = 0; i < 50; i++) {
      competitors.add(competitor(String.format("C%03d", i),
          i % 2 == 0 ? "US" : "ES",
          List.of(rank("333", 900 + i, i % 7 + 1, i % 5 + 1, i % 3 + 1))));
    }
    final List<IndexedRank> expected = builder.build(competitors).entries();

    final List<Competitor> shuffled = new ArrayList<>(competitors);
    Collections.shuffle(shuffled, new Random(42));

    assertEquals(expected, builder.build(shuffled).entries());
  }

  @Test
  void whenLookingUp_givenSeveralScopes_shouldLetLaterScopesOverride() {
    final RankIndex index = builder.build(List.of(
        competitor("A", "US", List.of(rank("333", 500, 10, 1, 1))),
        competitor("B", "ES", List.of(rank("333", 600, 20, 1, 1)))));

    assertEquals("B", index.lookup(List.of("north_america", "europe"), "333",
        ResultType.SINGLES, 1).orElseThrow().holder().competitorId());
    assertEquals("A", index.lookup("europe,north_america", "333",
        ResultType.SINGLES, 1).orElseThrow().holder().competitorId());
  }

  @Test
  void whenLookingUp_givenEmptyIndex_shouldReturnEmpty() {
    assertTrue(RankIndex.empty().lookup("world", "333", ResultType.SINGLES, 1)
        .isEmpty());
    assertEquals(0, RankIndex.empty().size());
  }
}
