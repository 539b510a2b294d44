package org.waabox.nexus;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import org.waabox.nexus.model.Competition;
import org.waabox.nexus.model.Competitor;
import org.waabox.nexus.model.RankEntry;
import org.waabox.nexus.model.ResultRound;

/**
 * Builders of domain objects shared by the tests.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class Fixtures {

  private Fixtures() {
  }

  public static Competitor competitor(final String id, final String country,
      final List<RankEntry> singles) {
    return new Competitor(id, "Competitor " + id, country, 1, 0, singles,
        List.of(), List.of());
  }

  public static Competitor competitor(final String id, final String country,
      final List<RankEntry> singles, final List<RankEntry> averages,
      final List<ResultRound> results, final int worldRecords) {
    return new Competitor(id, "Competitor " + id, country, 1, worldRecords,
        singles, averages, results);
  }

  public static RankEntry rank(final String eventId, final int best,
      final Integer world, final Integer continent, final Integer country) {
    return new RankEntry(eventId, best, world, continent, country);
  }

  public static RankEntry worldRank(final String eventId, final int world) {
    return new RankEntry(eventId, 1000 + world, world, null, null);
  }

  public static List<RankEntry> ranksFor(final Set<String> events) {
    final List<RankEntry> entries = new ArrayList<>();
    for (final String eventId : new TreeSet<>(events)) {
      entries.add(new RankEntry(eventId, 1000, 500, 50, 5));
    }
    return entries;
  }

  public static ResultRound round(final String competitionId,
      final String eventId, final String round, final Integer position,
      final int best, final int average) {
    return new ResultRound(competitionId, eventId, round, position, best,
        average, null, null);
  }

  public static ResultRound finalRound(final String competitionId,
      final String eventId, final int position) {
    return round(competitionId, eventId, "Final", position, 1000, 1200);
  }

  public static Competition competition(final String id,
      final LocalDate till) {
    return new Competition(id, id, "US", till, till, List.of("333"));
  }

  public static Competition competition(final String id,
      final LocalDate from, final List<String> events) {
    return new Competition(id, id, "US", from, from, events);
  }
}
