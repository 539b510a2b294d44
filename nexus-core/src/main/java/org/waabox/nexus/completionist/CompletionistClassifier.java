package org.waabox.nexus.completionist;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.nexus.model.Competition;
import org.waabox.nexus.model.Competitor;
import org.waabox.nexus.model.ResultRound;
import org.waabox.nexus.model.ResultType;

/**
 * Assigns completionist tiers and resolves when each tier was reached.
 *
 * <p>The tier is decided on the competitor's whole record: ranked singles
 * and averages plus the round history. The achievement date is then found
 * by replaying the rounds in chronological order, ordered by competition
 * end date, competition id, event id and round order, and picking the
 * first round after which every condition of that tier holds at once.
 * Rounds of competitions missing from the competition collection have no
 * date and are left out of the replay.
 *
 * <p>A competitor whose records report a world record but whose history
 * carries no world record tag is treated as a world record holder at
 * every point of the replay.
 *
 * <p>Instances are immutable and safe for concurrent use.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CompletionistClassifier {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      CompletionistClassifier.class);

  /** Round order by round name or round type code, unknown rounds are 0. */
  private static final Map<String, Integer> ROUND_ORDER = Map.ofEntries(
      Map.entry("0", 0), Map.entry("h", 0), Map.entry("qualification", 0),
      Map.entry("1", 1), Map.entry("d", 1), Map.entry("first round", 1),
      Map.entry("2", 2), Map.entry("e", 2), Map.entry("second round", 2),
      Map.entry("3", 3), Map.entry("g", 3), Map.entry("semi final", 3),
      Map.entry("b", 3), Map.entry("b final", 3),
      Map.entry("f", 4), Map.entry("c", 4), Map.entry("final", 4));

  /** Highest tier first, then earliest achievement, then id. */
  private static final Comparator<CompletionistRecord> LISTING_ORDER =
      Comparator.comparing(CompletionistRecord::category,
              Comparator.reverseOrder())
          .thenComparing(CompletionistRecord::achievedOn,
              Comparator.nullsLast(Comparator.naturalOrder()))
          .thenComparing(CompletionistRecord::competitorId);

  /** The competitions by id, for round dates. */
  private final Map<String, Competition> competitions;

  /**
   * Creates a new classifier.
   *
   * @param theCompetitions the known competitions, never null
   */
  public CompletionistClassifier(final Collection<Competition> theCompetitions) {
    Objects.requireNonNull(theCompetitions, "competitions must not be null");
    competitions = new HashMap<>();
    for (final Competition competition : theCompetitions) {
      competitions.putIfAbsent(competition.id(), competition);
    }
  }

  /**
   * Classifies every competitor and keeps those who reached a tier.
   *
   * @param competitors the competitors, never null
   *
   * @return the records, highest tier first, then by achievement date and
   *         competitor id, never null
   */
  public List<CompletionistRecord> classifyAll(
      final Collection<Competitor> competitors) {
    Objects.requireNonNull(competitors, "competitors must not be null");
    final List<CompletionistRecord> records = new ArrayList<>();
    for (final Competitor competitor : competitors) {
      classify(competitor).ifPresent(records::add);
    }
    records.sort(LISTING_ORDER);
    log.debug("Classified {} completionists out of {} competitors",
        records.size(), competitors.size());
    return List.copyOf(records);
  }

  /**
   * Classifies one competitor.
   *
   * @param competitor the competitor, never null
   *
   * @return the record, or empty if the competitor has not reached bronze
   */
  public Optional<CompletionistRecord> classify(final Competitor competitor) {
    final Optional<Category> category = categoryOf(competitor);
    if (category.isEmpty()) {
      return Optional.empty();
    }

    final boolean tagged = competitor.results().stream()
        .anyMatch(ResultRound::setWorldRecord);
    final Progress replay = new Progress(
        competitor.isWorldRecordHolder() && !tagged);

    for (final ResultRound round : timeline(competitor)) {
      replay.apply(round);
      if (replay.satisfies(category.get())) {
        final Competition competition = competitions.get(
            round.competitionId());
        return Optional.of(new CompletionistRecord(competitor.id(),
            competitor.name(), competitor.country(), category.get(),
            competition.till(), round.eventId()));
      }
    }
    return Optional.of(new CompletionistRecord(competitor.id(),
        competitor.name(), competitor.country(), category.get(), null, null));
  }

  /**
   * Returns the highest tier the competitor's whole record satisfies.
   *
   * @param competitor the competitor, never null
   *
   * @return the tier, or empty below bronze
   */
  public Optional<Category> categoryOf(final Competitor competitor) {
    Objects.requireNonNull(competitor, "competitor must not be null");
    final Progress whole = new Progress(competitor.isWorldRecordHolder());
    competitor.results().forEach(whole::apply);
    whole.coverRanked(competitor.rankedEvents(ResultType.SINGLES),
        competitor.rankedEvents(ResultType.AVERAGES));

    Category reached = null;
    for (final Category category : whole.satisfied()) {
      reached = category;
    }
    return Optional.ofNullable(reached);
  }

  /**
   * Returns the competitor's dated rounds in chronological order.
   *
   * @param competitor the competitor, never null
   *
   * @return the rounds, never null
   */
  List<ResultRound> timeline(final Competitor competitor) {
    final List<ResultRound> rounds = new ArrayList<>();
    for (final ResultRound round : competitor.results()) {
      if (round.competitionId() != null
          && competitions.containsKey(round.competitionId())) {
        rounds.add(round);
      }
    }
    rounds.sort(Comparator
        .comparing((ResultRound r) -> competitions.get(r.competitionId())
            .till())
        .thenComparing(ResultRound::competitionId)
        .thenComparing(ResultRound::eventId)
        .thenComparingInt(r -> roundOrder(r.round())));
    return rounds;
  }

  /**
   * Returns the position of a round within its event.
   *
   * @param round the round name or round type code, never null
   *
   * @return the order, 0 for unknown rounds
   */
  static int roundOrder(final String round) {
    return ROUND_ORDER.getOrDefault(round.trim().toLowerCase(Locale.ROOT), 0);
  }
}
