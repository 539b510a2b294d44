package org.waabox.nexus.model;

import java.util.Locale;
import java.util.Objects;
import java.util.Set;

/**
 * One round a competitor took part in, normalized from either of the two
 * result-history shapes the source publishes.
 *
 * <p>Result values follow the source convention: a positive number is a
 * valid result, zero or negative values mean DNF, DNS or no result.
 *
 * @param competitionId the competition id, may be null when the source
 *                      record did not carry one
 * @param eventId       the event id, never null
 * @param round         the round name or round type code, never null
 * @param position      the finishing position, may be null
 * @param best          the best single of the round
 * @param average       the average of the round
 * @param singleRecord  the regional record tag of the single, may be null
 * @param averageRecord the regional record tag of the average, may be null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record ResultRound(
    String competitionId,
    String eventId,
    String round,
    Integer position,
    int best,
    int average,
    String singleRecord,
    String averageRecord
) {

  /** Round names and round type codes that denote a final. */
  private static final Set<String> FINAL_ROUNDS = Set.of("final", "f", "c");

  /** The tag the source uses for a world record. */
  private static final String WORLD_RECORD = "WR";

  /** Validates the required fields. */
  public ResultRound {
    Objects.requireNonNull(eventId, "eventId must not be null");
    Objects.requireNonNull(round, "round must not be null");
  }

  /**
   * Returns whether this round is a final.
   *
   * @return true for a final round
   */
  public boolean isFinal() {
    return FINAL_ROUNDS.contains(round.trim().toLowerCase(Locale.ROOT));
  }

  /**
   * Returns whether this round has a valid single.
   *
   * @return true if the best single is a positive result
   */
  public boolean hasValidSingle() {
    return best > 0;
  }

  /**
   * Returns whether this round has a valid average.
   *
   * @return true if the average is a positive result
   */
  public boolean hasValidAverage() {
    return average > 0;
  }

  /**
   * Returns whether this round is a podium finish: a final, position 1 to
   * 3, with at least one valid result.
   *
   * @return true for a podium finish
   */
  public boolean isPodium() {
    return isFinal()
        && position != null && position >= 1 && position <= 3
        && (hasValidSingle() || hasValidAverage());
  }

  /**
   * Returns whether this round is a won final.
   *
   * @return true if the competitor finished first in a final with a valid
   *         result
   */
  public boolean isWin() {
    return isPodium() && position == 1;
  }

  /**
   * Returns whether a world record was set in this round.
   *
   * @return true if the single or the average is tagged as world record
   */
  public boolean setWorldRecord() {
    return WORLD_RECORD.equalsIgnoreCase(singleRecord)
        || WORLD_RECORD.equalsIgnoreCase(averageRecord);
  }
}
