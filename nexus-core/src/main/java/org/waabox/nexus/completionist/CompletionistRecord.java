package org.waabox.nexus.completionist;

import java.time.LocalDate;
import java.util.Objects;
import java.util.Optional;

/**
 * The completionist tier reached by a competitor.
 *
 * @param competitorId      the competitor id, never null
 * @param name              the competitor name, never null
 * @param country           the competitor country, may be null
 * @param category          the tier reached, never null
 * @param achievedOn        the end date of the competition at which every
 *                          condition of the tier first held, null when the
 *                          history does not pin it down
 * @param completingEventId the event that completed the tier, null when
 *                          {@code achievedOn} is null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record CompletionistRecord(
    String competitorId,
    String name,
    String country,
    Category category,
    LocalDate achievedOn,
    String completingEventId
) {

  /** Validates the required fields. */
  public CompletionistRecord {
    Objects.requireNonNull(competitorId, "competitorId must not be null");
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(category, "category must not be null");
  }

  /**
   * Returns the achievement date.
   *
   * @return the date, or empty if it could not be resolved
   */
  public Optional<LocalDate> achievementDate() {
    return Optional.ofNullable(achievedOn);
  }

  /**
   * Returns the event that completed the tier.
   *
   * @return the event id, or empty if it could not be resolved
   */
  public Optional<String> completingEvent() {
    return Optional.ofNullable(completingEventId);
  }
}
