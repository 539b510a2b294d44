package org.waabox.nexus;

import java.util.Objects;
import java.util.Optional;

import org.waabox.nexus.model.Competitor;

/**
 * The answer to a rank query.
 *
 * @param requestedRank the rank asked for
 * @param actualRank    the rank returned; differs from the requested one
 *                      only when a fallback was applied
 * @param competitor    the holder of the returned rank, never null
 * @param result        the result value that earned the rank
 * @param note          the fallback explanation, null on an exact match
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RankLookup(
    int requestedRank,
    int actualRank,
    Competitor competitor,
    int result,
    String note
) {

  /** Validates the competitor. */
  public RankLookup {
    Objects.requireNonNull(competitor, "competitor must not be null");
  }

  /**
   * Returns the fallback note.
   *
   * @return the note, or empty on an exact match
   */
  public Optional<String> fallbackNote() {
    return Optional.ofNullable(note);
  }
}
