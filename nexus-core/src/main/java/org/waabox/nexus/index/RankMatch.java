package org.waabox.nexus.index;

import java.util.Objects;
import java.util.Optional;

/**
 * The answer of a rank lookup.
 *
 * @param requestedRank the rank the caller asked for
 * @param actualRank    the rank returned, equal to the requested one on an
 *                      exact match
 * @param holder        the holder of the returned rank, never null
 * @param note          a human readable explanation when a fallback rank
 *                      was returned, null on an exact match
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RankMatch(
    int requestedRank,
    int actualRank,
    RankHolder holder,
    String note
) {

  /** Validates the holder. */
  public RankMatch {
    Objects.requireNonNull(holder, "holder must not be null");
  }

  /**
   * Returns the fallback note.
   *
   * @return the note, or empty on an exact match
   */
  public Optional<String> fallbackNote() {
    return Optional.ofNullable(note);
  }

  /**
   * Returns whether the requested rank was found as is.
   *
   * @return true on an exact match
   */
  public boolean exact() {
    return note == null;
  }
}
