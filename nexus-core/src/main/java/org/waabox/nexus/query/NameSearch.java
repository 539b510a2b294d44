package org.waabox.nexus.query;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;

import org.waabox.nexus.model.Competitor;

/**
 * Case-insensitive search over competitor names.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NameSearch {

  /** The maximum number of matches returned. */
  public static final int MAX_RESULTS = 50;

  private NameSearch() {
    throw new UnsupportedOperationException("Utility class");
  }

  /**
   * Finds competitors whose name contains the fragment.
   *
   * @param competitors the competitors, in the order to report them, never
   *                    null
   * @param fragment    the name fragment, never null
   *
   * @return at most {@link #MAX_RESULTS} competitors, empty for a blank
   *         fragment, never null
   */
  public static List<Competitor> search(
      final Collection<Competitor> competitors, final String fragment) {
    Objects.requireNonNull(competitors, "competitors must not be null");
    Objects.requireNonNull(fragment, "fragment must not be null");

    final String needle = fragment.trim().toLowerCase(Locale.ROOT);
    if (needle.isEmpty()) {
      return List.of();
    }
    final List<Competitor> matches = new ArrayList<>();
    for (final Competitor competitor : competitors) {
      if (competitor.name().toLowerCase(Locale.ROOT).contains(needle)) {
        matches.add(competitor);
        if (matches.size() == MAX_RESULTS) {
          break;
        }
      }
    }
    return matches;
  }
}
