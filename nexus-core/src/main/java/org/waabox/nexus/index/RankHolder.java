package org.waabox.nexus.index;

import java.util.Objects;

/**
 * The competitor holding a rank, with the result that earned it.
 *
 * @param competitorId the competitor id, never null
 * @param result       the best result value
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record RankHolder(String competitorId, int result) {

  /** Validates the competitor id. */
  public RankHolder {
    Objects.requireNonNull(competitorId, "competitorId must not be null");
  }
}
