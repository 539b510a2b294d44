package org.waabox.nexus.completionist;

/**
 * The completionist tiers, from the lowest to the highest.
 *
 * <p>The declaration order is the tier order: every tier requires all the
 * conditions of the tiers below it.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum Category {

  /** A valid single in every canonical event. */
  BRONZE,

  /** Bronze plus an average in every silver average event. */
  SILVER,

  /** Silver plus an average in every gold average event. */
  GOLD,

  /** Gold plus a world record or a world championship podium. */
  PLATINUM,

  /** Platinum plus a final won in every canonical event. */
  PALLADIUM,

  /**
   * Palladium plus both a world record and a world championship podium,
   * and final finishes in first, second and third place in every
   * canonical event.
   */
  IRIDIUM;

  /**
   * Returns whether this tier is the given one or above it.
   *
   * @param other the tier to compare against, never null
   *
   * @return true if this tier is at least {@code other}
   */
  public boolean atLeast(final Category other) {
    return compareTo(other) >= 0;
  }
}
