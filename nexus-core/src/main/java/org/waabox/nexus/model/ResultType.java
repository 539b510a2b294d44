package org.waabox.nexus.model;

import java.util.Locale;
import java.util.Objects;

/**
 * The two kinds of ranked results a competitor can hold for an event.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public enum ResultType {

  /** The best single attempt. */
  SINGLES("singles"),

  /** The best average over a set of attempts. */
  AVERAGES("averages");

  /** The name used by the source data and by query callers. */
  private final String wireName;

  ResultType(final String theWireName) {
    wireName = theWireName;
  }

  /**
   * Returns the name used by the source data, e.g. {@code singles}.
   *
   * @return the wire name, never null
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a result type from its wire name, ignoring case.
   *
   * @param name the wire name, never null
   *
   * @return the matching result type, never null
   *
   * @throws IllegalArgumentException if the name is not a known type
   */
  public static ResultType fromWireName(final String name) {
    Objects.requireNonNull(name, "name must not be null");
    final String normalized = name.trim().toLowerCase(Locale.ROOT);
    for (final ResultType type : values()) {
      if (type.wireName.equals(normalized)) {
        return type;
      }
    }
    throw new IllegalArgumentException("Unknown result type: " + name);
  }
}
