package org.waabox.nexus.model;

import java.time.LocalDate;
import java.util.List;
import java.util.Objects;

/**
 * A competition as published by the source.
 *
 * @param id      the unique competition id, never null
 * @param name    the display name, never null
 * @param country the host country ISO2 code, may be null
 * @param from    the first day, never null
 * @param till    the last day, never null and not before {@code from}
 * @param events  the event ids held, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record Competition(
    String id,
    String name,
    String country,
    LocalDate from,
    LocalDate till,
    List<String> events
) {

  /** Validates the fields and copies the event list. */
  public Competition {
    Objects.requireNonNull(id, "id must not be null");
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(from, "from must not be null");
    Objects.requireNonNull(till, "till must not be null");
    Objects.requireNonNull(events, "events must not be null");
    if (till.isBefore(from)) {
      throw new IllegalArgumentException("Competition " + id
          + " ends before it starts: " + from + " > " + till);
    }
    events = List.copyOf(events);
  }
}
