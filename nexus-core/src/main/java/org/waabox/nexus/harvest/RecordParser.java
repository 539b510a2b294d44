package org.waabox.nexus.harvest;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.nexus.model.Competition;
import org.waabox.nexus.model.Competitor;
import org.waabox.nexus.model.EventSets;
import org.waabox.nexus.model.RankEntry;
import org.waabox.nexus.model.ResultRound;

/**
 * Converts raw source records into domain objects.
 *
 * <p>Validation happens at the smallest possible granularity: a malformed
 * round, rank entry or event is dropped on its own, and a record is only
 * skipped when its identity cannot be established. Hidden events are
 * removed from every record.
 *
 * <p>Both result-history shapes are accepted: a map of competition id to
 * a map of event id to rounds, and a flat list of rounds each carrying
 * its own event id.
 *
 * <p>This class is stateless and thread-safe.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RecordParser {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(RecordParser.class);

  /** The name used when a competitor record has none. */
  private static final String UNKNOWN_NAME = "Unknown";

  /**
   * Parses a competitor record.
   *
   * @param node the raw record, never null
   *
   * @return the competitor, or empty if the record has no id
   */
  public Optional<Competitor> parseCompetitor(final JsonNode node) {
    final String id = text(node, "id");
    if (id == null) {
      log.debug("Skipping competitor record without id");
      return Optional.empty();
    }
    final String name = Optional.ofNullable(text(node, "name"))
        .orElse(UNKNOWN_NAME);
    final String country = text(node, "country");
    final int competitions = node.path("numberOfCompetitions").asInt(0);

    final JsonNode rank = node.path("rank");
    final List<RankEntry> singles = parseRanks(rank.path("singles"));
    final List<RankEntry> averages = parseRanks(rank.path("averages"));
    final List<ResultRound> results = parseResults(node.path("results"));
    final int worldRecords = node.path("records").path("single").path("WR")
        .asInt(0) + node.path("records").path("average").path("WR").asInt(0);

    return Optional.of(new Competitor(id, name, country, competitions,
        worldRecords, singles, averages, results));
  }

  /**
   * Parses a competition record.
   *
   * @param node the raw record, never null
   *
   * @return the competition, or empty if the record has no id or no valid
   *         date range
   */
  public Optional<Competition> parseCompetition(final JsonNode node) {
    final String id = text(node, "id");
    if (id == null) {
      log.debug("Skipping competition record without id");
      return Optional.empty();
    }
    final JsonNode date = node.path("date");
    final LocalDate from = date(date, "from");
    if (from == null) {
      log.debug("Skipping competition {} without a start date", id);
      return Optional.empty();
    }
    final LocalDate till = Optional.ofNullable(date(date, "till"))
        .orElse(from);
    if (till.isBefore(from)) {
      log.debug("Skipping competition {} ending before it starts", id);
      return Optional.empty();
    }
    final List<String> events = new ArrayList<>();
    for (final JsonNode event : node.path("events")) {
      final String eventId = event.asText("");
      if (!eventId.isBlank() && !EventSets.HIDDEN_EVENTS.contains(eventId)) {
        events.add(eventId);
      }
    }
    final String name = Optional.ofNullable(text(node, "name")).orElse(id);
    return Optional.of(new Competition(id, name, text(node, "country"),
        from, till, events));
  }

  private List<RankEntry> parseRanks(final JsonNode entries) {
    final List<RankEntry> result = new ArrayList<>();
    if (!entries.isArray()) {
      return result;
    }
    for (final JsonNode entry : entries) {
      final String eventId = text(entry, "eventId");
      if (eventId == null || EventSets.HIDDEN_EVENTS.contains(eventId)) {
        continue;
      }
      final JsonNode rank = entry.path("rank");
      result.add(new RankEntry(eventId,
          entry.path("best").asInt(0),
          positiveInt(rank.path("world")),
          positiveInt(rank.path("continent")),
          positiveInt(rank.path("country"))));
    }
    return result;
  }

  private List<ResultRound> parseResults(final JsonNode results) {
    final List<ResultRound> rounds = new ArrayList<>();
    if (results.isObject()) {
      final Iterator<Map.Entry<String, JsonNode>> competitions =
          results.fields();
      while (competitions.hasNext()) {
        final Map.Entry<String, JsonNode> competition = competitions.next();
        if (!competition.getValue().isObject()) {
          continue;
        }
        final Iterator<Map.Entry<String, JsonNode>> events =
            competition.getValue().fields();
        while (events.hasNext()) {
          final Map.Entry<String, JsonNode> event = events.next();
          if (EventSets.HIDDEN_EVENTS.contains(event.getKey())
              || !event.getValue().isArray()) {
            continue;
          }
          for (final JsonNode round : event.getValue()) {
            parseRound(round, competition.getKey(), event.getKey())
                .ifPresent(rounds::add);
          }
        }
      }
    } else if (results.isArray()) {
      for (final JsonNode round : results) {
        final String eventId = text(round, "eventId");
        if (eventId == null || EventSets.HIDDEN_EVENTS.contains(eventId)) {
          continue;
        }
        parseRound(round, text(round, "competitionId"), eventId)
            .ifPresent(rounds::add);
      }
    }
    return rounds;
  }

  private Optional<ResultRound> parseRound(final JsonNode round,
      final String competitionId, final String eventId) {
    if (!round.isObject()) {
      return Optional.empty();
    }
    String name = text(round, "round");
    if (name == null) {
      name = text(round, "roundTypeId");
    }
    if (name == null) {
      return Optional.empty();
    }
    JsonNode position = round.path("position");
    if (position.isMissingNode() || position.isNull()) {
      position = round.path("pos");
    }
    String singleRecord = text(round, "regionalSingleRecord");
    if (singleRecord == null) {
      singleRecord = text(round, "singleRecord");
    }
    String averageRecord = text(round, "regionalAverageRecord");
    if (averageRecord == null) {
      averageRecord = text(round, "averageRecord");
    }
    return Optional.of(new ResultRound(competitionId, eventId, name,
        positiveInt(position),
        round.path("best").asInt(-1),
        round.path("average").asInt(-1),
        singleRecord, averageRecord));
  }

  /**
   * Reads a positive integer, accepting integral numbers and numeric
   * strings.
   *
   * @param node the node, never null
   *
   * @return the value, or null when absent, non-integral or not positive
   */
  private static Integer positiveInt(final JsonNode node) {
    final long value;
    if (node.isIntegralNumber()) {
      value = node.asLong();
    } else if (node.isNumber() && node.asDouble() == Math.rint(node.asDouble())) {
      value = (long) node.asDouble();
    } else if (node.isTextual() && node.asText().trim().matches("\\d+")) {
      value = Long.parseLong(node.asText().trim());
    } else {
      return null;
    }
    if (value <= 0 || value > Integer.MAX_VALUE) {
      return null;
    }
    return (int) value;
  }

  private static String text(final JsonNode node, final String field) {
    final JsonNode value = node.path(field);
    if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
      return null;
    }
    final String text = value.asText();
    return text.isBlank() ? null : text;
  }

  private static LocalDate date(final JsonNode node, final String field) {
    final String value = text(node, field);
    if (value == null) {
      return null;
    }
    try {
      return LocalDate.parse(value);
    } catch (final DateTimeParseException e) {
      return null;
    }
  }
}
