package org.waabox.nexus.snapshot;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

import org.waabox.nexus.model.Competition;
import org.waabox.nexus.model.Competitor;
import org.waabox.nexus.model.HarvestSnapshot;
import org.waabox.nexus.model.RankEntry;
import org.waabox.nexus.model.ResultRound;

/**
 * Writes a {@link HarvestSnapshot} as CBOR, a compact binary encoding of
 * maps and arrays.
 *
 * <p>Uses Jackson's tree model so the layout is explicit and independent
 * of the domain classes. Dates are ISO-8601 strings, absent values are
 * omitted, and every collection is written in a fixed order so the same
 * snapshot always yields the same bytes.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class CborSnapshotSerializer
    implements SnapshotSerializer<HarvestSnapshot> {

  /** The current layout version. */
  public static final int FORMAT_VERSION = 1;

  /** The shared CBOR mapper, used for tree operations only. */
  private static final CBORMapper MAPPER = new CBORMapper();

  @Override
  public int formatVersion() {
    return FORMAT_VERSION;
  }

  @Override
  public byte[] serialize(final HarvestSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot cannot be null");

    final ObjectNode root = MAPPER.createObjectNode();
    root.put("formatVersion", FORMAT_VERSION);
    root.put("createdAt", snapshot.createdAt().toString());

    final ArrayNode competitors = root.putArray("competitors");
    for (final Competitor competitor : snapshot.competitors()) {
      competitors.add(writeCompetitor(competitor));
    }
    final ArrayNode competitions = root.putArray("competitions");
    for (final Competition competition : snapshot.competitions()) {
      competitions.add(writeCompetition(competition));
    }
    final ObjectNode continents = root.putObject("continents");
    snapshot.sortedContinents().forEach(continents::put);

    try {
      return MAPPER.writeValueAsBytes(root);
    } catch (final IOException e) {
      throw new UncheckedIOException("Failed to serialize snapshot", e);
    }
  }

  @Override
  public HarvestSnapshot deserialize(final byte[] data) {
    Objects.requireNonNull(data, "data cannot be null");
    try {
      final JsonNode root = MAPPER.readTree(data);
      if (root == null || !root.isObject()) {
        throw new IllegalArgumentException("Snapshot root is not a map");
      }
      final int version = requireField(root, "formatVersion").asInt();
      if (version != FORMAT_VERSION) {
        throw new IllegalArgumentException("Unsupported snapshot format "
            + version);
      }

      final List<Competitor> competitors = new ArrayList<>();
      for (final JsonNode node : requireField(root, "competitors")) {
        competitors.add(readCompetitor(node));
      }
      final List<Competition> competitions = new ArrayList<>();
      for (final JsonNode node : requireField(root, "competitions")) {
        competitions.add(readCompetition(node));
      }
      final Map<String, String> continents = new TreeMap<>();
      requireField(root, "continents").fields().forEachRemaining(entry ->
          continents.put(entry.getKey(), entry.getValue().asText()));

      return new HarvestSnapshot(competitors, competitions, continents,
          Instant.parse(requireField(root, "createdAt").asText()));
    } catch (final IOException | RuntimeException e) {
      throw new SnapshotFormatException("Failed to deserialize snapshot", e);
    }
  }

  private static ObjectNode writeCompetitor(final Competitor competitor) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("id", competitor.id());
    node.put("name", competitor.name());
    putIfPresent(node, "country", competitor.country());
    node.put("competitions", competitor.numberOfCompetitions());
    node.put("worldRecords", competitor.worldRecords());

    final ArrayNode singles = node.putArray("singles");
    competitor.singles().forEach(entry -> singles.add(writeRank(entry)));
    final ArrayNode averages = node.putArray("averages");
    competitor.averages().forEach(entry -> averages.add(writeRank(entry)));

    final ArrayNode results = node.putArray("results");
    for (final ResultRound round : competitor.results()) {
      final ObjectNode r = results.addObject();
      putIfPresent(r, "competitionId", round.competitionId());
      r.put("eventId", round.eventId());
      r.put("round", round.round());
      putIfPresent(r, "position", round.position());
      r.put("best", round.best());
      r.put("average", round.average());
      putIfPresent(r, "singleRecord", round.singleRecord());
      putIfPresent(r, "averageRecord", round.averageRecord());
    }
    return node;
  }

  private static ObjectNode writeRank(final RankEntry entry) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("eventId", entry.eventId());
    node.put("best", entry.best());
    putIfPresent(node, "world", entry.worldRank());
    putIfPresent(node, "continent", entry.continentRank());
    putIfPresent(node, "country", entry.countryRank());
    return node;
  }

  private static ObjectNode writeCompetition(final Competition competition) {
    final ObjectNode node = MAPPER.createObjectNode();
    node.put("id", competition.id());
    node.put("name", competition.name());
    putIfPresent(node, "country", competition.country());
    node.put("from", competition.from().toString());
    node.put("till", competition.till().toString());
    final ArrayNode events = node.putArray("events");
    competition.events().forEach(events::add);
    return node;
  }

  private static Competitor readCompetitor(final JsonNode node) {
    final List<RankEntry> singles = new ArrayList<>();
    requireField(node, "singles").forEach(n -> singles.add(readRank(n)));
    final List<RankEntry> averages = new ArrayList<>();
    requireField(node, "averages").forEach(n -> averages.add(readRank(n)));

    final List<ResultRound> results = new ArrayList<>();
    for (final JsonNode r : requireField(node, "results")) {
      results.add(new ResultRound(
          optionalText(r, "competitionId"),
          requireField(r, "eventId").asText(),
          requireField(r, "round").asText(),
          optionalInt(r, "position"),
          requireField(r, "best").asInt(),
          requireField(r, "average").asInt(),
          optionalText(r, "singleRecord"),
          optionalText(r, "averageRecord")));
    }

    return new Competitor(
        requireField(node, "id").asText(),
        requireField(node, "name").asText(),
        optionalText(node, "country"),
        requireField(node, "competitions").asInt(),
        requireField(node, "worldRecords").asInt(),
        singles, averages, results);
  }

  private static RankEntry readRank(final JsonNode node) {
    return new RankEntry(
        requireField(node, "eventId").asText(),
        requireField(node, "best").asInt(),
        optionalInt(node, "world"),
        optionalInt(node, "continent"),
        optionalInt(node, "country"));
  }

  private static Competition readCompetition(final JsonNode node) {
    final List<String> events = new ArrayList<>();
    requireField(node, "events").forEach(e -> events.add(e.asText()));
    return new Competition(
        requireField(node, "id").asText(),
        requireField(node, "name").asText(),
        optionalText(node, "country"),
        LocalDate.parse(requireField(node, "from").asText()),
        LocalDate.parse(requireField(node, "till").asText()),
        events);
  }

  private static void putIfPresent(final ObjectNode node, final String field,
      final String value) {
    if (value != null) {
      node.put(field, value);
    }
  }

  private static void putIfPresent(final ObjectNode node, final String field,
      final Integer value) {
    if (value != null) {
      node.put(field, value);
    }
  }

  private static String optionalText(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asText();
  }

  private static Integer optionalInt(final JsonNode node, final String field) {
    final JsonNode value = node.get(field);
    return value == null || value.isNull() ? null : value.asInt();
  }

  /** Returns the field node for the given key or throws if missing.
   *
   * @param node the parent node.
   * @param field the field name to look up.
   * @return the field node, never null.
   * @throws IllegalArgumentException if the field is missing.
   */
  private static JsonNode requireField(final JsonNode node,
      final String field) {
    final JsonNode value = node.get(field);
    if (value == null || value.isNull()) {
      throw new IllegalArgumentException("Missing field: " + field);
    }
    return value;
  }
}
