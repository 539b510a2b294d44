package org.waabox.nexus.harvest;

import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Maps country codes to the continent names used as rank scopes.
 *
 * <p>The source spells continents in several ways: WCA region codes
 * ({@code XN}), ISO continent codes ({@code NA}) and display ids
 * ({@code _North America}). All of them normalize to lower-case snake
 * case names such as {@code north_america}.
 *
 * <p>Instances are immutable.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class RegionDirectory {

  /** WCA region codes and ISO continent codes to normalized names. */
  private static final Map<String, String> CONTINENT_CODES = Map.ofEntries(
      Map.entry("XW", "world"),
      Map.entry("XA", "asia"),
      Map.entry("XE", "europe"),
      Map.entry("XF", "africa"),
      Map.entry("XN", "north_america"),
      Map.entry("XS", "south_america"),
      Map.entry("XO", "oceania"),
      Map.entry("AF", "africa"),
      Map.entry("AS", "asia"),
      Map.entry("EU", "europe"),
      Map.entry("NA", "north_america"),
      Map.entry("SA", "south_america"),
      Map.entry("OC", "oceania"));

  /** An empty directory. */
  private static final RegionDirectory EMPTY = new RegionDirectory(Map.of());

  /** Lower-case ISO2 country code to continent name, sorted. */
  private final Map<String, String> continentsByCountry;

  private RegionDirectory(final Map<String, String> theContinents) {
    continentsByCountry = new TreeMap<>(theContinents);
  }

  /**
   * Creates a directory from an existing country to continent table.
   *
   * @param continentsByCountry the table, keys are ISO2 country codes in
   *                            any case, never null
   *
   * @return a new directory, never null
   */
  public static RegionDirectory of(
      final Map<String, String> continentsByCountry) {
    Objects.requireNonNull(continentsByCountry,
        "continentsByCountry must not be null");
    final Map<String, String> normalized = new TreeMap<>();
    continentsByCountry.forEach((country, continent) ->
        normalized.put(country.toLowerCase(Locale.ROOT),
            normalizeContinent(continent)));
    return new RegionDirectory(normalized);
  }

  /**
   * Returns a directory without any mapping.
   *
   * @return the empty directory, never null
   */
  public static RegionDirectory empty() {
    return EMPTY;
  }

  /**
   * Builds a directory from the records of the source's country document.
   *
   * <p>Each record needs an {@code iso2Code} and a {@code continentId};
   * records missing either are skipped.
   *
   * @param countries the country records, never null
   *
   * @return a new directory, never null
   */
  public static RegionDirectory fromCountries(final List<JsonNode> countries) {
    Objects.requireNonNull(countries, "countries must not be null");
    final Map<String, String> table = new TreeMap<>();
    for (final JsonNode country : countries) {
      final String iso2 = country.path("iso2Code").asText("");
      final String continentId = country.path("continentId").asText("");
      if (iso2.isBlank() || continentId.isBlank()) {
        continue;
      }
      table.put(iso2.toLowerCase(Locale.ROOT),
          normalizeContinent(continentId));
    }
    return new RegionDirectory(table);
  }

  /**
   * Normalizes any of the continent spellings the source uses.
   *
   * @param continentId the raw continent id, never null
   *
   * @return the normalized continent name, never null
   */
  public static String normalizeContinent(final String continentId) {
    Objects.requireNonNull(continentId, "continentId must not be null");
    final String trimmed = continentId.trim();
    final String known = CONTINENT_CODES.get(trimmed.toUpperCase(Locale.ROOT));
    if (known != null) {
      return known;
    }
    String name = trimmed;
    while (name.startsWith("_")) {
      name = name.substring(1);
    }
    return name.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "_");
  }

  /**
   * Returns the continent of a country.
   *
   * @param countryCode the ISO2 country code in any case, may be null
   *
   * @return the continent name, or empty if unknown
   */
  public Optional<String> continentOf(final String countryCode) {
    if (countryCode == null) {
      return Optional.empty();
    }
    return Optional.ofNullable(
        continentsByCountry.get(countryCode.toLowerCase(Locale.ROOT)));
  }

  /**
   * Returns the table as an unmodifiable sorted map.
   *
   * @return the country to continent table, never null
   */
  public Map<String, String> asMap() {
    return Collections.unmodifiableMap(continentsByCountry);
  }

  /**
   * Returns the number of countries mapped.
   *
   * @return the number of countries
   */
  public int size() {
    return continentsByCountry.size();
  }
}
