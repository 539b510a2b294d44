package org.waabox.nexus.harvest;

import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.SortedSet;
import java.util.TreeSet;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The merged records of one collection harvest.
 *
 * <p>Records are deduplicated by id and sorted by id, so two harvests of
 * the same set of pages produce equal results whatever the fetch order.
 *
 * @param collection   the collection name, never null
 * @param records      the merged raw records, never null
 * @param fetchedPages the indices of the pages fetched, never null
 * @param failedPages  the indices of the pages dropped, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record HarvestResult(
    String collection,
    List<JsonNode> records,
    SortedSet<Integer> fetchedPages,
    SortedSet<Integer> failedPages
) {

  /** Validates the fields and copies the collections. */
  public HarvestResult {
    Objects.requireNonNull(collection, "collection must not be null");
    records = List.copyOf(Objects.requireNonNull(records,
        "records must not be null"));
    fetchedPages = Collections.unmodifiableSortedSet(new TreeSet<>(
        Objects.requireNonNull(fetchedPages, "fetchedPages must not be null")));
    failedPages = Collections.unmodifiableSortedSet(new TreeSet<>(
        Objects.requireNonNull(failedPages, "failedPages must not be null")));
  }

  /**
   * Returns whether not a single page could be fetched.
   *
   * @return true if no page was fetched
   */
  public boolean nothingFetched() {
    return fetchedPages.isEmpty();
  }
}
