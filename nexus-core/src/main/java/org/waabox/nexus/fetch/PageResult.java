package org.waabox.nexus.fetch;

import java.util.List;
import java.util.Objects;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The result of fetching one page of a collection.
 *
 * @param collection the collection name, never null
 * @param pageIndex  the one based page index
 * @param status     the fetch outcome, never null
 * @param items      the raw records of the page, empty unless the status
 *                   is {@link PageStatus#OK}, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record PageResult(
    String collection,
    int pageIndex,
    PageStatus status,
    List<JsonNode> items
) {

  /** Validates the fields and copies the items. */
  public PageResult {
    Objects.requireNonNull(collection, "collection must not be null");
    Objects.requireNonNull(status, "status must not be null");
    items = List.copyOf(Objects.requireNonNull(items,
        "items must not be null"));
  }

  /**
   * Creates a successful page result.
   *
   * @param collection the collection name, never null
   * @param pageIndex  the page index
   * @param items      the parsed records, never null
   *
   * @return the page result, never null
   */
  public static PageResult ok(final String collection, final int pageIndex,
      final List<JsonNode> items) {
    return new PageResult(collection, pageIndex, PageStatus.OK, items);
  }

  /**
   * Creates a result for a page the source does not have.
   *
   * @param collection the collection name, never null
   * @param pageIndex  the page index
   *
   * @return the page result, never null
   */
  public static PageResult notFound(final String collection,
      final int pageIndex) {
    return new PageResult(collection, pageIndex, PageStatus.NOT_FOUND,
        List.of());
  }

  /**
   * Creates a result for a page that failed after every retry.
   *
   * @param collection the collection name, never null
   * @param pageIndex  the page index
   *
   * @return the page result, never null
   */
  public static PageResult unavailable(final String collection,
      final int pageIndex) {
    return new PageResult(collection, pageIndex, PageStatus.UNAVAILABLE,
        List.of());
  }

  /**
   * Returns whether the page was fetched.
   *
   * @return true for an OK page
   */
  public boolean isOk() {
    return status == PageStatus.OK;
  }
}
