package org.waabox.nexus.fetch;

import java.util.List;
import java.util.Optional;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Retrieves pages of raw records from the paginated source.
 *
 * <p>Implementations retry transient failures internally and never throw
 * for them: a page that cannot be fetched is reported as
 * {@link PageStatus#UNAVAILABLE}. Implementations must be safe for
 * concurrent use and must not mutate shared state.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface PageFetcher {

  /**
   * Fetches one page of a collection.
   *
   * @param collection the collection name, e.g. {@code persons}, never null
   * @param pageIndex  the one based page index
   *
   * @return the page result, never null
   */
  PageResult fetch(String collection, int pageIndex);

  /**
   * Fetches a non-paginated document, such as the country list.
   *
   * @param name the document name, e.g. {@code countries}, never null
   *
   * @return the document's records, or empty if it could not be fetched
   */
  Optional<List<JsonNode>> fetchDocument(String name);
}
