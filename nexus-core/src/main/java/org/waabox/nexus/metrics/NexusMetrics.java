package org.waabox.nexus.metrics;

/**
 * An abstraction for recording operational metrics of the nexus engine.
 *
 * <p>Implementations can integrate with monitoring systems such as
 * Micrometer or Prometheus. Use {@link NoopNexusMetrics} when metrics
 * collection is not required.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface NexusMetrics {

  /**
   * Records a page that could not be fetched after every retry.
   *
   * @param collection the collection name, never null
   * @param pageIndex  the page index
   */
  void pageUnavailable(String collection, int pageIndex);

  /**
   * Records the completion of a collection harvest.
   *
   * @param collection   the collection name, never null
   * @param fetchedPages the number of pages fetched
   * @param failedPages  the number of pages dropped
   * @param items        the number of distinct records merged
   * @param durationMs   the wall time of the harvest
   */
  void harvestCompleted(String collection, int fetchedPages, int failedPages,
      int items, long durationMs);

  /**
   * Records a state load.
   *
   * @param source a description of the source ("cache", "harvest"),
   *               never null
   */
  void snapshotLoaded(String source);

  /**
   * Records a failed load or refresh.
   *
   * @param cause the throwable that caused the failure, never null
   */
  void loadFailed(Throwable cause);

  /**
   * Records the number of entries of a derived index after a build.
   *
   * @param indexName the index name, never null
   * @param entries   the number of entries
   */
  void indexSizeReported(String indexName, long entries);
}
