package org.waabox.nexus.metrics;

/**
 * A no-operation implementation of {@link NexusMetrics}.
 *
 * <p>All methods in this class are intentionally empty. Use this
 * implementation when metrics collection is not required or during
 * testing.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class NoopNexusMetrics implements NexusMetrics {

  /** {@inheritDoc} */
  @Override
  public void pageUnavailable(final String collection, final int pageIndex) {
  }

  /** {@inheritDoc} */
  @Override
  public void harvestCompleted(final String collection,
      final int fetchedPages, final int failedPages, final int items,
      final long durationMs) {
  }

  /** {@inheritDoc} */
  @Override
  public void snapshotLoaded(final String source) {
  }

  /** {@inheritDoc} */
  @Override
  public void loadFailed(final Throwable cause) {
  }

  /** {@inheritDoc} */
  @Override
  public void indexSizeReported(final String indexName, final long entries) {
  }
}
