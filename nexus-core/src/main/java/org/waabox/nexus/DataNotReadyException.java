package org.waabox.nexus;

import java.time.Duration;

/**
 * Thrown when a query reaches the engine before its first load completed.
 *
 * <p>This is the "still loading" condition; callers should retry later.
 * It is never used to signal that a looked up item does not exist.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public class DataNotReadyException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception for a query that waited the given time.
   *
   * @param waited how long the query waited for readiness, never null
   */
  public DataNotReadyException(final Duration waited) {
    super("Competitor data is still loading (waited " + waited.toMillis()
        + "ms)");
  }
}
