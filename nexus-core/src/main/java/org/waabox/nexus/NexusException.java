package org.waabox.nexus;

/**
 * Base exception for infrastructure failures of the nexus engine.
 *
 * <p>This is an unchecked exception intended to wrap failures that cannot
 * be meaningfully recovered from at the call site, such as a first load
 * that reached neither the cache nor a single page of the source.</p>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class NexusException extends RuntimeException {

  private static final long serialVersionUID = 1L;

  /** Creates a new exception with the given message.
   *
   * @param message the detail message, cannot be null.
   */
  public NexusException(final String message) {
    super(message);
  }

  /** Creates a new exception with the given message and cause.
   *
   * @param message the detail message, cannot be null.
   * @param cause the underlying cause, cannot be null.
   */
  public NexusException(final String message, final Throwable cause) {
    super(message, cause);
  }
}
