package org.waabox.nexus.snapshot;

/**
 * Thrown when stored bytes cannot be read back as a snapshot.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class SnapshotFormatException extends RuntimeException {

  /** Serial version UID. */
  private static final long serialVersionUID = 1L;

  /**
   * Creates a new exception.
   *
   * @param message the detail message
   * @param cause   the underlying cause
   */
  public SnapshotFormatException(final String message,
      final Throwable cause) {
    super(message, cause);
  }
}
