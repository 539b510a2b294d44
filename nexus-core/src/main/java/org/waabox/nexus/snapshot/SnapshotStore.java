package org.waabox.nexus.snapshot;

import java.util.Optional;

/**
 * A persistent store for the harvested collections.
 *
 * <p>The store lets a process start skip the network harvest by loading the
 * collections a previous run saved. Implementations decide where the
 * snapshot lives and when a stored snapshot is no longer usable; an
 * unusable snapshot is reported as absent, never as an error.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SnapshotStore {

  /**
   * Saves a serialized snapshot, replacing any previous one.
   *
   * @param snapshot the serialized snapshot to persist, never null
   */
  void save(SerializedSnapshot snapshot);

  /**
   * Loads the stored snapshot.
   *
   * @return the snapshot, or empty if none is stored or the stored one is
   *         corrupt or stale
   */
  Optional<SerializedSnapshot> load();

  /** Removes the stored snapshot, if any. */
  void delete();
}
