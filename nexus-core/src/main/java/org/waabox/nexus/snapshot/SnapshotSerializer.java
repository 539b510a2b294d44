package org.waabox.nexus.snapshot;

/**
 * A strategy for turning a snapshot into bytes and back.
 *
 * @param <T> the type of snapshot this serializer handles
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public interface SnapshotSerializer<T> {

  /**
   * Returns the version of the format written by {@link #serialize}.
   *
   * @return the format version
   */
  int formatVersion();

  /**
   * Serializes a snapshot.
   *
   * @param snapshot the snapshot to serialize, never null
   *
   * @return the serialized bytes, never null
   */
  byte[] serialize(T snapshot);

  /**
   * Deserializes a snapshot.
   *
   * @param data the bytes to read, never null
   *
   * @return the snapshot, never null
   *
   * @throws SnapshotFormatException if the bytes are not a valid snapshot
   */
  T deserialize(byte[] data);
}
