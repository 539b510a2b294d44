package org.waabox.nexus.snapshot;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * An immutable serialized harvest snapshot plus the metadata needed to
 * verify it.
 *
 * <p>The {@code data} byte array is defensively copied on construction
 * and on access to guarantee immutability.
 *
 * @param name      the snapshot name, never null
 * @param hash      the hex SHA-256 of {@code data}, never null
 * @param version   the format version of {@code data}
 * @param createdAt the instant the harvest completed, never null
 * @param data      the serialized collections, never null
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public record SerializedSnapshot(
    String name,
    String hash,
    int version,
    Instant createdAt,
    byte[] data
) {

  /**
   * Compact constructor that defensively copies the byte array and
   * validates required fields.
   */
  public SerializedSnapshot {
    Objects.requireNonNull(name, "name must not be null");
    Objects.requireNonNull(hash, "hash must not be null");
    Objects.requireNonNull(createdAt, "createdAt must not be null");
    Objects.requireNonNull(data, "data must not be null");
    data = data.clone();
  }

  /**
   * Creates a snapshot, hashing the given data.
   *
   * @param name      the snapshot name, never null
   * @param version   the format version
   * @param createdAt the creation instant, never null
   * @param data      the serialized collections, never null
   *
   * @return the snapshot, never null
   */
  public static SerializedSnapshot of(final String name, final int version,
      final Instant createdAt, final byte[] data) {
    Objects.requireNonNull(data, "data must not be null");
    return new SerializedSnapshot(name, Hashes.sha256(data), version,
        createdAt, data);
  }

  /**
   * Returns a defensive copy of the serialized data.
   *
   * @return a copy of the data byte array, never null
   */
  @Override
  public byte[] data() {
    return data.clone();
  }

  /**
   * Returns whether the hash matches the data.
   *
   * @return true if the data is intact
   */
  public boolean intact() {
    return hash.equals(Hashes.sha256(data));
  }

  /**
   * Compares this snapshot to another using content equality for the
   * byte array rather than reference identity.
   *
   * @param o the object to compare with
   * @return true if equal by content, false otherwise
   */
  @Override
  public boolean equals(final Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof SerializedSnapshot that)) {
      return false;
    }
    return version == that.version
        && Objects.equals(name, that.name)
        && Objects.equals(hash, that.hash)
        && Objects.equals(createdAt, that.createdAt)
        && Arrays.equals(data, that.data);
  }

  /**
   * Returns a hash code using content-based hashing for the byte array.
   *
   * @return the hash code
   */
  @Override
  public int hashCode() {
    int result = Objects.hash(name, hash, version, createdAt);
    result = 31 * result + Arrays.hashCode(data);
    return result;
  }

  /**
   * Returns a short description without the payload.
   *
   * @return the description, never null
   */
  @Override
  public String toString() {
    return "SerializedSnapshot[name=" + name + ", hash=" + hash
        + ", version=" + version + ", createdAt=" + createdAt
        + ", bytes=" + data.length + "]";
  }
}
