package org.waabox.nexus.snapshot.fs;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.DataInputStream;
import java.io.DataOutputStream;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.Objects;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.waabox.nexus.snapshot.SerializedSnapshot;
import org.waabox.nexus.snapshot.SnapshotStore;

/**
 * A {@link SnapshotStore} that keeps the snapshot in a single local file.
 *
 * <p>The file holds a small binary header followed by the payload:
 * <pre>
 * int    magic ("NXS1")
 * int    file layout version
 * UTF    snapshot name
 * int    payload format version
 * UTF    createdAt, ISO-8601
 * UTF    SHA-256 of the payload, hex
 * int    payload length
 * byte[] payload
 * </pre>
 *
 * <p>Writes go to a temporary file that is then renamed over the previous
 * one, so a crash mid-write leaves the previous snapshot intact.
 *
 * <p>On load, a file with a wrong magic, a truncated or oversized body, a
 * payload not matching its hash, or a creation instant older than the
 * freshness window is deleted and reported as absent.
 *
 * <p>Storage layout:
 * <pre>
 * {baseDir}/
 *   {name}.snapshot
 * </pre>
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
public final class FileSystemSnapshotStore implements SnapshotStore {

  /** The class logger. */
  private static final Logger log = LoggerFactory.getLogger(
      FileSystemSnapshotStore.class);

  /** The default snapshot name. */
  public static final String DEFAULT_NAME = "nexus";

  /** The default freshness window. */
  public static final Duration DEFAULT_FRESHNESS = Duration.ofHours(24);

  /** The file magic, "NXS1". */
  static final int MAGIC = 0x4E585331;

  /** The file layout version. */
  static final int LAYOUT_VERSION = 1;

  /** The snapshot file extension. */
  private static final String EXTENSION = ".snapshot";

  /** The base directory. */
  private final Path baseDir;

  /** The snapshot name, also the file name. */
  private final String name;

  /** The maximum age of a usable snapshot. */
  private final Duration freshness;

  /** The clock measuring snapshot age. */
  private final Clock clock;

  /**
   * Creates a store with the default name, a 24 hour freshness window and
   * the system clock.
   *
   * @param theBaseDir the directory holding the file, never null
   *
   * @throws UncheckedIOException if the directory cannot be created
   */
  public FileSystemSnapshotStore(final Path theBaseDir) {
    this(theBaseDir, DEFAULT_NAME, DEFAULT_FRESHNESS, Clock.systemUTC());
  }

  /**
   * Creates a new store.
   *
   * <p>If the base directory does not exist, it is created along with any
   * necessary parent directories.
   *
   * @param theBaseDir   the directory holding the file, never null
   * @param theName      the snapshot name, never null or blank
   * @param theFreshness the maximum age of a usable snapshot, positive
   * @param theClock     the clock measuring snapshot age, never null
   *
   * @throws UncheckedIOException if the directory cannot be created
   */
  public FileSystemSnapshotStore(final Path theBaseDir, final String theName,
      final Duration theFreshness, final Clock theClock) {
    baseDir = Objects.requireNonNull(theBaseDir, "baseDir must not be null");
    name = Objects.requireNonNull(theName, "name must not be null");
    if (theName.isBlank()) {
      throw new IllegalArgumentException("name must not be blank");
    }
    freshness = Objects.requireNonNull(theFreshness,
        "freshness must not be null");
    if (theFreshness.isZero() || theFreshness.isNegative()) {
      throw new IllegalArgumentException(
          "freshness must be positive, got: " + theFreshness);
    }
    clock = Objects.requireNonNull(theClock, "clock must not be null");

    try {
      Files.createDirectories(baseDir);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to create base directory: " + baseDir, e);
    }
  }

  /**
   * Returns the snapshot file.
   *
   * @return the file path, never null
   */
  public Path file() {
    return baseDir.resolve(name + EXTENSION);
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException if writing to the filesystem fails
   */
  @Override
  public void save(final SerializedSnapshot snapshot) {
    Objects.requireNonNull(snapshot, "snapshot must not be null");

    final Path target = file();
    final Path temp = baseDir.resolve(name + EXTENSION + ".tmp");
    try {
      Files.write(temp, encode(snapshot));
      Files.move(temp, target, StandardCopyOption.REPLACE_EXISTING,
          StandardCopyOption.ATOMIC_MOVE);
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to save snapshot to: " + target, e);
    }
    log.info("Saved snapshot {} ({} bytes) to {}", snapshot.hash(),
        snapshot.data().length, target);
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException if the file exists but cannot be read
   */
  @Override
  public Optional<SerializedSnapshot> load() {
    final Path source = file();
    final byte[] bytes;
    try {
      bytes = Files.readAllBytes(source);
    } catch (final NoSuchFileException e) {
      return Optional.empty();
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to read snapshot from: " + source, e);
    }

    final SerializedSnapshot snapshot;
    try {
      snapshot = decode(bytes);
    } catch (final IOException | IllegalArgumentException
        | DateTimeParseException e) {
      log.warn("Snapshot file {} is corrupt, deleting it: {}", source,
          e.getMessage());
      discard();
      return Optional.empty();
    }

    if (!snapshot.intact()) {
      log.warn("Snapshot file {} does not match its hash, deleting it",
          source);
      discard();
      return Optional.empty();
    }

    final Duration age = Duration.between(snapshot.createdAt(),
        clock.instant());
    if (age.compareTo(freshness) > 0) {
      log.info("Snapshot file {} is {} old, older than {}, deleting it",
          source, age, freshness);
      discard();
      return Optional.empty();
    }
    return Optional.of(snapshot);
  }

  /**
   * {@inheritDoc}
   *
   * @throws UncheckedIOException if the file exists but cannot be deleted
   */
  @Override
  public void delete() {
    try {
      Files.deleteIfExists(file());
    } catch (final IOException e) {
      throw new UncheckedIOException(
          "Failed to delete snapshot: " + file(), e);
    }
  }

  private void discard() {
    try {
      delete();
    } catch (final UncheckedIOException e) {
      log.warn("Could not delete invalid snapshot {}", file(), e);
    }
  }

  /**
   * Encodes a snapshot as the file content.
   *
   * @param snapshot the snapshot, never null
   *
   * @return the file bytes, never null
   *
   * @throws IOException if encoding fails
   */
  static byte[] encode(final SerializedSnapshot snapshot) throws IOException {
    final byte[] payload = snapshot.data();
    final ByteArrayOutputStream buffer = new ByteArrayOutputStream(
        payload.length + 256);
    try (DataOutputStream out = new DataOutputStream(buffer)) {
      out.writeInt(MAGIC);
      out.writeInt(LAYOUT_VERSION);
      out.writeUTF(snapshot.name());
      out.writeInt(snapshot.version());
      out.writeUTF(snapshot.createdAt().toString());
      out.writeUTF(snapshot.hash());
      out.writeInt(payload.length);
      out.write(payload);
    }
    return buffer.toByteArray();
  }

  /**
   * Decodes the file content.
   *
   * @param bytes the file bytes, never null
   *
   * @return the snapshot, never null
   *
   * @throws IOException              if the content is truncated
   * @throws IllegalArgumentException if the header or length is invalid
   */
  static SerializedSnapshot decode(final byte[] bytes) throws IOException {
    try (DataInputStream in = new DataInputStream(
        new ByteArrayInputStream(bytes))) {
      final int magic = in.readInt();
      if (magic != MAGIC) {
        throw new IllegalArgumentException("Not a snapshot file, magic "
            + Integer.toHexString(magic));
      }
      final int layout = in.readInt();
      if (layout != LAYOUT_VERSION) {
        throw new IllegalArgumentException("Unsupported file layout "
            + layout);
      }
      final String snapshotName = in.readUTF();
      final int version = in.readInt();
      final Instant createdAt = Instant.parse(in.readUTF());
      final String hash = in.readUTF();
      final int length = in.readInt();
      if (length < 0 || length != in.available()) {
        throw new IllegalArgumentException("Payload length " + length
            + " does not match the " + in.available() + " bytes stored");
      }
      final byte[] payload = new byte[length];
      in.readFully(payload);
      return new SerializedSnapshot(snapshotName, hash, version, createdAt,
          payload);
    }
  }
}
