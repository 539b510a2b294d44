package org.waabox.nexus.snapshot.fs;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Optional;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.nexus.snapshot.Hashes;
import org.waabox.nexus.snapshot.SerializedSnapshot;

/**
 * Tests for {@link FileSystemSnapshotStore}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class FileSystemSnapshotStoreTest {

  private static final Instant CREATED = Instant.parse("2026-01-15T10:30:00Z");

  private static FileSystemSnapshotStore storeAt(final Path dir,
      final Instant now) {
    return new FileSystemSnapshotStore(dir, "nexus", Duration.ofHours(24),
        Clock.fixed(now, ZoneOffset.UTC));
  }

  private static SerializedSnapshot snapshot(final String payload) {
    return SerializedSnapshot.of("nexus", 1, CREATED,
        payload.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void whenSavingAndLoading_givenValidSnapshot_shouldReturnEqualSnapshot(
      @TempDir final Path tempDir) {

    final FileSystemSnapshotStore store = storeAt(tempDir,
        CREATED.plusSeconds(60));
    final SerializedSnapshot original = snapshot("competitor-data");

    store.save(original);

    final Optional<SerializedSnapshot> loaded = store.load();
    assertTrue(loaded.isPresent(), "Loaded snapshot should be present");
    assertEquals(original, loaded.get());
    assertArrayEquals(original.data(), loaded.get().data());
    assertTrue(Files.exists(tempDir.resolve("nexus.snapshot")));
    assertFalse(Files.exists(tempDir.resolve("nexus.snapshot.tmp")),
        "The temporary file should be renamed away");
  }

  @Test
  void whenLoading_givenNoFile_shouldReturnEmpty(@TempDir final Path tempDir) {
    assertTrue(new FileSystemSnapshotStore(tempDir).load().isEmpty());
  }

  @Test
  void whenSaving_givenExistingSnapshot_shouldOverwrite(
      @TempDir final Path tempDir) {

    final FileSystemSnapshotStore store = storeAt(tempDir,
        CREATED.plusSeconds(60));
    store.save(snapshot("first"));
    final SerializedSnapshot second = snapshot("second-data-updated");

    store.save(second);

    assertEquals(second, store.load().orElseThrow());
  }

  @Test
  void whenLoading_givenStaleSnapshot_shouldDeleteItAndReturnEmpty(
      @TempDir final Path tempDir) {

    storeAt(tempDir, CREATED).save(snapshot("old"));
    final FileSystemSnapshotStore later = storeAt(tempDir,
        CREATED.plus(Duration.ofHours(25)));

    assertTrue(later.load().isEmpty(), "A stale snapshot is not usable");
    assertFalse(Files.exists(later.file()));
  }

  @Test
  void whenLoading_givenSnapshotAtFreshnessLimit_shouldReturnIt(
      @TempDir final Path tempDir) {

    storeAt(tempDir, CREATED).save(snapshot("edge"));

    assertTrue(storeAt(tempDir, CREATED.plus(Duration.ofHours(24))).load()
        .isPresent());
  }

  @Test
  void whenLoading_givenGarbageFile_shouldDeleteItAndReturnEmpty(
      @TempDir final Path tempDir) throws Exception {

    final FileSystemSnapshotStore store = storeAt(tempDir, CREATED);
    Files.write(store.file(), "not a snapshot at all"
        .getBytes(StandardCharsets.UTF_8));

    assertTrue(store.load().isEmpty());
    assertFalse(Files.exists(store.file()));
  }

  @Test
  void whenLoading_givenTruncatedFile_shouldDeleteItAndReturnEmpty(
      @TempDir final Path tempDir) throws Exception {

    final FileSystemSnapshotStore store = storeAt(tempDir, CREATED);
    store.save(snapshot("a payload long enough to be cut"));
    final byte[] full = Files.readAllBytes(store.file());
    Files.write(store.file(), Arrays.copyOf(full, full.length - 5));

    assertTrue(store.load().isEmpty());
    assertFalse(Files.exists(store.file()));
  }

  @Test
  void whenLoading_givenTamperedPayload_shouldDeleteItAndReturnEmpty(
      @TempDir final Path tempDir) throws Exception {

    final FileSystemSnapshotStore store = storeAt(tempDir, CREATED);
    final byte[] payload = "original".getBytes(StandardCharsets.UTF_8);
    store.save(new SerializedSnapshot("nexus",
        Hashes.sha256("tampered".getBytes(StandardCharsets.UTF_8)), 1,
        CREATED, payload));

    assertTrue(store.load().isEmpty());
    assertFalse(Files.exists(store.file()));
  }

  @Test
  void whenDeleting_givenSavedSnapshot_shouldRemoveTheFile(
      @TempDir final Path tempDir) {

    final FileSystemSnapshotStore store = storeAt(tempDir, CREATED);
    store.save(snapshot("data"));

    store.delete();
    store.delete();

    assertTrue(store.load().isEmpty());
  }

  @Test
  void whenCreating_givenMissingDirectory_shouldCreateIt(
      @TempDir final Path tempDir) {

    final Path nested = tempDir.resolve("a").resolve("b");

    new FileSystemSnapshotStore(nested);

    assertTrue(Files.isDirectory(nested));
  }

  @Test
  void whenCreating_givenInvalidSettings_shouldThrow(
      @TempDir final Path tempDir) {

    assertThrows(IllegalArgumentException.class,
        () -> new FileSystemSnapshotStore(tempDir, " ", Duration.ofHours(1),
            Clock.systemUTC()));
    assertThrows(IllegalArgumentException.class,
        () -> new FileSystemSnapshotStore(tempDir, "nexus", Duration.ZERO,
            Clock.systemUTC()));
  }

  @Test
  void whenDecoding_givenOtherLayoutVersion_shouldReject() throws Exception {
    final byte[] bytes = FileSystemSnapshotStore.encode(snapshot("data"));
    bytes[7] = 9;

    assertThrows(IllegalArgumentException.class,
        () -> FileSystemSnapshotStore.decode(bytes));
  }
}
