package org.waabox.nexus.snapshot;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Instant;

import org.junit.jupiter.api.Test;

/**
 * Tests for {@link SerializedSnapshot}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SerializedSnapshotTest {

  private static final Instant NOW = Instant.parse("2024-05-01T10:15:30Z");

  private static byte[] bytes(final String text) {
    return text.getBytes(StandardCharsets.UTF_8);
  }

  @Test
  void whenCreating_givenPayload_shouldComputeSha256Hex() {
    final SerializedSnapshot snapshot = SerializedSnapshot.of("nexus", 1, NOW,
        bytes("abc"));

    assertEquals(
        "ba7816bf8f01cfea414140de5dae2223b00361a396177a9cb410ff61f20015ad",
        snapshot.hash());
    assertTrue(snapshot.intact());
  }

  @Test
  void whenHashDoesNotMatch_shouldNotBeIntact() {
    final SerializedSnapshot snapshot = new SerializedSnapshot("nexus",
        Hashes.sha256(bytes("abc")), 1, NOW, bytes("abd"));

    assertFalse(snapshot.intact());
  }

  @Test
  void whenMutatingArrays_shouldNotAffectTheSnapshot() {
    final byte[] payload = bytes("abc");
    final SerializedSnapshot snapshot = SerializedSnapshot.of("nexus", 1, NOW,
        payload);

    payload[0] = 'z';
    snapshot.data()[1] = 'z';

    assertArrayEquals(bytes("abc"), snapshot.data());
    assertTrue(snapshot.intact());
  }

  @Test
  void whenComparing_givenSameContent_shouldBeEqual() {
    final SerializedSnapshot first = SerializedSnapshot.of("nexus", 1, NOW,
        bytes("abc"));
    final SerializedSnapshot second = SerializedSnapshot.of("nexus", 1, NOW,
        bytes("abc"));

    assertEquals(first, second);
    assertEquals(first.hashCode(), second.hashCode());
    assertNotEquals(first, SerializedSnapshot.of("nexus", 2, NOW,
        bytes("abc")));
  }

  @Test
  void whenPrinting_shouldNotIncludeThePayload() {
    final String text = SerializedSnapshot.of("nexus", 1, NOW, bytes("abc"))
        .toString();

    assertTrue(text.contains("bytes=3"));
    assertFalse(text.contains("abc"));
  }

  @Test
  void whenCreating_givenNullData_shouldThrow() {
    assertThrows(NullPointerException.class,
        () -> SerializedSnapshot.of("nexus", 1, NOW, null));
  }
}
