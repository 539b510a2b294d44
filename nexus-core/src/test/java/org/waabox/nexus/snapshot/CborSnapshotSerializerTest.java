package org.waabox.nexus.snapshot;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.dataformat.cbor.databind.CBORMapper;

import org.junit.jupiter.api.Test;
import org.waabox.nexus.model.Competition;
import org.waabox.nexus.model.Competitor;
import org.waabox.nexus.model.HarvestSnapshot;
import org.waabox.nexus.model.RankEntry;
import org.waabox.nexus.model.ResultRound;

/**
 * Tests for {@link CborSnapshotSerializer}.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class CborSnapshotSerializerTest {

  private final CborSnapshotSerializer serializer =
      new CborSnapshotSerializer();

  private static HarvestSnapshot sample() {
    final Competitor full = new Competitor("2009ZEMD01", "Feliks Zemdegs",
        "AU", 150, 5,
        List.of(new RankEntry("333", 347, 5, 1, 1)),
        List.of(new RankEntry("333", 421, 2, null, null)),
        List.of(
            new ResultRound("WC2019", "333", "Final", 2, 450, 520, "OcR",
                null),
            new ResultRound(null, "222", "1", null, -1, -1, null, "WR")));
    final Competitor bare = new Competitor("2020NOBO01", "Unknown", null, 0,
        0, List.of(), List.of(), List.of());
    final Competition competition = new Competition("WC2019",
        "WCA World Championship 2019", "AU", LocalDate.of(2019, 7, 11),
        LocalDate.of(2019, 7, 14), List.of("333", "222"));
    final Competition nowhere = new Competition("FMC2020", "FMC 2020", null,
        LocalDate.of(2020, 2, 1), LocalDate.of(2020, 2, 1), List.of());
    return new HarvestSnapshot(List.of(full, bare),
        List.of(competition, nowhere),
        Map.of("au", "oceania", "us", "north_america"),
        Instant.parse("2024-05-01T10:15:30Z"));
  }

  @Test
  void whenDeserializing_givenSerializedSnapshot_shouldRestoreEveryField() {
    final HarvestSnapshot original = sample();

    final HarvestSnapshot restored = serializer.deserialize(
        serializer.serialize(original));

    assertEquals(original, restored);
  }

  @Test
  void whenSerializing_givenSameSnapshotTwice_shouldProduceSameBytes() {
    assertEquals(Hashes.sha256(serializer.serialize(sample())),
        Hashes.sha256(serializer.serialize(sample())));
  }

  @Test
  void whenDeserializing_givenGarbage_shouldThrowFormatException() {
    assertThrows(SnapshotFormatException.class, () -> serializer.deserialize(
        "not a snapshot".getBytes(StandardCharsets.UTF_8)));
    assertThrows(SnapshotFormatException.class,
        () -> serializer.deserialize(new byte[0]));
  }

  @Test
  void whenDeserializing_givenOtherFormatVersion_shouldThrowFormatException()
      throws Exception {
    final CBORMapper mapper = new CBORMapper();
    final byte[] data = mapper.writeValueAsBytes(Map.of(
        "formatVersion", 99, "createdAt", "2024-05-01T10:15:30Z",
        "competitors", List.of(), "competitions", List.of(),
        "continents", Map.of()));

    final SnapshotFormatException e = assertThrows(
        SnapshotFormatException.class, () -> serializer.deserialize(data));
    assertTrue(e.getCause().getMessage().contains("99"));
  }

  @Test
  void whenDeserializing_givenMissingField_shouldThrowFormatException()
      throws Exception {
    final byte[] data = new CBORMapper().writeValueAsBytes(Map.of(
        "formatVersion", 1, "competitors", List.of()));

    assertThrows(SnapshotFormatException.class,
        () -> serializer.deserialize(data));
  }

  @Test
  void whenAskingFormatVersion_shouldReturnCurrentVersion() {
    assertEquals(CborSnapshotSerializer.FORMAT_VERSION,
        serializer.formatVersion());
  }
}
