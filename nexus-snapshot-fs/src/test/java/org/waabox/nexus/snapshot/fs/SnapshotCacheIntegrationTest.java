package org.waabox.nexus.snapshot.fs;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import com.fasterxml.jackson.databind.JsonNode;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.waabox.nexus.Nexus;
import org.waabox.nexus.NexusConfig;
import org.waabox.nexus.NexusException;
import org.waabox.nexus.fetch.PageFetcher;
import org.waabox.nexus.fetch.PageResult;
import org.waabox.nexus.model.Competition;
import org.waabox.nexus.model.Competitor;
import org.waabox.nexus.model.HarvestSnapshot;
import org.waabox.nexus.model.RankEntry;
import org.waabox.nexus.snapshot.CborSnapshotSerializer;
import org.waabox.nexus.snapshot.SerializedSnapshot;

/**
 * Boots a {@link Nexus} from a snapshot file, with a source that has no
 * data at all.
 *
 * @author waabox(waabox[at]gmail[dot]com)
 */
class SnapshotCacheIntegrationTest {

  /** A source where every page is missing, counting requests. */
  private static final class EmptySource implements PageFetcher {

    private final AtomicInteger requests = new AtomicInteger();

    @Override
    public PageResult fetch(final String collection, final int pageIndex) {
      requests.incrementAndGet();
      return PageResult.notFound(collection, pageIndex);
    }

    @Override
    public Optional<List<JsonNode>> fetchDocument(final String name) {
      requests.incrementAndGet();
      return Optional.empty();
    }
  }

  @Test
  void whenBootstrapping_givenFreshSnapshotFile_shouldNotHitTheSource(
      @TempDir final Path tempDir) {

    final CborSnapshotSerializer serializer = new CborSnapshotSerializer();
    final HarvestSnapshot snapshot = new HarvestSnapshot(
        List.of(new Competitor("2016PARK01", "Max Park", "US", 90, 0,
            List.of(new RankEntry("333", 313, 1, 1, 1)), List.of(),
            List.of())),
        List.of(new Competition("WC2023", "WC 2023", "KR",
            LocalDate.of(2023, 8, 12), LocalDate.of(2023, 8, 15),
            List.of("333"))),
        Map.of("us", "north_america"), Instant.now());

    final FileSystemSnapshotStore store = new FileSystemSnapshotStore(tempDir);
    store.save(SerializedSnapshot.of("nexus", serializer.formatVersion(),
        snapshot.createdAt(), serializer.serialize(snapshot)));

    final EmptySource source = new EmptySource();
    final Nexus nexus = Nexus.builder()
        .config(NexusConfig.create("http://localhost/api").withPages(1, 1))
        .pageFetcher(source)
        .snapshotStore(store)
        .build();

    nexus.bootstrap();

    assertTrue(nexus.isReady());
    assertEquals(0, source.requests.get());
    assertEquals("Max Park", nexus.lookupRank("north_america", "333",
        "singles", 1).orElseThrow().competitor().name());
  }

  @Test
  void whenBootstrapping_givenEmptySourceAndNoFile_shouldFail(
      @TempDir final Path tempDir) {

    final Nexus nexus = Nexus.builder()
        .config(NexusConfig.create("http://localhost/api").withPages(1, 1))
        .pageFetcher(new EmptySource())
        .snapshotStore(new FileSystemSnapshotStore(tempDir))
        .build();

    assertThrows(NexusException.class, nexus::bootstrap);
  }
}
