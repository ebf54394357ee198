package com.scholary.audio.upload.assembly;

import static com.scholary.audio.upload.assembly.ChunkFixtures.BUCKET;
import static com.scholary.audio.upload.assembly.ChunkFixtures.MB;
import static com.scholary.audio.upload.assembly.ChunkFixtures.context;
import static com.scholary.audio.upload.assembly.ChunkFixtures.expectedConcatenation;
import static com.scholary.audio.upload.assembly.ChunkFixtures.storeChunks;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.scholary.audio.upload.objectstore.InMemoryObjectStoreClient;
import com.scholary.audio.upload.objectstore.ObjectStoreClient;
import com.scholary.audio.upload.objectstore.ObjectStoreException;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.util.unit.DataSize;

class MultipartStrategyTest {

  private static final String TARGET = "audio/lesson-1/0_1700000000000.mp3";
  private static final long MIN_PART = ObjectStoreClient.MIN_MULTIPART_PART_SIZE;

  private InMemoryObjectStoreClient store;
  private MutableClock clock;
  private MultipartStrategy strategy;

  @BeforeEach
  void setUp() {
    store = new InMemoryObjectStoreClient();
    clock = ChunkFixtures.clock();
    strategy = new MultipartStrategy(store, new ChunkCleaner(store), DataSize.ofBytes(MIN_PART));
  }

  @Test
  void reconstruct_shouldGroupChunksIntoMinimumSizedParts() {
    List<String> keys = storeChunks(store, "s1", 5, 3 * MB);

    ReconstructionOutcome outcome = strategy.reconstruct(context("s1", TARGET, keys, clock));

    assertThat(store.completedPartSizes(TARGET)).containsExactly(6 * MB, 6 * MB, 3 * MB);
    assertThat(store.contentOf(TARGET)).isEqualTo(expectedConcatenation(5, 3 * MB));
    assertThat(outcome.byteSize()).isEqualTo(15L * MB);
    assertThat(outcome.storagePuts()).isEqualTo(3);
    assertThat(store.openUploadIds()).isEmpty();
  }

  @Test
  void reconstruct_shouldDeleteEachChunkOnceConsumed() {
    List<String> keys = storeChunks(store, "s1", 3, 2 * MB);

    strategy.reconstruct(context("s1", TARGET, keys, clock));

    assertThat(store.listKeys(BUCKET, "_chunks/s1/")).isEmpty();
    assertThat(strategy.consumesChunks()).isTrue();
  }

  @Test
  void reconstruct_shouldBoundBufferedBytesForManySmallChunks() {
    int chunkSize = 700 * 1024;
    List<String> keys = storeChunks(store, "s1", 40, chunkSize);

    ReconstructionOutcome outcome = strategy.reconstruct(context("s1", TARGET, keys, clock));

    assertThat(outcome.peakBufferedBytes()).isLessThan(MIN_PART + chunkSize);
    assertThat(outcome.byteSize()).isEqualTo(40L * chunkSize);
    assertThat(store.contentOf(TARGET)).isEqualTo(expectedConcatenation(40, chunkSize));
    List<Integer> sizes = store.completedPartSizes(TARGET);
    assertThat(sizes.subList(0, sizes.size() - 1)).allMatch(size -> size >= MIN_PART);
  }

  @Test
  void reconstruct_shouldUploadSinglePartWhenEverythingIsSmall() {
    List<String> keys = storeChunks(store, "s1", 2, MB);

    ReconstructionOutcome outcome = strategy.reconstruct(context("s1", TARGET, keys, clock));

    assertThat(store.completedPartSizes(TARGET)).containsExactly(2 * MB);
    assertThat(outcome.storagePuts()).isEqualTo(1);
  }

  @Test
  void reconstruct_shouldAbortUploadWhenPartUploadFails() {
    List<String> keys = storeChunks(store, "s1", 5, 3 * MB);
    store.failUploadOfPart(2);

    assertThatThrownBy(() -> strategy.reconstruct(context("s1", TARGET, keys, clock)))
        .isInstanceOf(ObjectStoreException.class)
        .hasMessageContaining("part=2");

    assertThat(store.listParts(BUCKET, TARGET, store.lastUploadId())).isEmpty();
    assertThat(store.openUploadIds()).isEmpty();
    assertThat(store.exists(BUCKET, TARGET)).isFalse();
  }

  @Test
  void reconstruct_shouldAbortUploadWhenCompletionFails() {
    List<String> keys = storeChunks(store, "s1", 2, 3 * MB);
    store.failCompletion();

    assertThatThrownBy(() -> strategy.reconstruct(context("s1", TARGET, keys, clock)))
        .isInstanceOf(ObjectStoreException.class);

    assertThat(store.openUploadIds()).isEmpty();
    assertThat(store.exists(BUCKET, TARGET)).isFalse();
  }

  @Test
  void reconstruct_shouldAttachAbortFailureAsSuppressed() {
    List<String> keys = storeChunks(store, "s1", 2, 3 * MB);
    store.failCompletion();
    store.failAbort();

    assertThatThrownBy(() -> strategy.reconstruct(context("s1", TARGET, keys, clock)))
        .isInstanceOf(ObjectStoreException.class)
        .satisfies(e -> assertThat(e.getSuppressed()).hasSize(1));

    assertThat(store.openUploadIds()).hasSize(1);
  }

  @Test
  void reconstruct_shouldAbortWhenDeadlinePassesMidway() {
    List<String> keys = storeChunks(store, "s1", 3, 3 * MB);
    InMemoryObjectStoreClient slowStore =
        new InMemoryObjectStoreClient() {
          @Override
          public byte[] getObjectBytes(String bucket, String key) {
            byte[] data = store.getObjectBytes(bucket, key);
            clock.advance(Duration.ofMinutes(3));
            return data;
          }

          @Override
          public void deleteObject(String bucket, String key) {
            store.deleteObject(bucket, key);
          }
        };
    MultipartStrategy slow =
        new MultipartStrategy(slowStore, new ChunkCleaner(slowStore), DataSize.ofBytes(MIN_PART));

    assertThatThrownBy(() -> slow.reconstruct(context("s1", TARGET, keys, clock)))
        .isInstanceOf(AssemblyTimeoutException.class);

    assertThat(slowStore.openUploadIds()).isEmpty();
    assertThat(slowStore.exists(BUCKET, TARGET)).isFalse();
  }

  @Test
  void reconstruct_shouldCarryOnWhenChunkDeleteFails() {
    List<String> keys = storeChunks(store, "s1", 3, 2 * MB);
    store.failDeleteOf(keys.get(1));

    strategy.reconstruct(context("s1", TARGET, keys, clock));

    assertThat(store.contentOf(TARGET)).isEqualTo(expectedConcatenation(3, 2 * MB));
    assertThat(store.listKeys(BUCKET, "_chunks/s1/")).containsExactly(keys.get(1));
  }

  @Test
  void constructor_shouldRejectPartSizeBelowBackendMinimum() {
    assertThatThrownBy(
            () ->
                new MultipartStrategy(
                    store, new ChunkCleaner(store), DataSize.ofBytes(MIN_PART - 1)))
        .isInstanceOf(IllegalArgumentException.class);
  }
}
