package com.ospicorp.dataapi.cache;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.spy;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import com.ospicorp.dataapi.cache.store.InMemoryBlobCacheStore;
import com.ospicorp.dataapi.cache.store.LeaseHandle;
import com.ospicorp.dataapi.cache.store.LeaseState;
import com.ospicorp.dataapi.producer.Chunk;
import com.ospicorp.dataapi.support.MutableClock;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.URI;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

class CacheWriterTest {

  private static final CacheKey KEY = new CacheKey("2021-03-01/nation/complete/abc.csv", "csv");
  private static final String CSV = "text/csv; charset=utf-8";

  private MutableClock clock;
  private InMemoryBlobCacheStore store;
  private CacheWriter writer;
  private LeaseHandle lease;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2021-03-01T12:00:00Z"));
    store = spy(new InMemoryBlobCacheStore(clock, key -> URI.create("https://cdn.test/" + key)));
    writer = new CacheWriter(store);
    store.createEmpty(KEY.path());
    lease = store.acquireLease(KEY.path(), Duration.ofSeconds(60)).orElseThrow();
    store.setTags(KEY.path(), CacheTags.inProgress(), lease);
  }

  @Test
  void outOfOrderChunksAreReassembledForCacheAndClient() {
    ByteArrayOutputStream client = new ByteArrayOutputStream();

    writer.write(KEY, lease, CSV, CacheTags.metrics("newCasesByPublishDate"),
        List.of(Chunk.of(1, "b"), Chunk.of(0, "a"), Chunk.of(2, "c")).iterator(), client);

    assertThat(new String(store.download(KEY.path()), StandardCharsets.UTF_8)).isEqualTo("abc");
    assertThat(client.toString(StandardCharsets.UTF_8)).isEqualTo("abc");
  }

  @Test
  void entryIsPublishedOnlyAfterUpload() {
    writer.write(KEY, lease, CSV, CacheTags.metrics("newCasesByPublishDate"),
        List.of(Chunk.of(0, "areaCode,date\n"), Chunk.of(1, "E92000001,2021-03-01\n")).iterator(),
        null);

    InOrder order = inOrder(store);
    order.verify(store).upload(eq(KEY.path()), any(InputStream.class), anyLong(), anyString(),
        eq(lease));
    order.verify(store).setTags(eq(KEY.path()), eq(Map.of(
        CacheTags.DONE, "1",
        CacheTags.IN_PROGRESS, "0",
        CacheTags.METRICS, "newCasesByPublishDate")), eq(lease));
    order.verify(store).release(lease);

    assertThat(CacheTags.isDone(store.getTags(KEY.path()))).isTrue();
    assertThat(store.getProperties(KEY.path()).orElseThrow().leaseState())
        .isEqualTo(LeaseState.UNLOCKED);
  }

  @Test
  void leaseIsRenewedAfterEveryChunk() {
    Iterator<Chunk> chunks = new Iterator<>() {
      private int index;

      @Override
      public boolean hasNext() {
        return index < 3;
      }

      @Override
      public Chunk next() {
        // each chunk takes most of a lease period to produce
        clock.advance(Duration.ofSeconds(50));
        return Chunk.of(index++, "x");
      }
    };

    writer.write(KEY, lease, CSV, Map.of(), chunks, null);

    verify(store, times(3)).renew(lease);
    assertThat(store.download(KEY.path())).hasSize(3);
  }

  @Test
  void producerFailureRemovesEntry() {
    Iterator<Chunk> chunks = new Iterator<>() {
      private int index;

      @Override
      public boolean hasNext() {
        return true;
      }

      @Override
      public Chunk next() {
        if (index == 2) {
          throw new IllegalStateException("connection reset");
        }
        return Chunk.of(index++, "x");
      }
    };

    assertThatThrownBy(() -> writer.write(KEY, lease, CSV, Map.of(), chunks, null))
        .isInstanceOf(ProducerFailureException.class)
        .hasRootCauseMessage("connection reset");

    assertThat(store.exists(KEY.path())).isFalse();
  }

  @Test
  void clientDisconnectDoesNotStopCaching() {
    OutputStream client = new OutputStream() {
      @Override
      public void write(int b) throws IOException {
        throw new IOException("Broken pipe");
      }
    };
    CacheWriteSession session = writer.open(KEY, lease, CSV, client);

    session.accept(Chunk.of(0, "a"));
    session.accept(Chunk.of(1, "b"));
    session.complete(Map.of());

    assertThat(session.isClientDetached()).isTrue();
    assertThat(new String(store.download(KEY.path()), StandardCharsets.UTF_8)).isEqualTo("ab");
    assertThat(CacheTags.isDone(store.getTags(KEY.path()))).isTrue();
  }

  @Test
  void missingChunkPreventsCompletion() {
    CacheWriteSession session = writer.open(KEY, lease, CSV, null);
    session.accept(Chunk.of(0, "a"));
    session.accept(Chunk.of(2, "c"));

    assertThatThrownBy(() -> session.complete(Map.of()))
        .isInstanceOf(ProducerFailureException.class);
    assertThat(store.exists(KEY.path())).isFalse();
  }

  @Test
  void closingAnUnfinishedSessionDiscardsEntry() {
    try (CacheWriteSession session = writer.open(KEY, lease, CSV, null)) {
      session.accept(Chunk.of(0, "a"));
    }

    assertThat(store.exists(KEY.path())).isFalse();
    assertThat(store.acquireLease(KEY.path(), Duration.ofSeconds(60))).isEmpty();
  }
}
