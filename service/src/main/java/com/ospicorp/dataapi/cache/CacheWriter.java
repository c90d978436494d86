package com.ospicorp.dataapi.cache;

import com.ospicorp.dataapi.cache.store.BlobCacheStore;
import com.ospicorp.dataapi.cache.store.LeaseHandle;
import com.ospicorp.dataapi.producer.Chunk;
import java.io.OutputStream;
import java.util.Iterator;
import java.util.Map;
import org.springframework.stereotype.Component;

@Component
public class CacheWriter {

  private final BlobCacheStore store;

  public CacheWriter(BlobCacheStore store) {
    this.store = store;
  }

  /**
   * @param client receives the chunks in order as they are cached; may be {@code null}
   */
  public CacheWriteSession open(CacheKey key, LeaseHandle lease, String contentType,
      OutputStream client) {
    return new CacheWriteSession(store, key, lease, contentType, client);
  }

  /**
   * Drains {@code chunks} into the cache entry and publishes it.
   *
   * @throws ProducerFailureException when producing or storing failed; the entry is removed
   */
  public void write(CacheKey key, LeaseHandle lease, String contentType, Map<String, String> tags,
      Iterator<Chunk> chunks, OutputStream client) {
    try (CacheWriteSession session = open(key, lease, contentType, client)) {
      while (chunks.hasNext()) {
        Chunk chunk;
        try {
          chunk = chunks.next();
        } catch (RuntimeException e) {
          throw session.fail(e);
        }
        session.accept(chunk);
      }
      session.complete(tags);
    }
  }
}
