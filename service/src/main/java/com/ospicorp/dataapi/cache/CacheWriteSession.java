package com.ospicorp.dataapi.cache;

import com.ospicorp.dataapi.cache.store.BlobCacheStore;
import com.ospicorp.dataapi.cache.store.LeaseHandle;
import com.ospicorp.dataapi.producer.Chunk;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Writes one response into the cache while relaying it to the client.
 *
 * <p>The entry only becomes visible as done after the full content is uploaded. Any failure
 * removes the entry so that waiters reclaim it instead of serving a partial response.
 */
public class CacheWriteSession implements AutoCloseable {

  private static final Logger log = LoggerFactory.getLogger(CacheWriteSession.class);

  private enum Status { OPEN, COMPLETED, ABORTED }

  private final ReentrantLock lock = new ReentrantLock();
  private final BlobCacheStore store;
  private final CacheKey key;
  private final LeaseHandle lease;
  private final String contentType;
  private final ScratchBuffer buffer;
  private final ClientRelay relay;
  private Status status = Status.OPEN;
  private int chunks;

  CacheWriteSession(BlobCacheStore store, CacheKey key, LeaseHandle lease, String contentType,
      OutputStream client) {
    this.store = store;
    this.key = key;
    this.lease = lease;
    this.contentType = contentType;
    this.relay = new ClientRelay(client);
    try {
      this.buffer = new ScratchBuffer();
    } catch (IOException e) {
      abandon(e);
      throw new ProducerFailureException("Unable to open scratch buffer for " + key, e);
    }
  }

  public void accept(Chunk chunk) {
    lock.lock();
    try {
      ensureOpen();
      buffer.write(chunk.index(), chunk.bytes());
      relay.offer(chunk);
      store.renew(lease);
      chunks++;
    } catch (IOException | RuntimeException e) {
      throw abort(e);
    } finally {
      lock.unlock();
    }
  }

  /**
   * Uploads the assembled content, marks it done and gives up the lease, in that order.
   */
  public void complete(Map<String, String> tags) {
    lock.lock();
    try {
      ensureOpen();
      if (!buffer.isContiguous()) {
        throw new IllegalStateException("Missing chunks before completing " + key);
      }
      try (InputStream content = buffer.openStream()) {
        store.upload(key.path(), content, buffer.size(), contentType, lease);
      }
      store.setTags(key.path(), CacheTags.completed(tags), lease);
      store.release(lease);
      status = Status.COMPLETED;
      log.info("Cached {} ({} chunks, {} bytes)", key, chunks, buffer.size());
    } catch (IOException | RuntimeException e) {
      throw abort(e);
    } finally {
      buffer.close();
      lock.unlock();
    }
  }

  /**
   * Abandons the entry because producing its content failed.
   *
   * @return the exception to rethrow
   */
  public ProducerFailureException fail(Exception cause) {
    lock.lock();
    try {
      return abort(cause);
    } finally {
      lock.unlock();
    }
  }

  public boolean isClientDetached() {
    return relay.isDetached();
  }

  /** Aborts the session unless it already completed. */
  @Override
  public void close() {
    lock.lock();
    try {
      if (status == Status.OPEN) {
        abort(new IllegalStateException("Cache write for " + key + " closed before completion"));
      }
    } finally {
      lock.unlock();
    }
  }

  private ProducerFailureException abort(Exception cause) {
    if (status == Status.OPEN) {
      status = Status.ABORTED;
      log.warn("Discarding partial cache entry {} after {} chunks: {}", key, chunks,
          cause.getMessage());
      abandon(cause);
      buffer.close();
    }
    if (cause instanceof ProducerFailureException failure) {
      return failure;
    }
    return new ProducerFailureException("Failed to produce " + key, cause);
  }

  private void abandon(Exception cause) {
    try {
      store.delete(key.path(), lease);
    } catch (RuntimeException e) {
      cause.addSuppressed(e);
    }
    try {
      store.release(lease);
    } catch (RuntimeException e) {
      cause.addSuppressed(e);
    }
  }

  private void ensureOpen() {
    if (status != Status.OPEN) {
      throw new ProducerFailureException("Cache write for " + key + " is " + status,
          new IllegalStateException(status.name()));
    }
  }
}
