package com.ospicorp.dataapi.web;

import com.ospicorp.dataapi.cache.CacheCoordinator;
import com.ospicorp.dataapi.cache.CacheKey;
import com.ospicorp.dataapi.cache.CacheProperties;
import com.ospicorp.dataapi.cache.CacheTags;
import com.ospicorp.dataapi.cache.CacheWriter;
import com.ospicorp.dataapi.cache.Resolution;
import com.ospicorp.dataapi.cache.store.BlobCacheStore;
import com.ospicorp.dataapi.cache.store.LeaseHandle;
import com.ospicorp.dataapi.data.RequestDescriptor;
import com.ospicorp.dataapi.producer.ChunkStream;
import com.ospicorp.dataapi.producer.ResultProducer;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

/**
 * Answers data requests through the response cache.
 */
@Service
public class DataService {

  private static final Logger log = LoggerFactory.getLogger(DataService.class);

  private final CacheCoordinator coordinator;
  private final CacheWriter writer;
  private final BlobCacheStore store;
  private final ResultProducer producer;
  private final CacheProperties cacheProperties;
  private final Executor producerExecutor;

  public DataService(CacheCoordinator coordinator, CacheWriter writer, BlobCacheStore store,
      ResultProducer producer, CacheProperties cacheProperties,
      @Qualifier("producerExecutor") Executor producerExecutor) {
    this.coordinator = coordinator;
    this.writer = writer;
    this.store = store;
    this.producer = producer;
    this.cacheProperties = cacheProperties;
    this.producerExecutor = producerExecutor;
  }

  public CompletableFuture<DataResponse> get(RequestDescriptor descriptor) {
    return coordinator.resolve(descriptor.cacheKey())
        .thenCompose(resolution -> respondAsync(descriptor, resolution));
  }

  /** Existence probe for HEAD requests; bypasses the cache. */
  public CompletableFuture<DataResponse> head(RequestDescriptor descriptor) {
    return CompletableFuture.supplyAsync(
        () -> producer.exists(descriptor) ? DataResponse.exists() : DataResponse.noContent(),
        producerExecutor);
  }

  private CompletableFuture<DataResponse> respondAsync(RequestDescriptor descriptor,
      Resolution resolution) {
    try {
      return CompletableFuture.supplyAsync(() -> respond(descriptor, resolution),
          producerExecutor);
    } catch (RejectedExecutionException e) {
      if (resolution instanceof Resolution.BecomeProducer claim) {
        log.warn("No producer thread for {}; releasing the claim", claim.key());
        discard(claim.key(), claim.lease(), e);
      }
      throw e;
    }
  }

  DataResponse respond(RequestDescriptor descriptor, Resolution resolution) {
    if (resolution instanceof Resolution.ServeFromCache hit) {
      return DataResponse.inline(hit.body());
    }
    if (resolution instanceof Resolution.Redirect redirect) {
      return DataResponse.redirect(redirect.location());
    }
    if (resolution instanceof Resolution.BecomeProducer claim) {
      return produce(descriptor, claim.key(), claim.lease());
    }
    log.warn("Serving {} without the cache", descriptor);
    ChunkStream chunks = producer.produce(descriptor).prime();
    return DataResponse.stream(out -> {
      try (chunks) {
        while (chunks.hasNext()) {
          out.write(chunks.next().bytes());
        }
        out.flush();
      }
    });
  }

  private DataResponse produce(RequestDescriptor descriptor, CacheKey key, LeaseHandle lease) {
    ChunkStream chunks = primeOrDiscard(descriptor, key, lease);
    String contentType = descriptor.format().contentType();
    Map<String, String> tags = CacheTags.metrics(descriptor.metricTag());
    if (!cacheProperties.isStreamWhileCaching()) {
      writer.write(key, lease, contentType, tags, chunks, null);
      return DataResponse.redirect(store.locationOf(key.path()));
    }
    BodyPipe pipe = new BodyPipe(cacheProperties.getClientBufferChunks(),
        cacheProperties.getClientStallTimeout());
    try {
      producerExecutor.execute(() -> {
        try {
          writer.write(key, lease, contentType, tags, chunks, pipe);
          pipe.finish(null);
        } catch (RuntimeException e) {
          log.error("Caching {} failed", key, e);
          pipe.finish(e);
        }
      });
    } catch (RejectedExecutionException e) {
      chunks.close();
      discard(key, lease, e);
      throw e;
    }
    return DataResponse.stream(pipe::drainTo);
  }

  private ChunkStream primeOrDiscard(RequestDescriptor descriptor, CacheKey key,
      LeaseHandle lease) {
    try {
      return producer.produce(descriptor).prime();
    } catch (RuntimeException e) {
      discard(key, lease, e);
      throw e;
    }
  }

  private void discard(CacheKey key, LeaseHandle lease, RuntimeException cause) {
    try {
      store.delete(key.path(), lease);
      store.release(lease);
    } catch (RuntimeException e) {
      cause.addSuppressed(e);
    }
  }
}
