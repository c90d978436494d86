package com.ospicorp.dataapi.cache;

import com.ospicorp.dataapi.cache.store.BlobCacheStore;
import com.ospicorp.dataapi.cache.store.BlobNotFoundException;
import com.ospicorp.dataapi.cache.store.BlobProperties;
import com.ospicorp.dataapi.cache.store.LeaseConflictException;
import com.ospicorp.dataapi.cache.store.LeaseHandle;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

/**
 * Decides, per request, whether to serve a cached response, produce it, wait for another
 * producer or give up and compute it uncached.
 *
 * <p>Only the lease primitive of the store serialises producers. A request that finds the entry
 * leased re-polls it on the scheduler, so waiting never blocks a thread.
 */
@Service
public class CacheCoordinator {

  private static final Logger log = LoggerFactory.getLogger(CacheCoordinator.class);

  /** Immediate transitions (lost races, reclaims) allowed within a single inspection. */
  private static final int MAX_TRANSITIONS = 5;

  private final BlobCacheStore store;
  private final CacheProperties properties;
  private final TaskScheduler scheduler;
  private final Clock clock;

  public CacheCoordinator(BlobCacheStore store, CacheProperties properties,
      @Qualifier("cachePollScheduler") TaskScheduler scheduler, Clock clock) {
    this.store = store;
    this.properties = properties;
    this.scheduler = scheduler;
    this.clock = clock;
  }

  public CompletableFuture<Resolution> resolve(CacheKey key) {
    CompletableFuture<Resolution> result = new CompletableFuture<>();
    poll(key, 0, clock.instant(), result);
    return result;
  }

  private void poll(CacheKey key, int cycle, Instant started, CompletableFuture<Resolution> result) {
    try {
      Optional<Resolution> resolved = inspect(key);
      if (resolved.isPresent()) {
        log.info("Resolved {} as {} after {} polls ({} ms)", key,
            resolved.get().getClass().getSimpleName(), cycle, elapsedMillis(started));
        result.complete(resolved.get());
        return;
      }
      if (cycle >= properties.getMaxWaitCycles()) {
        log.warn("Gave up waiting for {} after {} polls ({} ms); state {}", key, cycle,
            elapsedMillis(started), CacheState.FALLBACK);
        result.complete(new Resolution.Fallback(key));
        return;
      }
      Duration interval = properties.getPollInterval();
      log.debug("{} is being produced elsewhere; poll {} in {} ms", key, cycle + 1,
          interval.toMillis());
      scheduler.schedule(() -> poll(key, cycle + 1, started, result),
          scheduler.getClock().instant().plus(interval));
    } catch (RejectedExecutionException e) {
      log.warn("Poll scheduler rejected {}; falling back", key);
      result.complete(new Resolution.Fallback(key));
    } catch (RuntimeException e) {
      result.completeExceptionally(e);
    }
  }

  /**
   * Runs the state machine until it settles.
   *
   * @return empty while another producer holds the entry
   */
  Optional<Resolution> inspect(CacheKey key) {
    for (int transition = 0; transition < MAX_TRANSITIONS; transition++) {
      CacheState state = classify(key);
      log.debug("{} is {}", key, state);
      switch (state) {
        case COLD -> {
          Optional<Resolution> claimed = claim(key);
          if (claimed.isPresent()) {
            return claimed;
          }
        }
        case WAITING -> {
          return Optional.empty();
        }
        case RECLAIMING -> {
          if (!reclaim(key)) {
            return Optional.empty();
          }
        }
        case COMPLETE -> {
          try {
            return Optional.of(serve(key));
          } catch (BlobNotFoundException e) {
            log.debug("{} vanished before it could be served", key);
          }
        }
        default -> throw new IllegalStateException("Unexpected state " + state);
      }
    }
    return Optional.empty();
  }

  CacheState classify(CacheKey key) {
    Optional<BlobProperties> properties = store.getProperties(key.path());
    if (properties.isEmpty()) {
      return CacheState.COLD;
    }
    if (properties.get().leaseState().isHeld()) {
      return CacheState.WAITING;
    }
    return CacheTags.isDone(store.getTags(key.path())) ? CacheState.COMPLETE : CacheState.RECLAIMING;
  }

  private Optional<Resolution> claim(CacheKey key) {
    if (!store.createEmpty(key.path())) {
      log.debug("Lost the race to create {}", key);
      return Optional.empty();
    }
    Optional<LeaseHandle> lease = store.acquireLease(key.path(), properties.getLeaseDuration());
    if (lease.isEmpty()) {
      log.debug("Lost the race to lease {}", key);
      return Optional.empty();
    }
    try {
      store.setTags(key.path(), CacheTags.inProgress(), lease.get());
    } catch (RuntimeException e) {
      store.release(lease.get());
      throw e;
    }
    log.info("Claimed {} with lease {}", key, lease.get().leaseId());
    return Optional.of(new Resolution.BecomeProducer(key, lease.get()));
  }

  private boolean reclaim(CacheKey key) {
    try {
      store.delete(key.path());
      log.info("Reclaimed abandoned cache entry {}", key);
      return true;
    } catch (LeaseConflictException e) {
      log.debug("{} was leased before it could be reclaimed", key);
      return false;
    }
  }

  private Resolution serve(CacheKey key) {
    boolean inline = properties.getInlineFormats().stream()
        .anyMatch(format -> format.toLowerCase(Locale.ROOT).equals(key.format()));
    if (inline) {
      return new Resolution.ServeFromCache(key, store.download(key.path()));
    }
    return new Resolution.Redirect(key, store.locationOf(key.path()));
  }

  private long elapsedMillis(Instant started) {
    return Duration.between(started, clock.instant()).toMillis();
  }
}
