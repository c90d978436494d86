package com.ospicorp.dataapi.cache.store;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.net.URI;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * In-process store for local mode and tests.
 *
 * <p>Only provides single-JVM semantics. Lease expiry follows the injected clock.
 */
public class InMemoryBlobCacheStore implements BlobCacheStore {

  private static final Logger log = LoggerFactory.getLogger(InMemoryBlobCacheStore.class);

  private static final class Entry {
    private byte[] content = new byte[0];
    private String contentType;
    private Map<String, String> tags = new LinkedHashMap<>();
    private String leaseId;
    private Instant leaseExpiresAt;
  }

  private final Map<String, Entry> entries = new HashMap<>();
  private final Clock clock;
  private final Function<String, URI> locator;

  public InMemoryBlobCacheStore(Clock clock, Function<String, URI> locator) {
    this.clock = Objects.requireNonNull(clock);
    this.locator = Objects.requireNonNull(locator);
  }

  @Override
  public synchronized boolean exists(String key) {
    return entries.containsKey(key);
  }

  @Override
  public synchronized boolean createEmpty(String key) {
    if (entries.containsKey(key)) {
      return false;
    }
    entries.put(key, new Entry());
    return true;
  }

  @Override
  public synchronized void upload(String key, InputStream content, long length, String contentType,
      LeaseHandle lease) {
    Entry entry = entries.computeIfAbsent(key, k -> new Entry());
    checkWritable(key, entry, lease);
    try {
      entry.content = content.readAllBytes();
    } catch (IOException e) {
      throw new UncheckedIOException("Unable to read upload for " + key, e);
    }
    entry.contentType = contentType;
    log.debug("Stored {} bytes at {}", entry.content.length, key);
  }

  @Override
  public synchronized byte[] download(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      throw new BlobNotFoundException(key);
    }
    return entry.content.clone();
  }

  @Override
  public synchronized void delete(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return;
    }
    if (leaseState(entry).isHeld()) {
      throw new LeaseConflictException(key);
    }
    entries.remove(key);
  }

  @Override
  public synchronized void delete(String key, LeaseHandle lease) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return;
    }
    if (!lease.leaseId().equals(entry.leaseId)) {
      log.info("Not deleting {}: lease {} was taken over", key, lease.leaseId());
      return;
    }
    entries.remove(key);
  }

  @Override
  public synchronized Optional<LeaseHandle> acquireLease(String key, Duration duration) {
    Entry entry = entries.get(key);
    if (entry == null || leaseState(entry).isHeld()) {
      return Optional.empty();
    }
    entry.leaseId = UUID.randomUUID().toString();
    entry.leaseExpiresAt = clock.instant().plus(duration);
    return Optional.of(new LeaseHandle(key, entry.leaseId, duration));
  }

  @Override
  public synchronized void renew(LeaseHandle lease) {
    Entry entry = entries.get(lease.key());
    if (entry == null || !lease.leaseId().equals(entry.leaseId)) {
      throw new LeaseLostException(lease);
    }
    entry.leaseExpiresAt = clock.instant().plus(lease.duration());
  }

  @Override
  public synchronized void release(LeaseHandle lease) {
    Entry entry = entries.get(lease.key());
    if (entry != null && lease.leaseId().equals(entry.leaseId)) {
      entry.leaseId = null;
      entry.leaseExpiresAt = null;
    }
  }

  @Override
  public synchronized Map<String, String> getTags(String key) {
    Entry entry = entries.get(key);
    return entry == null ? Map.of() : Map.copyOf(entry.tags);
  }

  @Override
  public synchronized void setTags(String key, Map<String, String> tags, LeaseHandle lease) {
    Entry entry = entries.get(key);
    if (entry == null) {
      throw new BlobNotFoundException(key);
    }
    checkWritable(key, entry, lease);
    entry.tags = new LinkedHashMap<>(tags);
  }

  @Override
  public synchronized Optional<BlobProperties> getProperties(String key) {
    Entry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    return Optional.of(new BlobProperties(entry.content.length, leaseState(entry)));
  }

  @Override
  public URI locationOf(String key) {
    return locator.apply(key);
  }

  synchronized String contentType(String key) {
    Entry entry = entries.get(key);
    return entry == null ? null : entry.contentType;
  }

  private void checkWritable(String key, Entry entry, LeaseHandle lease) {
    if (leaseState(entry).isHeld()
        && (lease == null || !lease.leaseId().equals(entry.leaseId))) {
      throw new LeaseConflictException(key);
    }
  }

  private LeaseState leaseState(Entry entry) {
    if (entry.leaseId == null) {
      return LeaseState.UNLOCKED;
    }
    return entry.leaseExpiresAt.isAfter(clock.instant()) ? LeaseState.LOCKED : LeaseState.EXPIRED;
  }
}
