package com.ospicorp.dataapi.cache.store;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.net.URI;
import java.time.Duration;
import java.util.Map;
import java.util.Optional;

/**
 * Object store holding materialised responses, keyed by cache path.
 *
 * <p>Besides plain object operations the store offers an advisory, time-bounded lease per
 * object and a small tag set. Mutual exclusion between producers rests entirely on the lease
 * primitive: callers only interpret lease state, they never hold an in-process lock across
 * requests.
 */
public interface BlobCacheStore {

  boolean exists(String key);

  /**
   * Creates a zero-byte placeholder.
   *
   * @return {@code false} when the object already exists
   */
  boolean createEmpty(String key);

  /**
   * Replaces the object content. A lease must be supplied when the object is leased.
   *
   * @throws LeaseConflictException when the object is leased by another party
   */
  void upload(String key, InputStream content, long length, String contentType, LeaseHandle lease);

  default void upload(String key, byte[] content, String contentType, LeaseHandle lease) {
    upload(key, new ByteArrayInputStream(content), content.length, contentType, lease);
  }

  /**
   * @throws BlobNotFoundException when the object does not exist
   */
  byte[] download(String key);

  /**
   * Deletes an object the caller does not hold a lease on.
   *
   * @throws LeaseConflictException while another party holds an active lease
   */
  void delete(String key);

  /**
   * Deletes an object on behalf of the lease holder. Does nothing when the lease has since been
   * taken over by another party or the object is gone.
   */
  void delete(String key, LeaseHandle lease);

  /**
   * @return empty when the object is absent or actively leased by another party
   */
  Optional<LeaseHandle> acquireLease(String key, Duration duration);

  /**
   * @throws LeaseLostException when the lease is no longer held by the caller
   */
  void renew(LeaseHandle lease);

  void release(LeaseHandle lease);

  Map<String, String> getTags(String key);

  void setTags(String key, Map<String, String> tags, LeaseHandle lease);

  Optional<BlobProperties> getProperties(String key);

  /** Public location a client can be redirected to for a completed entry. */
  URI locationOf(String key);
}
