package com.ospicorp.dataapi.cache;

import com.ospicorp.dataapi.cache.store.LeaseHandle;
import java.net.URI;

/**
 * Outcome of resolving a request against the cache.
 */
public sealed interface Resolution
    permits Resolution.ServeFromCache, Resolution.BecomeProducer, Resolution.Redirect,
    Resolution.Fallback {

  CacheKey key();

  /** Entry is complete and its bytes were downloaded for an inline response. */
  record ServeFromCache(CacheKey key, byte[] body) implements Resolution {
  }

  /** The caller holds the lease and must produce, cache and publish the entry. */
  record BecomeProducer(CacheKey key, LeaseHandle lease) implements Resolution {
  }

  /** Entry is complete; the client should download it from {@code location}. */
  record Redirect(CacheKey key, URI location) implements Resolution {
  }

  /** Waited too long; compute the response directly and leave the cache alone. */
  record Fallback(CacheKey key) implements Resolution {
  }
}
