package com.ospicorp.dataapi.cache;

/**
 * Location of a cached response inside the cache container, together with its response format.
 */
public record CacheKey(String path, String format) {

  @Override
  public String toString() {
    return path;
  }
}
