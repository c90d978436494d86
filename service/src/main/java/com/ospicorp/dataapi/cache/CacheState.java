package com.ospicorp.dataapi.cache;

/**
 * What a request observed about a cache entry on its latest inspection.
 */
public enum CacheState {
  /** No entry; the request tries to claim it. */
  COLD,
  /** Entry leased by a live producer. */
  WAITING,
  /** Entry neither leased nor done: left behind by a crashed producer. */
  RECLAIMING,
  /** Entry fully written and tagged done. */
  COMPLETE,
  /** Wait budget exhausted; the request computes its own response without caching it. */
  FALLBACK
}
