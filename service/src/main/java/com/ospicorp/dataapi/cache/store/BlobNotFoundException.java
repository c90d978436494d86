package com.ospicorp.dataapi.cache.store;

public class BlobNotFoundException extends BlobStoreException {
  public BlobNotFoundException(String key) {
    super("Cache object not found: " + key);
  }

  public BlobNotFoundException(String key, Throwable cause) {
    super("Cache object not found: " + key, cause);
  }
}
