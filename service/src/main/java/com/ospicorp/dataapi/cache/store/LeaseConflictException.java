package com.ospicorp.dataapi.cache.store;

public class LeaseConflictException extends BlobStoreException {
  public LeaseConflictException(String key) {
    super("Cache object is leased by another party: " + key);
  }
}
