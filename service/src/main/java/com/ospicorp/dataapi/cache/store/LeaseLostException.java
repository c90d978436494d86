package com.ospicorp.dataapi.cache.store;

public class LeaseLostException extends BlobStoreException {
  public LeaseLostException(LeaseHandle lease) {
    super("Lease " + lease.leaseId() + " on " + lease.key() + " is no longer held");
  }
}
