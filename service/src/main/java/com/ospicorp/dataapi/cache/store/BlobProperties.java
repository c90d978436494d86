package com.ospicorp.dataapi.cache.store;

public record BlobProperties(long size, LeaseState leaseState) {}
