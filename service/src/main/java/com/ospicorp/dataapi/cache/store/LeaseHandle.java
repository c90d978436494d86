package com.ospicorp.dataapi.cache.store;

import java.time.Duration;

public record LeaseHandle(String key, String leaseId, Duration duration) {}
