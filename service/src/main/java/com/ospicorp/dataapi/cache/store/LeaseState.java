package com.ospicorp.dataapi.cache.store;

public enum LeaseState {
  UNLOCKED,
  LOCKED,
  /** A lease was taken but not renewed within its duration. */
  EXPIRED;

  public boolean isHeld() {
    return this == LOCKED;
  }
}
