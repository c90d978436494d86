package com.ospicorp.dataapi.data;

public class RequestTooLargeException extends RuntimeException {
  private final int limit;

  public RequestTooLargeException(int requested, int limit) {
    super("Too many metrics requested: " + requested + " (maximum " + limit + ")");
    this.limit = limit;
  }

  public int limit() {
    return limit;
  }
}
