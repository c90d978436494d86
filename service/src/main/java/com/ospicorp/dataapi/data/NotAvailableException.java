package com.ospicorp.dataapi.data;

/** The query matched no records. Answered with 204 rather than as an error. */
public class NotAvailableException extends RuntimeException {
  public NotAvailableException(String message) {
    super(message);
  }
}
