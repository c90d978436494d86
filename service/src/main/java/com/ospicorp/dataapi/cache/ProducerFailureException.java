package com.ospicorp.dataapi.cache;

/**
 * Raised when producing or caching a response failed. The partial entry has been removed.
 */
public class ProducerFailureException extends RuntimeException {
  public ProducerFailureException(String message, Throwable cause) {
    super(message, cause);
  }
}
