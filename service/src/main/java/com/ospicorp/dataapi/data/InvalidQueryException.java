package com.ospicorp.dataapi.data;

/** The parameters are individually valid but cannot be combined in one query. */
public class InvalidQueryException extends RuntimeException {
  public InvalidQueryException(String message) {
    super(message);
  }
}
