package com.acme.delivery.core;

/** A failure that will not succeed on a later attempt; the retry engine never retries it. */
public class PermanentException extends RuntimeException {
  public PermanentException(String message) {
    super(message);
  }

  public PermanentException(String message, Throwable e) {
    super(message, e);
  }
}
