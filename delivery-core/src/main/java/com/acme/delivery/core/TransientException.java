package com.acme.delivery.core;

/** A failure that is expected to clear up on its own; classified as retryable. */
public class TransientException extends RuntimeException {
  public TransientException(String message) {
    super(message);
  }

  public TransientException(String message, Throwable e) {
    super(message, e);
  }
}
