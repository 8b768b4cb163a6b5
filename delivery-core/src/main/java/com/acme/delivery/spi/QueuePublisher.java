package com.acme.delivery.spi;

/** Pushes a payload back onto the origin queue consumed by the business workers. */
public interface QueuePublisher {
  void push(String queue, String payload);
}
