package com.acme.delivery.domain;

import java.time.Instant;

/**
 * Schedule entry for a pending re-delivery. Carries only identity and due time so a scan never has
 * to load full payloads.
 */
public record RetryPointer(String queue, String messageId, Instant nextRetryAt, int retryCount) {

  public static RetryPointer of(FailedMessage message) {
    return new RetryPointer(
        message.getQueue(), message.getId(), message.getNextRetryAt(), message.getRetryCount());
  }

  public boolean isDue(Instant now) {
    return nextRetryAt != null && !nextRetryAt.isAfter(now);
  }
}
