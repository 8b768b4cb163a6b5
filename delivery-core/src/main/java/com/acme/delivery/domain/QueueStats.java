package com.acme.delivery.domain;

/** Per-queue record counts: active, permanent and scheduled retries. */
public record QueueStats(long total, long permanent, long retry) {

  public static final QueueStats EMPTY = new QueueStats(0, 0, 0);

  public QueueStats plusTotal() {
    return new QueueStats(total + 1, permanent, retry);
  }

  public QueueStats plusPermanent() {
    return new QueueStats(total, permanent + 1, retry);
  }

  public QueueStats plusRetry() {
    return new QueueStats(total, permanent, retry + 1);
  }
}
