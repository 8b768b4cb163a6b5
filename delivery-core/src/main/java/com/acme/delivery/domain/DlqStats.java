package com.acme.delivery.domain;

import java.util.Map;

/**
 * Aggregate dead letter counts. {@code total} counts active records only; permanent records and
 * retry pointers are counted separately.
 */
public record DlqStats(
    long total, long permanent, long retryScheduled, Map<String, QueueStats> byQueue) {

  public static DlqStats empty() {
    return new DlqStats(0, 0, 0, Map.of());
  }

  public QueueStats forQueue(String queue) {
    return byQueue.getOrDefault(queue, QueueStats.EMPTY);
  }
}
