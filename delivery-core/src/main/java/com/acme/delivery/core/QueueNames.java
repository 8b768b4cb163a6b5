package com.acme.delivery.core;

import java.util.Set;

/** Queue name rules shared by the dead letter store key scheme. */
public final class QueueNames {

  private static final Set<String> RESERVED = Set.of("permanent", "claim", "retry");

  private QueueNames() {
    // Utility class - no instantiation
  }

  /**
   * Rejects names that would make dead letter keys ambiguous.
   *
   * @throws PermanentException if the name is blank, contains {@code ':'} or is reserved
   */
  public static String requireValid(String queue) {
    if (queue == null || queue.isBlank()) {
      throw new PermanentException("Queue name must not be blank");
    }
    if (queue.indexOf(':') >= 0) {
      throw new PermanentException("Queue name must not contain ':': " + queue);
    }
    if (RESERVED.contains(queue)) {
      throw new PermanentException("Queue name is reserved: " + queue);
    }
    return queue;
  }
}
