package com.acme.delivery.event;

import java.time.Instant;
import java.util.Map;

/**
 * Notification raised by the dead letter queue. {@code messageId} is null for queue-level events
 * such as {@link DlqEventType#THRESHOLD_EXCEEDED}.
 */
public record DlqEvent(
    DlqEventType type,
    String queue,
    String messageId,
    Map<String, Object> attributes,
    Instant occurredAt) {

  public DlqEvent {
    attributes = attributes == null ? Map.of() : Map.copyOf(attributes);
  }

  public String name() {
    return type.getEventName();
  }
}
