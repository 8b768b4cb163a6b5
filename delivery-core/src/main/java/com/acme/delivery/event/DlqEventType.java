package com.acme.delivery.event;

public enum DlqEventType {
  MESSAGE_ADDED("dlq.message.added"),
  RETRY_SUCCESSFUL("dlq.retry.successful"),
  MESSAGE_PERMANENT("dlq.message.permanent"),
  THRESHOLD_EXCEEDED("dlq.threshold.exceeded"),
  MANUAL_RETRY("dlq.message.manual_retry"),
  MESSAGE_DELETED("dlq.message.deleted");

  private final String eventName;

  DlqEventType(String eventName) {
    this.eventName = eventName;
  }

  public String getEventName() {
    return eventName;
  }
}
