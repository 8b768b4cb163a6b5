package com.acme.delivery.domain;

import com.fasterxml.jackson.annotation.JsonIgnore;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A message that failed processing, as held by the dead letter store. Identity is {@code (queue,
 * id)}; the payload is opaque and never interpreted here.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class FailedMessage {

  private String id;
  private String queue;
  private String payload;
  private String error;
  private String stackTrace;
  private int retryCount;
  private int maxRetries;
  private Instant failedAt;
  private Instant nextRetryAt; // null once permanent
  private String lastProcessedBy;
  private Map<String, String> metadata = new HashMap<>();

  @JsonIgnore
  public boolean isRetryBudgetExhausted() {
    return retryCount >= maxRetries;
  }
}
