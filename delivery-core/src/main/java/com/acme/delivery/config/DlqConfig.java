package com.acme.delivery.config;

import com.acme.delivery.retry.BackoffSettings;
import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Per-queue dead letter policy. Unset fields take the defaults below. */
@Value
@Builder(toBuilder = true)
public class DlqConfig implements BackoffSettings {

  @Builder.Default int maxRetries = 5;
  @Builder.Default Duration baseDelay = Duration.ofSeconds(1);
  @Builder.Default Duration maxDelay = Duration.ofHours(1);
  @Builder.Default double backoffFactor = 2.0;
  @Builder.Default boolean enableJitter = true;
  @Builder.Default Duration retentionPeriod = Duration.ofDays(7);

  /** Number of permanent messages in one queue that raises a threshold alert. */
  @Builder.Default int alertThreshold = 10;

  public static DlqConfig defaults() {
    return DlqConfig.builder().build();
  }

  @Override
  public boolean isJitter() {
    return enableJitter;
  }
}
