package com.acme.delivery.config;

import java.time.Duration;
import lombok.Builder;
import lombok.Value;

/** Partial {@link DlqConfig}; null fields leave the underlying value untouched. */
@Value
@Builder
public class DlqConfigOverrides {

  Integer maxRetries;
  Duration baseDelay;
  Duration maxDelay;
  Double backoffFactor;
  Boolean enableJitter;
  Duration retentionPeriod;
  Integer alertThreshold;

  public static DlqConfigOverrides none() {
    return DlqConfigOverrides.builder().build();
  }

  public DlqConfig applyTo(DlqConfig base) {
    var b = base.toBuilder();
    if (maxRetries != null) {
      b.maxRetries(maxRetries);
    }
    if (baseDelay != null) {
      b.baseDelay(baseDelay);
    }
    if (maxDelay != null) {
      b.maxDelay(maxDelay);
    }
    if (backoffFactor != null) {
      b.backoffFactor(backoffFactor);
    }
    if (enableJitter != null) {
      b.enableJitter(enableJitter);
    }
    if (retentionPeriod != null) {
      b.retentionPeriod(retentionPeriod);
    }
    if (alertThreshold != null) {
      b.alertThreshold(alertThreshold);
    }
    return b.build();
  }
}
