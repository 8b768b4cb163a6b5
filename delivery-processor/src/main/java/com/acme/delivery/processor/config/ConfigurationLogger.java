package com.acme.delivery.processor.config;

import com.acme.delivery.config.DeliveryConfig;
import io.micronaut.context.annotation.Requires;
import io.micronaut.context.annotation.Value;
import io.micronaut.context.event.ApplicationEventListener;
import io.micronaut.context.event.StartupEvent;
import jakarta.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Logs effective configuration on application startup for visibility and troubleshooting.
 * Disabled in test environment to avoid configuration errors.
 */
@Singleton
@Requires(notEnv = "test")
public class ConfigurationLogger implements ApplicationEventListener<StartupEvent> {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigurationLogger.class);

    private final DeliveryConfig config;
    private final String redisAddress;

    public ConfigurationLogger(
            DeliveryConfig config, @Value("${redisson.address:not configured}") String redisAddress) {
        this.config = config;
        this.redisAddress = redisAddress;
    }

    @Override
    public void onApplicationEvent(StartupEvent event) {
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("                         EFFECTIVE CONFIGURATION                                ");
        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
        LOG.info("");

        LOG.info("━━━ Redis ━━━");
        LOG.info("  Address:            {} (Dead letter store and origin queues)", redisAddress);
        LOG.info("");

        DeliveryConfig.Scheduler scheduler = config.getScheduler();
        LOG.info("━━━ Retry Scheduler ━━━");
        LOG.info("  Enabled:            {}", scheduler.isEnabled() ? "ENABLED" : "DISABLED");
        LOG.info("  Scan Interval:      {} (How often due retry pointers are re-delivered)", scheduler.getScanInterval());
        LOG.info("  Cleanup Interval:   {} (How often the audit logs stats and drops orphans)", scheduler.getCleanupInterval());
        LOG.info("");

        DeliveryConfig.Dlq dlq = config.getDlq();
        LOG.info("━━━ Dead Letter Queue Defaults ━━━");
        LOG.info("  Max Retries:        {} (Re-deliveries before a message turns permanent)", dlq.getMaxRetries());
        LOG.info("  Base Delay:         {}", dlq.getBaseDelay());
        LOG.info("  Max Delay:          {}", dlq.getMaxDelay());
        LOG.info("  Backoff Factor:     {}", dlq.getBackoffFactor());
        LOG.info("  Jitter:             {}", dlq.isEnableJitter());
        LOG.info("  Retention:          {} (TTL of every stored record)", dlq.getRetentionPeriod());
        LOG.info("  Alert Threshold:    {} (Permanent messages per queue before alerting)", dlq.getAlertThreshold());
        LOG.info("  Claim TTL:          {} (Exclusivity window of a re-delivery)", dlq.getClaimTtl());
        LOG.info("");

        DeliveryConfig.Retry retry = config.getRetry();
        LOG.info("━━━ In-Process Retry Defaults ━━━");
        LOG.info("  Max Attempts:       {}", retry.getMaxAttempts());
        LOG.info("  Base Delay:         {}", retry.getBaseDelay());
        LOG.info("  Max Delay:          {}", retry.getMaxDelay());
        LOG.info("  Backoff Factor:     {}", retry.getBackoffFactor());
        LOG.info("  Jitter:             {}", retry.isJitter());
        LOG.info("");

        DeliveryConfig.CircuitBreaker breaker = config.getCircuitBreaker();
        LOG.info("━━━ Circuit Breaker Defaults ━━━");
        LOG.info("  Failure Threshold:  {} (Consecutive failures that open the circuit)", breaker.getFailureThreshold());
        LOG.info("  Recovery Timeout:   {} (Time open before a half-open trial)", breaker.getRecoveryTimeout());
        LOG.info("");

        LOG.info("═══════════════════════════════════════════════════════════════════════════════");
    }
}
