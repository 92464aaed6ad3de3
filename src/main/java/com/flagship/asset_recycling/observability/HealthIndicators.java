package com.flagship.asset_recycling.observability;

import com.flagship.asset_recycling.admin.PauseSwitch;
import com.flagship.asset_recycling.outbox.OutboxService;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Actuator health indicators for the recycling service.
 */
public class HealthIndicators {

    /**
     * Health indicator for the outbox backlog.
     * Unhealthy if too many events are waiting to be published. Only present
     * while the publisher runs; without it the backlog is expected to sit.
     */
    @Component("outboxHealth")
    @ConditionalOnProperty(name = "outbox.publisher.enabled", havingValue = "true")
    public static class OutboxHealthIndicator implements HealthIndicator {

        private static final long BACKLOG_WARNING_THRESHOLD = 1000;
        private static final long BACKLOG_CRITICAL_THRESHOLD = 10000;

        private final OutboxService outboxService;

        public OutboxHealthIndicator(OutboxService outboxService) {
            this.outboxService = outboxService;
        }

        @Override
        public Health health() {
            long backlogSize = outboxService.countUnpublished();

            Health.Builder builder = backlogSize < BACKLOG_WARNING_THRESHOLD
                    ? Health.up()
                    : backlogSize < BACKLOG_CRITICAL_THRESHOLD
                    ? Health.status("WARNING")
                    : Health.down();

            return builder
                    .withDetail("backlogSize", backlogSize)
                    .withDetail("deadLettered", outboxService.countDeadLettered())
                    .withDetail("warningThreshold", BACKLOG_WARNING_THRESHOLD)
                    .withDetail("criticalThreshold", BACKLOG_CRITICAL_THRESHOLD)
                    .build();
        }
    }

    /**
     * Reports the pause switch. A paused service is alive but does not accept
     * exchanges, so it reports OUT_OF_SERVICE.
     */
    @Component("recyclingPauseHealth")
    public static class PauseHealthIndicator implements HealthIndicator {

        private final PauseSwitch pauseSwitch;

        public PauseHealthIndicator(PauseSwitch pauseSwitch) {
            this.pauseSwitch = pauseSwitch;
        }

        @Override
        public Health health() {
            boolean paused = pauseSwitch.isPaused();
            return (paused ? Health.outOfService() : Health.up())
                    .withDetail("paused", paused)
                    .build();
        }
    }
}
