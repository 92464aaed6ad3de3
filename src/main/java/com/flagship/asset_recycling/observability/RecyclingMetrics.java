package com.flagship.asset_recycling.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for recycling operations.
 *
 * Metrics exposed:
 * - recycling.exchanges: exchanges by disposal mode and outcome
 * - recycling.points.awarded: points awarded by successful exchanges
 * - recycling.latency: exchange and batch latency by operation
 * - recycling.batch.size / recycling.batch.item.failures: batch shape and per-item failure reasons
 * - recycling.admin.operations: administrative calls by operation and outcome
 */
@Component
public class RecyclingMetrics {

    private final MeterRegistry registry;

    private final Counter pointsAwarded;
    private final DistributionSummary batchSize;

    public RecyclingMetrics(MeterRegistry registry) {
        this.registry = registry;

        this.pointsAwarded = Counter.builder("recycling.points.awarded")
                .description("Points awarded by completed exchanges")
                .register(registry);

        this.batchSize = DistributionSummary.builder("recycling.batch.size")
                .description("Number of items per batch call")
                .register(registry);
    }

    public void recordExchange(String mode, String outcome) {
        registry.counter("recycling.exchanges",
                "mode", sanitizeTag(mode),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordPointsAwarded(long points) {
        pointsAwarded.increment(points);
    }

    public void recordLatency(String operation, long durationMs) {
        registry.timer("recycling.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordBatch(int size, int failures) {
        batchSize.record(size);
        registry.counter("recycling.batch.calls",
                "partial", String.valueOf(failures > 0)
        ).increment();
    }

    public void recordBatchItemFailure(String reason) {
        registry.counter("recycling.batch.item.failures",
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordAdminOperation(String operation, String outcome) {
        registry.counter("recycling.admin.operations",
                "operation", sanitizeTag(operation),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    /**
     * Sanitizes a tag value to prevent cardinality explosion.
     */
    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
