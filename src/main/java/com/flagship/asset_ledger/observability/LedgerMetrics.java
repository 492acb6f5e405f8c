package com.flagship.asset_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Centralized metrics for ledger operations.
 *
 * Metrics exposed:
 * - assets.created: asset registrations, tagged by type and outcome
 * - assets.price_updated: price updates, tagged by outcome
 * - orders.created: orders placed, tagged by order type
 * - trades.executed: trade executions, tagged by outcome (success or error code)
 * - ledger.latency: operation latency, tagged by operation
 * - events.published: domain events sent to Kafka, tagged by type and outcome
 */
@Component
public class LedgerMetrics {

    private final MeterRegistry registry;

    public LedgerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordAssetCreated(String assetType, String outcome) {
        registry.counter("assets.created",
                "asset_type", sanitizeTag(assetType),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public void recordPriceUpdated(String outcome) {
        registry.counter("assets.price_updated", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordOrderCreated(String orderType) {
        registry.counter("orders.created", "order_type", sanitizeTag(orderType)).increment();
    }

    public void recordTradeExecuted(String outcome) {
        registry.counter("trades.executed", "outcome", sanitizeTag(outcome)).increment();
    }

    /**
     * Records ledger operation latency.
     */
    public void recordLatency(String operation, long durationMs) {
        registry.timer("ledger.latency",
                "operation", sanitizeTag(operation)
        ).record(Duration.ofMillis(durationMs));
    }

    public void recordEventPublished(String eventType, boolean success) {
        registry.counter("events.published",
                "event_type", sanitizeTag(eventType),
                "outcome", success ? "success" : "failure"
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
