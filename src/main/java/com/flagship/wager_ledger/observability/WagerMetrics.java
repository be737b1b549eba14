package com.flagship.wager_ledger.observability;

import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Meters for the wizard and settlement engines.
 *
 * - wizard.sessions.started / wizard.sessions.closed{outcome}
 * - wizard.sessions.active (gauge)
 * - wizard.inputs.rejected{step, reason}
 * - wizard.inputs.dropped
 * - wagers.posted{type}, wagers.post.failed
 * - settlement.signals{direction, kind, outcome}
 * - settlement.duration
 */
@Component
public class WagerMetrics {

    private final MeterRegistry registry;
    private final Timer settlementTimer;
    private final AtomicInteger activeSessions = new AtomicInteger();

    public WagerMetrics(MeterRegistry registry) {
        this.registry = registry;
        this.settlementTimer = Timer.builder("settlement.duration")
                .description("Time taken to apply or reverse an outcome signal")
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(registry);
        registry.gauge("wizard.sessions.active", activeSessions);
    }

    public void recordSessionStarted(String wagerType) {
        activeSessions.incrementAndGet();
        registry.counter("wizard.sessions.started", "type", sanitizeTag(wagerType)).increment();
    }

    public void recordSessionClosed(String outcome) {
        activeSessions.updateAndGet(n -> Math.max(0, n - 1));
        registry.counter("wizard.sessions.closed", "outcome", sanitizeTag(outcome)).increment();
    }

    public void recordInputRejected(String step, String reason) {
        registry.counter("wizard.inputs.rejected",
                "step", sanitizeTag(step),
                "reason", sanitizeTag(reason)
        ).increment();
    }

    public void recordInputDropped() {
        registry.counter("wizard.inputs.dropped").increment();
    }

    public void recordWagerPosted(String wagerType) {
        registry.counter("wagers.posted", "type", sanitizeTag(wagerType)).increment();
    }

    public void recordPostFailed() {
        registry.counter("wagers.post.failed").increment();
    }

    public void recordSignal(String direction, String kind, String outcome) {
        registry.counter("settlement.signals",
                "direction", sanitizeTag(direction),
                "kind", sanitizeTag(kind),
                "outcome", sanitizeTag(outcome)
        ).increment();
    }

    public <T> T timeSettlement(Supplier<T> operation) {
        return settlementTimer.record(operation);
    }

    private String sanitizeTag(String value) {
        if (value == null) {
            return "unknown";
        }
        String sanitized = value.replaceAll("[^a-zA-Z0-9_]", "_");
        return sanitized.length() > 50 ? sanitized.substring(0, 50) : sanitized;
    }
}
