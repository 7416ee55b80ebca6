package com.phillippitts.swarmcouncil.service.metrics;

import com.phillippitts.swarmcouncil.service.health.HealthStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.concurrent.TimeUnit;

/**
 * Centralized metrics for council operations.
 *
 * <p>Provides instrumentation for:
 * <ul>
 *   <li>Stage latency per provider and role</li>
 *   <li>Workflow outcomes per workflow and status</li>
 *   <li>Fallback attempts per provider and outcome</li>
 *   <li>Health check outcomes per provider</li>
 * </ul>
 *
 * <p>All metrics are exposed via Micrometer and available at /actuator/prometheus.
 */
@Component
public class CouncilMetrics {

    private static final String METRIC_PREFIX = "council";

    private final MeterRegistry registry;

    public CouncilMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Records how long a stage's provider call took.
     *
     * @param providerId provider that served the stage
     * @param role       stage role
     * @param durationNanos duration in nanoseconds
     */
    public void recordStageLatency(String providerId, String role, long durationNanos) {
        Timer.builder(METRIC_PREFIX + ".stage.latency")
                .description("Time taken by a pipeline stage's provider call")
                .tag("provider", providerId)
                .tag("role", role)
                .register(registry)
                .record(durationNanos, TimeUnit.NANOSECONDS);
    }

    /**
     * Counts a finished workflow run.
     *
     * @param workflow workflow name (full, create, review, optimize, quality)
     * @param status   final run status
     */
    public void recordWorkflowOutcome(String workflow, String status) {
        Counter.builder(METRIC_PREFIX + ".workflow.outcome")
                .description("Number of workflow runs by final status")
                .tag("workflow", workflow)
                .tag("status", status.toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }

    /**
     * Counts a fallback attempt against a provider.
     *
     * @param providerId provider tried
     * @param succeeded  whether it produced content
     */
    public void recordFallbackAttempt(String providerId, boolean succeeded) {
        Counter.builder(METRIC_PREFIX + ".fallback.attempt")
                .description("Number of degradation fallback attempts")
                .tag("provider", providerId)
                .tag("outcome", succeeded ? "success" : "failure")
                .register(registry)
                .increment();
    }

    public void recordHealthCheck(String providerId, HealthStatus status) {
        Counter.builder(METRIC_PREFIX + ".health.check")
                .description("Number of provider health checks by outcome")
                .tag("provider", providerId)
                .tag("status", status.name().toLowerCase(Locale.ROOT))
                .register(registry)
                .increment();
    }
}
