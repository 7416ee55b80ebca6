package com.phillippitts.swarmcouncil.service.metrics;

import com.phillippitts.swarmcouncil.service.health.HealthStatus;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class CouncilMetricsTest {

    private MeterRegistry registry;
    private CouncilMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new CouncilMetrics(registry);
    }

    @Test
    void shouldRecordStageLatencyPerProviderAndRole() {
        long durationNanos = TimeUnit.MILLISECONDS.toNanos(120);

        metrics.recordStageLatency("gemini", "creator", durationNanos);
        metrics.recordStageLatency("gemini", "creator", durationNanos);

        Timer timer = registry.find("council.stage.latency")
                .tag("provider", "gemini")
                .tag("role", "creator")
                .timer();

        assertThat(timer).isNotNull();
        assertThat(timer.count()).isEqualTo(2);
        assertThat(timer.totalTime(TimeUnit.NANOSECONDS)).isEqualTo(durationNanos * 2);
    }

    @Test
    void shouldTagWorkflowOutcomeWithLowercaseStatus() {
        metrics.recordWorkflowOutcome("full", "DEGRADED");

        Counter counter = registry.find("council.workflow.outcome")
                .tag("workflow", "full")
                .tag("status", "degraded")
                .counter();

        assertThat(counter).isNotNull();
        assertThat(counter.count()).isEqualTo(1.0);
    }

    @Test
    void shouldSeparateFallbackSuccessesFromFailures() {
        metrics.recordFallbackAttempt("openai", true);
        metrics.recordFallbackAttempt("openai", false);
        metrics.recordFallbackAttempt("openai", false);

        assertThat(registry.find("council.fallback.attempt").tag("outcome", "success").counter().count())
                .isEqualTo(1.0);
        assertThat(registry.find("council.fallback.attempt").tag("outcome", "failure").counter().count())
                .isEqualTo(2.0);
    }

    @Test
    void shouldCountHealthChecksByStatus() {
        metrics.recordHealthCheck("deepseek", HealthStatus.HEALTHY);
        metrics.recordHealthCheck("deepseek", HealthStatus.UNHEALTHY);

        Counter unhealthy = registry.find("council.health.check")
                .tag("provider", "deepseek")
                .tag("status", "unhealthy")
                .counter();

        assertThat(unhealthy).isNotNull();
        assertThat(unhealthy.count()).isEqualTo(1.0);
    }
}
