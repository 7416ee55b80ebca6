package com.phillippitts.swarmcouncil.service.health;

import com.phillippitts.swarmcouncil.service.health.event.ProviderRecoveredEvent;
import com.phillippitts.swarmcouncil.service.health.event.ProviderUnhealthyEvent;
import com.phillippitts.swarmcouncil.service.metrics.CouncilMetrics;
import com.phillippitts.swarmcouncil.service.provider.ProviderCapability;
import com.phillippitts.swarmcouncil.service.provider.ProviderRecord;
import com.phillippitts.swarmcouncil.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.SortedMap;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Per-council tracker of provider health, with a cancelable periodic check.
 *
 * <p>Detection model:
 * <ul>
 *   <li>Providers are seeded HEALTHY when they join the council</li>
 *   <li>Every interval, each provider is probed: the dedicated health probe when the provider
 *       declares {@link ProviderCapability#HEALTH_PROBE}, otherwise a trivial generation</li>
 *   <li>A check in flight is visible as CHECKING; its outcome replaces the record wholesale</li>
 *   <li>Checks are independent: one provider's failure never touches another's record</li>
 *   <li>A check still running when the tracker is cleared is discarded</li>
 * </ul>
 *
 * <p>Health-check failures are recorded, never thrown to callers. Transitions publish
 * {@link ProviderUnhealthyEvent} and {@link ProviderRecoveredEvent}.
 *
 * <p>Each council owns its own tracker; records are never shared between councils.
 */
public class ProviderHealthTracker {

    private static final Logger LOG = LogManager.getLogger(ProviderHealthTracker.class);

    static final String HEALTH_CHECK_PROMPT = "Health check";

    private final String councilName;
    private final TaskScheduler scheduler;
    private final Duration interval;
    private final ApplicationEventPublisher publisher;
    private final CouncilMetrics metrics;
    private final Clock clock;

    private final ConcurrentMap<String, HealthRecord> records = new ConcurrentHashMap<>();
    private final AtomicLong epoch = new AtomicLong();

    private final Object scheduleLock = new Object();
    private ScheduledFuture<?> scheduled;

    public ProviderHealthTracker(String councilName,
                                 TaskScheduler scheduler,
                                 Duration interval,
                                 ApplicationEventPublisher publisher,
                                 CouncilMetrics metrics) {
        this(councilName, scheduler, interval, publisher, metrics, Clock.systemUTC());
    }

    ProviderHealthTracker(String councilName,
                          TaskScheduler scheduler,
                          Duration interval,
                          ApplicationEventPublisher publisher,
                          CouncilMetrics metrics,
                          Clock clock) {
        this.councilName = Objects.requireNonNull(councilName, "councilName");
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
        this.interval = Objects.requireNonNull(interval, "interval");
        this.publisher = Objects.requireNonNull(publisher, "publisher");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Seeds a HEALTHY record for a provider that just joined the council.
     */
    public void seed(String providerId) {
        records.put(providerId, HealthRecord.healthy(providerId, clock.instant(), 0L));
    }

    /**
     * Starts the periodic check, replacing any running schedule. The first check runs one
     * interval from now.
     *
     * @param members supplier of the council's current members, read at every tick
     */
    public void start(Supplier<? extends Collection<ProviderRecord>> members) {
        Objects.requireNonNull(members, "members");
        synchronized (scheduleLock) {
            cancelScheduled();
            scheduled = scheduler.scheduleAtFixedRate(
                    () -> checkAll(members.get()),
                    clock.instant().plus(interval),
                    interval);
            LOG.info("[{}] Health monitoring started ({}s interval)", councilName, interval.toSeconds());
        }
    }

    /**
     * Cancels the periodic check. Safe to call when nothing is scheduled.
     */
    public void stop() {
        synchronized (scheduleLock) {
            if (cancelScheduled()) {
                LOG.info("[{}] Health monitoring stopped", councilName);
            }
        }
    }

    public boolean isRunning() {
        synchronized (scheduleLock) {
            return scheduled != null && !scheduled.isCancelled() && !scheduled.isDone();
        }
    }

    /** Stops monitoring and forgets all records. */
    public void clear() {
        stop();
        epoch.incrementAndGet();
        records.clear();
    }

    /**
     * Checks every given provider once. Never throws.
     */
    public void checkAll(Collection<ProviderRecord> members) {
        if (members == null || members.isEmpty()) {
            return;
        }
        LOG.debug("[{}] Performing health checks for {} providers", councilName, members.size());
        for (ProviderRecord member : members) {
            check(member);
        }
    }

    /**
     * Checks a single provider and replaces its record with the outcome. The outcome is dropped
     * when {@link #clear()} ran while the check was in flight.
     *
     * @return the outcome of the check
     */
    public HealthRecord check(ProviderRecord member) {
        String id = member.identifier();
        long observedEpoch = epoch.get();
        HealthRecord previous = records.get(id);
        writeIfCurrent(id, observedEpoch, new HealthRecord(id, clock.instant(), HealthStatus.CHECKING,
                previous == null ? null : previous.latencyMs(), null));

        long start = System.nanoTime();
        HealthRecord outcome;
        try {
            if (member.supports(ProviderCapability.HEALTH_PROBE)) {
                member.provider().probeHealth();
            } else {
                member.provider().generate(HEALTH_CHECK_PROMPT);
            }
            long latencyMs = (System.nanoTime() - start) / 1_000_000L;
            outcome = HealthRecord.healthy(id, clock.instant(), latencyMs);
            LOG.debug("[{}] {} health check passed ({}ms)", councilName, id, latencyMs);
        } catch (Exception e) {
            String message = e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
            outcome = HealthRecord.unhealthy(id, clock.instant(), LogSanitizer.truncate(message, 500));
            LOG.warn("[{}] {} health check failed: {}", councilName, id, message);
        }
        metrics.recordHealthCheck(id, outcome.status());
        if (writeIfCurrent(id, observedEpoch, outcome)) {
            publishTransition(previous, outcome);
        } else {
            LOG.debug("[{}] Discarding stale health check for {}", councilName, id);
        }
        return outcome;
    }

    private boolean writeIfCurrent(String id, long observedEpoch, HealthRecord value) {
        HealthRecord stored = records.compute(id,
                (key, current) -> epoch.get() == observedEpoch ? value : current);
        return stored == value;
    }

    private void publishTransition(HealthRecord previous, HealthRecord outcome) {
        boolean wasHealthy = previous == null || previous.status() != HealthStatus.UNHEALTHY;
        if (wasHealthy && !outcome.isHealthy()) {
            publisher.publishEvent(new ProviderUnhealthyEvent(
                    councilName, outcome.providerId(), outcome.lastError(), outcome.lastCheckedAt()));
        } else if (!wasHealthy && outcome.isHealthy()) {
            publisher.publishEvent(new ProviderRecoveredEvent(
                    councilName, outcome.providerId(), outcome.latencyMs(), outcome.lastCheckedAt()));
        }
    }

    /**
     * Returns an immutable snapshot of all records, sorted by provider id.
     */
    public SortedMap<String, HealthRecord> records() {
        return Collections.unmodifiableSortedMap(new TreeMap<>(records));
    }

    public HealthRecord record(String providerId) {
        return records.get(providerId);
    }

    /**
     * Percentage of tracked providers currently HEALTHY, rounded; 0 when nothing is tracked.
     */
    public int overallHealth() {
        Map<String, HealthRecord> snapshot = Map.copyOf(records);
        if (snapshot.isEmpty()) {
            return 0;
        }
        long healthy = snapshot.values().stream().filter(HealthRecord::isHealthy).count();
        return (int) Math.round(100.0 * healthy / snapshot.size());
    }

    public Duration getInterval() {
        return interval;
    }

    private boolean cancelScheduled() {
        if (scheduled == null) {
            return false;
        }
        scheduled.cancel(false);
        scheduled = null;
        return true;
    }
}
