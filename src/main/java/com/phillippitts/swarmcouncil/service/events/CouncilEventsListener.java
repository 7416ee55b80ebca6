package com.phillippitts.swarmcouncil.service.events;

import com.phillippitts.swarmcouncil.service.fallback.event.AllFallbacksFailedEvent;
import com.phillippitts.swarmcouncil.service.fallback.event.FallbackAttemptFailedEvent;
import com.phillippitts.swarmcouncil.service.health.event.ProviderRecoveredEvent;
import com.phillippitts.swarmcouncil.service.health.event.ProviderUnhealthyEvent;
import com.phillippitts.swarmcouncil.service.provider.ProviderFailureEvent;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Centralized handler for provider and degradation events. Throttled to avoid log spam.
 */
@Component
class CouncilEventsListener {
    private static final Logger LOG = LogManager.getLogger(CouncilEventsListener.class);

    private final Map<String, Instant> lastLog = new ConcurrentHashMap<>();
    private static final Duration THROTTLE = Duration.ofMinutes(1);

    @EventListener
    void onProviderUnhealthy(ProviderUnhealthyEvent e) {
        if (shouldLog("unhealthy-" + e.council() + '-' + e.providerId())) {
            LOG.warn("Provider became unhealthy: council={}, provider={}, reason={}",
                    e.council(), e.providerId(), e.reason());
        }
    }

    @EventListener
    void onProviderRecovered(ProviderRecoveredEvent e) {
        LOG.info("Provider recovered: council={}, provider={}, latencyMs={}",
                e.council(), e.providerId(), e.latencyMs());
    }

    @EventListener
    void onProviderFailure(ProviderFailureEvent e) {
        if (shouldLog("failure-" + e.providerId())) {
            LOG.warn("Provider call failed: provider={}, msg={}", e.providerId(), e.message());
        }
    }

    @EventListener
    void onFallbackAttemptFailed(FallbackAttemptFailedEvent e) {
        if (shouldLog("fallback-" + e.council() + '-' + e.providerId())) {
            LOG.warn("Fallback attempt failed: council={}, provider={}, reason={}",
                    e.council(), e.providerId(), e.reason());
        }
    }

    @EventListener
    void onAllFallbacksFailed(AllFallbacksFailedEvent e) {
        if (shouldLog("all-fallbacks-" + e.council())) {
            LOG.error("All fallbacks failed: council={}, attempted={}. Check provider credentials and quotas.",
                    e.council(), e.attempted());
        }
    }

    // Package-private for tests
    boolean shouldLog(String key) {
        Instant now = Instant.now();
        Instant prev = lastLog.get(key);
        if (prev == null || Duration.between(prev, now).compareTo(THROTTLE) > 0) {
            lastLog.put(key, now);
            return true;
        }
        return false;
    }
}
