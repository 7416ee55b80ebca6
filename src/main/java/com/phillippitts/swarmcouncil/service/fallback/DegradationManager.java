package com.phillippitts.swarmcouncil.service.fallback;

import com.phillippitts.swarmcouncil.config.properties.CouncilProperties;
import com.phillippitts.swarmcouncil.service.fallback.event.AllFallbacksFailedEvent;
import com.phillippitts.swarmcouncil.service.fallback.event.FallbackAttemptFailedEvent;
import com.phillippitts.swarmcouncil.service.metrics.CouncilMetrics;
import com.phillippitts.swarmcouncil.service.provider.ProviderRecord;
import com.phillippitts.swarmcouncil.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * Produces best-effort content after a pipeline stage fails.
 *
 * <p>Tries every council member in registration order with the original prompt plus the fallback
 * marker and returns the first non-blank answer. When all members fail the configured sentinel is
 * returned instead.
 */
@Service
public class DegradationManager {
    private static final Logger LOG = LogManager.getLogger(DegradationManager.class);

    private final CouncilProperties props;
    private final ApplicationEventPublisher publisher;
    private final CouncilMetrics metrics;

    public DegradationManager(CouncilProperties props, ApplicationEventPublisher publisher, CouncilMetrics metrics) {
        this.props = Objects.requireNonNull(props);
        this.publisher = Objects.requireNonNull(publisher);
        this.metrics = Objects.requireNonNull(metrics);
    }

    /**
     * @param councilName    council name for logs and events
     * @param originalPrompt the caller's prompt, not the partially transformed buffer
     * @param members        active members in registration order
     */
    public DegradationResult degrade(String councilName, String originalPrompt, List<ProviderRecord> members) {
        String fallbackPrompt = originalPrompt + props.getFallbackMarker();
        int attempts = 0;
        for (ProviderRecord member : members) {
            attempts++;
            String id = member.identifier();
            try {
                String content = member.provider().generate(fallbackPrompt);
                if (content != null && !content.isBlank()) {
                    metrics.recordFallbackAttempt(id, true);
                    LOG.info("[{}] Fallback content from {} (chars={})", councilName, id, content.length());
                    return new DegradationResult(content, id, attempts);
                }
                metrics.recordFallbackAttempt(id, false);
                publisher.publishEvent(new FallbackAttemptFailedEvent(councilName, id, "empty response", Instant.now()));
            } catch (Exception e) {
                LOG.warn("[{}] Fallback provider {} failed: {}", councilName, id, e.toString());
                metrics.recordFallbackAttempt(id, false);
                publisher.publishEvent(new FallbackAttemptFailedEvent(
                        councilName, id, e.getClass().getSimpleName(), Instant.now()));
            }
        }
        LOG.error("[{}] All {} fallback providers failed (prompt='{}')",
                councilName, attempts, LogSanitizer.preview(originalPrompt));
        publisher.publishEvent(new AllFallbacksFailedEvent(councilName, attempts, Instant.now()));
        return new DegradationResult(props.getFallbackSentinel(), null, attempts);
    }
}
