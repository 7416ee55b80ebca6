package com.phillippitts.swarmcouncil.config;

import com.phillippitts.swarmcouncil.config.properties.CouncilProperties;
import com.phillippitts.swarmcouncil.exception.SwarmCouncilException;
import com.phillippitts.swarmcouncil.service.council.AbstractCouncil;
import com.phillippitts.swarmcouncil.service.council.SwarmCouncil;
import com.phillippitts.swarmcouncil.service.provider.pool.DefaultProviderPool;
import com.phillippitts.swarmcouncil.service.quality.QualityCouncil;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Initializes both councils once the application is ready.
 *
 * <p>A council that cannot initialize is logged and left in its failed state; the application
 * keeps running so {@code POST /api/council/reinitialize} can retry.
 */
@Component
@ConditionalOnProperty(name = "council.auto-initialize", havingValue = "true", matchIfMissing = true)
class CouncilBootstrap {

    private static final Logger LOG = LogManager.getLogger(CouncilBootstrap.class);

    private final SwarmCouncil swarmCouncil;
    private final QualityCouncil qualityCouncil;
    private final DefaultProviderPool pool;
    private final CouncilProperties props;

    CouncilBootstrap(SwarmCouncil swarmCouncil, QualityCouncil qualityCouncil,
                     DefaultProviderPool pool, CouncilProperties props) {
        this.swarmCouncil = swarmCouncil;
        this.qualityCouncil = qualityCouncil;
        this.pool = pool;
        this.props = props;
    }

    @EventListener(ApplicationReadyEvent.class)
    void initializeCouncils() {
        if (props.isUseSharedPool()) {
            pool.initialize();
        }
        for (AbstractCouncil council : List.of(swarmCouncil, qualityCouncil)) {
            try {
                if (props.isUseSharedPool()) {
                    council.initializeFromSharedPool(pool);
                } else {
                    council.initialize();
                }
            } catch (SwarmCouncilException e) {
                LOG.error("Failed to initialize {} at startup: {}", council.getName(), e.getMessage());
            }
        }
    }
}
