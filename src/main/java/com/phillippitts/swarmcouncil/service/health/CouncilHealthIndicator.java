package com.phillippitts.swarmcouncil.service.health;

import com.phillippitts.swarmcouncil.service.council.CouncilState;
import com.phillippitts.swarmcouncil.service.council.DetailedCouncilStatus;
import com.phillippitts.swarmcouncil.service.council.SwarmCouncil;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Health indicator for the base council.
 *
 * <ul>
 *   <li>UP: fully initialized and every provider healthy</li>
 *   <li>DEGRADED: operational with partial initialization or unhealthy providers</li>
 *   <li>DOWN: not operational</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health endpoint.
 */
@Component
public class CouncilHealthIndicator implements HealthIndicator {

    private final SwarmCouncil council;

    public CouncilHealthIndicator(SwarmCouncil council) {
        this.council = council;
    }

    @Override
    public Health health() {
        DetailedCouncilStatus detailed = council.detailedStatus();
        CouncilState state = detailed.status().state();
        int overall = detailed.overallHealth();

        Health.Builder builder = new Health.Builder();
        if (state == CouncilState.FULLY_INITIALIZED && overall == 100) {
            builder.up();
        } else if (state.isOperational()) {
            builder.status("DEGRADED");
        } else {
            builder.down();
        }
        return builder
                .withDetail("state", state.name())
                .withDetail("overallHealth", overall)
                .withDetail("members", detailed.status().memberCount())
                .withDetail("providers", providerStatuses(detailed.health()))
                .build();
    }

    private static Map<String, String> providerStatuses(Map<String, HealthRecord> records) {
        Map<String, String> out = new LinkedHashMap<>();
        records.forEach((id, record) -> out.put(id, record.status().name().toLowerCase(Locale.ROOT)));
        return out;
    }
}
