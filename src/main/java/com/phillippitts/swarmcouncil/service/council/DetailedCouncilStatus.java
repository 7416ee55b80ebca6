package com.phillippitts.swarmcouncil.service.council;

import com.phillippitts.swarmcouncil.service.health.HealthRecord;

import java.util.Map;

/**
 * Status plus initialization and health details.
 *
 * @param status                 basic status
 * @param lastInitialization     most recent initialization attempt
 * @param health                 health record per provider, sorted by id
 * @param overallHealth          percentage of healthy providers
 * @param healthMonitoringActive whether the periodic check is scheduled
 */
public record DetailedCouncilStatus(
        CouncilStatus status,
        InitializationAttempt lastInitialization,
        Map<String, HealthRecord> health,
        int overallHealth,
        boolean healthMonitoringActive
) {
}
