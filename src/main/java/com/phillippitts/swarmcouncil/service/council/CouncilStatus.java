package com.phillippitts.swarmcouncil.service.council;

import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of a council. Two snapshots taken without an intervening lifecycle change
 * are equal.
 */
public record CouncilStatus(
        String councilName,
        CouncilState state,
        boolean initialized,
        int memberCount,
        List<MemberStatus> members,
        Map<String, String> roleAssignments,
        List<String> availableWorkflows
) {
    public CouncilStatus {
        members = members == null ? List.of() : List.copyOf(members);
        roleAssignments = roleAssignments == null ? Map.of() : roleAssignments;
        availableWorkflows = availableWorkflows == null ? List.of() : List.copyOf(availableWorkflows);
    }
}
