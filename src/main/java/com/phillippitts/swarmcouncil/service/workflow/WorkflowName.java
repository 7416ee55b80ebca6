package com.phillippitts.swarmcouncil.service.workflow;

import com.phillippitts.swarmcouncil.exception.InvalidRequestException;

import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Workflows offered by the base council.
 */
public enum WorkflowName {
    FULL,
    CREATE,
    REVIEW,
    OPTIMIZE;

    /** Lower-case name used on the API. */
    public String key() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static List<String> keys() {
        return Arrays.stream(values()).map(WorkflowName::key).collect(Collectors.toUnmodifiableList());
    }

    /**
     * Parses a workflow name case-insensitively.
     *
     * @throws InvalidRequestException listing the valid names when unknown
     */
    public static WorkflowName parse(String name) {
        if (name != null) {
            for (WorkflowName w : values()) {
                if (w.key().equalsIgnoreCase(name.trim())) {
                    return w;
                }
            }
        }
        throw new InvalidRequestException("workflow",
                "Unknown workflow: " + name + ". Available workflows: " + String.join(", ", keys()));
    }
}
