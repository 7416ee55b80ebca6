package com.phillippitts.swarmcouncil.service.workflow;

import java.util.List;
import java.util.Map;

/**
 * Council role names and their descriptions.
 */
public final class CouncilRoles {

    public static final String CREATOR = "creator";
    public static final String REVIEWER = "reviewer";
    public static final String ENHANCER = "enhancer";
    public static final String VALIDATOR = "validator";
    public static final String LOCALIZER = "localizer";

    /** Roles in full-workflow order. */
    public static final List<String> ALL = List.of(CREATOR, REVIEWER, ENHANCER, VALIDATOR, LOCALIZER);

    private static final Map<String, String> DESCRIPTIONS = Map.of(
            CREATOR, "Primary content creator - produce creative, comprehensive content",
            REVIEWER, "Quality reviewer - check accuracy, consistency and overall quality",
            ENHANCER, "Structural enhancer - make the content easier to read and more engaging",
            VALIDATOR, "Technical validator - verify technical accuracy and effectiveness",
            LOCALIZER, "Localization expert - adapt language and cultural fit for the target audience"
    );

    private CouncilRoles() {
        // Constants class - prevent instantiation
    }

    /**
     * Returns the description for a role, or the role name itself when unknown.
     */
    public static String describe(String role) {
        return DESCRIPTIONS.getOrDefault(role, role);
    }
}
