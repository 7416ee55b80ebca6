package com.phillippitts.swarmcouncil.service.provider;

import java.util.Map;
import java.util.Optional;

/**
 * Read-only view of the council a provider has joined.
 */
public interface CouncilContext {

    String councilName();

    /** Current role to provider-identifier assignment, as an immutable map. */
    Map<String, String> roleAssignments();

    default Optional<String> providerForRole(String role) {
        return Optional.ofNullable(roleAssignments().get(role));
    }
}
