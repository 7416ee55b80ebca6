package com.phillippitts.swarmcouncil.service.workflow;

import com.phillippitts.swarmcouncil.service.provider.ProviderRecord;

import java.util.List;
import java.util.Optional;

/**
 * Read-only member lookup a pipeline runs against.
 */
public interface RoleDirectory {

    /** Provider currently assigned to the role. */
    Optional<ProviderRecord> forRole(String role);

    /** All active members in registration order. */
    List<ProviderRecord> inRegistrationOrder();
}
