package com.phillippitts.swarmcouncil.service.provider;

/**
 * Optional extensions a {@link ContentProvider} may support beyond text generation.
 *
 * <p>Declared once through {@link ContentProvider#capabilities()} and snapshotted at registration;
 * the council only calls an optional method when its flag is present in the snapshot.
 */
public enum ProviderCapability {
    /** {@link ContentProvider#probeHealth()} is implemented. */
    HEALTH_PROBE,
    /** {@link ContentProvider#assignRole(String)} is implemented. */
    ROLE,
    /** {@link ContentProvider#assignSpecialties(java.util.List)} is implemented. */
    SPECIALTIES,
    /** {@link ContentProvider#attachCouncilContext(CouncilContext)} is implemented. */
    COUNCIL_CONTEXT,
    /** {@link ContentProvider#teardown()} releases resources. */
    TEARDOWN
}
