package com.phillippitts.swarmcouncil.service.provider;

import com.phillippitts.swarmcouncil.exception.ProviderException;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Contract for text-generation backends that take part in a council.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Provider is constructed by a {@link ProviderRegistry} from its configuration</li>
 *   <li>The council calls the optional setup methods it finds in {@link #capabilities()}
 *       ({@link #assignRole}, {@link #assignSpecialties}, {@link #attachCouncilContext})</li>
 *   <li>{@link #generate(String)} is called by pipeline stages, consultations and fallbacks</li>
 *   <li>{@link #probeHealth()} is called periodically when supported</li>
 *   <li>{@link #teardown()} releases resources when the council shuts down</li>
 * </ol>
 *
 * <p>Only {@link #getProviderId()} and {@link #generate(String)} are required. The optional methods
 * default to throwing {@link UnsupportedOperationException}; implementations that override them
 * must also list the matching {@link ProviderCapability}.
 *
 * <p>Thread Safety: implementations must allow concurrent {@code generate} calls, since health
 * checks and workflows run independently.
 */
public interface ContentProvider {

    /**
     * Returns the provider identifier used for role assignment, logging and metrics.
     *
     * @return identifier (e.g. "gemini", "openai")
     */
    String getProviderId();

    /**
     * Generates text for the given prompt.
     *
     * @param prompt non-blank prompt text
     * @return generated text
     * @throws ProviderException on transport, backend or response-format failure
     */
    String generate(String prompt);

    /**
     * Optional extensions implemented by this provider.
     *
     * @return capability flags; empty by default
     */
    default Set<ProviderCapability> capabilities() {
        return EnumSet.noneOf(ProviderCapability.class);
    }

    /**
     * Performs a dedicated health probe. Requires {@link ProviderCapability#HEALTH_PROBE}.
     *
     * @throws ProviderException if the backend is unhealthy
     */
    default void probeHealth() {
        throw new UnsupportedOperationException(getProviderId() + " does not support health probes");
    }

    /** Requires {@link ProviderCapability#ROLE}. */
    default void assignRole(String role) {
        throw new UnsupportedOperationException(getProviderId() + " does not accept roles");
    }

    /** Requires {@link ProviderCapability#SPECIALTIES}. */
    default void assignSpecialties(List<String> specialties) {
        throw new UnsupportedOperationException(getProviderId() + " does not accept specialties");
    }

    /** Requires {@link ProviderCapability#COUNCIL_CONTEXT}. */
    default void attachCouncilContext(CouncilContext context) {
        throw new UnsupportedOperationException(getProviderId() + " does not accept a council context");
    }

    /**
     * Releases resources held by this provider. Requires {@link ProviderCapability#TEARDOWN}.
     * Must be idempotent.
     */
    default void teardown() {
        throw new UnsupportedOperationException(getProviderId() + " does not support teardown");
    }
}
