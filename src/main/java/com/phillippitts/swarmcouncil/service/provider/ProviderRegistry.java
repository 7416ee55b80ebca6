package com.phillippitts.swarmcouncil.service.provider;

import com.phillippitts.swarmcouncil.exception.ProviderConstructionException;

/**
 * Factory for provider instances.
 */
@FunctionalInterface
public interface ProviderRegistry {

    /**
     * Constructs a new provider for the given identifier.
     *
     * @param identifier provider id
     * @return a ready-to-use provider
     * @throws ProviderConstructionException if the identifier is unknown or construction fails
     */
    ContentProvider construct(String identifier);
}
