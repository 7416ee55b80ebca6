package com.phillippitts.swarmcouncil.service.provider;

import java.util.List;

/**
 * Source of provider definitions for council initialization.
 */
public interface ProviderCatalog {

    /**
     * Returns definitions that are enabled and have a credential, in declaration order.
     *
     * @return candidate definitions; empty when nothing is usable
     */
    List<ProviderDefinition> enabledProviders();

    /**
     * Looks up a definition regardless of whether it is enabled.
     *
     * @param identifier provider id
     * @return definition, or {@code null} if unknown
     */
    ProviderDefinition find(String identifier);
}
