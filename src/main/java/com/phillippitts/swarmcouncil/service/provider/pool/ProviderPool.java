package com.phillippitts.swarmcouncil.service.provider.pool;

import java.util.List;
import java.util.Optional;

/**
 * Read-only view of providers constructed once and shared between councils.
 *
 * <p>The pool owns the providers it hands out: councils that adopt them never tear them down.
 */
public interface ProviderPool {

    /**
     * Returns entries whose last probe succeeded, in catalog order.
     *
     * @return healthy entries; empty if the pool has not been initialized
     */
    List<PooledProvider> healthyProviders();

    Optional<PooledProvider> find(String providerId);
}
