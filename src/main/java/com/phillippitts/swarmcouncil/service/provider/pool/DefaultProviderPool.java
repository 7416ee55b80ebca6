package com.phillippitts.swarmcouncil.service.provider.pool;

import com.phillippitts.swarmcouncil.service.provider.BoundedProviderFactory;
import com.phillippitts.swarmcouncil.service.provider.ContentProvider;
import com.phillippitts.swarmcouncil.service.provider.ProviderCapability;
import com.phillippitts.swarmcouncil.service.provider.ProviderCatalog;
import com.phillippitts.swarmcouncil.service.provider.ProviderDefinition;
import jakarta.annotation.PreDestroy;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;

/**
 * Pool that constructs every enabled provider concurrently, probes each once and keeps the
 * handles for councils to adopt.
 *
 * <p>Construction and the health probe of each provider are each bounded by the
 * {@link BoundedProviderFactory} timeout; a probe that overruns leaves an unhealthy entry. One
 * provider's failure never affects the others.
 */
public class DefaultProviderPool implements ProviderPool {

    private static final Logger LOG = LogManager.getLogger(DefaultProviderPool.class);

    private final ProviderCatalog catalog;
    private final BoundedProviderFactory factory;
    private final Executor executor;

    private final Object lock = new Object();
    private volatile Map<String, PooledProvider> entries = Map.of();
    private volatile List<String> orderedIds = List.of();
    private boolean initialized = false;

    public DefaultProviderPool(ProviderCatalog catalog, BoundedProviderFactory factory, Executor executor) {
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.executor = Objects.requireNonNull(executor, "executor");
    }

    /**
     * Constructs and probes all enabled providers. Idempotent once it has run.
     */
    public void initialize() {
        synchronized (lock) {
            if (initialized) {
                return;
            }
            List<ProviderDefinition> definitions = catalog.enabledProviders();
            LOG.info("Initializing provider pool with {} candidates", definitions.size());

            List<CompletableFuture<PooledProvider>> futures = new ArrayList<>(definitions.size());
            for (ProviderDefinition def : definitions) {
                String id = def.identifier();
                futures.add(factory.constructAsync(id)
                        .thenCompose(provider -> probeAsync(id, provider))
                        .exceptionally(error -> {
                            LOG.warn("Pool failed to construct {}: {}", id, rootMessage(error));
                            return null;
                        }));
            }

            Map<String, PooledProvider> built = new LinkedHashMap<>();
            for (int i = 0; i < futures.size(); i++) {
                PooledProvider entry = futures.get(i).join();
                if (entry != null) {
                    built.put(definitions.get(i).identifier(), entry);
                }
            }
            entries = Map.copyOf(built);
            orderedIds = List.copyOf(built.keySet());
            initialized = true;
            LOG.info("Provider pool ready: {} constructed, {} healthy", built.size(), healthyProviders().size());
        }
    }

    private static String rootMessage(Throwable error) {
        Throwable cause = error instanceof CompletionException && error.getCause() != null ? error.getCause() : error;
        return cause.getMessage();
    }

    private CompletableFuture<PooledProvider> probeAsync(String id, ContentProvider provider) {
        long timeoutMs = factory.getTimeout().toMillis();
        CompletableFuture<PooledProvider> probing;
        try {
            probing = CompletableFuture.supplyAsync(() -> probe(id, provider), executor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Pool health probe for {} rejected by executor: {}", id, e.getMessage());
            return CompletableFuture.completedFuture(new PooledProvider(id, provider, false, Instant.now(),
                    "Health probe rejected: executor saturated"));
        }
        return probing
                .completeOnTimeout(null, timeoutMs, TimeUnit.MILLISECONDS)
                .thenApply(entry -> {
                    if (entry != null) {
                        return entry;
                    }
                    LOG.warn("Pool health probe for {} timed out after {}ms", id, timeoutMs);
                    return new PooledProvider(id, provider, false, Instant.now(),
                            "Health probe timed out after " + timeoutMs + "ms");
                });
    }

    private PooledProvider probe(String id, ContentProvider provider) {
        if (!provider.capabilities().contains(ProviderCapability.HEALTH_PROBE)) {
            return new PooledProvider(id, provider, true, Instant.now(), null);
        }
        try {
            provider.probeHealth();
            return new PooledProvider(id, provider, true, Instant.now(), null);
        } catch (RuntimeException e) {
            LOG.warn("Pool health probe failed for {}: {}", id, e.getMessage());
            return new PooledProvider(id, provider, false, Instant.now(), e.getMessage());
        }
    }

    @Override
    public List<PooledProvider> healthyProviders() {
        Map<String, PooledProvider> snapshot = entries;
        List<PooledProvider> healthy = new ArrayList<>();
        for (String id : orderedIds) {
            PooledProvider p = snapshot.get(id);
            if (p != null && p.healthy()) {
                healthy.add(p);
            }
        }
        return List.copyOf(healthy);
    }

    @Override
    public Optional<PooledProvider> find(String providerId) {
        return Optional.ofNullable(entries.get(providerId));
    }

    public boolean isInitialized() {
        synchronized (lock) {
            return initialized;
        }
    }

    /**
     * Tears down every pooled provider that supports it. Errors are logged, not raised.
     */
    @PreDestroy
    public void shutdown() {
        synchronized (lock) {
            for (PooledProvider entry : entries.values()) {
                ContentProvider provider = entry.provider();
                if (!provider.capabilities().contains(ProviderCapability.TEARDOWN)) {
                    continue;
                }
                try {
                    provider.teardown();
                } catch (RuntimeException e) {
                    LOG.warn("Teardown failed for pooled provider {}: {}", entry.providerId(), e.getMessage());
                }
            }
            entries = Map.of();
            orderedIds = List.of();
            initialized = false;
        }
    }
}
