package com.phillippitts.swarmcouncil.service.provider;

import com.phillippitts.swarmcouncil.exception.ConstructionTimeoutException;
import com.phillippitts.swarmcouncil.exception.ProviderConstructionException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs {@link ProviderRegistry#construct(String)} on an executor and bounds it with a timeout.
 *
 * <p>A construction that exceeds the timeout surfaces as {@link ConstructionTimeoutException};
 * any other failure as {@link ProviderConstructionException}, including an executor that refuses
 * the task. The abandoned task is left to finish on its worker thread; its result is discarded.
 */
public class BoundedProviderFactory {

    private static final Logger LOG = LogManager.getLogger(BoundedProviderFactory.class);

    private final ProviderRegistry registry;
    private final Executor executor;
    private final Duration timeout;

    public BoundedProviderFactory(ProviderRegistry registry, Executor executor, Duration timeout) {
        this.registry = Objects.requireNonNull(registry, "registry");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.timeout = Objects.requireNonNull(timeout, "timeout");
    }

    /**
     * Constructs the provider, blocking at most for the configured timeout.
     *
     * @param identifier provider id
     * @return constructed provider
     * @throws ConstructionTimeoutException if construction exceeds the timeout
     * @throws ProviderConstructionException if construction fails or yields no provider
     */
    public ContentProvider construct(String identifier) {
        try {
            return constructAsync(identifier).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof ProviderConstructionException pce) {
                throw pce;
            }
            throw new ProviderConstructionException(identifier, "Construction failed: " + e.getMessage(), e);
        }
    }

    /**
     * Starts construction without blocking.
     *
     * @param identifier provider id
     * @return future completing with the provider, or exceptionally with a
     *         {@link ProviderConstructionException}
     */
    public CompletableFuture<ContentProvider> constructAsync(String identifier) {
        CompletableFuture<ContentProvider> constructing;
        try {
            constructing = CompletableFuture.supplyAsync(() -> registry.construct(identifier), executor);
        } catch (RejectedExecutionException e) {
            LOG.warn("Construction of {} rejected by executor: {}", identifier, e.getMessage());
            return CompletableFuture.failedFuture(
                    new ProviderConstructionException(identifier, "Construction rejected: executor saturated", e));
        }
        return constructing
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((provider, error) -> {
                    if (error == null && provider != null) {
                        return provider;
                    }
                    throw toConstructionException(identifier, error);
                });
    }

    private ProviderConstructionException toConstructionException(String identifier, Throwable error) {
        Throwable cause = error;
        while (cause instanceof CompletionException && cause.getCause() != null) {
            cause = cause.getCause();
        }
        if (cause == null) {
            return new ProviderConstructionException(identifier, "Registry returned no provider");
        }
        if (cause instanceof TimeoutException) {
            LOG.warn("Construction of {} timed out after {}ms", identifier, timeout.toMillis());
            return new ConstructionTimeoutException(identifier, timeout);
        }
        if (cause instanceof ProviderConstructionException pce) {
            return pce;
        }
        return new ProviderConstructionException(identifier, "Construction failed: " + cause.getMessage(), cause);
    }

    public Duration getTimeout() {
        return timeout;
    }
}
