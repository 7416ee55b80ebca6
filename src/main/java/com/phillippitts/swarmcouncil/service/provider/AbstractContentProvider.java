package com.phillippitts.swarmcouncil.service.provider;

import com.phillippitts.swarmcouncil.exception.ProviderException;
import org.springframework.context.ApplicationEventPublisher;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Base class for providers, handling role bookkeeping, prompt validation, error wrapping and
 * idempotent teardown.
 *
 * <p>This class implements the Template Method pattern: {@link #generate(String)} validates the
 * prompt and delegates to {@link #doGenerate(String)}; {@link #teardown()} delegates to
 * {@link #doTeardown()} at most once.
 *
 * <p><b>Thread Safety:</b> Role, specialties and context are published through volatile fields.
 * The closed flag is guarded by {@link #lock}. {@link #doGenerate(String)} may be called
 * concurrently and must be thread-safe.
 *
 * <p><b>Capabilities:</b> every optional extension is supported. Subclasses that cannot probe
 * health cheaply may override {@link #doProbe()}; the default issues a minimal generation.
 *
 * @since 1.0
 * @see ContentProvider
 * @see com.phillippitts.swarmcouncil.service.provider.http.ChatCompletionsProvider
 * @see com.phillippitts.swarmcouncil.service.provider.http.GeminiProvider
 */
public abstract class AbstractContentProvider implements ContentProvider {

    /** Prompt used by the default health probe. */
    protected static final String HEALTH_CHECK_PROMPT = "Health check";

    /**
     * Lock for the closed flag. Access to {@link #closed} must be synchronized on this lock.
     */
    protected final Object lock = new Object();

    /** Access must be synchronized on {@link #lock}. */
    protected boolean closed = false;

    private final String providerId;
    private final ApplicationEventPublisher publisher;

    private volatile String role;
    private volatile List<String> specialties = List.of();
    private volatile CouncilContext councilContext;

    protected AbstractContentProvider(String providerId, ApplicationEventPublisher publisher) {
        this.providerId = Objects.requireNonNull(providerId, "providerId");
        this.publisher = publisher;
    }

    @Override
    public final String getProviderId() {
        return providerId;
    }

    @Override
    public Set<ProviderCapability> capabilities() {
        return EnumSet.allOf(ProviderCapability.class);
    }

    /**
     * Validates the prompt and delegates to {@link #doGenerate(String)}.
     *
     * @throws ProviderException if the provider is torn down, the prompt is blank, or the backend fails
     */
    @Override
    public final String generate(String prompt) {
        ensureOpen();
        if (prompt == null || prompt.isBlank()) {
            throw new ProviderException("Prompt must not be blank", providerId);
        }
        try {
            return doGenerate(prompt);
        } catch (Exception e) {
            throw handleProviderError(e, "generation failure", Map.of("promptChars", String.valueOf(prompt.length())));
        }
    }

    /**
     * Backend-specific generation.
     *
     * @param prompt non-blank prompt
     * @return generated text, never null
     */
    protected abstract String doGenerate(String prompt);

    @Override
    public final void probeHealth() {
        ensureOpen();
        try {
            doProbe();
        } catch (Exception e) {
            throw handleProviderError(e, "health probe failure", null);
        }
    }

    /**
     * Backend-specific health probe. Default issues a minimal generation request.
     */
    protected void doProbe() {
        doGenerate(HEALTH_CHECK_PROMPT);
    }

    @Override
    public void assignRole(String role) {
        this.role = role;
    }

    @Override
    public void assignSpecialties(List<String> specialties) {
        this.specialties = specialties == null ? List.of() : List.copyOf(specialties);
    }

    @Override
    public void attachCouncilContext(CouncilContext context) {
        this.councilContext = context;
    }

    public String getRole() {
        return role;
    }

    public List<String> getSpecialties() {
        return Collections.unmodifiableList(specialties);
    }

    public CouncilContext getCouncilContext() {
        return councilContext;
    }

    /**
     * Releases resources once; further calls are no-ops.
     */
    @Override
    public final void teardown() {
        synchronized (lock) {
            if (closed) {
                return;
            }
            doTeardown();
            closed = true;
        }
    }

    /**
     * Backend-specific cleanup. Called at most once, within the lock. Should not throw.
     */
    protected void doTeardown() {
        // nothing to release by default
    }

    public final boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    private void ensureOpen() {
        synchronized (lock) {
            if (closed) {
                throw new ProviderException("Provider has been torn down", providerId);
            }
        }
    }

    /**
     * Publishes a {@link ProviderFailureEvent} and converts the exception into a
     * {@link ProviderException}, preserving an existing one without double-wrapping.
     */
    protected final ProviderException handleProviderError(Exception exception, String what,
                                                          Map<String, String> context) {
        if (publisher != null) {
            publisher.publishEvent(new ProviderFailureEvent(providerId, Instant.now(), what, exception, context));
        }
        if (exception instanceof ProviderException pe) {
            return pe;
        }
        return new ProviderException(providerId + " " + what + ": " + exception.getMessage(), providerId, exception);
    }
}
