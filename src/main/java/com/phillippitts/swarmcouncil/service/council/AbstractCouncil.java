package com.phillippitts.swarmcouncil.service.council;

import com.phillippitts.swarmcouncil.config.properties.CouncilProperties;
import com.phillippitts.swarmcouncil.exception.CouncilConfigurationException;
import com.phillippitts.swarmcouncil.exception.CouncilNotReadyException;
import com.phillippitts.swarmcouncil.exception.InvalidRequestException;
import com.phillippitts.swarmcouncil.exception.ProviderConstructionException;
import com.phillippitts.swarmcouncil.exception.ProviderSetupException;
import com.phillippitts.swarmcouncil.service.health.ProviderHealthTracker;
import com.phillippitts.swarmcouncil.service.provider.BoundedProviderFactory;
import com.phillippitts.swarmcouncil.service.provider.ContentProvider;
import com.phillippitts.swarmcouncil.service.provider.CouncilContext;
import com.phillippitts.swarmcouncil.service.provider.ProviderCapability;
import com.phillippitts.swarmcouncil.service.provider.ProviderCatalog;
import com.phillippitts.swarmcouncil.service.provider.ProviderDefinition;
import com.phillippitts.swarmcouncil.service.provider.ProviderRecord;
import com.phillippitts.swarmcouncil.service.provider.pool.PooledProvider;
import com.phillippitts.swarmcouncil.service.provider.pool.ProviderPool;
import com.phillippitts.swarmcouncil.service.workflow.CancellationToken;
import com.phillippitts.swarmcouncil.util.LogSanitizer;
import com.phillippitts.swarmcouncil.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.ThreadContext;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Function;

/**
 * Provider lifecycle shared by every council variant.
 *
 * <p>State model:
 * <ul>
 *   <li>Members, state and the last initialization attempt are published together as one
 *       immutable snapshot; readers never observe a half-built council</li>
 *   <li>initialize, reinitialize and shutdown hold the write lock of a fair read/write lock</li>
 *   <li>Workflows and consultations hold the read lock for their whole run, so a lifecycle change
 *       waits for in-flight runs and new runs wait for the lifecycle change</li>
 * </ul>
 *
 * <p>Provider failures during initialization are recorded and never abort the loop. Only a
 * council that ends with no members raises {@link CouncilConfigurationException}.
 */
public abstract class AbstractCouncil {

    private static final Logger LOG = LogManager.getLogger(AbstractCouncil.class);

    private final String name;
    private final ProviderCatalog catalog;
    private final BoundedProviderFactory factory;
    private final ProviderHealthTracker healthTracker;
    private final CouncilProperties props;

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock(true);
    private final CouncilContext contextView = new ContextView();

    private volatile CouncilSnapshot snapshot =
            new CouncilSnapshot(CouncilState.UNINITIALIZED, CouncilMembers.EMPTY, InitializationAttempt.none());

    // Pool adopted by the last initializeFromSharedPool; reinitialize re-adopts from it.
    private ProviderPool adoptedPool;

    protected AbstractCouncil(String name,
                              ProviderCatalog catalog,
                              BoundedProviderFactory factory,
                              ProviderHealthTracker healthTracker,
                              CouncilProperties props) {
        this.name = Objects.requireNonNull(name, "name");
        this.catalog = Objects.requireNonNull(catalog, "catalog");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.healthTracker = Objects.requireNonNull(healthTracker, "healthTracker");
        this.props = Objects.requireNonNull(props, "props");
    }

    /**
     * Orders the enabled candidates before construction.
     */
    protected List<ProviderDefinition> orderCandidates(List<ProviderDefinition> candidates) {
        return candidates;
    }

    /** Workflow names this council serves, for status reports. */
    protected abstract List<String> availableWorkflows();

    /**
     * Constructs every enabled provider and brings the council up. Does nothing when the council is
     * already operational.
     *
     * @return the resulting state
     * @throws CouncilConfigurationException if no provider could join
     */
    public CouncilState initialize() {
        lock.writeLock().lock();
        try {
            if (snapshot.state().isOperational()) {
                LOG.debug("[{}] Already initialized", name);
                return snapshot.state();
            }
            adoptedPool = null;
            return initializeLocked(null);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Brings the council up from providers already constructed and probed by a shared pool.
     * The council never tears those providers down. Falls back to {@link #initialize()} when
     * {@code pool} is {@code null}.
     *
     * @return the resulting state
     * @throws CouncilConfigurationException if no provider could be adopted
     */
    public CouncilState initializeFromSharedPool(ProviderPool pool) {
        if (pool == null) {
            LOG.info("[{}] No shared pool supplied; constructing providers directly", name);
            return initialize();
        }
        lock.writeLock().lock();
        try {
            if (snapshot.state().isOperational()) {
                LOG.debug("[{}] Already initialized", name);
                return snapshot.state();
            }
            adoptedPool = pool;
            return initializeLocked(pool);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Stops health monitoring, tears down owned providers, clears all state and initializes again
     * from the same source as before.
     *
     * @return detailed status after the new initialization
     * @throws CouncilConfigurationException if no provider could join
     */
    public DetailedCouncilStatus reinitialize() {
        LOG.info("[{}] Reinitializing", name);
        lock.writeLock().lock();
        try {
            releaseMembers();
            initializeLocked(adoptedPool);
        } finally {
            lock.writeLock().unlock();
        }
        return detailedStatus();
    }

    /**
     * Stops health monitoring, tears down owned providers (best effort) and clears all state.
     */
    public void shutdown() {
        lock.writeLock().lock();
        try {
            releaseMembers();
            adoptedPool = null;
            publish(CouncilState.UNINITIALIZED, CouncilMembers.EMPTY, InitializationAttempt.none());
            LOG.info("[{}] Shut down", name);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Sends a question straight to the provider holding a role, bypassing the pipeline.
     *
     * @return the provider's raw answer
     * @throws InvalidRequestException if role or question is blank, or no member holds the role
     * @throws CouncilNotReadyException if the council is not operational
     */
    public String consult(String role, String question) {
        requireText("role", role, "Invalid role: must be a non-empty string");
        requireText("question", question, "Invalid question: must be a non-empty string");
        return withMembers(members -> {
            ProviderRecord member = members.forRole(role)
                    .orElseThrow(() -> new InvalidRequestException("role", "No member found with role: " + role));
            LOG.info("[{}] Consulting {} ({}) (question='{}')",
                    name, member.identifier(), role, LogSanitizer.preview(question));
            return member.provider().generate(question);
        });
    }

    public CouncilStatus status() {
        CouncilSnapshot current = snapshot;
        CouncilMembers members = current.members();
        List<MemberStatus> views = new ArrayList<>(members.size());
        for (ProviderRecord r : members.inRegistrationOrder()) {
            List<String> caps = r.capabilities().stream().map(Enum::name).sorted().toList();
            views.add(new MemberStatus(r.identifier(), r.role(), r.specialties(), caps, !r.owned()));
        }
        return new CouncilStatus(name, current.state(), current.state().isOperational(), members.size(),
                views, members.roleAssignments(), availableWorkflows());
    }

    public DetailedCouncilStatus detailedStatus() {
        CouncilSnapshot current = snapshot;
        return new DetailedCouncilStatus(status(), current.lastAttempt(), healthTracker.records(),
                healthTracker.overallHealth(), healthTracker.isRunning());
    }

    public String getName() {
        return name;
    }

    public CouncilState getState() {
        return snapshot.state();
    }

    public boolean isOperational() {
        return snapshot.state().isOperational();
    }

    protected CouncilProperties properties() {
        return props;
    }

    /**
     * Runs an action against the current members while holding the read lock.
     *
     * @throws CouncilNotReadyException if the council is not operational
     */
    protected <T> T withMembers(Function<CouncilMembers, T> action) {
        lock.readLock().lock();
        ThreadContext.put("council", name);
        try {
            CouncilSnapshot current = snapshot;
            if (!current.state().isOperational()) {
                throw new CouncilNotReadyException(name, current.state().name(), current.lastAttempt().errorMessages());
            }
            return action.apply(current.members());
        } finally {
            ThreadContext.remove("council");
            lock.readLock().unlock();
        }
    }

    /** Token for a run without a caller deadline: the configured workflow timeout, if any. */
    protected CancellationToken defaultToken() {
        return TimeUtils.isUnbounded(props.getWorkflowTimeout())
                ? CancellationToken.none()
                : CancellationToken.withTimeout(props.getWorkflowTimeout());
    }

    protected static void requireText(String field, String value, String message) {
        if (value == null || value.isBlank()) {
            throw new InvalidRequestException(field, message);
        }
    }

    private CouncilState initializeLocked(ProviderPool pool) {
        Instant attemptedAt = Instant.now();
        publish(CouncilState.INITIALIZING, CouncilMembers.EMPTY, new InitializationAttempt(attemptedAt, List.of(), 0, 0));
        healthTracker.clear();

        List<ProviderDefinition> candidates = orderCandidates(catalog.enabledProviders());
        if (candidates.isEmpty()) {
            String message = "No enabled providers with credentials configured";
            publish(CouncilState.FAILED_INITIALIZATION, CouncilMembers.EMPTY, new InitializationAttempt(attemptedAt,
                    List.of(new InitializationError("*", message, Instant.now())), 0, 0));
            LOG.error("[{}] {}", name, message);
            throw new CouncilConfigurationException(message);
        }

        LOG.info("[{}] Initializing {} providers{}", name, candidates.size(), pool == null ? "" : " from shared pool");
        CouncilMembers.Builder builder = CouncilMembers.builder();
        List<InitializationError> errors = new ArrayList<>();
        for (ProviderDefinition def : candidates) {
            String id = def.identifier();
            if (pool == null) {
                try {
                    ContentProvider provider = factory.construct(id);
                    register(builder, def, provider, true);
                } catch (ProviderConstructionException e) {
                    LOG.warn("[{}] Failed to initialize {}: {}", name, id, e.getMessage());
                    errors.add(new InitializationError(id, e.getMessage(), Instant.now()));
                }
            } else {
                Optional<PooledProvider> pooled = pool.find(id).filter(PooledProvider::healthy);
                if (pooled.isPresent()) {
                    register(builder, def, pooled.get().provider(), false);
                } else {
                    LOG.warn("[{}] {} is not available in the shared pool", name, id);
                    errors.add(new InitializationError(id, "Not available in shared pool", Instant.now()));
                }
            }
        }

        CouncilMembers members = builder.build();
        InitializationAttempt attempt = new InitializationAttempt(attemptedAt, errors, members.size(), candidates.size());
        if (members.isEmpty()) {
            publish(CouncilState.FAILED_INITIALIZATION, CouncilMembers.EMPTY, attempt);
            healthTracker.clear();
            LOG.error("[{}] Initialization failed: no providers available", name);
            throw new CouncilConfigurationException("Failed to initialize any providers", attempt.errorMessages());
        }

        CouncilState state = errors.isEmpty() ? CouncilState.FULLY_INITIALIZED : CouncilState.PARTIALLY_INITIALIZED;
        publish(state, members, attempt);
        if (props.isHealthMonitoringEnabled()) {
            healthTracker.start(() -> snapshot.members().inRegistrationOrder());
        }
        LOG.info("[{}] Initialized {}/{} providers (state={}, roles={})",
                name, members.size(), candidates.size(), state, members.roleAssignments());
        return state;
    }

    private void register(CouncilMembers.Builder builder, ProviderDefinition def, ContentProvider provider,
                          boolean owned) {
        String id = def.identifier();
        ProviderRecord record = new ProviderRecord(id, provider, def.role(), def.specialties(),
                provider.capabilities(), owned);
        if (owned) {
            setUp(record);
        }
        builder.add(record);
        healthTracker.seed(id);
        LOG.info("[{}] {} joined as {}", name, def.displayName(), def.role() == null ? "member" : def.role());
    }

    private void setUp(ProviderRecord record) {
        ContentProvider provider = record.provider();
        if (record.role() != null && record.supports(ProviderCapability.ROLE)) {
            runSetupStep(record, "role", () -> provider.assignRole(record.role()));
        }
        if (!record.specialties().isEmpty() && record.supports(ProviderCapability.SPECIALTIES)) {
            runSetupStep(record, "specialties", () -> provider.assignSpecialties(record.specialties()));
        }
        if (record.supports(ProviderCapability.COUNCIL_CONTEXT)) {
            runSetupStep(record, "context", () -> provider.attachCouncilContext(contextView));
        }
    }

    private void runSetupStep(ProviderRecord record, String step, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            ProviderSetupException failure = new ProviderSetupException(record.identifier(), step, e);
            LOG.warn("[{}] {}; provider stays active", name, failure.getMessage());
        }
    }

    private void releaseMembers() {
        healthTracker.clear();
        for (ProviderRecord r : snapshot.members().inRegistrationOrder()) {
            if (!r.owned() || !r.supports(ProviderCapability.TEARDOWN)) {
                continue;
            }
            try {
                r.provider().teardown();
            } catch (RuntimeException e) {
                LOG.warn("[{}] Teardown failed for {}: {}", name, r.identifier(), e.getMessage());
            }
        }
    }

    private void publish(CouncilState state, CouncilMembers members, InitializationAttempt attempt) {
        snapshot = new CouncilSnapshot(state, members, attempt);
    }

    private record CouncilSnapshot(CouncilState state, CouncilMembers members, InitializationAttempt lastAttempt) {}

    private final class ContextView implements CouncilContext {
        @Override
        public String councilName() {
            return name;
        }

        @Override
        public Map<String, String> roleAssignments() {
            return snapshot.members().roleAssignments();
        }
    }
}
