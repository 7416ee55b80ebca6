package com.phillippitts.swarmcouncil.service.council;

import com.phillippitts.swarmcouncil.service.provider.ProviderRecord;
import com.phillippitts.swarmcouncil.service.workflow.RoleDirectory;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Immutable snapshot of a council's providers and role assignment.
 *
 * <p>Role assignment is last-writer-wins: a later member declaring an already assigned role
 * takes it over, while the earlier member stays registered for fallbacks.
 */
public final class CouncilMembers implements RoleDirectory {

    private static final Logger LOG = LogManager.getLogger(CouncilMembers.class);

    static final CouncilMembers EMPTY = new CouncilMembers(List.of(), Map.of());

    private final List<ProviderRecord> records;
    private final Map<String, String> roleAssignments;
    private final Map<String, ProviderRecord> byId;

    private CouncilMembers(List<ProviderRecord> records, Map<String, String> roleAssignments) {
        this.records = List.copyOf(records);
        this.roleAssignments = Collections.unmodifiableMap(new LinkedHashMap<>(roleAssignments));
        Map<String, ProviderRecord> index = new LinkedHashMap<>();
        for (ProviderRecord r : this.records) {
            index.put(r.identifier(), r);
        }
        this.byId = Collections.unmodifiableMap(index);
    }

    static Builder builder() {
        return new Builder();
    }

    @Override
    public Optional<ProviderRecord> forRole(String role) {
        String id = roleAssignments.get(role);
        return id == null ? Optional.empty() : Optional.ofNullable(byId.get(id));
    }

    @Override
    public List<ProviderRecord> inRegistrationOrder() {
        return records;
    }

    public Optional<ProviderRecord> find(String providerId) {
        return Optional.ofNullable(byId.get(providerId));
    }

    /** Role to provider id, in first-assignment order. */
    public Map<String, String> roleAssignments() {
        return roleAssignments;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }

    static final class Builder {
        private final Map<String, ProviderRecord> records = new LinkedHashMap<>();
        private final Map<String, String> roles = new LinkedHashMap<>();

        Builder add(ProviderRecord record) {
            records.put(record.identifier(), record);
            String role = record.role();
            if (role != null && !role.isBlank()) {
                String previous = roles.put(role, record.identifier());
                if (previous != null && !previous.equals(record.identifier())) {
                    LOG.warn("Role '{}' reassigned from {} to {}", role, previous, record.identifier());
                }
            }
            return this;
        }

        CouncilMembers build() {
            return records.isEmpty() ? EMPTY : new CouncilMembers(new ArrayList<>(records.values()), roles);
        }
    }
}
