package com.phillippitts.swarmcouncil.service.provider;

import java.util.List;
import java.util.Objects;

/**
 * One entry of the enabled-provider configuration as seen by a council.
 *
 * @param identifier    provider id passed to {@link ProviderRegistry#construct(String)}
 * @param displayName   human-readable name
 * @param role          council role this provider fills, or {@code null} for none
 * @param specialties   ordered specialty labels
 * @param priority      ascending sort key used by the quality council
 * @param enabled       whether the entry is switched on
 * @param hasCredential whether an API credential is configured
 */
public record ProviderDefinition(
        String identifier,
        String displayName,
        String role,
        List<String> specialties,
        int priority,
        boolean enabled,
        boolean hasCredential
) {

    public ProviderDefinition {
        Objects.requireNonNull(identifier, "identifier must not be null");
        specialties = specialties == null ? List.of() : List.copyOf(specialties);
        if (displayName == null || displayName.isBlank()) {
            displayName = identifier;
        }
    }

    /** True when the entry is a candidate for initialization. */
    public boolean isCandidate() {
        return enabled && hasCredential;
    }
}
