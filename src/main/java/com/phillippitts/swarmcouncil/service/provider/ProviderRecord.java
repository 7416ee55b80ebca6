package com.phillippitts.swarmcouncil.service.provider;

import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * A provider registered with a council.
 *
 * @param identifier   provider id
 * @param provider     provider handle
 * @param role         assigned council role, or {@code null}
 * @param specialties  ordered specialty labels
 * @param capabilities optional extensions, snapshotted at registration
 * @param owned        true when the council constructed the provider and must tear it down;
 *                     false for providers adopted from a shared pool
 */
public record ProviderRecord(
        String identifier,
        ContentProvider provider,
        String role,
        List<String> specialties,
        Set<ProviderCapability> capabilities,
        boolean owned
) {

    public ProviderRecord {
        Objects.requireNonNull(identifier, "identifier");
        Objects.requireNonNull(provider, "provider");
        specialties = specialties == null ? List.of() : List.copyOf(specialties);
        capabilities = capabilities == null ? Set.of() : Set.copyOf(capabilities);
    }

    public boolean supports(ProviderCapability capability) {
        return capabilities.contains(capability);
    }
}
