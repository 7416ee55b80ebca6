package com.phillippitts.swarmcouncil.service.council;

import java.util.List;

/**
 * Status view of one council member.
 *
 * @param identifier   provider id
 * @param role         assigned role, or {@code null}
 * @param specialties  specialty labels
 * @param capabilities optional extensions, sorted by name
 * @param shared       true when adopted from the shared pool
 */
public record MemberStatus(
        String identifier,
        String role,
        List<String> specialties,
        List<String> capabilities,
        boolean shared
) {
    public MemberStatus {
        specialties = specialties == null ? List.of() : List.copyOf(specialties);
        capabilities = capabilities == null ? List.of() : List.copyOf(capabilities);
    }
}
