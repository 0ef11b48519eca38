package com.ClinicCare.clinic_backend.security;

import com.ClinicCare.clinic_backend.enums.Role;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

import java.util.UUID;

/**
 * Caller identity decoded from a tenant-scoped token. {@link #role} is what the token was issued with;
 * services never trust it and re-read the membership instead.
 */
@Getter
@Builder
@AllArgsConstructor
public class AuthenticatedUser {
    private final UUID id;
    private final String email;
    private final Role role;
    private final UUID tenantId;

    @Override
    public String toString() {
        return "AuthenticatedUser{id=" + id + ", tenantId=" + tenantId + ", role=" + role + '}';
    }
}
