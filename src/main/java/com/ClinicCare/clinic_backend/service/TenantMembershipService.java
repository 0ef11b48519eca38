package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ForbiddenException;
import com.ClinicCare.clinic_backend.model.UserTenant;
import com.ClinicCare.clinic_backend.repository.UserTenantRepository;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;
import java.util.Set;
import java.util.UUID;

/**
 * Answers what a user may do inside one tenant. The live {@link UserTenant} row is the only input; the role
 * carried by a token is ignored.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class TenantMembershipService {

    private final UserTenantRepository userTenantRepository;

    /**
     * Role the user currently holds in the tenant, empty when there is no membership or it was soft-deleted.
     */
    @Transactional(readOnly = true)
    public Optional<Role> findRole(UUID userId, UUID tenantId) {
        if (userId == null || tenantId == null) {
            return Optional.empty();
        }
        return userTenantRepository.findByUserIdAndTenantId(userId, tenantId)
                .filter(membership -> !membership.isDeleted() && !membership.getTenant().isDeleted())
                .map(UserTenant::getRole);
    }

    @Transactional(readOnly = true)
    public boolean authorize(UUID userId, UUID tenantId, Set<Role> allowedRoles) {
        if (allowedRoles == null || allowedRoles.isEmpty()) {
            return false;
        }
        return findRole(userId, tenantId).map(allowedRoles::contains).orElse(false);
    }

    /**
     * Guard step used at the top of every entity operation.
     *
     * @return the caller's live role in the token's tenant
     * @throws ForbiddenException when the caller has no usable membership or the role is not allowed
     */
    public Role requireRole(AuthenticatedUser caller, Set<Role> allowedRoles, String action) {
        if (caller == null) {
            throw new ForbiddenException("You are not allowed to " + action);
        }
        Optional<Role> role = findRole(caller.getId(), caller.getTenantId());
        if (role.isEmpty() || !allowedRoles.contains(role.get())) {
            log.warn("User {} denied '{}' in tenant {} (role {})",
                    caller.getId(), action, caller.getTenantId(), role.orElse(null));
            throw new ForbiddenException("You are not allowed to " + action);
        }
        return role.get();
    }
}
