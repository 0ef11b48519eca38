package com.ClinicCare.clinic_backend.repository;

import com.ClinicCare.clinic_backend.model.UserTenant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface UserTenantRepository extends JpaRepository<UserTenant, UUID> {

    @Query("SELECT ut FROM UserTenant ut WHERE ut.user.id = :userId AND ut.tenant.id = :tenantId")
    Optional<UserTenant> findByUserIdAndTenantId(@Param("userId") UUID userId,
                                                 @Param("tenantId") UUID tenantId);

    // Memberships usable for login: neither the membership nor its clinic is soft-deleted
    @Query("""
        SELECT ut FROM UserTenant ut
        JOIN FETCH ut.tenant t
        WHERE ut.user.id = :userId
        AND ut.deletedAt IS NULL
        AND t.deletedAt IS NULL
        ORDER BY t.name ASC
    """)
    List<UserTenant> findActiveMemberships(@Param("userId") UUID userId);
}
