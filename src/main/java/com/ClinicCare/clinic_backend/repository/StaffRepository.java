package com.ClinicCare.clinic_backend.repository;

import com.ClinicCare.clinic_backend.model.Staff;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface StaffRepository extends JpaRepository<Staff, UUID> {

    @Query(value = """
        SELECT s FROM Staff s
        JOIN FETCH s.user
        WHERE s.tenantId = :tenantId
        AND s.deletedAt IS NULL
    """, countQuery = """
        SELECT COUNT(s) FROM Staff s
        WHERE s.tenantId = :tenantId
        AND s.deletedAt IS NULL
    """)
    Page<Staff> findActiveByTenant(@Param("tenantId") UUID tenantId, Pageable pageable);

    Optional<Staff> findByIdAndTenantIdAndDeletedAtIsNull(UUID id, UUID tenantId);

    boolean existsByTenantIdAndEmployeeCode(UUID tenantId, String employeeCode);

    boolean existsByTenantIdAndEmployeeCodeAndIdNot(UUID tenantId, String employeeCode, UUID id);
}
