package com.ClinicCare.clinic_backend.repository;

import com.ClinicCare.clinic_backend.model.Doctor;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface DoctorRepository extends JpaRepository<Doctor, UUID> {

    @Query(value = """
        SELECT d FROM Doctor d
        JOIN FETCH d.user
        WHERE d.tenantId = :tenantId
        AND d.deletedAt IS NULL
    """, countQuery = """
        SELECT COUNT(d) FROM Doctor d
        WHERE d.tenantId = :tenantId
        AND d.deletedAt IS NULL
    """)
    Page<Doctor> findActiveByTenant(@Param("tenantId") UUID tenantId, Pageable pageable);

    Optional<Doctor> findByIdAndTenantIdAndDeletedAtIsNull(UUID id, UUID tenantId);

    boolean existsByTenantIdAndEmployeeCode(UUID tenantId, String employeeCode);

    boolean existsByTenantIdAndEmployeeCodeAndIdNot(UUID tenantId, String employeeCode, UUID id);
}
