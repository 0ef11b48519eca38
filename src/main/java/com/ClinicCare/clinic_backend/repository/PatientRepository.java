package com.ClinicCare.clinic_backend.repository;

import com.ClinicCare.clinic_backend.enums.PatientStatus;
import com.ClinicCare.clinic_backend.model.Patient;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface PatientRepository extends JpaRepository<Patient, UUID> {

    @Query("""
        SELECT p FROM Patient p
        WHERE p.tenantId = :tenantId
        AND p.deletedAt IS NULL
        AND (:status IS NULL OR p.status = :status)
        AND (COALESCE(:search, '') = ''
             OR LOWER(p.fullName) LIKE LOWER(CONCAT('%', :search, '%'))
             OR LOWER(p.patientNumber) LIKE LOWER(CONCAT('%', :search, '%')))
    """)
    Page<Patient> searchActiveByTenant(@Param("tenantId") UUID tenantId,
                                       @Param("status") PatientStatus status,
                                       @Param("search") String search,
                                       Pageable pageable);

    Optional<Patient> findByIdAndTenantIdAndDeletedAtIsNull(UUID id, UUID tenantId);

    // Counts soft-deleted rows too so that numbers are never reused
    long countByTenantId(UUID tenantId);

    boolean existsByTenantIdAndPatientNumber(UUID tenantId, String patientNumber);

    // Increments in the database so concurrent visits are all counted
    @Modifying(flushAutomatically = true)
    @Query("UPDATE Patient p SET p.noOfVisits = p.noOfVisits + 1 WHERE p.id = :id")
    int incrementVisitCount(@Param("id") UUID id);
}
