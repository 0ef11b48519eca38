package com.ClinicCare.clinic_backend.repository;

import com.ClinicCare.clinic_backend.model.Visit;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface VisitRepository extends JpaRepository<Visit, UUID> {

    @Query(value = """
        SELECT v FROM Visit v
        JOIN FETCH v.patient p
        WHERE p.tenantId = :tenantId
        AND p.deletedAt IS NULL
        AND v.deletedAt IS NULL
        AND (:patientId IS NULL OR p.id = :patientId)
    """, countQuery = """
        SELECT COUNT(v) FROM Visit v
        JOIN v.patient p
        WHERE p.tenantId = :tenantId
        AND p.deletedAt IS NULL
        AND v.deletedAt IS NULL
        AND (:patientId IS NULL OR p.id = :patientId)
    """)
    Page<Visit> findActiveByTenant(@Param("tenantId") UUID tenantId,
                                   @Param("patientId") UUID patientId,
                                   Pageable pageable);

    Optional<Visit> findFirstByPatientIdAndDeletedAtIsNullOrderByVisitDateDesc(UUID patientId);
}
