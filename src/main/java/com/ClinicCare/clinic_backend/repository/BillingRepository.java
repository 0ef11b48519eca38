package com.ClinicCare.clinic_backend.repository;

import com.ClinicCare.clinic_backend.enums.BillingType;
import com.ClinicCare.clinic_backend.model.Billing;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface BillingRepository extends JpaRepository<Billing, UUID> {

    Optional<Billing> findFirstByPatientIdAndTypeAndDeletedAtIsNullOrderByCreatedAtDesc(UUID patientId, BillingType type);

    @Query(value = """
        SELECT b FROM Billing b
        JOIN FETCH b.patient p
        WHERE p.tenantId = :tenantId
        AND p.deletedAt IS NULL
        AND b.deletedAt IS NULL
        AND (:patientId IS NULL OR p.id = :patientId)
    """, countQuery = """
        SELECT COUNT(b) FROM Billing b
        JOIN b.patient p
        WHERE p.tenantId = :tenantId
        AND p.deletedAt IS NULL
        AND b.deletedAt IS NULL
        AND (:patientId IS NULL OR p.id = :patientId)
    """)
    Page<Billing> findActiveByTenant(@Param("tenantId") UUID tenantId,
                                     @Param("patientId") UUID patientId,
                                     Pageable pageable);
}
