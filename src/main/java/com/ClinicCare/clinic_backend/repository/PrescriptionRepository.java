package com.ClinicCare.clinic_backend.repository;

import com.ClinicCare.clinic_backend.model.Prescription;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface PrescriptionRepository extends JpaRepository<Prescription, UUID> {

    @Query(value = """
        SELECT rx FROM Prescription rx
        JOIN FETCH rx.visit v
        JOIN FETCH v.patient p
        WHERE p.tenantId = :tenantId
        AND p.deletedAt IS NULL
        AND v.deletedAt IS NULL
        AND rx.deletedAt IS NULL
        AND (:patientId IS NULL OR p.id = :patientId)
        AND (:visitId IS NULL OR v.id = :visitId)
    """, countQuery = """
        SELECT COUNT(rx) FROM Prescription rx
        JOIN rx.visit v
        JOIN v.patient p
        WHERE p.tenantId = :tenantId
        AND p.deletedAt IS NULL
        AND v.deletedAt IS NULL
        AND rx.deletedAt IS NULL
        AND (:patientId IS NULL OR p.id = :patientId)
        AND (:visitId IS NULL OR v.id = :visitId)
    """)
    Page<Prescription> findActiveByTenant(@Param("tenantId") UUID tenantId,
                                          @Param("patientId") UUID patientId,
                                          @Param("visitId") UUID visitId,
                                          Pageable pageable);
}
