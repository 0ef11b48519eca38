package com.ClinicCare.clinic_backend.repository;

import com.ClinicCare.clinic_backend.model.Operation;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.UUID;

@Repository
public interface OperationRepository extends JpaRepository<Operation, UUID> {

    @Query(value = """
        SELECT o FROM Operation o
        JOIN FETCH o.patient p
        JOIN FETCH o.surgeon s
        WHERE p.tenantId = :tenantId
        AND p.deletedAt IS NULL
        AND o.deletedAt IS NULL
        AND (:patientId IS NULL OR p.id = :patientId)
    """, countQuery = """
        SELECT COUNT(o) FROM Operation o
        JOIN o.patient p
        JOIN o.surgeon s
        WHERE p.tenantId = :tenantId
        AND p.deletedAt IS NULL
        AND o.deletedAt IS NULL
        AND (:patientId IS NULL OR p.id = :patientId)
    """)
    Page<Operation> findActiveByTenant(@Param("tenantId") UUID tenantId,
                                       @Param("patientId") UUID patientId,
                                       Pageable pageable);
}
