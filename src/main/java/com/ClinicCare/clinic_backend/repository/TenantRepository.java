package com.ClinicCare.clinic_backend.repository;

import com.ClinicCare.clinic_backend.model.Tenant;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface TenantRepository extends JpaRepository<Tenant, UUID> {
    boolean existsByCode(String code);

    Optional<Tenant> findByIdAndDeletedAtIsNull(UUID id);
}
