package com.ClinicCare.clinic_backend.repository;

import com.ClinicCare.clinic_backend.model.InventoryItem;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.Optional;
import java.util.UUID;

@Repository
public interface InventoryItemRepository extends JpaRepository<InventoryItem, UUID> {
    Page<InventoryItem> findAllByTenantIdAndDeletedAtIsNull(UUID tenantId, Pageable pageable);

    Optional<InventoryItem> findByIdAndTenantIdAndDeletedAtIsNull(UUID id, UUID tenantId);

    boolean existsByTenantIdAndItemNameIgnoreCaseAndDeletedAtIsNull(UUID tenantId, String itemName);
}
