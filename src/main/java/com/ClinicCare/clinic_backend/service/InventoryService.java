package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.dto.request.InventoryItemRequest;
import com.ClinicCare.clinic_backend.dto.request.StockAdjustmentRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.InventoryItemResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ConflictException;
import com.ClinicCare.clinic_backend.exception.ResourceNotFoundException;
import com.ClinicCare.clinic_backend.exception.ValidationException;
import com.ClinicCare.clinic_backend.model.InventoryItem;
import com.ClinicCare.clinic_backend.repository.InventoryItemRepository;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class InventoryService {

    private final InventoryItemRepository inventoryItemRepository;
    private final TenantMembershipService membershipService;

    @Transactional(readOnly = true)
    public ApiResponse<PaginatedResponse<InventoryItemResponse>> findAll(AuthenticatedUser caller,
                                                                         int page, int limit) {
        return ServiceResults.run(log, "Failed to fetch inventory", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "view inventory");
            Pageable pageable = Paging.of(page, limit, Sort.by("itemName").ascending());
            Page<InventoryItem> results = inventoryItemRepository
                    .findAllByTenantIdAndDeletedAtIsNull(caller.getTenantId(), pageable);
            List<InventoryItemResponse> items = results.getContent()
                    .stream()
                    .map(this::mapToInventoryItemResponse)
                    .collect(Collectors.toList());
            return ApiResponse.success(PaginatedResponse.of(items, results), "Inventory fetched successfully");
        });
    }

    public ApiResponse<InventoryItemResponse> create(InventoryItemRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to create inventory item", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "manage inventory");
            if (!StringUtils.hasText(request.getItemName())) {
                throw new ValidationException("Item name is required");
            }
            if (request.getQuantity() < 0) {
                throw new ValidationException("Quantity cannot be negative");
            }
            String itemName = request.getItemName().trim();
            if (inventoryItemRepository.existsByTenantIdAndItemNameIgnoreCaseAndDeletedAtIsNull(caller.getTenantId(), itemName)) {
                throw new ConflictException("Item '" + itemName + "' already exists");
            }

            InventoryItem saved = inventoryItemRepository.save(InventoryItem.builder()
                    .tenantId(caller.getTenantId())
                    .itemName(itemName)
                    .quantity(request.getQuantity())
                    .build());
            log.info("Inventory item {} created in tenant {}", saved.getId(), caller.getTenantId());
            return ApiResponse.created(mapToInventoryItemResponse(saved), "Inventory item created successfully");
        });
    }

    /**
     * Adds a signed delta to the stock level. The level never drops below zero.
     */
    public ApiResponse<InventoryItemResponse> adjustQuantity(UUID id, StockAdjustmentRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to adjust stock", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "manage inventory");
            InventoryItem item = inventoryItemRepository.findByIdAndTenantIdAndDeletedAtIsNull(id, caller.getTenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("Inventory item not found"));

            int newQuantity = item.getQuantity() + request.getQuantity();
            if (newQuantity < 0) {
                throw new ValidationException("Insufficient stock for " + item.getItemName()
                        + ". Available: " + item.getQuantity() + ", Requested: " + Math.abs(request.getQuantity()));
            }
            item.setQuantity(newQuantity);

            InventoryItem saved = inventoryItemRepository.save(item);
            log.info("Stock of {} adjusted by {} to {} ({})", item.getId(), request.getQuantity(), newQuantity,
                    request.getReason() != null ? request.getReason() : "no reason given");
            return ApiResponse.success(mapToInventoryItemResponse(saved), "Stock adjusted successfully");
        });
    }

    private InventoryItemResponse mapToInventoryItemResponse(InventoryItem item) {
        return InventoryItemResponse.builder()
                .id(item.getId())
                .tenantId(item.getTenantId())
                .itemName(item.getItemName())
                .quantity(item.getQuantity())
                .createdAt(item.getCreatedAt())
                .updatedAt(item.getUpdatedAt())
                .build();
    }
}
