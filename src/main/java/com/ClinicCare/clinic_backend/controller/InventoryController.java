package com.ClinicCare.clinic_backend.controller;

import com.ClinicCare.clinic_backend.dto.request.InventoryItemRequest;
import com.ClinicCare.clinic_backend.dto.request.StockAdjustmentRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.dto.response.InventoryItemResponse;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import com.ClinicCare.clinic_backend.service.InventoryService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/inventory")
@RequiredArgsConstructor
public class InventoryController {

    private final InventoryService inventoryService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<InventoryItemResponse>>> getInventory(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PaginatedResponse<InventoryItemResponse>> result = inventoryService.findAll(caller, page, limit);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @PostMapping
    public ResponseEntity<ApiResponse<InventoryItemResponse>> createItem(
            @Valid @RequestBody InventoryItemRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<InventoryItemResponse> result = inventoryService.create(request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @PatchMapping("/{id}/quantity")
    public ResponseEntity<ApiResponse<InventoryItemResponse>> adjustQuantity(
            @PathVariable UUID id,
            @Valid @RequestBody StockAdjustmentRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<InventoryItemResponse> result = inventoryService.adjustQuantity(id, request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }
}
