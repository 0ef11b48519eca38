package com.ClinicCare.clinic_backend.controller;

import com.ClinicCare.clinic_backend.dto.request.PaymentUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.dto.response.BillingResponse;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import com.ClinicCare.clinic_backend.service.BillingService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/billings")
@RequiredArgsConstructor
public class BillingController {

    private final BillingService billingService;

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<BillingResponse>>> getAllBillings(
            @RequestParam(required = false) UUID patientId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PaginatedResponse<BillingResponse>> result = billingService.findAll(caller, patientId, page, limit);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<BillingResponse>> getBillingById(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<BillingResponse> result = billingService.findOne(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @PatchMapping("/{id}/payment")
    public ResponseEntity<ApiResponse<BillingResponse>> updatePayment(
            @PathVariable UUID id,
            @Valid @RequestBody PaymentUpdateRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<BillingResponse> result = billingService.updatePayment(id, request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }
}
