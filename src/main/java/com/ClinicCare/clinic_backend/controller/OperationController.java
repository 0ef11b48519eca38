package com.ClinicCare.clinic_backend.controller;

import com.ClinicCare.clinic_backend.dto.request.OperationRequest;
import com.ClinicCare.clinic_backend.dto.request.OperationUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.dto.response.OperationResponse;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import com.ClinicCare.clinic_backend.service.OperationService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/operations")
@RequiredArgsConstructor
public class OperationController {

    private final OperationService operationService;

    @PostMapping
    public ResponseEntity<ApiResponse<OperationResponse>> createOperation(
            @Valid @RequestBody OperationRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<OperationResponse> result = operationService.create(request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<OperationResponse>>> getAllOperations(
            @RequestParam(required = false) UUID patientId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PaginatedResponse<OperationResponse>> result = operationService.findAll(caller, patientId, page, limit);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<OperationResponse>> getOperationById(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<OperationResponse> result = operationService.findOne(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<OperationResponse>> updateOperation(
            @PathVariable UUID id,
            @Valid @RequestBody OperationUpdateRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<OperationResponse> result = operationService.update(id, request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<OperationResponse>> deleteOperation(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<OperationResponse> result = operationService.remove(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }
}
