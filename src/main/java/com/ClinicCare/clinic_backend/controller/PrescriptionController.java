package com.ClinicCare.clinic_backend.controller;

import com.ClinicCare.clinic_backend.dto.request.PrescriptionRequest;
import com.ClinicCare.clinic_backend.dto.request.PrescriptionUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.dto.response.PrescriptionResponse;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import com.ClinicCare.clinic_backend.service.PrescriptionService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/prescriptions")
@RequiredArgsConstructor
public class PrescriptionController {

    private final PrescriptionService prescriptionService;

    @PostMapping
    public ResponseEntity<ApiResponse<PrescriptionResponse>> createPrescription(
            @Valid @RequestBody PrescriptionRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PrescriptionResponse> result = prescriptionService.create(request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<PrescriptionResponse>>> getAllPrescriptions(
            @RequestParam(required = false) UUID patientId,
            @RequestParam(required = false) UUID visitId,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PaginatedResponse<PrescriptionResponse>> result = prescriptionService.findAll(caller, patientId, visitId, page, limit);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<PrescriptionResponse>> getPrescriptionById(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PrescriptionResponse> result = prescriptionService.findOne(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<PrescriptionResponse>> updatePrescription(
            @PathVariable UUID id,
            @Valid @RequestBody PrescriptionUpdateRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PrescriptionResponse> result = prescriptionService.update(id, request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<PrescriptionResponse>> deletePrescription(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PrescriptionResponse> result = prescriptionService.remove(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }
}
