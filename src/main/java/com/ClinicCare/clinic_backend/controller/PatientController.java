package com.ClinicCare.clinic_backend.controller;

import com.ClinicCare.clinic_backend.dto.request.PatientRequest;
import com.ClinicCare.clinic_backend.dto.request.PatientUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.dto.response.PatientResponse;
import com.ClinicCare.clinic_backend.enums.PatientStatus;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import com.ClinicCare.clinic_backend.service.PatientService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/patients")
@RequiredArgsConstructor
public class PatientController {

    private final PatientService patientService;

    @PostMapping
    public ResponseEntity<ApiResponse<PatientResponse>> createPatient(
            @Valid @RequestBody PatientRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PatientResponse> result = patientService.create(request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<PatientResponse>>> getAllPatients(
            @RequestParam(required = false) PatientStatus status,
            @RequestParam(required = false) String search,
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PaginatedResponse<PatientResponse>> result = patientService.findAll(caller, status, search, page, limit);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<PatientResponse>> getPatientById(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PatientResponse> result = patientService.findOne(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<PatientResponse>> updatePatient(
            @PathVariable UUID id,
            @Valid @RequestBody PatientUpdateRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PatientResponse> result = patientService.update(id, request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<PatientResponse>> deletePatient(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PatientResponse> result = patientService.remove(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }
}
