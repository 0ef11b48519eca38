package com.ClinicCare.clinic_backend.controller;

import com.ClinicCare.clinic_backend.dto.request.DoctorRequest;
import com.ClinicCare.clinic_backend.dto.request.DoctorUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.dto.response.DoctorResponse;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import com.ClinicCare.clinic_backend.service.DoctorService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/doctors")
@RequiredArgsConstructor
public class DoctorController {

    private final DoctorService doctorService;

    @PostMapping
    public ResponseEntity<ApiResponse<DoctorResponse>> createDoctor(
            @Valid @RequestBody DoctorRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<DoctorResponse> result = doctorService.create(request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<DoctorResponse>>> getAllDoctors(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PaginatedResponse<DoctorResponse>> result = doctorService.findAll(caller, page, limit);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<DoctorResponse>> getDoctorById(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<DoctorResponse> result = doctorService.findOne(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<DoctorResponse>> updateDoctor(
            @PathVariable UUID id,
            @Valid @RequestBody DoctorUpdateRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<DoctorResponse> result = doctorService.update(id, request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<DoctorResponse>> deleteDoctor(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<DoctorResponse> result = doctorService.remove(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @PatchMapping("/{id}/restore")
    public ResponseEntity<ApiResponse<DoctorResponse>> restoreDoctor(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<DoctorResponse> result = doctorService.restore(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }
}
