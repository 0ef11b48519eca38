package com.ClinicCare.clinic_backend.controller;

import com.ClinicCare.clinic_backend.dto.request.StaffRequest;
import com.ClinicCare.clinic_backend.dto.request.StaffUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.dto.response.StaffResponse;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import com.ClinicCare.clinic_backend.service.StaffService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.security.core.annotation.AuthenticationPrincipal;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

@RestController
@RequestMapping("/api/staffs")
@RequiredArgsConstructor
public class StaffController {

    private final StaffService staffService;

    @PostMapping
    public ResponseEntity<ApiResponse<StaffResponse>> createStaff(
            @Valid @RequestBody StaffRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<StaffResponse> result = staffService.create(request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @GetMapping
    public ResponseEntity<ApiResponse<PaginatedResponse<StaffResponse>>> getAllStaff(
            @RequestParam(defaultValue = "1") int page,
            @RequestParam(defaultValue = "20") int limit,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<PaginatedResponse<StaffResponse>> result = staffService.findAll(caller, page, limit);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @GetMapping("/{id}")
    public ResponseEntity<ApiResponse<StaffResponse>> getStaffById(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<StaffResponse> result = staffService.findOne(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @PutMapping("/{id}")
    public ResponseEntity<ApiResponse<StaffResponse>> updateStaff(
            @PathVariable UUID id,
            @Valid @RequestBody StaffUpdateRequest request,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<StaffResponse> result = staffService.update(id, request, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @DeleteMapping("/{id}")
    public ResponseEntity<ApiResponse<StaffResponse>> deleteStaff(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<StaffResponse> result = staffService.remove(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @PatchMapping("/{id}/restore")
    public ResponseEntity<ApiResponse<StaffResponse>> restoreStaff(
            @PathVariable UUID id,
            @AuthenticationPrincipal AuthenticatedUser caller) {
        ApiResponse<StaffResponse> result = staffService.restore(id, caller);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }
}
