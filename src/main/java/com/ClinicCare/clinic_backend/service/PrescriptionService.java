package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.dto.request.PrescriptionRequest;
import com.ClinicCare.clinic_backend.dto.request.PrescriptionUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.dto.response.PrescriptionResponse;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ResourceNotFoundException;
import com.ClinicCare.clinic_backend.exception.ValidationException;
import com.ClinicCare.clinic_backend.model.Medication;
import com.ClinicCare.clinic_backend.model.Patient;
import com.ClinicCare.clinic_backend.model.Prescription;
import com.ClinicCare.clinic_backend.model.Visit;
import com.ClinicCare.clinic_backend.repository.PrescriptionRepository;
import com.ClinicCare.clinic_backend.repository.VisitRepository;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PrescriptionService {

    private final PrescriptionRepository prescriptionRepository;
    private final VisitRepository visitRepository;
    private final TenantMembershipService membershipService;
    private final Clock clock;

    public ApiResponse<PrescriptionResponse> create(PrescriptionRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to create prescription", () -> {
            membershipService.requireRole(caller, Role.ADMIN_OR_DOCTOR, "write prescriptions");
            if (request.getVisitId() == null) {
                throw new ValidationException("Visit is required");
            }
            List<Medication> medications = toMedications(request.getMedications());
            Visit visit = visitRepository.findById(request.getVisitId())
                    .filter(v -> !v.isDeleted() && inTenant(v, caller))
                    .orElseThrow(() -> new ResourceNotFoundException("Visit not found"));

            Prescription saved = prescriptionRepository.save(Prescription.builder()
                    .visit(visit)
                    .medications(medications)
                    .build());
            log.info("Prescription {} with {} medications written for visit {}", saved.getId(), medications.size(), visit.getId());
            return ApiResponse.created(mapToPrescriptionResponse(saved), "Prescription created successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<PaginatedResponse<PrescriptionResponse>> findAll(AuthenticatedUser caller, UUID patientId,
                                                                        UUID visitId, int page, int limit) {
        return ServiceResults.run(log, "Failed to fetch prescriptions", () -> {
            membershipService.requireRole(caller, Role.ALL, "view prescriptions");
            Pageable pageable = Paging.of(page, limit, Sort.by("createdAt").descending());
            Page<Prescription> results = prescriptionRepository
                    .findActiveByTenant(caller.getTenantId(), patientId, visitId, pageable);
            List<PrescriptionResponse> prescriptions = results.getContent()
                    .stream()
                    .map(this::mapToPrescriptionResponse)
                    .collect(Collectors.toList());
            return ApiResponse.success(PaginatedResponse.of(prescriptions, results), "Prescriptions fetched successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<PrescriptionResponse> findOne(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to fetch prescription", () -> {
            membershipService.requireRole(caller, Role.ALL, "view prescriptions");
            Prescription prescription = prescriptionRepository.findById(id)
                    .filter(rx -> !rx.isDeleted() && !rx.getVisit().isDeleted() && inTenant(rx.getVisit(), caller))
                    .orElseThrow(() -> new ResourceNotFoundException("Prescription not found"));
            return ApiResponse.success(mapToPrescriptionResponse(prescription), "Prescription fetched successfully");
        });
    }

    public ApiResponse<PrescriptionResponse> update(UUID id, PrescriptionUpdateRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to update prescription", () -> {
            membershipService.requireRole(caller, Role.ADMIN_OR_DOCTOR, "update prescriptions");
            Prescription prescription = loadForMutation(id, caller);

            if (request.getMedications() != null) {
                prescription.setMedications(toMedications(request.getMedications()));
            }

            Prescription updated = prescriptionRepository.save(prescription);
            log.info("Prescription {} updated by {}", id, caller.getId());
            return ApiResponse.success(mapToPrescriptionResponse(updated), "Prescription updated successfully");
        });
    }

    public ApiResponse<PrescriptionResponse> remove(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to delete prescription", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "delete prescriptions");
            Prescription prescription = loadForMutation(id, caller);

            prescription.setDeletedAt(LocalDateTime.now(clock));
            Prescription deleted = prescriptionRepository.save(prescription);
            log.info("Prescription {} soft-deleted by {}", id, caller.getId());
            return ApiResponse.success(mapToPrescriptionResponse(deleted), "Prescription deleted successfully");
        });
    }

    private Prescription loadForMutation(UUID id, AuthenticatedUser caller) {
        Prescription prescription = prescriptionRepository.findById(id)
                .filter(rx -> !rx.getVisit().isDeleted() && inTenant(rx.getVisit(), caller))
                .orElseThrow(() -> new ResourceNotFoundException("Prescription not found"));
        if (prescription.isDeleted()) {
            throw new ResourceNotFoundException("Prescription already deleted");
        }
        return prescription;
    }

    private boolean inTenant(Visit visit, AuthenticatedUser caller) {
        Patient patient = visit.getPatient();
        return !patient.isDeleted() && caller.getTenantId().equals(patient.getTenantId());
    }

    private List<Medication> toMedications(List<PrescriptionRequest.MedicationRequest> requests) {
        if (requests == null || requests.isEmpty()) {
            throw new ValidationException("At least one medication is required");
        }
        List<Medication> medications = new ArrayList<>(requests.size());
        for (PrescriptionRequest.MedicationRequest item : requests) {
            if (item == null || !StringUtils.hasText(item.getDrugName()) || !StringUtils.hasText(item.getDosage())) {
                throw new ValidationException("Each medication needs a drug name and a dosage");
            }
            medications.add(Medication.builder()
                    .drugName(item.getDrugName().trim())
                    .dosage(item.getDosage().trim())
                    .duration(item.getDuration())
                    .instructions(item.getInstructions())
                    .build());
        }
        return medications;
    }

    private PrescriptionResponse mapToPrescriptionResponse(Prescription prescription) {
        Visit visit = prescription.getVisit();
        Patient patient = visit.getPatient();
        return PrescriptionResponse.builder()
                .id(prescription.getId())
                .visitId(visit.getId())
                .patientId(patient.getId())
                .patientName(patient.getFullName())
                .medications(prescription.getMedications().stream()
                        .map(m -> PrescriptionResponse.MedicationResponse.builder()
                                .drugName(m.getDrugName())
                                .dosage(m.getDosage())
                                .duration(m.getDuration())
                                .instructions(m.getInstructions())
                                .build())
                        .collect(Collectors.toList()))
                .createdAt(prescription.getCreatedAt())
                .updatedAt(prescription.getUpdatedAt())
                .build();
    }
}
