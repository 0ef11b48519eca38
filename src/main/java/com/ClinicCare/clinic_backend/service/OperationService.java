package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.dto.request.OperationRequest;
import com.ClinicCare.clinic_backend.dto.request.OperationUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.OperationResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ResourceNotFoundException;
import com.ClinicCare.clinic_backend.exception.ValidationException;
import com.ClinicCare.clinic_backend.model.Doctor;
import com.ClinicCare.clinic_backend.model.Operation;
import com.ClinicCare.clinic_backend.model.Patient;
import com.ClinicCare.clinic_backend.repository.DoctorRepository;
import com.ClinicCare.clinic_backend.repository.OperationRepository;
import com.ClinicCare.clinic_backend.repository.PatientRepository;
import com.ClinicCare.clinic_backend.repository.VisitRepository;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Surgical operations. Every live operation has an OPERATION bill; fee changes and deletions are mirrored
 * on the patient's newest such bill in the same transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class OperationService {

    private final OperationRepository operationRepository;
    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;
    private final VisitRepository visitRepository;
    private final BillingService billingService;
    private final TenantMembershipService membershipService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ApiResponse<OperationResponse> create(OperationRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to create operation", () -> {
            membershipService.requireRole(caller, Role.ADMIN_OR_DOCTOR, "schedule operations");
            BigDecimal fee = requirePositiveFee(request.getFee());
            if (!StringUtils.hasText(request.getName())) {
                throw new ValidationException("Operation name is required");
            }
            if (request.getDate() == null) {
                throw new ValidationException("Operation date is required");
            }
            if (request.getPatientId() == null || request.getSurgeonId() == null) {
                throw new ValidationException("Patient and surgeon are required");
            }
            Patient patient = patientRepository.findByIdAndTenantIdAndDeletedAtIsNull(request.getPatientId(), caller.getTenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("Patient not found"));
            Doctor surgeon = resolveSurgeon(request.getSurgeonId(), caller);
            String name = request.getName().trim();

            Operation saved = transactionTemplate.execute(status -> {
                Operation operation = operationRepository.save(Operation.builder()
                        .patient(patient)
                        .surgeon(surgeon)
                        .name(name)
                        .date(request.getDate())
                        .fee(fee)
                        .outcome(request.getOutcome())
                        .build());

                billingService.recordOperationFee(patient, fee);

                visitRepository.findFirstByPatientIdAndDeletedAtIsNullOrderByVisitDateDesc(patient.getId())
                        .ifPresent(visit -> {
                            String note = "Operation scheduled: " + name;
                            visit.setNotes(StringUtils.hasText(visit.getNotes()) ? visit.getNotes() + "\n" + note : note);
                            visitRepository.save(visit);
                        });
                return operation;
            });

            log.info("Operation {} scheduled for patient {} by {}", saved.getId(), patient.getId(), caller.getId());
            return ApiResponse.created(mapToOperationResponse(saved), "Operation created successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<PaginatedResponse<OperationResponse>> findAll(AuthenticatedUser caller, UUID patientId,
                                                                     int page, int limit) {
        return ServiceResults.run(log, "Failed to fetch operations", () -> {
            membershipService.requireRole(caller, Role.ALL, "view operations");
            Pageable pageable = Paging.of(page, limit, Sort.by("date").descending());
            if (patientId != null) {
                patientRepository.findByIdAndTenantIdAndDeletedAtIsNull(patientId, caller.getTenantId())
                        .orElseThrow(() -> new ResourceNotFoundException("Patient not found"));
            }
            Page<Operation> results = operationRepository.findActiveByTenant(caller.getTenantId(), patientId, pageable);
            List<OperationResponse> operations = results.getContent()
                    .stream()
                    .map(this::mapToOperationResponse)
                    .collect(Collectors.toList());
            return ApiResponse.success(PaginatedResponse.of(operations, results), "Operations fetched successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<OperationResponse> findOne(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to fetch operation", () -> {
            membershipService.requireRole(caller, Role.ALL, "view operations");
            Operation operation = operationRepository.findById(id)
                    .filter(o -> !o.isDeleted() && inTenant(o, caller))
                    .orElseThrow(() -> new ResourceNotFoundException("Operation not found"));
            return ApiResponse.success(mapToOperationResponse(operation), "Operation fetched successfully");
        });
    }

    public ApiResponse<OperationResponse> update(UUID id, OperationUpdateRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to update operation", () -> {
            membershipService.requireRole(caller, Role.ADMIN_OR_DOCTOR, "update operations");
            Operation operation = loadForMutation(id, caller);
            BigDecimal newFee = request.getFee() == null ? null : requirePositiveFee(request.getFee());

            if (request.getName() != null) {
                if (!StringUtils.hasText(request.getName())) {
                    throw new ValidationException("Operation name cannot be blank");
                }
                operation.setName(request.getName().trim());
            }
            if (request.getDate() != null) {
                operation.setDate(request.getDate());
            }
            if (request.getSurgeonId() != null) {
                operation.setSurgeon(resolveSurgeon(request.getSurgeonId(), caller));
            }
            if (request.getOutcome() != null) {
                operation.setOutcome(request.getOutcome());
            }
            boolean feeChanged = newFee != null && newFee.compareTo(operation.getFee()) != 0;
            if (newFee != null) {
                operation.setFee(newFee);
            }

            Operation updated = transactionTemplate.execute(status -> {
                Operation result = operationRepository.save(operation);
                if (feeChanged) {
                    billingService.adjustLatestOperationFee(result.getPatient().getId(), newFee);
                }
                return result;
            });

            log.info("Operation {} updated by {} (fee changed: {})", id, caller.getId(), feeChanged);
            return ApiResponse.success(mapToOperationResponse(updated), "Operation updated successfully");
        });
    }

    public ApiResponse<OperationResponse> remove(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to delete operation", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "delete operations");
            Operation operation = loadForMutation(id, caller);
            LocalDateTime now = LocalDateTime.now(clock);

            Operation deleted = transactionTemplate.execute(status -> {
                operation.setDeletedAt(now);
                Operation result = operationRepository.save(operation);
                billingService.voidLatestOperationFee(result.getPatient().getId(), now);
                return result;
            });

            log.info("Operation {} soft-deleted by {}", id, caller.getId());
            return ApiResponse.success(mapToOperationResponse(deleted), "Operation deleted successfully");
        });
    }

    private Operation loadForMutation(UUID id, AuthenticatedUser caller) {
        Operation operation = operationRepository.findById(id)
                .filter(o -> inTenant(o, caller))
                .orElseThrow(() -> new ResourceNotFoundException("Operation not found"));
        if (operation.isDeleted()) {
            throw new ResourceNotFoundException("Operation already deleted");
        }
        return operation;
    }

    private boolean inTenant(Operation operation, AuthenticatedUser caller) {
        Patient patient = operation.getPatient();
        return !patient.isDeleted() && caller.getTenantId().equals(patient.getTenantId());
    }

    private Doctor resolveSurgeon(UUID surgeonId, AuthenticatedUser caller) {
        return doctorRepository.findByIdAndTenantIdAndDeletedAtIsNull(surgeonId, caller.getTenantId())
                .orElseThrow(() -> new ResourceNotFoundException("Surgeon not found"));
    }

    private BigDecimal requirePositiveFee(BigDecimal fee) {
        if (fee == null || fee.signum() <= 0) {
            throw new ValidationException("Operation fee must be greater than zero");
        }
        return fee;
    }

    private OperationResponse mapToOperationResponse(Operation operation) {
        Patient patient = operation.getPatient();
        Doctor surgeon = operation.getSurgeon();
        return OperationResponse.builder()
                .id(operation.getId())
                .patientId(patient.getId())
                .patientName(patient.getFullName())
                .surgeonId(surgeon != null ? surgeon.getId() : null)
                .surgeonName(surgeon != null && surgeon.getUser() != null ? surgeon.getUser().getName() : null)
                .name(operation.getName())
                .date(operation.getDate())
                .fee(operation.getFee())
                .outcome(operation.getOutcome())
                .createdAt(operation.getCreatedAt())
                .updatedAt(operation.getUpdatedAt())
                .build();
    }
}
