package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.dto.request.PaymentUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.BillingResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.enums.BillingType;
import com.ClinicCare.clinic_backend.enums.PaymentStatus;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ResourceNotFoundException;
import com.ClinicCare.clinic_backend.exception.ValidationException;
import com.ClinicCare.clinic_backend.model.Billing;
import com.ClinicCare.clinic_backend.model.Patient;
import com.ClinicCare.clinic_backend.repository.BillingRepository;
import com.ClinicCare.clinic_backend.repository.PatientRepository;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Billing rows for patients. The {@code record*}, {@code adjust*} and {@code void*} methods are side effects of
 * patient, visit and operation writes and run inside the caller's transaction.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BillingService {

    private final BillingRepository billingRepository;
    private final PatientRepository patientRepository;
    private final TenantMembershipService membershipService;
    private final Clock clock;

    public Billing recordRegistrationFee(Patient patient, BigDecimal amount) {
        return record(patient, BillingType.REGISTRATION, amount);
    }

    public Billing recordOperationFee(Patient patient, BigDecimal amount) {
        return record(patient, BillingType.OPERATION, amount);
    }

    /**
     * Moves the newest live OPERATION bill of the patient to the new amount. Empty when the patient has none.
     */
    public Optional<Billing> adjustLatestOperationFee(UUID patientId, BigDecimal amount) {
        return billingRepository
                .findFirstByPatientIdAndTypeAndDeletedAtIsNullOrderByCreatedAtDesc(patientId, BillingType.OPERATION)
                .map(billing -> {
                    billing.setAmount(amount);
                    Billing saved = billingRepository.save(billing);
                    log.info("Operation bill {} adjusted to {}", saved.getId(), amount);
                    return saved;
                });
    }

    public Optional<Billing> voidLatestOperationFee(UUID patientId, LocalDateTime deletedAt) {
        return billingRepository
                .findFirstByPatientIdAndTypeAndDeletedAtIsNullOrderByCreatedAtDesc(patientId, BillingType.OPERATION)
                .map(billing -> {
                    billing.setDeletedAt(deletedAt);
                    Billing saved = billingRepository.save(billing);
                    log.info("Operation bill {} voided", saved.getId());
                    return saved;
                });
    }

    private Billing record(Patient patient, BillingType type, BigDecimal amount) {
        Billing billing = Billing.builder()
                .patient(patient)
                .type(type)
                .amount(amount == null ? BigDecimal.ZERO : amount)
                .status(PaymentStatus.UNPAID)
                .build();
        Billing saved = billingRepository.save(billing);
        log.info("{} bill of {} recorded for patient {}", type, saved.getAmount(), patient.getId());
        return saved;
    }

    @Transactional(readOnly = true)
    public ApiResponse<PaginatedResponse<BillingResponse>> findAll(AuthenticatedUser caller, UUID patientId,
                                                                   int page, int limit) {
        return ServiceResults.run(log, "Failed to fetch billings", () -> {
            membershipService.requireRole(caller, Role.ALL, "view billings");
            Pageable pageable = Paging.of(page, limit, Sort.by("createdAt").descending());
            if (patientId != null) {
                patientRepository.findByIdAndTenantIdAndDeletedAtIsNull(patientId, caller.getTenantId())
                        .orElseThrow(() -> new ResourceNotFoundException("Patient not found"));
            }
            Page<Billing> results = billingRepository.findActiveByTenant(caller.getTenantId(), patientId, pageable);
            List<BillingResponse> billings = results.getContent()
                    .stream()
                    .map(this::mapToBillingResponse)
                    .collect(Collectors.toList());
            return ApiResponse.success(PaginatedResponse.of(billings, results), "Billings fetched successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<BillingResponse> findOne(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to fetch billing", () -> {
            membershipService.requireRole(caller, Role.ALL, "view billings");
            Billing billing = loadInTenant(id, caller);
            return ApiResponse.success(mapToBillingResponse(billing), "Billing fetched successfully");
        });
    }

    public ApiResponse<BillingResponse> updatePayment(UUID id, PaymentUpdateRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to update payment", () -> {
            membershipService.requireRole(caller, Role.ADMIN_OR_STAFF, "record payments");
            Billing billing = loadInTenant(id, caller);

            if (request.getStatus() == null) {
                throw new ValidationException("Payment status is required");
            }
            if (request.getStatus() != PaymentStatus.UNPAID && request.getPaymentMethod() == null) {
                throw new ValidationException("Payment method is required for paid bills");
            }

            billing.setStatus(request.getStatus());
            if (request.getStatus() == PaymentStatus.UNPAID) {
                billing.setPaymentMethod(null);
                billing.setPaidAt(null);
            } else {
                billing.setPaymentMethod(request.getPaymentMethod());
                billing.setPaidAt(LocalDateTime.now(clock));
            }

            Billing saved = billingRepository.save(billing);
            log.info("Billing {} marked {} by {}", id, saved.getStatus(), caller.getId());
            return ApiResponse.success(mapToBillingResponse(saved), "Payment updated successfully");
        });
    }

    private Billing loadInTenant(UUID id, AuthenticatedUser caller) {
        return billingRepository.findById(id)
                .filter(billing -> !billing.isDeleted())
                .filter(billing -> !billing.getPatient().isDeleted()
                        && caller.getTenantId().equals(billing.getPatient().getTenantId()))
                .orElseThrow(() -> new ResourceNotFoundException("Billing not found"));
    }

    private BillingResponse mapToBillingResponse(Billing billing) {
        Patient patient = billing.getPatient();
        return BillingResponse.builder()
                .id(billing.getId())
                .patientId(patient.getId())
                .patientName(patient.getFullName())
                .patientNumber(patient.getPatientNumber())
                .type(billing.getType())
                .amount(billing.getAmount())
                .status(billing.getStatus())
                .paymentMethod(billing.getPaymentMethod())
                .paidAt(billing.getPaidAt())
                .createdAt(billing.getCreatedAt())
                .updatedAt(billing.getUpdatedAt())
                .build();
    }
}
