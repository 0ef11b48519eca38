package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.dto.request.VisitRequest;
import com.ClinicCare.clinic_backend.dto.request.VisitUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.dto.response.VisitResponse;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ResourceNotFoundException;
import com.ClinicCare.clinic_backend.exception.ValidationException;
import com.ClinicCare.clinic_backend.model.Doctor;
import com.ClinicCare.clinic_backend.model.Patient;
import com.ClinicCare.clinic_backend.model.User;
import com.ClinicCare.clinic_backend.model.Visit;
import com.ClinicCare.clinic_backend.repository.DoctorRepository;
import com.ClinicCare.clinic_backend.repository.PatientRepository;
import com.ClinicCare.clinic_backend.repository.UserRepository;
import com.ClinicCare.clinic_backend.repository.VisitRepository;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import com.ClinicCare.clinic_backend.util.Constants;
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
import java.util.Optional;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Patient visits. A new visit charges the registration fee again only once the last live visit is more than
 * {@value Constants#FEE_WAIVER_DAYS} days old; inside that window it inherits the previous fee validity.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class VisitService {

    private final VisitRepository visitRepository;
    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;
    private final UserRepository userRepository;
    private final BillingService billingService;
    private final TenantMembershipService membershipService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    public ApiResponse<VisitResponse> create(VisitRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to create visit", () -> {
            membershipService.requireRole(caller, Role.ALL, "record visits");
            if (request.getPatientId() == null || request.getDoctorId() == null) {
                throw new ValidationException("Patient and doctor are required");
            }
            Patient patient = patientRepository.findByIdAndTenantIdAndDeletedAtIsNull(request.getPatientId(), caller.getTenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("Patient not found"));
            Doctor doctor = doctorRepository.findByIdAndTenantIdAndDeletedAtIsNull(request.getDoctorId(), caller.getTenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("Doctor not found"));
            BigDecimal consultationFee = requireNonNegative(
                    request.getConsultationFee() == null ? BigDecimal.ZERO : request.getConsultationFee());
            LocalDateTime now = LocalDateTime.now(clock);

            VisitResponse created = transactionTemplate.execute(status -> {
                Optional<Visit> latest = visitRepository.findFirstByPatientIdAndDeletedAtIsNullOrderByVisitDateDesc(patient.getId());
                boolean chargeRegistration = latest
                        .map(previous -> previous.getVisitDate().isBefore(now.minusDays(Constants.FEE_WAIVER_DAYS)))
                        .orElse(true);

                LocalDateTime feeValidUntil;
                if (chargeRegistration) {
                    billingService.recordRegistrationFee(patient, patient.getRegistrationFee());
                    feeValidUntil = now.plusDays(Constants.FEE_WAIVER_DAYS);
                } else {
                    Visit previous = latest.get();
                    feeValidUntil = previous.getFeeValidUntil() != null
                            ? previous.getFeeValidUntil()
                            : previous.getVisitDate().plusDays(Constants.FEE_WAIVER_DAYS);
                }

                Visit visit = visitRepository.save(Visit.builder()
                        .patient(patient)
                        .doctor(doctor)
                        .staff(userRepository.getReferenceById(caller.getId()))
                        .visitDate(now)
                        .notes(StringUtils.hasText(request.getNotes()) ? request.getNotes() : Constants.DEFAULT_VISIT_NOTES)
                        .consultationFee(consultationFee)
                        .feeValidUntil(feeValidUntil)
                        .build());

                patientRepository.incrementVisitCount(patient.getId());

                VisitResponse response = mapToVisitResponse(visit);
                response.setRegistrationCharged(chargeRegistration);
                return response;
            });

            log.info("Visit {} recorded for patient {} (registration charged: {})",
                    created.getId(), patient.getId(), created.isRegistrationCharged());
            return ApiResponse.created(created, "Visit created successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<PaginatedResponse<VisitResponse>> findAll(AuthenticatedUser caller, UUID patientId,
                                                                 int page, int limit) {
        return ServiceResults.run(log, "Failed to fetch visits", () -> {
            membershipService.requireRole(caller, Role.ALL, "view visits");
            Pageable pageable = Paging.of(page, limit, Sort.by("visitDate").descending());
            if (patientId != null) {
                patientRepository.findByIdAndTenantIdAndDeletedAtIsNull(patientId, caller.getTenantId())
                        .orElseThrow(() -> new ResourceNotFoundException("Patient not found"));
            }
            Page<Visit> results = visitRepository.findActiveByTenant(caller.getTenantId(), patientId, pageable);
            List<VisitResponse> visits = results.getContent()
                    .stream()
                    .map(this::mapToVisitResponse)
                    .collect(Collectors.toList());
            return ApiResponse.success(PaginatedResponse.of(visits, results), "Visits fetched successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<VisitResponse> findOne(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to fetch visit", () -> {
            membershipService.requireRole(caller, Role.ALL, "view visits");
            Visit visit = visitRepository.findById(id)
                    .filter(v -> !v.isDeleted() && inTenant(v, caller))
                    .orElseThrow(() -> new ResourceNotFoundException("Visit not found"));
            return ApiResponse.success(mapToVisitResponse(visit), "Visit fetched successfully");
        });
    }

    public ApiResponse<VisitResponse> update(UUID id, VisitUpdateRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to update visit", () -> {
            membershipService.requireRole(caller, Role.ADMIN_DOCTOR_OR_STAFF, "update visits");
            Visit visit = loadForMutation(id, caller);

            if (request.getDoctorId() != null) {
                visit.setDoctor(doctorRepository.findByIdAndTenantIdAndDeletedAtIsNull(request.getDoctorId(), caller.getTenantId())
                        .orElseThrow(() -> new ResourceNotFoundException("Doctor not found")));
            }
            if (request.getNotes() != null) {
                visit.setNotes(request.getNotes());
            }
            if (request.getConsultationFee() != null) {
                visit.setConsultationFee(requireNonNegative(request.getConsultationFee()));
            }

            Visit updated = visitRepository.save(visit);
            log.info("Visit {} updated by {}", id, caller.getId());
            return ApiResponse.success(mapToVisitResponse(updated), "Visit updated successfully");
        });
    }

    public ApiResponse<VisitResponse> remove(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to delete visit", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "delete visits");
            Visit visit = loadForMutation(id, caller);

            visit.setDeletedAt(LocalDateTime.now(clock));
            Visit deleted = visitRepository.save(visit);
            log.info("Visit {} soft-deleted by {}", id, caller.getId());
            return ApiResponse.success(mapToVisitResponse(deleted), "Visit deleted successfully");
        });
    }

    private Visit loadForMutation(UUID id, AuthenticatedUser caller) {
        Visit visit = visitRepository.findById(id)
                .filter(v -> inTenant(v, caller))
                .orElseThrow(() -> new ResourceNotFoundException("Visit not found"));
        if (visit.isDeleted()) {
            throw new ResourceNotFoundException("Visit already deleted");
        }
        return visit;
    }

    private boolean inTenant(Visit visit, AuthenticatedUser caller) {
        Patient patient = visit.getPatient();
        return !patient.isDeleted() && caller.getTenantId().equals(patient.getTenantId());
    }

    private BigDecimal requireNonNegative(BigDecimal fee) {
        if (fee.signum() < 0) {
            throw new ValidationException("Consultation fee cannot be negative");
        }
        return fee;
    }

    private VisitResponse mapToVisitResponse(Visit visit) {
        Patient patient = visit.getPatient();
        Doctor doctor = visit.getDoctor();
        User staff = visit.getStaff();
        return VisitResponse.builder()
                .id(visit.getId())
                .patientId(patient.getId())
                .patientName(patient.getFullName())
                .doctorId(doctor != null ? doctor.getId() : null)
                .doctorName(doctor != null && doctor.getUser() != null ? doctor.getUser().getName() : null)
                .staffId(staff != null ? staff.getId() : null)
                .staffName(staff != null ? staff.getName() : null)
                .visitDate(visit.getVisitDate())
                .notes(visit.getNotes())
                .consultationFee(visit.getConsultationFee())
                .feeValidUntil(visit.getFeeValidUntil())
                .createdAt(visit.getCreatedAt())
                .updatedAt(visit.getUpdatedAt())
                .build();
    }
}
