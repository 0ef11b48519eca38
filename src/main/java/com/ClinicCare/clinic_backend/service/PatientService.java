package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.dto.request.PatientRequest;
import com.ClinicCare.clinic_backend.dto.request.PatientUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.dto.response.PatientResponse;
import com.ClinicCare.clinic_backend.enums.PatientStatus;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ResourceNotFoundException;
import com.ClinicCare.clinic_backend.exception.ValidationException;
import com.ClinicCare.clinic_backend.model.Doctor;
import com.ClinicCare.clinic_backend.model.Patient;
import com.ClinicCare.clinic_backend.model.Tenant;
import com.ClinicCare.clinic_backend.model.Visit;
import com.ClinicCare.clinic_backend.repository.DoctorRepository;
import com.ClinicCare.clinic_backend.repository.PatientRepository;
import com.ClinicCare.clinic_backend.repository.TenantRepository;
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
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Service
@RequiredArgsConstructor
@Slf4j
public class PatientService {

    private static final Pattern PHONE = Pattern.compile(Constants.PHONE_PATTERN);

    private final PatientRepository patientRepository;
    private final DoctorRepository doctorRepository;
    private final TenantRepository tenantRepository;
    private final VisitRepository visitRepository;
    private final UserRepository userRepository;
    private final BillingService billingService;
    private final TenantMembershipService membershipService;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    /**
     * Registers a patient together with the registration bill and the initial visit.
     */
    public ApiResponse<PatientResponse> create(PatientRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to register patient", () -> {
            membershipService.requireRole(caller, Role.ADMIN_DOCTOR_OR_STAFF, "register patients");
            Tenant tenant = tenantRepository.findByIdAndDeletedAtIsNull(caller.getTenantId())
                    .orElseThrow(() -> new ResourceNotFoundException("Clinic not found"));

            if (!StringUtils.hasText(request.getFullName())) {
                throw new ValidationException("Full name is required");
            }
            validatePhone(request.getPhone());
            BigDecimal registrationFee = requireNonNegative(request.getRegistrationFee());
            Doctor doctor = request.getDoctorId() == null ? null : resolveDoctor(request.getDoctorId(), tenant.getId());
            LocalDateTime now = LocalDateTime.now(clock);

            Patient saved = transactionTemplate.execute(status -> {
                Patient patient = patientRepository.save(Patient.builder()
                        .tenantId(tenant.getId())
                        .patientNumber(nextPatientNumber(tenant))
                        .fullName(request.getFullName().trim())
                        .dateOfBirth(request.getDateOfBirth())
                        .gender(request.getGender())
                        .address(request.getAddress())
                        .phone(request.getPhone())
                        .registrationFee(registrationFee)
                        .doctor(doctor)
                        .status(PatientStatus.ACTIVE)
                        .noOfVisits(1)
                        .build());

                billingService.recordRegistrationFee(patient, registrationFee);

                visitRepository.save(Visit.builder()
                        .patient(patient)
                        .doctor(doctor)
                        .staff(userRepository.getReferenceById(caller.getId()))
                        .visitDate(now)
                        .notes(Constants.INITIAL_VISIT_NOTES)
                        .consultationFee(BigDecimal.ZERO)
                        .feeValidUntil(now.plusDays(Constants.FEE_WAIVER_DAYS))
                        .build());
                return patient;
            });

            log.info("Patient {} registered as {} in tenant {}", saved.getId(), saved.getPatientNumber(), tenant.getId());
            return ApiResponse.created(mapToPatientResponse(saved), "Patient registered successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<PaginatedResponse<PatientResponse>> findAll(AuthenticatedUser caller, PatientStatus status,
                                                                   String search, int page, int limit) {
        return ServiceResults.run(log, "Failed to fetch patients", () -> {
            membershipService.requireRole(caller, Role.ALL, "view patients");
            Pageable pageable = Paging.of(page, limit, Sort.by("createdAt").descending());
            String term = StringUtils.hasText(search) ? search.trim() : null;
            Page<Patient> results = patientRepository.searchActiveByTenant(caller.getTenantId(), status, term, pageable);
            List<PatientResponse> patients = results.getContent()
                    .stream()
                    .map(this::mapToPatientResponse)
                    .collect(Collectors.toList());
            return ApiResponse.success(PaginatedResponse.of(patients, results), "Patients fetched successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<PatientResponse> findOne(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to fetch patient", () -> {
            membershipService.requireRole(caller, Role.ALL, "view patients");
            Patient patient = patientRepository.findById(id)
                    .filter(p -> !p.isDeleted() && caller.getTenantId().equals(p.getTenantId()))
                    .orElseThrow(() -> new ResourceNotFoundException("Patient not found"));
            return ApiResponse.success(mapToPatientResponse(patient), "Patient fetched successfully");
        });
    }

    public ApiResponse<PatientResponse> update(UUID id, PatientUpdateRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to update patient", () -> {
            membershipService.requireRole(caller, Role.ADMIN_DOCTOR_OR_STAFF, "update patients");
            Patient patient = loadForMutation(id, caller);

            if (request.getFullName() != null) {
                if (!StringUtils.hasText(request.getFullName())) {
                    throw new ValidationException("Full name cannot be blank");
                }
                patient.setFullName(request.getFullName().trim());
            }
            if (request.getDateOfBirth() != null) {
                patient.setDateOfBirth(request.getDateOfBirth());
            }
            if (request.getGender() != null) {
                patient.setGender(request.getGender());
            }
            if (request.getAddress() != null) {
                patient.setAddress(request.getAddress());
            }
            if (request.getPhone() != null) {
                validatePhone(request.getPhone());
                patient.setPhone(request.getPhone());
            }
            if (request.getRegistrationFee() != null) {
                patient.setRegistrationFee(requireNonNegative(request.getRegistrationFee()));
            }
            if (request.getDoctorId() != null) {
                patient.setDoctor(resolveDoctor(request.getDoctorId(), caller.getTenantId()));
            }
            if (request.getStatus() != null) {
                patient.setStatus(request.getStatus());
            }
            if (request.getReferredTo() != null) {
                patient.setReferredTo(request.getReferredTo());
            }
            if (request.getReferredReason() != null) {
                patient.setReferredReason(request.getReferredReason());
            }

            Patient updated = patientRepository.save(patient);
            log.info("Patient {} updated by {}", id, caller.getId());
            return ApiResponse.success(mapToPatientResponse(updated), "Patient updated successfully");
        });
    }

    public ApiResponse<PatientResponse> remove(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to delete patient", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "delete patients");
            Patient patient = loadForMutation(id, caller);

            patient.setDeletedAt(LocalDateTime.now(clock));
            Patient deleted = patientRepository.save(patient);
            log.info("Patient {} soft-deleted by {}", id, caller.getId());
            return ApiResponse.success(mapToPatientResponse(deleted), "Patient deleted successfully");
        });
    }

    // Number of every patient ever registered in the clinic, deleted ones included, plus one
    String nextPatientNumber(Tenant tenant) {
        long sequence = patientRepository.countByTenantId(tenant.getId()) + 1;
        String number = String.format(Constants.PATIENT_NUMBER_FORMAT, tenant.getCode(), sequence);
        while (patientRepository.existsByTenantIdAndPatientNumber(tenant.getId(), number)) {
            sequence++;
            number = String.format(Constants.PATIENT_NUMBER_FORMAT, tenant.getCode(), sequence);
        }
        return number;
    }

    private Patient loadForMutation(UUID id, AuthenticatedUser caller) {
        Patient patient = patientRepository.findById(id)
                .filter(p -> caller.getTenantId().equals(p.getTenantId()))
                .orElseThrow(() -> new ResourceNotFoundException("Patient not found"));
        if (patient.isDeleted()) {
            throw new ResourceNotFoundException("Patient already deleted");
        }
        return patient;
    }

    private Doctor resolveDoctor(UUID doctorId, UUID tenantId) {
        Doctor doctor = doctorRepository.findByIdAndTenantIdAndDeletedAtIsNull(doctorId, tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Doctor not found"));
        if (!doctor.isActive()) {
            throw new ValidationException("Doctor is not active");
        }
        return doctor;
    }

    private BigDecimal requireNonNegative(BigDecimal fee) {
        if (fee == null) {
            throw new ValidationException("Registration fee is required");
        }
        if (fee.signum() < 0) {
            throw new ValidationException("Registration fee cannot be negative");
        }
        return fee;
    }

    private void validatePhone(String phone) {
        if (phone != null && !PHONE.matcher(phone).matches()) {
            throw new ValidationException("Phone must be 10 to 15 digits");
        }
    }

    private PatientResponse mapToPatientResponse(Patient patient) {
        Doctor doctor = patient.getDoctor();
        return PatientResponse.builder()
                .id(patient.getId())
                .tenantId(patient.getTenantId())
                .patientNumber(patient.getPatientNumber())
                .fullName(patient.getFullName())
                .dateOfBirth(patient.getDateOfBirth())
                .gender(patient.getGender())
                .address(patient.getAddress())
                .phone(patient.getPhone())
                .registrationFee(patient.getRegistrationFee())
                .noOfVisits(patient.getNoOfVisits())
                .doctorId(doctor != null ? doctor.getId() : null)
                .doctorName(doctor != null && doctor.getUser() != null ? doctor.getUser().getName() : null)
                .status(patient.getStatus())
                .referredTo(patient.getReferredTo())
                .referredReason(patient.getReferredReason())
                .createdAt(patient.getCreatedAt())
                .updatedAt(patient.getUpdatedAt())
                .build();
    }
}
