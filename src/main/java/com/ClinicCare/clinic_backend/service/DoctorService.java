package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.dto.request.DoctorRequest;
import com.ClinicCare.clinic_backend.dto.request.DoctorUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.DoctorResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ConflictException;
import com.ClinicCare.clinic_backend.exception.ResourceNotFoundException;
import com.ClinicCare.clinic_backend.exception.ValidationException;
import com.ClinicCare.clinic_backend.model.Doctor;
import com.ClinicCare.clinic_backend.model.Tenant;
import com.ClinicCare.clinic_backend.model.User;
import com.ClinicCare.clinic_backend.repository.DoctorRepository;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;
import java.util.stream.Collectors;

/**
 * Doctor profiles. Create, remove and restore change the user, its membership and the profile together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class DoctorService {

    private final DoctorRepository doctorRepository;
    private final MemberAccountService memberAccountService;
    private final TenantMembershipService membershipService;
    private final TransactionTemplate transactionTemplate;
    private final ModelMapper modelMapper;
    private final Clock clock;

    public ApiResponse<DoctorResponse> create(DoctorRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to create doctor", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "add doctors");
            Tenant tenant = memberAccountService.requireTenant(caller.getTenantId());
            String email = memberAccountService.checkNewAccount(request.getEmail(), request.getPassword(), request.getPhone());
            String employeeCode = requireEmployeeCode(request.getEmployeeCode());
            if (doctorRepository.existsByTenantIdAndEmployeeCode(tenant.getId(), employeeCode)) {
                throw new ConflictException("Employee code already exists in this clinic");
            }

            Doctor saved = transactionTemplate.execute(status -> {
                User user = memberAccountService.createMember(email, request.getPassword(), request.getName(), Role.DOCTOR, tenant);
                return doctorRepository.save(Doctor.builder()
                        .user(user)
                        .tenantId(tenant.getId())
                        .employeeCode(employeeCode)
                        .specialty(request.getSpecialty())
                        .phone(request.getPhone())
                        .isActive(request.getIsActive() == null || request.getIsActive())
                        .build());
            });

            log.info("Doctor {} created in tenant {}", saved.getId(), tenant.getId());
            return ApiResponse.created(mapToDoctorResponse(saved), "Doctor created successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<PaginatedResponse<DoctorResponse>> findAll(AuthenticatedUser caller, int page, int limit) {
        return ServiceResults.run(log, "Failed to fetch doctors", () -> {
            membershipService.requireRole(caller, Role.ALL, "view doctors");
            Pageable pageable = Paging.of(page, limit, Sort.by("createdAt").descending());
            Page<Doctor> results = doctorRepository.findActiveByTenant(caller.getTenantId(), pageable);
            List<DoctorResponse> doctors = results.getContent()
                    .stream()
                    .map(this::mapToDoctorResponse)
                    .collect(Collectors.toList());
            return ApiResponse.success(PaginatedResponse.of(doctors, results), "Doctors fetched successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<DoctorResponse> findOne(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to fetch doctor", () -> {
            membershipService.requireRole(caller, Role.ALL, "view doctors");
            Doctor doctor = doctorRepository.findById(id)
                    .filter(d -> !d.isDeleted() && caller.getTenantId().equals(d.getTenantId()))
                    .orElseThrow(() -> new ResourceNotFoundException("Doctor not found"));
            return ApiResponse.success(mapToDoctorResponse(doctor), "Doctor fetched successfully");
        });
    }

    public ApiResponse<DoctorResponse> update(UUID id, DoctorUpdateRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to update doctor", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "update doctors");
            Doctor doctor = loadInTenant(id, caller);
            if (doctor.isDeleted()) {
                throw new ResourceNotFoundException("Doctor already deleted");
            }

            memberAccountService.updateIdentity(doctor.getUser(), request.getName(), request.getEmail());
            if (request.getEmployeeCode() != null) {
                String employeeCode = requireEmployeeCode(request.getEmployeeCode());
                if (doctorRepository.existsByTenantIdAndEmployeeCodeAndIdNot(doctor.getTenantId(), employeeCode, doctor.getId())) {
                    throw new ConflictException("Employee code already exists in this clinic");
                }
                doctor.setEmployeeCode(employeeCode);
            }
            if (request.getSpecialty() != null) {
                doctor.setSpecialty(request.getSpecialty());
            }
            if (request.getPhone() != null) {
                memberAccountService.checkPhone(request.getPhone());
                doctor.setPhone(request.getPhone());
            }
            if (request.getIsActive() != null) {
                doctor.setActive(request.getIsActive());
            }

            Doctor updated = transactionTemplate.execute(status -> doctorRepository.save(doctor));
            log.info("Doctor {} updated by {}", id, caller.getId());
            return ApiResponse.success(mapToDoctorResponse(updated), "Doctor updated successfully");
        });
    }

    public ApiResponse<DoctorResponse> remove(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to delete doctor", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "delete doctors");
            Doctor doctor = loadInTenant(id, caller);
            if (doctor.isDeleted()) {
                throw new ResourceNotFoundException("Doctor already deleted");
            }

            Doctor deleted = transactionTemplate.execute(status -> toggleDeleted(doctor, LocalDateTime.now(clock)));
            log.info("Doctor {} soft-deleted by {}", id, caller.getId());
            return ApiResponse.success(mapToDoctorResponse(deleted), "Doctor deleted successfully");
        });
    }

    public ApiResponse<DoctorResponse> restore(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to restore doctor", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "restore doctors");
            Doctor doctor = loadInTenant(id, caller);
            if (!doctor.isDeleted()) {
                throw new ResourceNotFoundException("Doctor is not deleted");
            }

            Doctor restored = transactionTemplate.execute(status -> toggleDeleted(doctor, null));
            log.info("Doctor {} restored by {}", id, caller.getId());
            return ApiResponse.success(mapToDoctorResponse(restored), "Doctor restored successfully");
        });
    }

    private Doctor toggleDeleted(Doctor doctor, LocalDateTime deletedAt) {
        memberAccountService.setDeleted(doctor.getUser(), doctor.getTenantId(), deletedAt);
        doctor.setDeletedAt(deletedAt);
        doctor.setActive(deletedAt == null);
        return doctorRepository.save(doctor);
    }

    // Any row of the caller's tenant, deleted or not
    private Doctor loadInTenant(UUID id, AuthenticatedUser caller) {
        return doctorRepository.findById(id)
                .filter(d -> caller.getTenantId().equals(d.getTenantId()))
                .orElseThrow(() -> new ResourceNotFoundException("Doctor not found"));
    }

    private String requireEmployeeCode(String employeeCode) {
        if (!StringUtils.hasText(employeeCode)) {
            throw new ValidationException("Employee code is required");
        }
        return employeeCode.trim();
    }

    private DoctorResponse mapToDoctorResponse(Doctor doctor) {
        DoctorResponse response = modelMapper.map(doctor, DoctorResponse.class);

        if (doctor.getUser() != null) {
            response.setUserId(doctor.getUser().getId());
            response.setName(doctor.getUser().getName());
            response.setEmail(doctor.getUser().getEmail());
        }

        return response;
    }
}
