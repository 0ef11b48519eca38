package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.dto.request.StaffRequest;
import com.ClinicCare.clinic_backend.dto.request.StaffUpdateRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.PaginatedResponse;
import com.ClinicCare.clinic_backend.dto.response.StaffResponse;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ConflictException;
import com.ClinicCare.clinic_backend.exception.ResourceNotFoundException;
import com.ClinicCare.clinic_backend.exception.ValidationException;
import com.ClinicCare.clinic_backend.model.Staff;
import com.ClinicCare.clinic_backend.model.Tenant;
import com.ClinicCare.clinic_backend.model.User;
import com.ClinicCare.clinic_backend.repository.StaffRepository;
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
 * Front-desk and nursing staff profiles. Create, remove and restore change the user, its membership and the
 * profile together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class StaffService {

    private final StaffRepository staffRepository;
    private final MemberAccountService memberAccountService;
    private final TenantMembershipService membershipService;
    private final TransactionTemplate transactionTemplate;
    private final ModelMapper modelMapper;
    private final Clock clock;

    public ApiResponse<StaffResponse> create(StaffRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to create staff", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "add staff");
            Tenant tenant = memberAccountService.requireTenant(caller.getTenantId());
            String email = memberAccountService.checkNewAccount(request.getEmail(), request.getPassword(), request.getPhone());
            String employeeCode = requireEmployeeCode(request.getEmployeeCode());
            if (staffRepository.existsByTenantIdAndEmployeeCode(tenant.getId(), employeeCode)) {
                throw new ConflictException("Employee code already exists in this clinic");
            }

            Staff saved = transactionTemplate.execute(status -> {
                User user = memberAccountService.createMember(email, request.getPassword(), request.getName(), Role.STAFF, tenant);
                return staffRepository.save(Staff.builder()
                        .user(user)
                        .tenantId(tenant.getId())
                        .employeeCode(employeeCode)
                        .phone(request.getPhone())
                        .isActive(request.getIsActive() == null || request.getIsActive())
                        .build());
            });

            log.info("Staff {} created in tenant {}", saved.getId(), tenant.getId());
            return ApiResponse.created(mapToStaffResponse(saved), "Staff created successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<PaginatedResponse<StaffResponse>> findAll(AuthenticatedUser caller, int page, int limit) {
        return ServiceResults.run(log, "Failed to fetch staff", () -> {
            membershipService.requireRole(caller, Role.ALL, "view staff");
            Pageable pageable = Paging.of(page, limit, Sort.by("createdAt").descending());
            Page<Staff> results = staffRepository.findActiveByTenant(caller.getTenantId(), pageable);
            List<StaffResponse> staff = results.getContent()
                    .stream()
                    .map(this::mapToStaffResponse)
                    .collect(Collectors.toList());
            return ApiResponse.success(PaginatedResponse.of(staff, results), "Staff fetched successfully");
        });
    }

    @Transactional(readOnly = true)
    public ApiResponse<StaffResponse> findOne(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to fetch staff", () -> {
            membershipService.requireRole(caller, Role.ALL, "view staff");
            Staff staff = staffRepository.findById(id)
                    .filter(d -> !d.isDeleted() && caller.getTenantId().equals(d.getTenantId()))
                    .orElseThrow(() -> new ResourceNotFoundException("Staff not found"));
            return ApiResponse.success(mapToStaffResponse(staff), "Staff fetched successfully");
        });
    }

    public ApiResponse<StaffResponse> update(UUID id, StaffUpdateRequest request, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to update staff", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "update staff");
            Staff staff = loadInTenant(id, caller);
            if (staff.isDeleted()) {
                throw new ResourceNotFoundException("Staff already deleted");
            }

            memberAccountService.updateIdentity(staff.getUser(), request.getName(), request.getEmail());
            if (request.getEmployeeCode() != null) {
                String employeeCode = requireEmployeeCode(request.getEmployeeCode());
                if (staffRepository.existsByTenantIdAndEmployeeCodeAndIdNot(staff.getTenantId(), employeeCode, staff.getId())) {
                    throw new ConflictException("Employee code already exists in this clinic");
                }
                staff.setEmployeeCode(employeeCode);
            }
            if (request.getPhone() != null) {
                memberAccountService.checkPhone(request.getPhone());
                staff.setPhone(request.getPhone());
            }
            if (request.getIsActive() != null) {
                staff.setActive(request.getIsActive());
            }

            Staff updated = transactionTemplate.execute(status -> staffRepository.save(staff));
            log.info("Staff {} updated by {}", id, caller.getId());
            return ApiResponse.success(mapToStaffResponse(updated), "Staff updated successfully");
        });
    }

    public ApiResponse<StaffResponse> remove(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to delete staff", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "delete staff");
            Staff staff = loadInTenant(id, caller);
            if (staff.isDeleted()) {
                throw new ResourceNotFoundException("Staff already deleted");
            }

            Staff deleted = transactionTemplate.execute(status -> toggleDeleted(staff, LocalDateTime.now(clock)));
            log.info("Staff {} soft-deleted by {}", id, caller.getId());
            return ApiResponse.success(mapToStaffResponse(deleted), "Staff deleted successfully");
        });
    }

    public ApiResponse<StaffResponse> restore(UUID id, AuthenticatedUser caller) {
        return ServiceResults.run(log, "Failed to restore staff", () -> {
            membershipService.requireRole(caller, Role.ADMIN_ONLY, "restore staff");
            Staff staff = loadInTenant(id, caller);
            if (!staff.isDeleted()) {
                throw new ResourceNotFoundException("Staff is not deleted");
            }

            Staff restored = transactionTemplate.execute(status -> toggleDeleted(staff, null));
            log.info("Staff {} restored by {}", id, caller.getId());
            return ApiResponse.success(mapToStaffResponse(restored), "Staff restored successfully");
        });
    }

    private Staff toggleDeleted(Staff staff, LocalDateTime deletedAt) {
        memberAccountService.setDeleted(staff.getUser(), staff.getTenantId(), deletedAt);
        staff.setDeletedAt(deletedAt);
        staff.setActive(deletedAt == null);
        return staffRepository.save(staff);
    }

    // Any row of the caller's tenant, deleted or not
    private Staff loadInTenant(UUID id, AuthenticatedUser caller) {
        return staffRepository.findById(id)
                .filter(d -> caller.getTenantId().equals(d.getTenantId()))
                .orElseThrow(() -> new ResourceNotFoundException("Staff not found"));
    }

    private String requireEmployeeCode(String employeeCode) {
        if (!StringUtils.hasText(employeeCode)) {
            throw new ValidationException("Employee code is required");
        }
        return employeeCode.trim();
    }

    private StaffResponse mapToStaffResponse(Staff staff) {
        StaffResponse response = modelMapper.map(staff, StaffResponse.class);

        if (staff.getUser() != null) {
            response.setUserId(staff.getUser().getId());
            response.setName(staff.getUser().getName());
            response.setEmail(staff.getUser().getEmail());
        }

        return response;
    }
}
