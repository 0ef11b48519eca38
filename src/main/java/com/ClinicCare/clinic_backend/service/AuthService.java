package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.dto.request.LoginRequest;
import com.ClinicCare.clinic_backend.dto.request.SignupRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.LoginResponse;
import com.ClinicCare.clinic_backend.dto.response.SignupResponse;
import com.ClinicCare.clinic_backend.dto.response.TenantResponse;
import com.ClinicCare.clinic_backend.dto.response.UserResponse;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ConflictException;
import com.ClinicCare.clinic_backend.exception.ForbiddenException;
import com.ClinicCare.clinic_backend.exception.TenantCodeCollisionException;
import com.ClinicCare.clinic_backend.exception.UnauthorizedException;
import com.ClinicCare.clinic_backend.model.Tenant;
import com.ClinicCare.clinic_backend.model.User;
import com.ClinicCare.clinic_backend.model.UserTenant;
import com.ClinicCare.clinic_backend.repository.TenantRepository;
import com.ClinicCare.clinic_backend.repository.UserRepository;
import com.ClinicCare.clinic_backend.repository.UserTenantRepository;
import com.ClinicCare.clinic_backend.security.AuthenticatedUser;
import com.ClinicCare.clinic_backend.security.JwtTokenProvider;
import com.ClinicCare.clinic_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.modelmapper.ModelMapper;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.support.TransactionTemplate;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;

/**
 * Onboarding and login. Signup creates the admin user, the clinic and the admin membership in one transaction;
 * login resolves which clinic the token is issued for.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class AuthService {

    private final UserRepository userRepository;
    private final TenantRepository tenantRepository;
    private final UserTenantRepository userTenantRepository;
    private final PasswordEncoder passwordEncoder;
    private final JwtTokenProvider jwtTokenProvider;
    private final TenantCodeGenerator tenantCodeGenerator;
    private final TransactionTemplate transactionTemplate;
    private final ModelMapper modelMapper;

    public ApiResponse<SignupResponse> signup(SignupRequest request) {
        String email = normalizeEmail(request.getEmail());
        log.info("Signup requested for clinic '{}' by {}", request.getTenantName(), email);

        return ServiceResults.run(log, "Signup failed", () -> {
            if (userRepository.existsByEmail(email)) {
                throw new ConflictException("Email already registered");
            }
            String passwordHash = passwordEncoder.encode(request.getPassword());

            for (int attempt = 1; attempt <= Constants.MAX_SIGNUP_ATTEMPTS; attempt++) {
                try {
                    SignupResponse created = transactionTemplate.execute(status ->
                            createClinicWithAdmin(request, email, passwordHash));
                    log.info("Clinic {} created with admin {}", created.getTenant().getCode(), created.getUser().getId());
                    return ApiResponse.created(created, "Signup successful. Please log in to continue.");
                } catch (TenantCodeCollisionException e) {
                    log.warn("Signup attempt {} lost a tenant code race: {}", attempt, e.getMessage());
                }
            }
            log.error("Signup for {} gave up after {} tenant code collisions", email, Constants.MAX_SIGNUP_ATTEMPTS);
            return ApiResponse.failure(HttpStatus.CONFLICT, "Could not allocate a clinic code, please try again");
        });
    }

    private SignupResponse createClinicWithAdmin(SignupRequest request, String email, String passwordHash) {
        User user = userRepository.saveAndFlush(User.builder()
                .email(email)
                .password(passwordHash)
                .name(request.getName())
                .role(Role.ADMIN)
                .build());

        String code = tenantCodeGenerator.generateUniqueCode();
        Tenant tenant;
        try {
            tenant = tenantRepository.saveAndFlush(Tenant.builder()
                    .name(request.getTenantName().trim())
                    .code(code)
                    .address(request.getAddress())
                    .phone(request.getPhone())
                    .build());
        } catch (DataIntegrityViolationException e) {
            throw new TenantCodeCollisionException(code, e);
        }

        userTenantRepository.save(UserTenant.builder()
                .user(user)
                .tenant(tenant)
                .role(Role.ADMIN)
                .build());

        return SignupResponse.builder()
                .user(mapToUserResponse(user))
                .tenant(mapToTenantResponse(tenant))
                .build();
    }

    public ApiResponse<LoginResponse> login(LoginRequest request) {
        String email = normalizeEmail(request.getEmail());

        return ServiceResults.run(log, "Login failed", () -> {
            User user = authenticate(email, request.getPassword());
            List<UserTenant> memberships = userTenantRepository.findActiveMemberships(user.getId());
            if (memberships.isEmpty()) {
                log.warn("Login refused for {}: no clinic membership", email);
                throw new ForbiddenException("User does not belong to any clinic");
            }

            UserTenant selected;
            if (StringUtils.hasText(request.getTenantCode())) {
                String code = request.getTenantCode().trim().toUpperCase(Locale.ROOT);
                selected = memberships.stream()
                        .filter(membership -> code.equals(membership.getTenant().getCode()))
                        .findFirst()
                        .orElseThrow(() -> {
                            log.warn("Login refused for {}: tenant code {} not among memberships", email, code);
                            return new UnauthorizedException("Invalid tenant code");
                        });
            } else if (memberships.size() == 1) {
                selected = memberships.get(0);
            } else {
                log.info("User {} belongs to {} clinics, asking for a tenant code", user.getId(), memberships.size());
                LoginResponse pending = LoginResponse.builder()
                        .user(mapToUserResponse(user))
                        .multiTenant(true)
                        .tenants(memberships.stream()
                                .map(membership -> mapToTenantResponse(membership.getTenant()))
                                .collect(Collectors.toList()))
                        .build();
                return ApiResponse.success(pending, "Multiple clinics found. Please select one with its tenant code.");
            }

            String token = jwtTokenProvider.generateToken(AuthenticatedUser.builder()
                    .id(user.getId())
                    .email(user.getEmail())
                    .role(selected.getRole())
                    .tenantId(selected.getTenant().getId())
                    .build());
            log.info("User {} logged in to clinic {}", user.getId(), selected.getTenant().getCode());

            LoginResponse response = LoginResponse.builder()
                    .token(token)
                    .user(mapToUserResponse(user))
                    .tenant(mapToTenantResponse(selected.getTenant()))
                    .role(selected.getRole())
                    .multiTenant(false)
                    .build();
            return ApiResponse.success(response, "Login successful");
        });
    }

    private User authenticate(String email, String password) {
        User user = userRepository.findByEmailAndDeletedAtIsNull(email)
                .orElseThrow(() -> {
                    log.warn("Login refused: unknown email {}", email);
                    return new UnauthorizedException("Invalid email or password");
                });
        if (password == null || !passwordEncoder.matches(password, user.getPassword())) {
            log.warn("Login refused for {}: bad password", email);
            throw new UnauthorizedException("Invalid email or password");
        }
        return user;
    }

    private String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }

    private UserResponse mapToUserResponse(User user) {
        return UserResponse.builder()
                .id(user.getId())
                .name(user.getName())
                .email(user.getEmail())
                .role(user.getRole())
                .createdAt(user.getCreatedAt())
                .build();
    }

    private TenantResponse mapToTenantResponse(Tenant tenant) {
        return modelMapper.map(tenant, TenantResponse.class);
    }
}
