package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.ConflictException;
import com.ClinicCare.clinic_backend.exception.ResourceNotFoundException;
import com.ClinicCare.clinic_backend.exception.ValidationException;
import com.ClinicCare.clinic_backend.model.Tenant;
import com.ClinicCare.clinic_backend.model.User;
import com.ClinicCare.clinic_backend.model.UserTenant;
import com.ClinicCare.clinic_backend.repository.TenantRepository;
import com.ClinicCare.clinic_backend.repository.UserRepository;
import com.ClinicCare.clinic_backend.repository.UserTenantRepository;
import com.ClinicCare.clinic_backend.util.Constants;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.time.LocalDateTime;
import java.util.Locale;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * User and membership half of a doctor or staff profile. Doctor and staff services call it from inside their
 * own transactions so the user, the membership and the profile row change together.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MemberAccountService {

    private static final Pattern EMAIL = Pattern.compile(Constants.EMAIL_PATTERN);
    private static final Pattern PHONE = Pattern.compile(Constants.PHONE_PATTERN);

    private final UserRepository userRepository;
    private final UserTenantRepository userTenantRepository;
    private final TenantRepository tenantRepository;
    private final PasswordEncoder passwordEncoder;

    public Tenant requireTenant(UUID tenantId) {
        return tenantRepository.findByIdAndDeletedAtIsNull(tenantId)
                .orElseThrow(() -> new ResourceNotFoundException("Clinic not found"));
    }

    /**
     * Guard step for a new account; runs before any write.
     *
     * @return the normalized email
     */
    public String checkNewAccount(String email, String password, String phone) {
        String normalized = normalizeEmail(email);
        if (normalized == null || !EMAIL.matcher(normalized).matches()) {
            throw new ValidationException("Invalid email format");
        }
        if (password == null || password.length() < Constants.MIN_PASSWORD_LENGTH) {
            throw new ValidationException("Password must be at least " + Constants.MIN_PASSWORD_LENGTH + " characters");
        }
        checkPhone(phone);
        if (userRepository.existsByEmail(normalized)) {
            throw new ConflictException("Email already registered");
        }
        return normalized;
    }

    public void checkPhone(String phone) {
        if (phone != null && !PHONE.matcher(phone).matches()) {
            throw new ValidationException("Phone must be 10 to 15 digits");
        }
    }

    /**
     * Creates the user and its membership in {@code tenant}. Must run inside a transaction.
     */
    public User createMember(String email, String password, String name, Role role, Tenant tenant) {
        User user = userRepository.saveAndFlush(User.builder()
                .email(email)
                .password(passwordEncoder.encode(password))
                .name(StringUtils.hasText(name) ? name.trim() : email.substring(0, email.indexOf('@')))
                .role(role)
                .build());

        userTenantRepository.save(UserTenant.builder()
                .user(user)
                .tenant(tenant)
                .role(role)
                .build());
        log.debug("User {} joined tenant {} as {}", user.getId(), tenant.getId(), role);
        return user;
    }

    /**
     * Applies a name or email change. The email must stay unique across all users.
     */
    public void updateIdentity(User user, String name, String email) {
        if (name != null) {
            if (!StringUtils.hasText(name)) {
                throw new ValidationException("Name cannot be blank");
            }
            user.setName(name.trim());
        }
        if (email != null) {
            String normalized = normalizeEmail(email);
            if (!EMAIL.matcher(normalized).matches()) {
                throw new ValidationException("Invalid email format");
            }
            if (!normalized.equals(user.getEmail()) && userRepository.existsByEmailAndIdNot(normalized, user.getId())) {
                throw new ConflictException("Email already registered");
            }
            user.setEmail(normalized);
        }
    }

    /**
     * Sets or clears the delete timestamp on the user and on its membership in {@code tenantId}.
     * Must run inside a transaction.
     */
    public void setDeleted(User user, UUID tenantId, LocalDateTime deletedAt) {
        user.setDeletedAt(deletedAt);
        userRepository.save(user);

        userTenantRepository.findByUserIdAndTenantId(user.getId(), tenantId)
                .ifPresent(membership -> {
                    membership.setDeletedAt(deletedAt);
                    userTenantRepository.save(membership);
                });
    }

    private String normalizeEmail(String email) {
        return email == null ? null : email.trim().toLowerCase(Locale.ROOT);
    }
}
