package com.ClinicCare.clinic_backend.config;

import com.ClinicCare.clinic_backend.dto.request.SignupRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.SignupResponse;
import com.ClinicCare.clinic_backend.repository.UserRepository;
import com.ClinicCare.clinic_backend.service.AuthService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Seeds a demo clinic through the regular signup path when {@code clinic.bootstrap.enabled} is set.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class DataInitializer {

    private final UserRepository userRepository;
    private final AuthService authService;
    private final BootstrapClinicConfig bootstrapClinicConfig;

    @Bean
    CommandLineRunner initDatabase() {
        return args -> {
            if (!bootstrapClinicConfig.isEnabled()) {
                log.debug("Clinic bootstrap disabled");
                return;
            }
            createBootstrapClinic();
        };
    }

    void createBootstrapClinic() {
        String email = bootstrapClinicConfig.getAdminEmail();
        if (userRepository.existsByEmail(email)) {
            log.info("Bootstrap admin {} already exists, skipping clinic seed", email);
            return;
        }
        if (bootstrapClinicConfig.getAdminPassword() == null || bootstrapClinicConfig.getAdminPassword().isBlank()) {
            log.warn("clinic.bootstrap.admin-password is not set, skipping clinic seed");
            return;
        }

        SignupRequest request = SignupRequest.builder()
                .email(email)
                .password(bootstrapClinicConfig.getAdminPassword())
                .name(bootstrapClinicConfig.getAdminName())
                .tenantName(bootstrapClinicConfig.getClinicName())
                .address(bootstrapClinicConfig.getAddress())
                .phone(bootstrapClinicConfig.getPhone())
                .build();

        ApiResponse<SignupResponse> result = authService.signup(request);
        if (result.isSuccess()) {
            log.info("Bootstrap clinic '{}' created with code {}",
                    result.getData().getTenant().getName(), result.getData().getTenant().getCode());
        } else {
            log.warn("Bootstrap clinic was not created: {} ({})", result.getMessage(), result.getStatusCode());
        }
    }
}
