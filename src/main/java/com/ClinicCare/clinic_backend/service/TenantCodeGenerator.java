package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.exception.ApiException;
import com.ClinicCare.clinic_backend.repository.TenantRepository;
import com.ClinicCare.clinic_backend.util.Constants;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.util.Random;

/**
 * Draws human-readable tenant codes. A code reported free here may still be claimed by a concurrent signup
 * before it is written; the unique column on {@code tenants.code} settles that race.
 */
@Component
@Slf4j
public class TenantCodeGenerator {

    private final TenantRepository tenantRepository;
    private final Random random;

    @Autowired
    public TenantCodeGenerator(TenantRepository tenantRepository) {
        this(tenantRepository, new SecureRandom());
    }

    TenantCodeGenerator(TenantRepository tenantRepository, Random random) {
        this.tenantRepository = tenantRepository;
        this.random = random;
    }

    public String generateUniqueCode() {
        for (int draw = 1; draw <= Constants.MAX_TENANT_CODE_DRAWS; draw++) {
            String code = randomCode();
            if (!tenantRepository.existsByCode(code)) {
                return code;
            }
            log.debug("Tenant code {} already taken (draw {})", code, draw);
        }
        log.error("No free tenant code after {} draws", Constants.MAX_TENANT_CODE_DRAWS);
        throw new ApiException("Could not allocate a clinic code, please try again", HttpStatus.SERVICE_UNAVAILABLE);
    }

    String randomCode() {
        StringBuilder code = new StringBuilder(Constants.TENANT_CODE_LENGTH);
        for (int i = 0; i < Constants.TENANT_CODE_LENGTH; i++) {
            code.append(Constants.TENANT_CODE_ALPHABET.charAt(random.nextInt(Constants.TENANT_CODE_ALPHABET.length())));
        }
        return code.toString();
    }
}
