package com.ClinicCare.clinic_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@Data
@ConfigurationProperties(prefix = "app.jwt")
public class JwtProperties {
    // HMAC key material, at least 32 bytes
    private String secret;
    private long expirationMs = 86400000;
}
