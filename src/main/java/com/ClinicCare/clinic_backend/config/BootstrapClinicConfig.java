package com.ClinicCare.clinic_backend.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "clinic.bootstrap")
@Data
public class BootstrapClinicConfig {
    private boolean enabled = false;
    private String clinicName = "Demo Clinic";
    private String address;
    private String phone;
    private String adminEmail = "admin@clinic.local";
    private String adminPassword;
    private String adminName = "Clinic Administrator";
}
