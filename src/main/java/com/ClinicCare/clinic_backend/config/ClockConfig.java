package com.ClinicCare.clinic_backend.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.time.ZoneId;

@Configuration
@Slf4j
public class ClockConfig {

    @Bean
    public Clock clock(@Value("${app.timezone:UTC}") String timezone) {
        ZoneId zone = ZoneId.of(timezone);
        log.info("Application clock zone set to: {}", zone.getId());
        return Clock.system(zone);
    }
}
