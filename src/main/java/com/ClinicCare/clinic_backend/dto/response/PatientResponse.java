package com.ClinicCare.clinic_backend.dto.response;

import com.ClinicCare.clinic_backend.enums.Gender;
import com.ClinicCare.clinic_backend.enums.PatientStatus;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class PatientResponse {
    private UUID id;
    private UUID tenantId;
    private String patientNumber;
    private String fullName;
    private LocalDate dateOfBirth;
    private Gender gender;
    private String address;
    private String phone;
    private BigDecimal registrationFee;
    private int noOfVisits;
    private UUID doctorId;
    private String doctorName;
    private PatientStatus status;
    private String referredTo;
    private String referredReason;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
