package com.ClinicCare.clinic_backend.dto.response;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class VisitResponse {
    private UUID id;
    private UUID patientId;
    private String patientName;
    private UUID doctorId;
    private String doctorName;
    private UUID staffId;
    private String staffName;
    private LocalDateTime visitDate;
    private String notes;
    private BigDecimal consultationFee;
    private LocalDateTime feeValidUntil;

    // True when this visit opened a new fee-waiver window and was billed for it
    private boolean registrationCharged;

    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
