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
public class OperationResponse {
    private UUID id;
    private UUID patientId;
    private String patientName;
    private UUID surgeonId;
    private String surgeonName;
    private String name;
    private LocalDateTime date;
    private BigDecimal fee;
    private String outcome;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
