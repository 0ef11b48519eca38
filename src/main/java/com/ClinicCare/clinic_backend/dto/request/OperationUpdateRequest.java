package com.ClinicCare.clinic_backend.dto.request;

import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Size;
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
public class OperationUpdateRequest {

    @Size(min = 1, message = "Operation name cannot be blank")
    private String name;

    private LocalDateTime date;

    private UUID surgeonId;

    @DecimalMin(value = "0.0", inclusive = false, message = "Operation fee must be positive")
    private BigDecimal fee;

    private String outcome;
}
