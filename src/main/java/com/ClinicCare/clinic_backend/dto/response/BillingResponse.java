package com.ClinicCare.clinic_backend.dto.response;

import com.ClinicCare.clinic_backend.enums.BillingType;
import com.ClinicCare.clinic_backend.enums.PaymentMethod;
import com.ClinicCare.clinic_backend.enums.PaymentStatus;
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
public class BillingResponse {
    private UUID id;
    private UUID patientId;
    private String patientName;
    private String patientNumber;
    private BillingType type;
    private BigDecimal amount;
    private PaymentStatus status;
    private PaymentMethod paymentMethod;
    private LocalDateTime paidAt;
    private LocalDateTime createdAt;
    private LocalDateTime updatedAt;
}
