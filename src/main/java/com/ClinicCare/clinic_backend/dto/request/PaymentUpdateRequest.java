package com.ClinicCare.clinic_backend.dto.request;

import com.ClinicCare.clinic_backend.enums.PaymentMethod;
import com.ClinicCare.clinic_backend.enums.PaymentStatus;
import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PaymentUpdateRequest {

    @NotNull(message = "Payment status is required")
    private PaymentStatus status;

    private PaymentMethod paymentMethod;
}
