package com.ClinicCare.clinic_backend.dto.request;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionRequest {

    @NotNull(message = "Visit ID is required")
    private UUID visitId;

    @NotNull(message = "Medications are required")
    @Size(min = 1, message = "At least one medication is required")
    private List<@Valid MedicationRequest> medications;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class MedicationRequest {

        @NotBlank(message = "Drug name is required")
        @Size(max = 255, message = "Drug name must not exceed 255 characters")
        private String drugName;

        @NotBlank(message = "Dosage is required")
        @Size(max = 100, message = "Dosage must not exceed 100 characters")
        private String dosage;

        @Size(max = 100, message = "Duration must not exceed 100 characters")
        private String duration;

        @Size(max = 500, message = "Instructions must not exceed 500 characters")
        private String instructions;
    }
}
