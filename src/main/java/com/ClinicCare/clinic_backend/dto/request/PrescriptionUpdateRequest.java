package com.ClinicCare.clinic_backend.dto.request;

import jakarta.validation.Valid;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PrescriptionUpdateRequest {

    // Null keeps the current list; an empty list is rejected
    private List<PrescriptionRequest.@Valid MedicationRequest> medications;
}
