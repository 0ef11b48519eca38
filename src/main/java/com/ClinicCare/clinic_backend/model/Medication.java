package com.ClinicCare.clinic_backend.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One line of a prescription. Stored inside the prescription's JSON column, not as its own table.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Medication {
    private String drugName;
    private String dosage;
    private String duration;
    private String instructions;
}
