package com.ClinicCare.clinic_backend.dto.request;

import com.ClinicCare.clinic_backend.enums.Gender;
import com.ClinicCare.clinic_backend.enums.PatientStatus;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Past;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.util.UUID;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PatientUpdateRequest {

    @Size(min = 1, max = 255, message = "Full name must be 1 to 255 characters")
    private String fullName;

    @Past(message = "Date of birth must be in the past")
    private LocalDate dateOfBirth;

    private Gender gender;

    private String address;

    @Pattern(regexp = "^\\+?[0-9]{10,15}$", message = "Phone must be 10 to 15 digits")
    private String phone;

    @DecimalMin(value = "0.0", message = "Registration fee cannot be negative")
    private BigDecimal registrationFee;

    private UUID doctorId;

    private PatientStatus status;

    private String referredTo;

    private String referredReason;
}
