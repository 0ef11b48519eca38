package com.ClinicCare.clinic_backend.dto.request;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DoctorUpdateRequest {

    @Size(min = 2, max = 100, message = "Name must be 2 to 100 characters")
    private String name;

    @Email(message = "Invalid email format")
    private String email;

    @Size(min = 2, max = 100, message = "Specialty must be 2 to 100 characters")
    private String specialty;

    @Pattern(regexp = "^\\+?[0-9]{10,15}$", message = "Phone must be 10 to 15 digits")
    private String phone;

    private Boolean isActive;

    @Size(min = 3, max = 50, message = "Employee code must be 3 to 50 characters")
    private String employeeCode;
}
