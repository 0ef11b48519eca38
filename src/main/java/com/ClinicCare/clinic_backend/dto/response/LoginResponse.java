package com.ClinicCare.clinic_backend.dto.response;

import com.ClinicCare.clinic_backend.enums.Role;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LoginResponse {

    // Absent while the caller still has to pick a clinic
    private String token;

    private UserResponse user;

    private TenantResponse tenant;

    // Role held inside the selected tenant
    private Role role;

    @JsonProperty("isMultiTenant")
    private boolean multiTenant;

    // Candidate clinics, only when multiTenant is set
    private List<TenantResponse> tenants;
}
