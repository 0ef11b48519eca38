package com.ClinicCare.clinic_backend.controller;

import com.ClinicCare.clinic_backend.dto.request.LoginRequest;
import com.ClinicCare.clinic_backend.dto.request.SignupRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.LoginResponse;
import com.ClinicCare.clinic_backend.dto.response.TenantResponse;
import com.ClinicCare.clinic_backend.dto.response.UserResponse;
import com.ClinicCare.clinic_backend.enums.Role;
import com.ClinicCare.clinic_backend.exception.GlobalExceptionHandler;
import com.ClinicCare.clinic_backend.service.AuthService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.util.List;
import java.util.UUID;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@ExtendWith(MockitoExtension.class)
class AuthControllerTest {

    @Mock
    private AuthService authService;

    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        mockMvc = MockMvcBuilders.standaloneSetup(new AuthController(authService))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    @Test
    @DisplayName("a multi-clinic login lists the clinics and carries no token")
    void multiTenantLogin() throws Exception {
        LoginResponse body = LoginResponse.builder()
                .user(UserResponse.builder().id(UUID.randomUUID()).email("jane@abc.com").role(Role.DOCTOR).build())
                .multiTenant(true)
                .tenants(List.of(
                        TenantResponse.builder().id(UUID.randomUUID()).name("ABC Clinic").code("ABC123").build(),
                        TenantResponse.builder().id(UUID.randomUUID()).name("DEF Clinic").code("DEF456").build()))
                .build();
        when(authService.login(any(LoginRequest.class)))
                .thenReturn(ApiResponse.success(body, "Multiple clinics found. Please select a clinic code"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"jane@abc.com\",\"password\":\"secret12\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.isMultiTenant").value(true))
                .andExpect(jsonPath("$.data.token").doesNotExist())
                .andExpect(jsonPath("$.data.tenants.length()").value(2))
                .andExpect(jsonPath("$.data.tenants[1].code").value("DEF456"));
    }

    @Test
    @DisplayName("a rejected login keeps the service status")
    void invalidCredentials() throws Exception {
        when(authService.login(any(LoginRequest.class)))
                .thenReturn(ApiResponse.failure(HttpStatus.UNAUTHORIZED, "Invalid email or password"));

        mockMvc.perform(post("/api/auth/login")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"jane@abc.com\",\"password\":\"wrong-one\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    @DisplayName("signup without a clinic name never reaches the service")
    void signupValidation() throws Exception {
        mockMvc.perform(post("/api/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"owner@abc.com\",\"password\":\"secret12\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.data.tenantName").exists());

        verifyNoInteractions(authService);
    }

    @Test
    @DisplayName("a successful signup answers 201")
    void signupCreated() throws Exception {
        when(authService.signup(any(SignupRequest.class)))
                .thenReturn(ApiResponse.created(null, "Signup successful. Please log in to continue."));

        mockMvc.perform(post("/api/auth/signup")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"email\":\"owner@abc.com\",\"password\":\"secret12\",\"name\":\"Clinic Owner\",\"tenantName\":\"ABC Clinic\"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.message").value("Signup successful. Please log in to continue."));
    }
}
