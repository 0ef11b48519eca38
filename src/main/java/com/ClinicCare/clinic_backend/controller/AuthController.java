package com.ClinicCare.clinic_backend.controller;

import com.ClinicCare.clinic_backend.dto.request.LoginRequest;
import com.ClinicCare.clinic_backend.dto.request.SignupRequest;
import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.dto.response.LoginResponse;
import com.ClinicCare.clinic_backend.dto.response.SignupResponse;
import com.ClinicCare.clinic_backend.service.AuthService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

@RestController
@RequestMapping("/api/auth")
@RequiredArgsConstructor
public class AuthController {

    private final AuthService authService;

    @PostMapping("/signup")
    public ResponseEntity<ApiResponse<SignupResponse>> signup(@Valid @RequestBody SignupRequest request) {
        ApiResponse<SignupResponse> result = authService.signup(request);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }

    @PostMapping("/login")
    public ResponseEntity<ApiResponse<LoginResponse>> login(@Valid @RequestBody LoginRequest request) {
        ApiResponse<LoginResponse> result = authService.login(request);
        return ResponseEntity.status(result.getStatusCode()).body(result);
    }
}
