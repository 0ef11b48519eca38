package com.ClinicCare.clinic_backend.exception;

import lombok.Getter;
import org.springframework.http.HttpStatus;

/**
 * Expected business failure. Services raise it from their guard steps and turn it into a failure
 * {@link com.ClinicCare.clinic_backend.dto.response.ApiResponse} at the operation boundary.
 */
@Getter
public class ApiException extends RuntimeException {
    private final HttpStatus status;
    private final String errorCode;

    public ApiException(String message, HttpStatus status) {
        this(message, status, status.name());
    }

    public ApiException(String message, HttpStatus status, String errorCode) {
        super(message);
        this.status = status;
        this.errorCode = errorCode;
    }
}
