package com.ClinicCare.clinic_backend.exception;

import org.springframework.http.HttpStatus;

/**
 * Raised for missing rows, soft-deleted rows and rows owned by another tenant alike.
 */
public class ResourceNotFoundException extends ApiException {
    public ResourceNotFoundException(String message) {
        super(message, HttpStatus.NOT_FOUND, "NOT_FOUND");
    }
}
