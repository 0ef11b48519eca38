package com.ClinicCare.clinic_backend.exception;

/**
 * The storage layer rejected a freshly drawn tenant code because a concurrent signup claimed it first.
 * Signup retries with a new code when it sees this.
 */
public class TenantCodeCollisionException extends RuntimeException {
    public TenantCodeCollisionException(String code, Throwable cause) {
        super("Tenant code already taken: " + code, cause);
    }
}
