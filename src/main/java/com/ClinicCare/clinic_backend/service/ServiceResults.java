package com.ClinicCare.clinic_backend.service;

import com.ClinicCare.clinic_backend.dto.response.ApiResponse;
import com.ClinicCare.clinic_backend.exception.ApiException;
import org.slf4j.Logger;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.http.HttpStatus;
import org.springframework.transaction.TransactionException;

import java.util.function.Supplier;

/**
 * Operation boundary shared by the services: guard failures become their own status, constraint violations
 * become 409 and storage failures become 500 with the cause attached. Nothing else is caught.
 */
final class ServiceResults {

    private ServiceResults() {
    }

    static <T> ApiResponse<T> run(Logger log, String failureMessage, Supplier<ApiResponse<T>> work) {
        try {
            return work.get();
        } catch (ApiException e) {
            return ApiResponse.failure(e);
        } catch (DataIntegrityViolationException e) {
            log.warn("{}: constraint violation: {}", failureMessage, e.getMostSpecificCause().getMessage());
            return ApiResponse.failure(HttpStatus.CONFLICT, "Record conflicts with existing data");
        } catch (DataAccessException | TransactionException e) {
            log.error("{}: {}", failureMessage, e.getMessage(), e);
            return ApiResponse.internalError(failureMessage, e);
        }
    }
}
