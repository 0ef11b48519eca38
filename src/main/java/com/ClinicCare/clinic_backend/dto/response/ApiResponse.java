package com.ClinicCare.clinic_backend.dto.response;

import com.ClinicCare.clinic_backend.exception.ApiException;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.http.HttpStatus;

/**
 * Envelope returned by every service operation, successful or not. Controllers copy
 * {@link #statusCode} onto the HTTP response.
 *
 * @param <T> payload type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {
    private boolean success;
    private int statusCode;
    private String message;
    private T data;

    // Diagnostic detail for internal failures only
    private String error;

    public static <T> ApiResponse<T> success(T data, String message) {
        return of(HttpStatus.OK, data, message);
    }

    public static <T> ApiResponse<T> created(T data, String message) {
        return of(HttpStatus.CREATED, data, message);
    }

    public static <T> ApiResponse<T> of(HttpStatus status, T data, String message) {
        return ApiResponse.<T>builder()
                .success(true)
                .statusCode(status.value())
                .message(message)
                .data(data)
                .build();
    }

    public static <T> ApiResponse<T> failure(HttpStatus status, String message) {
        return ApiResponse.<T>builder()
                .success(false)
                .statusCode(status.value())
                .message(message)
                .build();
    }

    public static <T> ApiResponse<T> failure(ApiException ex) {
        return failure(ex.getStatus(), ex.getMessage());
    }

    public static <T> ApiResponse<T> internalError(String message, Throwable cause) {
        return ApiResponse.<T>builder()
                .success(false)
                .statusCode(HttpStatus.INTERNAL_SERVER_ERROR.value())
                .message(message)
                .error(cause.getMessage())
                .build();
    }
}
