package com.lynkvertx.navarch.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Envelope for every API response, successful or not.
 * Computation endpoints put their result in {@code data}; errors carry
 * the HTTP status in {@code code} and, for validation failures, a field map in {@code data}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiResponse<T> {

    /**
     * HTTP status of the response
     */
    private int code;

    /**
     * Outcome message, or the error description
     */
    private String message;

    /**
     * Result payload, or the field-to-message map of a failed validation
     */
    private T data;

    /**
     * Instant the response was built, in ISO 8601 format
     */
    private String timestamp;

    /**
     * Create a successful response with data
     */
    public static <T> ApiResponse<T> success(T data) {
        return success("success", data);
    }

    /**
     * Create a successful response with a custom message
     */
    public static <T> ApiResponse<T> success(String message, T data) {
        return ApiResponse.<T>builder()
            .code(200)
            .message(message)
            .data(data)
            .timestamp(Instant.now().toString())
            .build();
    }

    /**
     * Create an error response
     */
    public static <T> ApiResponse<T> error(int code, String message) {
        return error(code, message, null);
    }

    /**
     * Error with a payload, e.g. the field-to-message map of a failed validation
     */
    public static <T> ApiResponse<T> error(int code, String message, T data) {
        return ApiResponse.<T>builder()
            .code(code)
            .message(message)
            .data(data)
            .timestamp(Instant.now().toString())
            .build();
    }
}
