package com.micronote.backend.global.web;

import java.util.List;

import com.fasterxml.jackson.annotation.JsonInclude;

/**
 * Response envelope shared by every endpoint. {@code success} tags the variant: ok responses
 * carry {@code data}, error responses carry {@code code} and optionally field level {@code errors}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ApiResponse<T>(
        boolean success,
        String message,
        T data,
        String code,
        List<FieldViolation> errors
) {

    public static <T> ApiResponse<T> ok(T data) {
        return new ApiResponse<>(true, null, data, null, null);
    }

    public static <T> ApiResponse<T> ok(String message, T data) {
        return new ApiResponse<>(true, message, data, null, null);
    }

    public static ApiResponse<Void> ok(String message) {
        return new ApiResponse<>(true, message, null, null, null);
    }

    public static ApiResponse<Void> error(String message, String code) {
        return new ApiResponse<>(false, message, null, code, null);
    }

    public static ApiResponse<Void> error(String message, String code, List<FieldViolation> errors) {
        return new ApiResponse<>(false, message, null, code, errors);
    }

    public record FieldViolation(String field, String message) {
    }
}
