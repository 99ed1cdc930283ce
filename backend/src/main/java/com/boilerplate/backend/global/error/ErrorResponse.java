package com.boilerplate.backend.global.error;

import com.fasterxml.jackson.annotation.JsonInclude;

import org.springframework.http.HttpStatus;

/**
 * JSON error body shared by the request gate and the controllers: {@code {"error": ..., "code": ...}}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ErrorResponse(String error, String code) {

    public static ErrorResponse of(HttpStatus status, String code, String message) {
        String safeCode = (code != null && !code.isBlank()) ? code : status.name();
        String safeMessage = (message != null && !message.isBlank()) ? message : status.getReasonPhrase();
        return new ErrorResponse(safeMessage, safeCode);
    }
}
