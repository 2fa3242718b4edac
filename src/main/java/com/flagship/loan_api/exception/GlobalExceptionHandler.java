package com.flagship.loan_api.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.HttpMediaTypeNotSupportedException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;

import java.time.Instant;
import java.util.List;

/**
 * Translates failures to REST error responses.
 */
@RestControllerAdvice
@Slf4j
public class GlobalExceptionHandler {

    @ExceptionHandler(LoanApiException.class)
    public ResponseEntity<ApiError> handleLoanApiException(LoanApiException e) {
        log.warn("Request rejected: code={}, error={}", e.getCode(), e.getMessage());

        List<String> fields = e.getFields().isEmpty() ? null : e.getFields();
        return respond(e.getCode().getStatus(), e.getCode(), e.getMessage(), fields);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, HttpMediaTypeNotSupportedException.class})
    public ResponseEntity<ApiError> handleUnreadableBody(Exception e) {
        log.warn("Malformed request body: {}", e.getMessage());
        return respond(ErrorCode.MALFORMED_REQUEST.getStatus(), ErrorCode.MALFORMED_REQUEST,
                "Request body must be valid JSON", null);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleGenericException(Exception e) {
        // Framework errors (unknown path, wrong method) keep their own status
        if (e instanceof ErrorResponse framework && !framework.getStatusCode().is5xxServerError()) {
            log.warn("Request failed: status={}, error={}", framework.getStatusCode(), e.getMessage());
            return respond(framework.getStatusCode(), null, e.getMessage(), null);
        }

        log.error("Unexpected error", e);
        String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
        return respond(ErrorCode.INTERNAL_FAILURE.getStatus(), ErrorCode.INTERNAL_FAILURE, message, null);
    }

    private ResponseEntity<ApiError> respond(HttpStatusCode status, ErrorCode code,
                                             String message, List<String> fields) {
        ApiError error = ApiError.builder()
            .error(message)
            .code(code)
            .fields(fields)
            .timestamp(Instant.now())
            .build();
        return ResponseEntity.status(status).body(error);
    }
}
