package com.flagship.loan_api.exception;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;
import java.util.List;

/**
 * Error body returned by REST endpoints: {"error": "&lt;message&gt;", "code": ...}.
 */
@Value
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ApiError {
    String error;
    ErrorCode code;
    List<String> fields;
    Instant timestamp;
}
