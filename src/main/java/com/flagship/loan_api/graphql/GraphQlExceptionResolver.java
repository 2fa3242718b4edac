package com.flagship.loan_api.graphql;

import com.flagship.loan_api.exception.ErrorCode;
import com.flagship.loan_api.exception.LoanApiException;
import graphql.GraphQLError;
import graphql.GraphqlErrorBuilder;
import graphql.schema.DataFetchingEnvironment;
import lombok.extern.slf4j.Slf4j;
import org.springframework.graphql.execution.DataFetcherExceptionResolverAdapter;
import org.springframework.graphql.execution.ErrorType;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Translates failures raised by data fetchers into GraphQL errors.
 *
 * Each error carries {@code extensions.code} with the {@link ErrorCode} name,
 * so clients can tell a missing loan from a rejected input, and
 * {@code extensions.fields} when the failure concerns specific input fields.
 */
@Component
@Slf4j
public class GraphQlExceptionResolver extends DataFetcherExceptionResolverAdapter {

    static final String CODE_EXTENSION = "code";
    static final String FIELDS_EXTENSION = "fields";

    @Override
    protected GraphQLError resolveToSingleError(Throwable ex, DataFetchingEnvironment env) {
        if (ex instanceof LoanApiException apiException) {
            log.warn("GraphQL request rejected: field={}, code={}, error={}",
                    env.getField().getName(), apiException.getCode(), apiException.getMessage());
            return buildError(env, apiException.getCode(), apiException.getMessage(), apiException.getFields());
        }

        log.error("Unexpected error in GraphQL field {}", env.getField().getName(), ex);
        String message = ex.getMessage() != null ? ex.getMessage() : ex.getClass().getSimpleName();
        return buildError(env, ErrorCode.INTERNAL_FAILURE, message, List.of());
    }

    private GraphQLError buildError(DataFetchingEnvironment env, ErrorCode code,
                                    String message, List<String> fields) {
        Map<String, Object> extensions = new LinkedHashMap<>();
        extensions.put(CODE_EXTENSION, code.name());
        if (!fields.isEmpty()) {
            extensions.put(FIELDS_EXTENSION, fields);
        }
        return GraphqlErrorBuilder.newError(env)
            .errorType(toErrorType(code))
            .message(message)
            .extensions(extensions)
            .build();
    }

    private ErrorType toErrorType(ErrorCode code) {
        return switch (code) {
            case LOAN_NOT_FOUND -> ErrorType.NOT_FOUND;
            case INTERNAL_FAILURE -> ErrorType.INTERNAL_ERROR;
            case MISSING_FIELD, MALFORMED_REQUEST, INVALID_TYPE, INVALID_FORMAT -> ErrorType.BAD_REQUEST;
        };
    }
}
