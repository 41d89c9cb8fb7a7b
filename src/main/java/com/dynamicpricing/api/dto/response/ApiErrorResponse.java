package com.dynamicpricing.api.dto.response;

import com.dynamicpricing.exception.ErrorCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import java.time.Instant;
import java.util.Map;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Value;

/**
 * Error envelope of the REST API: {@code {success: false, error: {code, status, message,
 * details, path, timestamp}}}.
 *
 * <p>{@code details} names the rejected input ({@code city}, {@code effect}, {@code duration},
 * a request field or parameter) and is omitted when there is none.
 */
@Value
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class ApiErrorResponse {

    boolean success;
    ErrorDetail error;

    public static ApiErrorResponse of(ErrorCode errorCode, String message, Map<String, Object> details, String path) {
        Map<String, Object> nonEmptyDetails = details == null || details.isEmpty() ? null : details;
        ErrorDetail error = new ErrorDetail(
                errorCode.getCode(), errorCode.getHttpStatus(), message, nonEmptyDetails, path, Instant.now());
        return new ApiErrorResponse(false, error);
    }

    @Value
    public static class ErrorDetail {
        String code;
        int status;
        String message;

        @JsonInclude(JsonInclude.Include.NON_NULL)
        Map<String, Object> details;

        String path;
        Instant timestamp;
    }
}
