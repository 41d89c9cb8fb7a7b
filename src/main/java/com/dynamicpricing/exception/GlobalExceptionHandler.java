package com.dynamicpricing.exception;

import com.dynamicpricing.api.dto.response.ApiErrorResponse;
import com.dynamicpricing.domain.enums.MetricField;
import com.fasterxml.jackson.databind.exc.InvalidFormatException;
import jakarta.servlet.http.HttpServletRequest;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

/**
 * Maps failures of the REST API to {@link ApiErrorResponse}.
 *
 * <ul>
 *   <li>Scenario input errors keep their own code (INVALID_ENTITY, INVALID_EFFECT_TYPE,
 *       INVALID_DURATION) and name the rejected city, effect or duration in {@code details}</li>
 *   <li>An effect key that is not a metric is reported as INVALID_EFFECT_TYPE, not as a
 *       malformed body</li>
 *   <li>Bean validation and parameter conversion failures name the offending field</li>
 * </ul>
 */
@RestControllerAdvice
public class GlobalExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(GlobalExceptionHandler.class);

    @ExceptionHandler({InvalidEntityException.class, InvalidEffectTypeException.class, InvalidDurationException.class})
    public ResponseEntity<ApiErrorResponse> handleScenarioInput(BaseException ex, HttpServletRequest request) {
        log.warn("Rejected scenario request {}: {} {}", request.getRequestURI(), ex.getMessage(), ex.getDetails());
        return buildResponse(ex.getErrorCode(), ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiErrorResponse> handleValidation(
            MethodArgumentNotValidException ex, HttpServletRequest request) {
        Map<String, Object> details = new LinkedHashMap<>();
        ex.getBindingResult()
                .getFieldErrors()
                .forEach(error -> details.putIfAbsent(error.getField(), error.getDefaultMessage()));
        return buildResponse(ErrorCode.VALIDATION_ERROR, "Validation failed", details, request);
    }

    @ExceptionHandler(HttpMessageNotReadableException.class)
    public ResponseEntity<ApiErrorResponse> handleUnreadable(
            HttpMessageNotReadableException ex, HttpServletRequest request) {
        InvalidFormatException invalidFormat = findInvalidFormat(ex);
        if (invalidFormat != null && invalidFormat.getTargetType() == MetricField.class) {
            String effect = String.valueOf(invalidFormat.getValue());
            log.warn("Rejected scenario request {}: unknown effect {}", request.getRequestURI(), effect);
            return buildResponse(
                    ErrorCode.INVALID_EFFECT_TYPE,
                    "Unknown effect: " + effect + ", expected one of " + Arrays.toString(MetricField.values()),
                    Map.of("effect", effect),
                    request);
        }
        return buildResponse(ErrorCode.BAD_REQUEST, "Malformed request body", null, request);
    }

    @ExceptionHandler(MethodArgumentTypeMismatchException.class)
    public ResponseEntity<ApiErrorResponse> handleTypeMismatch(
            MethodArgumentTypeMismatchException ex, HttpServletRequest request) {
        return buildResponse(
                ErrorCode.BAD_REQUEST,
                "Invalid value for parameter '" + ex.getName() + "'",
                Map.of(ex.getName(), String.valueOf(ex.getValue())),
                request);
    }

    @ExceptionHandler(BaseException.class)
    public ResponseEntity<ApiErrorResponse> handleBase(BaseException ex, HttpServletRequest request) {
        ErrorCode errorCode = ex.getErrorCode();
        if (errorCode.getHttpStatus() >= 500) {
            log.error("Server error: {}", ex.getMessage(), ex);
        } else {
            log.warn("Client error: {}", ex.getMessage());
        }
        return buildResponse(errorCode, ex.getMessage(), ex.getDetails(), request);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiErrorResponse> handleGeneric(Exception ex, HttpServletRequest request) {
        log.error("Unexpected error", ex);
        return buildResponse(ErrorCode.INTERNAL_ERROR, "An unexpected error occurred", null, request);
    }

    private static InvalidFormatException findInvalidFormat(Throwable ex) {
        for (Throwable cause = ex; cause != null; cause = cause.getCause()) {
            if (cause instanceof InvalidFormatException invalidFormat) {
                return invalidFormat;
            }
        }
        return null;
    }

    private static ResponseEntity<ApiErrorResponse> buildResponse(
            ErrorCode errorCode, String message, Map<String, Object> details, HttpServletRequest request) {
        ApiErrorResponse response = ApiErrorResponse.of(errorCode, message, details, request.getRequestURI());
        return ResponseEntity.status(errorCode.getHttpStatus()).body(response);
    }
}
