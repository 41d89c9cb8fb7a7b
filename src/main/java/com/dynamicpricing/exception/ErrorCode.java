package com.dynamicpricing.exception;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ErrorCode {
    VALIDATION_ERROR("VALIDATION_ERROR", 400),
    BAD_REQUEST("BAD_REQUEST", 400),
    INVALID_ENTITY("INVALID_ENTITY", 400),
    INVALID_EFFECT_TYPE("INVALID_EFFECT_TYPE", 400),
    INVALID_DURATION("INVALID_DURATION", 400),
    NOT_FOUND("NOT_FOUND", 404),
    INTERNAL_ERROR("INTERNAL_ERROR", 500),
    SCORING_ERROR("SCORING_ERROR", 502);

    private final String code;
    private final int httpStatus;
}
