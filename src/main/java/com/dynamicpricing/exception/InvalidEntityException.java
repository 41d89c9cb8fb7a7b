package com.dynamicpricing.exception;

import java.util.Map;

/** Scenario request names a city that is not part of the simulation. */
public class InvalidEntityException extends BaseException {

    public InvalidEntityException(String entityId) {
        super(ErrorCode.INVALID_ENTITY, "Invalid city: " + entityId, details(entityId));
    }

    private static Map<String, Object> details(String entityId) {
        return entityId != null ? Map.of("city", entityId) : Map.of();
    }
}
