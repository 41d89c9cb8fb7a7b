package com.dynamicpricing.exception;

import java.util.Map;

/**
 * Scenario request has an unknown event type, or an effect set that is empty or
 * carries a value the metric cannot take.
 *
 * <p>{@code details} names the rejected input: {@code eventType}, or {@code effect}
 * with the offending {@code value}.
 */
public class InvalidEffectTypeException extends BaseException {

    public InvalidEffectTypeException(String message) {
        super(ErrorCode.INVALID_EFFECT_TYPE, message);
    }

    public InvalidEffectTypeException(String message, Map<String, Object> details) {
        super(ErrorCode.INVALID_EFFECT_TYPE, message, details);
    }

    public static InvalidEffectTypeException unknownEventType(String eventType) {
        return new InvalidEffectTypeException(
                "Invalid event type: " + eventType, Map.of("eventType", String.valueOf(eventType)));
    }

    public static InvalidEffectTypeException invalidEffect(Object effect, Object value, String reason) {
        return new InvalidEffectTypeException(
                reason, Map.of("effect", String.valueOf(effect), "value", String.valueOf(value)));
    }
}
