package com.dynamicpricing.exception;

import java.time.Duration;
import java.util.Map;

public class InvalidDurationException extends BaseException {

    public InvalidDurationException(Duration duration) {
        super(
                ErrorCode.INVALID_DURATION,
                "Scenario duration must be positive",
                Map.of("duration", String.valueOf(duration)));
    }
}
