package com.dynamicpricing.exception;

import java.util.Map;

/** Snapshot query for a city that is not simulated or has not been priced yet. */
public class CityNotFoundException extends BaseException {

    public CityNotFoundException(String city) {
        super(ErrorCode.NOT_FOUND, "No pricing state for city: " + city, Map.of("city", city));
    }
}
