package com.intelcompliance.domain.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum DetectionMethod {
    AUTOMATED("automated"),
    MANUAL("manual");

    private final String value;

    DetectionMethod(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    @JsonCreator
    public static DetectionMethod fromValue(String value) {
        if (value == null) {
            return null;
        }
        return DetectionMethod.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
