package com.labassist.entity;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum RequestPriority {

    NORMAL,
    HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static RequestPriority fromValue(String value) {
        if (value == null) {
            return null;
        }
        for (RequestPriority priority : values()) {
            if (priority.value().equals(value)) {
                return priority;
            }
        }
        throw new IllegalArgumentException("Unknown priority: " + value);
    }
}
