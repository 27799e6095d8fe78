package com.micronote.backend.modules.todo.domain;

import java.util.Arrays;
import java.util.Locale;

import com.fasterxml.jackson.annotation.JsonValue;

public enum TodoPriority {
    LOW,
    MEDIUM,
    HIGH;

    @JsonValue
    public String value() {
        return name().toLowerCase(Locale.ROOT);
    }

    public static TodoPriority fromValue(String value) {
        return Arrays.stream(values())
                .filter(priority -> priority.value().equalsIgnoreCase(value.trim()))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown priority: " + value));
    }
}
