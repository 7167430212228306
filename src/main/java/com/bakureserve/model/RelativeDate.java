package com.bakureserve.model;

import com.fasterxml.jackson.annotation.JsonValue;

public enum RelativeDate {
    TODAY("today"),
    TOMORROW("tomorrow");

    private final String value;

    RelativeDate(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
