package com.cadence.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Input device family a behavioral event or feature belongs to.
 */
public enum Modality {

    KEYSTROKE("keystroke"),

    MOUSE("mouse");

    private final String value;

    Modality(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }
}
