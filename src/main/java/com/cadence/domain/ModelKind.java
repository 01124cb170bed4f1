package com.cadence.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The six scoring model families of the ensemble.
 */
public enum ModelKind {

    SEQUENCE("sequence"),

    RECONSTRUCTION("reconstruction"),

    BOUNDARY("boundary"),

    NEAREST_NEIGHBOR("nearest_neighbor"),

    ONLINE_LINEAR("online_linear"),

    ISOLATION("isolation");

    private final String value;

    ModelKind(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public static ModelKind fromValue(String value) {
        for (ModelKind kind : ModelKind.values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown ModelKind value: " + value);
    }
}
