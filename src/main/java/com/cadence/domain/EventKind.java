package com.cadence.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kind of raw input event delivered by the transport layer.
 */
public enum EventKind {

    /**
     * Key press and release of a single key
     */
    KEYSTROKE("keystroke", Modality.KEYSTROKE),

    /**
     * Pointer position sample
     */
    MOUSE_MOVE("mouse_move", Modality.MOUSE),

    /**
     * Pointer button press and release
     */
    MOUSE_CLICK("mouse_click", Modality.MOUSE),

    /**
     * Wheel or touchpad scroll
     */
    SCROLL("scroll", Modality.MOUSE);

    private final String value;
    private final Modality modality;

    EventKind(String value, Modality modality) {
        this.value = value;
        this.modality = modality;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Modality getModality() {
        return modality;
    }

    /**
     * Parse a string value to EventKind
     */
    public static EventKind fromValue(String value) {
        for (EventKind kind : EventKind.values()) {
            if (kind.value.equalsIgnoreCase(value)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown EventKind value: " + value);
    }
}
