package com.cadence.domain;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.EnumSet;
import java.util.Set;

/**
 * Authentication state of one live session.
 * The allowed edges are fixed here; {@link #LOCKED} has none.
 */
public enum SessionState {

    /**
     * Collecting calibration data, no trust decision yet
     */
    CALIBRATING("calibrating"),

    /**
     * Live behavior matches the profile
     */
    TRUSTED("trusted"),

    /**
     * Behavior deviates, waiting for recovery or lock
     */
    SUSPICIOUS("suspicious"),

    /**
     * Terminal for the session, primary re-authentication required
     */
    LOCKED("locked");

    private final String value;

    SessionState(String value) {
        this.value = value;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    public Set<SessionState> successors() {
        switch (this) {
            case CALIBRATING:
                return EnumSet.of(TRUSTED);
            case TRUSTED:
                return EnumSet.of(SUSPICIOUS);
            case SUSPICIOUS:
                return EnumSet.of(TRUSTED, LOCKED);
            default:
                return EnumSet.noneOf(SessionState.class);
        }
    }

    public boolean canTransitionTo(SessionState target) {
        return successors().contains(target);
    }

    public boolean isTerminal() {
        return successors().isEmpty();
    }
}
