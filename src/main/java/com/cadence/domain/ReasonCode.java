package com.cadence.domain;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Human-readable reason attached to every decision event.
 */
public enum ReasonCode {

    CALIBRATING("calibrating"),
    CALIBRATION_COMPLETE("calibration-complete"),
    CALIBRATION_DEGRADED("calibration-degraded"),
    PROFILES_RESTORED("profiles-restored"),
    PROFILE_LOAD_FAILED("profile-load-failed"),
    GENUINE("genuine"),
    LOW_CONFIDENCE("low-confidence"),
    NO_MODELS_AVAILABLE("no-models-available"),
    CONSECUTIVE_LOW_CONFIDENCE("consecutive-low-confidence"),
    SEVERE_ANOMALY("severe-anomaly"),
    DRIFT_WITH_LOW_CONFIDENCE("drift-with-low-confidence"),
    RECOVERING("recovering"),
    RECOVERY_BLOCKED_BY_DRIFT("recovery-blocked-by-drift"),
    RECOVERED("recovered"),
    ANOMALY_PERSISTED("anomaly-persisted"),
    SUSPICIOUS_TIMEOUT("suspicious-timeout"),
    RECALIBRATION_STARTED("recalibration-started"),
    SESSION_LOCKED("session-locked");

    private final String code;

    ReasonCode(String code) {
        this.code = code;
    }

    @JsonValue
    public String getCode() {
        return code;
    }

    @Override
    public String toString() {
        return code;
    }
}
