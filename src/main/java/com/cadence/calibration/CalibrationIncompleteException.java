package com.cadence.calibration;

import java.time.Duration;

/**
 * Raised when calibration is attempted before enough genuine data has been collected.
 */
public class CalibrationIncompleteException extends RuntimeException {

    private final String userId;
    private final Duration covered;
    private final Duration required;
    private final int windowCount;
    private final int requiredWindows;

    public CalibrationIncompleteException(String userId, Duration covered, Duration required,
                                          int windowCount, int requiredWindows) {
        super("Calibration data incomplete");
        this.userId = userId;
        this.covered = covered;
        this.required = required;
        this.windowCount = windowCount;
        this.requiredWindows = requiredWindows;
    }

    public String getUserId() {
        return userId;
    }

    public Duration getCovered() {
        return covered;
    }

    public Duration getRequired() {
        return required;
    }

    public int getWindowCount() {
        return windowCount;
    }

    public int getRequiredWindows() {
        return requiredWindows;
    }

    @Override
    public String getMessage() {
        return super.getMessage() + " for user " + userId + ": " + covered.getSeconds() + "s of "
            + required.getSeconds() + "s covered, " + windowCount + " of " + requiredWindows + " windows";
    }
}
