package com.cadence.profile;

import java.time.Duration;

/**
 * Raised when the profile lock of a user cannot be acquired within the configured timeout.
 */
public class ProfileLockTimeoutException extends RuntimeException {

    private final String userId;
    private final Duration timeout;
    private final boolean exclusive;

    public ProfileLockTimeoutException(String userId, Duration timeout, boolean exclusive) {
        super("Timed out after " + timeout.toMillis() + "ms waiting for the "
            + (exclusive ? "write" : "read") + " lock of user " + userId);
        this.userId = userId;
        this.timeout = timeout;
        this.exclusive = exclusive;
    }

    public String getUserId() {
        return userId;
    }

    public Duration getTimeout() {
        return timeout;
    }

    public boolean isExclusive() {
        return exclusive;
    }
}
