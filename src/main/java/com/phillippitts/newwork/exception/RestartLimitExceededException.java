package com.phillippitts.newwork.exception;

import java.time.Duration;

/**
 * User-facing fault raised when automatic restarts are exhausted for the current window.
 */
public class RestartLimitExceededException extends NewWorkException {

    private final int maxAttempts;
    private final Duration waitTime;

    public RestartLimitExceededException(int maxAttempts, Duration waitTime) {
        super("Automatic recovery limit reached (" + maxAttempts + " attempts); manual restart required"
                + (waitTime.isZero() ? "" : ", automatic recovery resumes in " + waitTime.toSeconds() + "s"));
        this.maxAttempts = maxAttempts;
        this.waitTime = waitTime;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getWaitTime() {
        return waitTime;
    }
}
