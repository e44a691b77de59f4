package com.punchclock.backend.modules.attendance.application;

import com.punchclock.backend.global.error.RetryableProblemException;

import org.springframework.http.HttpStatus;

/**
 * The unit of work behind a clock transition could not begin or commit. It has been rolled back,
 * so the caller may retry.
 */
public class ClockTransitionException extends RetryableProblemException {

    public static final String CODE = "CLOCK_TRANSITION_FAILED";
    private static final int RETRY_AFTER_SECONDS = 1;

    private final Long uid;
    private final String step;

    public ClockTransitionException(String step, String transition, Long uid, Throwable cause) {
        super(HttpStatus.SERVICE_UNAVAILABLE, CODE, "failed to " + step + " " + transition + " for uid " + uid,
                RETRY_AFTER_SECONDS, cause);
        this.uid = uid;
        this.step = step;
    }

    public Long getUid() {
        return uid;
    }

    public String getStep() {
        return step;
    }
}
