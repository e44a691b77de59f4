package com.punchclock.backend.global.error;

import org.springframework.http.HttpStatus;

/**
 * A problem the caller may retry unchanged; rendered with a {@code Retry-After} header.
 */
public class RetryableProblemException extends ProblemException {

    private final int retryAfterSeconds;

    public RetryableProblemException(HttpStatus status, String code, String detail, int retryAfterSeconds, Throwable cause) {
        super(status, code, detail, cause);
        if (retryAfterSeconds < 0) {
            throw new IllegalArgumentException("retryAfterSeconds must be >= 0");
        }
        this.retryAfterSeconds = retryAfterSeconds;
    }

    public int getRetryAfterSeconds() {
        return retryAfterSeconds;
    }
}
