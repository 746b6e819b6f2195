package com.lihtcmate.backend.global.error;

import java.time.Duration;

import org.springframework.http.HttpStatus;

/**
 * A problem the client may retry unchanged, such as a finalize racing another one on the same property.
 * Rendered with a {@code Retry-After} header in whole seconds.
 */
public class RetryableProblemException extends ProblemException {

    private final Duration retryAfter;

    public RetryableProblemException(HttpStatus status, String code, String detail, Duration retryAfter) {
        super(status, code, detail);
        if (retryAfter == null || retryAfter.isNegative()) {
            throw new IllegalArgumentException("retryAfter must be zero or positive");
        }
        this.retryAfter = retryAfter;
    }

    public long getRetryAfterSeconds() {
        // partial seconds round up
        long seconds = retryAfter.getSeconds();
        return retryAfter.getNano() > 0 ? seconds + 1 : seconds;
    }
}
