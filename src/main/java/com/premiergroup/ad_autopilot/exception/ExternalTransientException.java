package com.premiergroup.ad_autopilot.exception;

import com.premiergroup.ad_autopilot.enums.ErrorCode;

/**
 * Network failure, rate limit or platform-side internal error. Safe to retry.
 */
public class ExternalTransientException extends ExternalApiException {

    public ExternalTransientException(String message, Throwable cause) {
        super(message, cause);
    }

    public ExternalTransientException(String message) {
        this(message, null);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.EXTERNAL_TRANSIENT;
    }
}
