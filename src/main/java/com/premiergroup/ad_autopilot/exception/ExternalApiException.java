package com.premiergroup.ad_autopilot.exception;

import com.premiergroup.ad_autopilot.enums.ErrorCode;

/**
 * Failure reported by, or while talking to, the ad platform.
 */
public abstract class ExternalApiException extends RuntimeException {

    protected ExternalApiException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ErrorCode getErrorCode();
}
