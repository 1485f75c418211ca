package com.premiergroup.ad_autopilot.exception;

import com.premiergroup.ad_autopilot.enums.ErrorCode;

/**
 * The call did not answer in time. Whether the side effect happened is unknown,
 * so this is never retried automatically.
 */
public class ExternalTimeoutException extends ExternalApiException {

    public ExternalTimeoutException(String message, Throwable cause) {
        super(message, cause);
    }

    public ExternalTimeoutException(String message) {
        this(message, null);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.TIMEOUT;
    }
}
