package com.premiergroup.ad_autopilot.exception;

import com.premiergroup.ad_autopilot.enums.ErrorCode;

/**
 * Business-rule rejection by the platform. The message is the platform's own and is surfaced verbatim.
 */
public class ExternalRejectedException extends ExternalApiException {

    public ExternalRejectedException(String message, Throwable cause) {
        super(message, cause);
    }

    public ExternalRejectedException(String message) {
        this(message, null);
    }

    @Override
    public ErrorCode getErrorCode() {
        return ErrorCode.EXTERNAL_REJECTED;
    }
}
