package com.premiergroup.ad_autopilot.exception;

import com.premiergroup.ad_autopilot.enums.ErrorCode;
import lombok.Getter;

@Getter
public class MutationValidationException extends RuntimeException {

    private final ErrorCode errorCode;

    public MutationValidationException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public MutationValidationException(String message) {
        this(ErrorCode.VALIDATION_ERROR, message);
    }
}
