package com.premiergroup.ad_autopilot.exception;

public class BatchInProgressException extends IllegalStateException {

    public BatchInProgressException(String idempotencyKey) {
        super("Batch " + idempotencyKey + " is still being executed by another caller");
    }
}
