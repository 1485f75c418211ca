package com.premiergroup.ad_autopilot.enums;

public enum ErrorCode {
    /** Malformed or unresolvable mutation, never sent to the external API. */
    VALIDATION_ERROR,
    /** The directive has no Idle placement left. */
    RESOURCE_EXHAUSTED,
    EXTERNAL_TRANSIENT,
    EXTERNAL_REJECTED,
    /** The call timed out; the external side effect may or may not have happened. */
    TIMEOUT,
    UNKNOWN
}
