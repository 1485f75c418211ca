package com.premiergroup.ad_autopilot.enums;

/**
 * Objective of a directive. The objective decides whether a contact endpoint
 * is attached to new ads.
 */
public enum ObjectiveType {

    MESSAGES(EndpointPolicy.OPTIONAL),
    CALLS(EndpointPolicy.REQUIRED),
    WEBSITE_TRAFFIC(EndpointPolicy.NONE),
    LEAD_FORM(EndpointPolicy.NONE);

    private final EndpointPolicy endpointPolicy;

    ObjectiveType(EndpointPolicy endpointPolicy) {
        this.endpointPolicy = endpointPolicy;
    }

    public EndpointPolicy getEndpointPolicy() {
        return endpointPolicy;
    }

    public boolean usesEndpoint() {
        return endpointPolicy != EndpointPolicy.NONE;
    }

    public enum EndpointPolicy {
        /** A launch without an endpoint is rejected. */
        REQUIRED,
        /** Missing endpoint is omitted; the platform applies its own default. */
        OPTIONAL,
        NONE
    }
}
