package com.premiergroup.ad_autopilot.dto;

public record AdCreationRequest(
        String placementId,
        String creativeRef,
        boolean enabled
) {
}
