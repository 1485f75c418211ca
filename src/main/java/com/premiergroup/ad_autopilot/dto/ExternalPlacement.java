package com.premiergroup.ad_autopilot.dto;

public record ExternalPlacement(String id, String name, String campaignId, String status) {

    public boolean isPaused() {
        return "PAUSED".equalsIgnoreCase(status);
    }
}
