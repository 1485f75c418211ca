package com.premiergroup.ad_autopilot.dto;

import jakarta.validation.constraints.NotBlank;

public record LinkPlacementRequest(@NotBlank String externalPlacementId) {
}
