package com.premiergroup.ad_autopilot.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record ContactEndpointRequest(
        @NotBlank @Size(max = 64) String value,
        String label,
        boolean isDefault
) {
}
