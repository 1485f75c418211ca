package com.premiergroup.ad_autopilot.dto;

import com.premiergroup.ad_autopilot.entity.Placement;
import com.premiergroup.ad_autopilot.enums.PlacementStatus;

import java.time.Instant;

public record PlacementView(
        Long id,
        String externalId,
        String name,
        PlacementStatus status,
        String externalStatus,
        long usageCount,
        Instant lastUsedAt,
        Instant linkedAt
) {

    public static PlacementView of(Placement p) {
        return new PlacementView(p.getId(), p.getExternalId(), p.getName(), p.getStatus(),
                p.getExternalStatus(), p.getUsageCount(), p.getLastUsedAt(), p.getLinkedAt());
    }
}
