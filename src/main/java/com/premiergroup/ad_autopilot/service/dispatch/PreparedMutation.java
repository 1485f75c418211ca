package com.premiergroup.ad_autopilot.service.dispatch;

import com.premiergroup.ad_autopilot.dto.PlacementSettings;
import com.premiergroup.ad_autopilot.entity.Placement;
import com.premiergroup.ad_autopilot.enums.MutationType;
import lombok.Builder;

import java.util.List;

/**
 * A mutation that passed validation, with every resource it needs resolved.
 *
 * @param targetKey  mutations sharing a key run sequentially, in batch order
 * @param placement  the pooled placement involved, if any; reserved for launches
 * @param endpoint   contact endpoint to attach, null to leave it out
 */
@Builder
public record PreparedMutation(
        int index,
        MutationType type,
        String targetRef,
        String targetKey,
        String campaignId,
        String placementId,
        String adId,
        Long amountMicros,
        Placement placement,
        PlacementSettings settings,
        List<String> creativeRefs,
        String endpoint
) {
}
