package com.premiergroup.ad_autopilot.dto;

import java.util.List;

public record PlacementSyncResult(List<String> synced, List<String> failed) {
}
