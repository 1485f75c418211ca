package com.premiergroup.ad_autopilot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.premiergroup.ad_autopilot.enums.MutationType;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record ProposedMutation(
        MutationType type,
        @JsonProperty("target_ref") String targetRef,
        Map<String, Object> params
) {

    public ProposedMutation {
        params = params == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(params));
    }
}
