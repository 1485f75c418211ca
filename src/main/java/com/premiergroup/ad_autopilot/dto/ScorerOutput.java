package com.premiergroup.ad_autopilot.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

public record ScorerOutput(@JsonProperty("mutations") List<ProposedMutation> mutations) {

    public ScorerOutput {
        mutations = mutations == null ? List.of() : List.copyOf(mutations);
    }

    public static ScorerOutput empty() {
        return new ScorerOutput(List.of());
    }
}
