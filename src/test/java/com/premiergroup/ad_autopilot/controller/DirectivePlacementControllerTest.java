package com.premiergroup.ad_autopilot.controller;

import com.premiergroup.ad_autopilot.AutopilotIntegrationTest;
import com.premiergroup.ad_autopilot.dto.ExternalPlacement;
import com.premiergroup.ad_autopilot.entity.AdAccount;
import com.premiergroup.ad_autopilot.entity.Directive;
import com.premiergroup.ad_autopilot.entity.Placement;
import com.premiergroup.ad_autopilot.enums.ObjectiveType;
import com.premiergroup.ad_autopilot.enums.PlacementStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@AutoConfigureMockMvc
class DirectivePlacementControllerTest extends AutopilotIntegrationTest {

    private static final long CUSTOMER = 1234L;

    @Autowired
    private MockMvc mockMvc;

    private Directive directive;

    @BeforeEach
    void setUp() {
        AdAccount account = account("Acme", CUSTOMER);
        directive = directive(account, "555", ObjectiveType.CALLS);
    }

    @Test
    void linkCreatesIdlePlacement() throws Exception {
        when(campaignApi.getPlacement(CUSTOMER, "101"))
                .thenReturn(new ExternalPlacement("101", "Ad group A", "555", "PAUSED"));

        mockMvc.perform(post("/api/directives/{id}/placements", directive.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"externalPlacementId\": \" 101 \"}"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.externalId").value("101"))
                .andExpect(jsonPath("$.status").value("IDLE"));
    }

    @Test
    void linkOfEnabledAdGroupIsConflict() throws Exception {
        when(campaignApi.getPlacement(CUSTOMER, "101"))
                .thenReturn(new ExternalPlacement("101", "Ad group A", "555", "ENABLED"));

        mockMvc.perform(post("/api/directives/{id}/placements", directive.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"externalPlacementId\": \"101\"}"))
                .andExpect(status().isConflict());
    }

    @Test
    void blankPlacementIdIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/directives/{id}/placements", directive.getId())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"externalPlacementId\": \"\"}"))
                .andExpect(status().isBadRequest());
    }

    @Test
    void emptyPoolListsAsNoContent() throws Exception {
        mockMvc.perform(get("/api/directives/{id}/placements", directive.getId()))
                .andExpect(status().isNoContent());
    }

    @Test
    void listShowsRegisteredPlacements() throws Exception {
        idle(directive, "101");

        mockMvc.perform(get("/api/directives/{id}/placements", directive.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].externalId").value("101"));
    }

    @Test
    void unlinkOfActivePlacementIsConflict() throws Exception {
        Placement active = placement(directive, "101", PlacementStatus.ACTIVE, 1, null);
        Placement idle = idle(directive, "102");

        mockMvc.perform(delete("/api/directives/{id}/placements/{pid}", directive.getId(), active.getId()))
                .andExpect(status().isConflict());
        mockMvc.perform(delete("/api/directives/{id}/placements/{pid}", directive.getId(), idle.getId()))
                .andExpect(status().isNoContent());
    }

    @Test
    void unknownDirectiveIsNotFound() throws Exception {
        mockMvc.perform(get("/api/directives/{id}/placements", -1))
                .andExpect(status().isNotFound());
    }
}
