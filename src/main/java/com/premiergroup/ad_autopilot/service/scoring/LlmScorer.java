package com.premiergroup.ad_autopilot.service.scoring;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.ad_autopilot.config.AutopilotProperties;
import com.premiergroup.ad_autopilot.dto.ScorerOutput;
import com.premiergroup.ad_autopilot.dto.ScoringBundle;
import lombok.extern.log4j.Log4j2;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Primary;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.util.List;
import java.util.Map;

/**
 * Asks an OpenAI-compatible chat completions endpoint for the proposal. Any
 * failure, including an answer that does not parse, falls back to the rules.
 */
@Component
@Primary
@Log4j2
@ConditionalOnProperty(name = "autopilot.scorer.type", havingValue = "llm")
public class LlmScorer implements Scorer {

    private static final String SYSTEM_PROMPT = """
            You optimize advertising campaigns. You receive one account's metrics as JSON.
            Answer with a JSON object {"mutations": [{"type": ..., "target_ref": ..., "params": {...}}]}.
            Allowed types: PAUSE_CAMPAIGN, RESUME_CAMPAIGN, PAUSE_PLACEMENT, RESUME_PLACEMENT, PAUSE_AD,
            RESUME_AD, UPDATE_CAMPAIGN_BUDGET (params.daily_budget), LAUNCH_IN_PLACEMENT (target_ref is the
            directive id), RETIRE_PLACEMENT. A placement missing from "placements" has unknown metrics, not zero.
            Return an empty list when nothing should change.
            """;

    private final RestClient http;
    private final ObjectMapper objectMapper;
    private final RuleBasedScorer fallback;
    private final String model;

    public LlmScorer(AutopilotProperties properties, ObjectMapper objectMapper, RuleBasedScorer fallback) {
        AutopilotProperties.Llm llm = properties.scorer().llm();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout((int) llm.timeout().toMillis());
        requestFactory.setReadTimeout((int) llm.timeout().toMillis());

        this.http = RestClient.builder()
                .baseUrl(llm.baseUrl())
                .requestFactory(requestFactory)
                .defaultHeader("Authorization", "Bearer " + (llm.apiKey() == null ? "" : llm.apiKey()))
                .build();
        this.objectMapper = objectMapper;
        this.fallback = fallback;
        this.model = llm.model();
    }

    @Override
    public String name() {
        return "llm";
    }

    @Override
    public ScorerOutput score(ScoringBundle bundle) {
        try {
            Map<String, Object> request = Map.of(
                    "model", model,
                    "temperature", 0,
                    "response_format", Map.of("type", "json_object"),
                    "messages", List.of(
                            Map.of("role", "system", "content", SYSTEM_PROMPT),
                            Map.of("role", "user", "content", objectMapper.writeValueAsString(bundle))));

            JsonNode response = http.post()
                    .uri("/chat/completions")
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(request)
                    .retrieve()
                    .body(JsonNode.class);

            String content = response == null ? null
                    : response.path("choices").path(0).path("message").path("content").asText(null);
            if (content == null || content.isBlank()) {
                throw new IllegalStateException("empty completion");
            }
            ScorerOutput output = objectMapper.readValue(content, ScorerOutput.class);
            log.info("LLM scorer proposed {} mutations for account {}", output.mutations().size(),
                    bundle.account().id());
            return output;
        } catch (Exception e) {
            log.warn("LLM scoring failed for account {}, using rules instead: {}", bundle.account().id(),
                    e.getMessage());
            return fallback.score(bundle);
        }
    }
}
