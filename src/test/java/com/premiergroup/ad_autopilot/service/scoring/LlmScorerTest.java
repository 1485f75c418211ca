package com.premiergroup.ad_autopilot.service.scoring;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.premiergroup.ad_autopilot.TestProperties;
import com.premiergroup.ad_autopilot.dto.ProposedMutation;
import com.premiergroup.ad_autopilot.dto.ScorerOutput;
import com.premiergroup.ad_autopilot.dto.ScoringBundle;
import com.premiergroup.ad_autopilot.enums.MutationType;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.LocalDate;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class LlmScorerTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();
    private final AtomicReference<String> lastRequest = new AtomicReference<>();
    private HttpServer server;

    @AfterEach
    void stopServer() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    void parsesMutationsFromTheCompletion() throws IOException {
        String content = "{\"mutations\":[{\"type\":\"PAUSE_CAMPAIGN\",\"target_ref\":\"555\",\"params\":{}}]}";
        LlmScorer scorer = scorerAgainst(200, completion(content));

        ScorerOutput output = scorer.score(bundle());

        assertThat(output.mutations()).containsExactly(
                new ProposedMutation(MutationType.PAUSE_CAMPAIGN, "555", Map.of()));
        assertThat(lastRequest.get()).contains("\"model\":\"gpt-4o-mini\"").contains("json_object");
    }

    @Test
    void unparsableAnswerFallsBackToRules() throws IOException {
        LlmScorer scorer = scorerAgainst(200, completion("I would pause campaign 555"));

        ScorerOutput output = scorer.score(bundle());

        assertThat(output.mutations()).isEmpty();
    }

    @Test
    void serverErrorFallsBackToRules() throws IOException {
        LlmScorer scorer = scorerAgainst(500, "{\"error\":\"overloaded\"}");

        assertThat(scorer.score(bundle()).mutations()).isEmpty();
        assertThat(scorer.name()).isEqualTo("llm");
    }

    private LlmScorer scorerAgainst(int status, String body) throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/v1/chat/completions", exchange -> {
            lastRequest.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
            exchange.getResponseHeaders().add("Content-Type", "application/json");
            exchange.sendResponseHeaders(status, bytes.length);
            try (OutputStream out = exchange.getResponseBody()) {
                out.write(bytes);
            }
        });
        server.start();

        String baseUrl = "http://127.0.0.1:" + server.getAddress().getPort() + "/v1";
        return new LlmScorer(TestProperties.with(Map.of(
                "autopilot.scorer.type", "llm",
                "autopilot.scorer.llm.base-url", baseUrl,
                "autopilot.scorer.llm.api-key", "test-key",
                "autopilot.scorer.llm.timeout", "5s")), objectMapper, new RuleBasedScorer());
    }

    private String completion(String content) throws IOException {
        return objectMapper.writeValueAsString(Map.of(
                "choices", List.of(Map.of("message", Map.of("role", "assistant", "content", content)))));
    }

    private static ScoringBundle bundle() {
        return new ScoringBundle(new ScoringBundle.Account(1L, "Acme"), LocalDate.of(2024, 5, 10),
                List.of(), List.of(), List.of());
    }
}
