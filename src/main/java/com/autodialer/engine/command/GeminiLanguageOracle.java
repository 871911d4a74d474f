package com.autodialer.engine.command;

import com.autodialer.engine.exception.OracleUnavailableException;
import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestClient;
import org.springframework.web.client.RestClientException;

import java.util.List;
import java.util.Map;

/**
 * 通过 Gemini generateContent 接口做命令理解。
 */
@Slf4j
public class GeminiLanguageOracle implements LanguageOracle {

    private static final String GENERATE_PATH = "/v1beta/models/{model}:generateContent";

    private final RestClient restClient;
    private final String model;
    private final String configuredApiKey;

    public GeminiLanguageOracle(RestClient restClient, String model, String configuredApiKey) {
        this.restClient = restClient;
        this.model = model;
        this.configuredApiKey = configuredApiKey;
    }

    @Override
    public String interpret(String rawText, String schema, String apiKeyOverride) {
        String apiKey = apiKeyOverride != null && !apiKeyOverride.isBlank() ? apiKeyOverride : configuredApiKey;
        if (apiKey == null || apiKey.isBlank()) {
            throw new OracleUnavailableException("GEMINI_API_KEY not set or not provided");
        }

        String prompt = schema + "\nCommand: \"" + rawText + "\"\n";
        Map<String, Object> body = Map.of(
                "contents", List.of(Map.of("parts", List.of(Map.of("text", prompt)))));

        JsonNode response;
        try {
            response = restClient.post()
                    .uri(GENERATE_PATH, model)
                    .header("x-goog-api-key", apiKey)
                    .contentType(MediaType.APPLICATION_JSON)
                    .body(body)
                    .retrieve()
                    .body(JsonNode.class);
        } catch (RestClientException e) {
            throw new OracleUnavailableException("Gemini request failed: " + e.getMessage(), e);
        }

        JsonNode text = response == null ? null
                : response.path("candidates").path(0).path("content").path("parts").path(0).path("text");
        if (text == null || !text.isTextual()) {
            throw new OracleUnavailableException("Gemini returned no text candidate");
        }
        log.debug("Gemini reply for '{}': {}", rawText, text.asText());
        return text.asText();
    }
}
