package com.supportchat.infrastructure.generation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.supportchat.config.SupportProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.io.IOException;

/**
 * {@link ResponseGenerator} backed by the Gemini {@code generateContent} REST endpoint.
 *
 * Request shape:
 * <pre>
 * POST {baseUrl}/models/{model}:generateContent
 * { "contents": [{"parts": [{"text": prompt}]}],
 *   "generationConfig": {"temperature": .., "topP": .., "topK": .., "maxOutputTokens": ..} }
 * </pre>
 *
 * The reply is the concatenated text parts of the first candidate.
 */
@Slf4j
public class GeminiResponseGenerator implements ResponseGenerator {

    static final String API_KEY_HEADER = "x-goog-api-key";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final SupportProperties.Generation settings;

    public GeminiResponseGenerator(RestTemplate restTemplate, ObjectMapper objectMapper,
                                   SupportProperties.Generation settings) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.settings = settings;
    }

    @Override
    public boolean isAvailable() {
        return settings.getApiKey() != null && !settings.getApiKey().isBlank();
    }

    @Override
    public String generate(String prompt) {
        if (!isAvailable()) {
            throw new GenerationException("Gemini API key is not configured");
        }

        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set(API_KEY_HEADER, settings.getApiKey());
        HttpEntity<String> entity = new HttpEntity<>(requestBody(prompt).toString(), headers);

        ResponseEntity<String> response;
        try {
            response = restTemplate.postForEntity(endpoint(), entity, String.class);
        } catch (RestClientException e) {
            throw new GenerationException("Gemini request failed: " + e.getMessage(), e);
        }

        if (!response.getStatusCode().is2xxSuccessful() || response.getBody() == null) {
            throw new GenerationException("Gemini returned status " + response.getStatusCode().value());
        }
        return extractText(response.getBody());
    }

    String endpoint() {
        return settings.getBaseUrl() + "/models/" + settings.getModel() + ":generateContent";
    }

    ObjectNode requestBody(String prompt) {
        ObjectNode body = objectMapper.createObjectNode();
        body.putArray("contents").addObject().putArray("parts").addObject().put("text", prompt);
        body.putObject("generationConfig")
            .put("temperature", settings.getTemperature())
            .put("topP", settings.getTopP())
            .put("topK", settings.getTopK())
            .put("maxOutputTokens", settings.getMaxOutputTokens());
        return body;
    }

    String extractText(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (IOException e) {
            throw new GenerationException("Gemini response is not valid JSON", e);
        }

        JsonNode parts = root.path("candidates").path(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            String finishReason = root.path("candidates").path(0).path("finishReason").asText("none");
            log.warn("Gemini response carried no text parts: finishReason={}", finishReason);
            return "";
        }

        StringBuilder text = new StringBuilder();
        parts.forEach(part -> text.append(part.path("text").asText("")));
        return text.toString().strip();
    }
}
