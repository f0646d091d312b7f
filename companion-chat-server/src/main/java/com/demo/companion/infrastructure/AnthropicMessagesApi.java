package com.demo.companion.infrastructure;

import com.demo.companion.domain.CompletionResult;
import com.demo.companion.domain.PromptRequest;
import com.demo.companion.domain.PromptRequest.PromptMessage;
import com.demo.companion.domain.PromptRequest.SystemBlock;
import com.demo.companion.domain.TokenUsage;
import com.demo.companion.domain.UpstreamAttempt;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * One HTTP call to the Anthropic Messages API per {@link #send} invocation.
 * Never throws: every outcome is folded into an {@link UpstreamAttempt}.
 */
@Component
@Slf4j
public class AnthropicMessagesApi {

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String endpoint;
    private final String apiKey;
    private final String apiVersion;
    private final String model;
    private final int maxTokens;
    private final double temperature;

    public AnthropicMessagesApi(
            @Qualifier("completionRestTemplate") RestTemplate restTemplate,
            ObjectMapper objectMapper,
            @Value("${companion.completion.base-url:https://api.anthropic.com}") String baseUrl,
            @Value("${companion.completion.api-key:}") String apiKey,
            @Value("${companion.completion.api-version:2023-06-01}") String apiVersion,
            @Value("${companion.completion.model:claude-sonnet-4-20250514}") String model,
            @Value("${companion.completion.max-tokens:4096}") int maxTokens,
            @Value("${companion.completion.temperature:0.75}") double temperature) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.endpoint = stripTrailingSlash(baseUrl) + "/v1/messages";
        this.apiKey = apiKey;
        this.apiVersion = apiVersion;
        this.model = model;
        this.maxTokens = maxTokens;
        this.temperature = temperature;

        if (apiKey == null || apiKey.isBlank()) {
            log.warn("companion.completion.api-key is not set, completion calls will be rejected");
        }
    }

    public UpstreamAttempt send(PromptRequest prompt) {
        HttpHeaders headers = new HttpHeaders();
        headers.setContentType(MediaType.APPLICATION_JSON);
        headers.set("x-api-key", apiKey);
        headers.set("anthropic-version", apiVersion);

        ResponseEntity<String> response;
        try {
            String body = objectMapper.writeValueAsString(toRequestBody(prompt));
            response = restTemplate.exchange(endpoint, HttpMethod.POST, new HttpEntity<>(body, headers), String.class);
        } catch (RestClientException | JsonProcessingException e) {
            log.warn("Completion request failed before a response: error={}", e.getMessage());
            return UpstreamAttempt.failed(e);
        }

        int status = response.getStatusCode().value();
        if (!response.getStatusCode().is2xxSuccessful()) {
            return UpstreamAttempt.rejected(status, response.getBody());
        }
        try {
            return UpstreamAttempt.succeeded(status, parseResponse(response.getBody()));
        } catch (JsonProcessingException | IllegalStateException e) {
            log.warn("Unreadable completion response: status={}, error={}", status, e.getMessage());
            return UpstreamAttempt.failed(status, e);
        }
    }

    ObjectNode toRequestBody(PromptRequest prompt) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("model", model);
        root.put("max_tokens", maxTokens);
        root.put("temperature", temperature);

        ArrayNode system = root.putArray("system");
        for (SystemBlock block : prompt.getSystem()) {
            ObjectNode node = system.addObject();
            node.put("type", "text");
            node.put("text", block.getText());
            if (block.isCached()) {
                node.putObject("cache_control").put("type", "ephemeral");
            }
        }

        ArrayNode messages = root.putArray("messages");
        for (PromptMessage message : prompt.getMessages()) {
            ObjectNode node = messages.addObject();
            node.put("role", message.getRole().toUpstream());
            node.put("content", message.getContent());
        }
        return root;
    }

    CompletionResult parseResponse(String body) throws JsonProcessingException {
        if (body == null || body.isBlank()) {
            throw new IllegalStateException("Empty response body");
        }
        JsonNode root = objectMapper.readTree(body);
        JsonNode content = root.path("content");
        if (!content.isArray()) {
            throw new IllegalStateException("Response has no content array");
        }

        List<String> segments = new ArrayList<>();
        for (JsonNode block : content) {
            if ("text".equals(block.path("type").asText())) {
                segments.add(block.path("text").asText(""));
            }
        }

        JsonNode usage = root.path("usage");
        TokenUsage tokens = TokenUsage.builder()
                .inputTokens(usage.path("input_tokens").asInt(0))
                .outputTokens(usage.path("output_tokens").asInt(0))
                .cacheCreationInputTokens(usage.path("cache_creation_input_tokens").asInt(0))
                .cacheReadInputTokens(usage.path("cache_read_input_tokens").asInt(0))
                .build();

        return CompletionResult.builder()
                .text(String.join("\n", segments))
                .usage(tokens)
                .build();
    }

    private static String stripTrailingSlash(String url) {
        return url.endsWith("/") ? url.substring(0, url.length() - 1) : url;
    }
}
