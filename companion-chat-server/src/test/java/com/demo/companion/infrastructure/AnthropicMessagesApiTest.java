package com.demo.companion.infrastructure;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotNull;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.jsonPath;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

import com.demo.companion.TestObjects;
import com.demo.companion.config.RestTemplateConfig;
import com.demo.companion.domain.MessageRole;
import com.demo.companion.domain.PromptRequest;
import com.demo.companion.domain.UpstreamAttempt;
import java.time.Duration;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

class AnthropicMessagesApiTest {

    private MockRestServiceServer server;
    private AnthropicMessagesApi api;

    @BeforeEach
    void setUp() {
        RestTemplate restTemplate = new RestTemplateConfig()
                .completionRestTemplate(Duration.ofSeconds(1), Duration.ofSeconds(1));
        server = MockRestServiceServer.bindTo(restTemplate).build();
        api = new AnthropicMessagesApi(restTemplate, TestObjects.objectMapper(),
                "https://api.example.test/", "test-key", "2023-06-01",
                "claude-sonnet-4-20250514", 4096, 0.75);
    }

    @Test
    void sendsCachedSystemTiersAndParsesTextSegments() {
        server.expect(requestTo("https://api.example.test/v1/messages"))
                .andExpect(method(HttpMethod.POST))
                .andExpect(header("x-api-key", "test-key"))
                .andExpect(header("anthropic-version", "2023-06-01"))
                .andExpect(jsonPath("$.model").value("claude-sonnet-4-20250514"))
                .andExpect(jsonPath("$.max_tokens").value(4096))
                .andExpect(jsonPath("$.system[0].cache_control.type").value("ephemeral"))
                .andExpect(jsonPath("$.system[1].cache_control.type").value("ephemeral"))
                .andExpect(jsonPath("$.messages[0].role").value("user"))
                .andExpect(jsonPath("$.messages[1].role").value("assistant"))
                .andExpect(jsonPath("$.messages[2].content").value("how do I start?"))
                .andRespond(withSuccess("""
                        {"id":"msg_1","content":[
                          {"type":"text","text":"Start small."},
                          {"type":"tool_use","id":"t1","name":"x","input":{}},
                          {"type":"text","text":"What feels doable today?"}],
                         "usage":{"input_tokens":50,"output_tokens":12}}
                        """, MediaType.APPLICATION_JSON));

        UpstreamAttempt attempt = api.send(prompt());

        server.verify();
        assertNotNull(attempt.getResult());
        assertEquals("Start small.\nWhat feels doable today?", attempt.getResult().getText());
        assertEquals(50, attempt.getResult().getUsage().getInputTokens());
        assertEquals(12, attempt.getResult().getUsage().getOutputTokens());
        assertEquals(0, attempt.getResult().getUsage().getCacheCreationInputTokens());
        assertEquals(0, attempt.getResult().getUsage().getCacheReadInputTokens());
    }

    @Test
    void errorStatusIsReturnedNotThrown() {
        server.expect(requestTo("https://api.example.test/v1/messages"))
                .andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS)
                        .contentType(MediaType.APPLICATION_JSON)
                        .body("{\"type\":\"error\"}"));

        UpstreamAttempt attempt = api.send(prompt());

        assertEquals(429, attempt.getStatusCode());
        assertNull(attempt.getResult());
        assertNull(attempt.getFailure());
    }

    @Test
    void unreadableSuccessBodyIsAFailure() {
        server.expect(requestTo("https://api.example.test/v1/messages"))
                .andRespond(withSuccess("{\"unexpected\":true}", MediaType.APPLICATION_JSON));

        UpstreamAttempt attempt = api.send(prompt());

        assertEquals(200, attempt.getStatusCode());
        assertNull(attempt.getResult());
        assertNotNull(attempt.getFailure());
    }

    private PromptRequest prompt() {
        return PromptRequest.builder()
                .system(List.of(
                        new PromptRequest.SystemBlock("static", true),
                        new PromptRequest.SystemBlock("dynamic", true)))
                .messages(List.of(
                        new PromptRequest.PromptMessage(MessageRole.USER, "hi"),
                        new PromptRequest.PromptMessage(MessageRole.ASSISTANT, "hey, how are you?"),
                        new PromptRequest.PromptMessage(MessageRole.USER, "how do I start?")))
                .build();
    }
}
