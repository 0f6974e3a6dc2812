package io.mnemo.core.provider;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.mnemo.core.model.ChatMessage;
import io.mnemo.core.model.ToolCall;
import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class OpenAiCompatProviderTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private MockWebServer server;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
    }

    @Test
    void shouldSendNonStreamingRequestWithToolsAndHeaders() throws Exception {
        server.enqueue(json("""
            {"choices": [{"message": {"content": "hello there"}}], "usage": {"total_tokens": 12}}
            """));
        OpenAiCompatProvider provider = provider(Map.of("X-Title", "mnemo"), 1);

        LlmResponse response = provider.chat(
            "gpt-4o-mini",
            List.of(ChatMessage.system("be brief"), ChatMessage.user("hi")),
            List.of(Map.of("type", "function", "function", Map.of("name", "memory_search")))
        );

        assertThat(response.content()).isEqualTo("hello there");
        assertThat(response.hasToolCalls()).isFalse();
        assertThat(response.usage()).containsEntry("total_tokens", 12);

        RecordedRequest request = server.takeRequest();
        assertThat(request.getPath()).isEqualTo("/v1/chat/completions");
        assertThat(request.getHeader("Authorization")).isEqualTo("Bearer sk-test");
        assertThat(request.getHeader("X-Title")).isEqualTo("mnemo");
        JsonNode body = mapper.readTree(request.getBody().readUtf8());
        assertThat(body.path("model").asText()).isEqualTo("gpt-4o-mini");
        assertThat(body.path("stream").asBoolean(true)).isFalse();
        assertThat(body.path("tool_choice").asText()).isEqualTo("auto");
        assertThat(body.path("messages")).hasSize(2);
        assertThat(body.path("messages").path(0).path("role").asText()).isEqualTo("system");
    }

    @Test
    void shouldParseToolCallsAndReplayThem() throws Exception {
        server.enqueue(json("""
            {"choices": [{"message": {"content": null, "tool_calls": [
              {"id": "call_1", "type": "function",
               "function": {"name": "memory_search", "arguments": "{\\"query\\": \\"job\\", \\"limit\\": 3}"}},
              {"id": "call_2", "type": "function",
               "function": {"name": "goal_list", "arguments": "not json"}}
            ]}}]}
            """));
        server.enqueue(json("""
            {"choices": [{"message": {"content": "You are a teacher."}}]}
            """));
        OpenAiCompatProvider provider = provider(Map.of(), 1);

        LlmResponse first = provider.chat("m", List.of(ChatMessage.user("what is my job?")), List.of());

        assertThat(first.content()).isEmpty();
        assertThat(first.toolCalls()).extracting(ToolCall::name).containsExactly("memory_search", "goal_list");
        assertThat(first.toolCalls().get(0).arguments()).containsEntry("query", "job").containsEntry("limit", 3);
        assertThat(first.toolCalls().get(1).arguments()).isEmpty();

        provider.chat("m", List.of(
            ChatMessage.user("what is my job?"),
            ChatMessage.assistantWithToolCalls("", first.toolCalls()),
            ChatMessage.tool("{\"ok\":true}", "call_1")
        ), List.of());

        server.takeRequest();
        JsonNode replay = mapper.readTree(server.takeRequest().getBody().readUtf8()).path("messages");
        assertThat(replay.path(1).path("tool_calls").path(0).path("id").asText()).isEqualTo("call_1");
        assertThat(replay.path(1).path("tool_calls").path(0).path("function").path("arguments").isTextual()).isTrue();
        assertThat(replay.path(2).path("tool_call_id").asText()).isEqualTo("call_1");
    }

    @Test
    void shouldRetryServerErrors() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(503).setBody("busy"));
        server.enqueue(json("""
            {"choices": [{"message": {"content": "recovered"}}]}
            """));

        LlmResponse response = provider(Map.of(), 3).chat("m", List.of(ChatMessage.user("hi")), List.of());

        assertThat(response.content()).isEqualTo("recovered");
        assertThat(server.getRequestCount()).isEqualTo(2);
    }

    @Test
    void shouldFailFastOnClientErrors() {
        server.enqueue(new MockResponse().setResponseCode(400).setBody("{\"error\": \"bad request\"}"));
        OpenAiCompatProvider provider = provider(Map.of(), 3);

        assertThatThrownBy(() -> provider.chat("m", List.of(ChatMessage.user("hi")), List.of()))
            .isInstanceOfSatisfying(LlmException.class, e -> assertThat(e.statusCode()).isEqualTo(400));
        assertThat(server.getRequestCount()).isEqualTo(1);
    }

    @Test
    void shouldRejectResponseWithoutChoices() {
        server.enqueue(json("{\"id\": \"x\"}"));

        assertThatThrownBy(() -> provider(Map.of(), 1).chat("m", List.of(ChatMessage.user("hi")), List.of()))
            .isInstanceOf(LlmException.class)
            .hasMessageContaining("no choices");
    }

    @Test
    void shouldRefuseToCallWithoutApiKey() {
        OpenAiCompatProvider provider = new OpenAiCompatProvider("openai", "", server.url("/v1").toString(), Map.of());

        assertThatThrownBy(() -> provider.chat("m", List.of(ChatMessage.user("hi")), List.of()))
            .isInstanceOf(LlmException.class)
            .hasMessageContaining("missing API key");
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void shouldCompleteTextThroughProvider() throws Exception {
        server.enqueue(json("""
            {"choices": [{"message": {"content": "  summary text  "}}]}
            """));

        String text = new ProviderTextCompletion(provider(Map.of(), 1), "m").complete("summarize");

        assertThat(text).isEqualTo("  summary text  ");
        JsonNode body = mapper.readTree(server.takeRequest().getBody().readUtf8());
        assertThat(body.has("tools")).isFalse();
        assertThat(body.path("messages").path(0).path("content").asText()).isEqualTo("summarize");
    }

    @Test
    void disabledProviderAlwaysFails() {
        DisabledProvider provider = new DisabledProvider("openai", "missing API key");

        assertThatThrownBy(() -> provider.chat("m", List.of(ChatMessage.user("hi")), List.of()))
            .isInstanceOf(LlmException.class)
            .hasMessageContaining("not configured");
    }

    private OpenAiCompatProvider provider(Map<String, String> headers, int attempts) {
        return new OpenAiCompatProvider("openai", "sk-test", server.url("/v1").toString(), headers, attempts,
            Duration.ofSeconds(5));
    }

    private static MockResponse json(String body) {
        return new MockResponse().setHeader("Content-Type", "application/json").setBody(body);
    }
}
