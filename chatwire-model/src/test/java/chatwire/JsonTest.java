package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonValue;
import org.junit.jupiter.api.Test;

import java.io.StringReader;
import java.math.BigDecimal;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class JsonTest
{
    @Test
    void request_from_json_and_back() {
        //language=JSON
        String json =
                """
                {
                  "model": "gpt-4o",
                  "messages": [
                    {
                      "role": "developer",
                      "content": "You are a helpful assistant."
                    },
                    {
                      "role": "user",
                      "content": "Hello!"
                    }
                  ]
                }
                """;

        ChatRequest request = JsonBinding.jsonb().fromJson(json, ChatRequest.class);

        assertEquals("gpt-4o", request.model());
        assertEquals(
                List.of(
                        new DeveloperMessage("You are a helpful assistant."),
                        new UserMessage("Hello!")
                ),
                request.messages());
        assertNull(request.maxTokens());
        assertEquals(Map.of(), request.extra());

        assertEquals(parse(json), parse(JsonBinding.jsonb().toJson(request)));
    }

    @Test
    void response_from_json_and_back() {
        //language=JSON
        String json =
                """
                {
                  "id": "chatcmpl-123456",
                  "object": "chat.completion",
                  "created": 1728933352,
                  "model": "gpt-4o-2024-08-06",
                  "choices": [
                    {
                      "index": 0,
                      "message": {
                        "role": "assistant",
                        "content": "Hi there! How can I assist you today?",
                        "refusal": null
                      },
                      "logprobs": null,
                      "finish_reason": "stop"
                    }
                  ],
                  "usage": {
                    "prompt_tokens": 19,
                    "completion_tokens": 10,
                    "total_tokens": 29,
                    "prompt_tokens_details": {
                      "cached_tokens": 0
                    },
                    "completion_tokens_details": {
                      "reasoning_tokens": 0,
                      "accepted_prediction_tokens": 0,
                      "rejected_prediction_tokens": 0
                    }
                  },
                  "system_fingerprint": "fp_6b68a8204b"
                }
                """;

        ChatResponse resp = JsonBinding.jsonb().fromJson(json, ChatResponse.class);

        assertEquals("chatcmpl-123456", resp.id());
        assertEquals("chat.completion", resp.object());
        assertEquals(1728933352L, resp.created());
        assertEquals("gpt-4o-2024-08-06", resp.model());
        assertEquals("fp_6b68a8204b", resp.systemFingerprint());
        assertNull(resp.serviceTier());

        Choice choice = resp.choices().get(0);
        assertEquals(0, choice.index());
        assertEquals("stop", choice.finishReason());
        assertEquals(JsonValue.NULL, choice.logprobs());
        AssistantMessage msg = assertInstanceOf(AssistantMessage.class, choice.message());
        assertEquals("Hi there! How can I assist you today?", msg.contentText());
        assertEquals(JsonValue.NULL, msg.extra().get("refusal"));

        Usage usage = resp.usage();
        assertEquals(19, usage.promptTokens());
        assertEquals(10, usage.completionTokens());
        assertEquals(29, usage.totalTokens());
        assertEquals(usage.promptTokens() + usage.completionTokens(), usage.totalTokens());

        assertEquals(parse(json), parse(JsonBinding.jsonb().toJson(resp)));
    }

    @Test
    void request_keeps_unknown_and_null_keys() {
        //language=JSON
        String json =
                """
                {
                  "model": "gpt-4o-mini",
                  "messages": [
                    { "role": "system", "content": "Be terse.", "name": "rules" },
                    {
                      "role": "user",
                      "content": [
                        { "type": "text", "text": "What is in this image?" },
                        { "type": "image_url", "image_url": { "url": "https://example.com/cat.png" } }
                      ]
                    },
                    {
                      "role": "assistant",
                      "content": null,
                      "tool_calls": [
                        {
                          "id": "call_1",
                          "type": "function",
                          "function": { "name": "lookup", "arguments": "{\\"q\\":\\"cat\\"}" }
                        }
                      ]
                    },
                    { "role": "tool", "content": "a cat", "tool_call_id": "call_1" },
                    { "role": "function", "content": "42", "name": "answer" }
                  ],
                  "max_tokens": 300,
                  "max_completion_tokens": 200,
                  "temperature": 0.7,
                  "stream": false,
                  "user": "user-1234",
                  "seed": 7,
                  "response_format": { "type": "json_object" },
                  "stop": null
                }
                """;

        ChatRequest request = JsonBinding.jsonb().fromJson(json, ChatRequest.class);

        assertEquals(5, request.messages().size());
        assertEquals(300, request.maxTokens());
        assertEquals(200, request.maxCompletionTokens());
        assertEquals(new BigDecimal("0.7"), request.temperature());
        assertEquals(false, request.stream());
        assertEquals("user-1234", request.user());
        assertEquals(Json.createValue(7), request.extra().get("seed"));
        assertEquals(JsonValue.NULL, request.extra().get("stop"));
        assertTrue(request.extra().containsKey("response_format"));

        assertInstanceOf(PartsContent.class, request.messages().get(1).content());
        AssistantMessage call = assertInstanceOf(AssistantMessage.class, request.messages().get(2));
        assertNull(call.content());
        assertTrue(call.extra().containsKey("tool_calls"));
        assertEquals("call_1", ((ToolMessage) request.messages().get(3)).toolCallId());

        assertEquals(parse(json), parse(JsonBinding.jsonb().toJson(request)));
        assertEquals(request, ChatRequest.fromJson(request.toJson()));
    }

    @Test
    void response_keeps_unknown_keys_at_every_level() {
        //language=JSON
        String json =
                """
                {
                  "id": "chatcmpl-7fp29q2jX7MEaiu6ic2vjaiEPyrDJ",
                  "object": "chat.completion",
                  "created": 1690201977,
                  "model": "gpt-3.5-turbo-0613",
                  "choices": [
                    {
                      "index": 0,
                      "message": {
                        "role": "assistant",
                        "content": "some response",
                        "annotations": []
                      },
                      "finish_reason": "length",
                      "content_filter_results": { "hate": { "filtered": false } }
                    }
                  ],
                  "usage": {
                    "prompt_tokens": 3736,
                    "completion_tokens": 361,
                    "total_tokens": 4097,
                    "cost": 0.0042
                  },
                  "service_tier": "default",
                  "prompt_filter_results": []
                }
                """;

        ChatResponse resp = JsonBinding.jsonb().fromJson(json, ChatResponse.class);

        assertEquals("default", resp.serviceTier());
        assertNull(resp.systemFingerprint());
        assertTrue(resp.extra().containsKey("prompt_filter_results"));
        assertNull(resp.choices().get(0).logprobs());
        assertTrue(resp.choices().get(0).extra().containsKey("content_filter_results"));
        assertNull(resp.usage().promptTokensDetails());
        assertTrue(resp.usage().extra().containsKey("cost"));

        assertEquals(parse(json), parse(JsonBinding.jsonb().toJson(resp)));
        assertEquals(resp, ChatResponse.fromJson(resp.toJson()));
    }

    @Test
    void choice_with_null_finish_reason() {
        //language=JSON
        String json =
                """
                {
                  "id": "chatcmpl-1",
                  "object": "chat.completion",
                  "created": 1728933352,
                  "model": "llama-3",
                  "choices": [
                    {
                      "index": 0,
                      "message": { "role": "assistant", "content": "partial" },
                      "finish_reason": null
                    }
                  ],
                  "usage": { "prompt_tokens": 1, "completion_tokens": 1, "total_tokens": 2 }
                }
                """;

        ChatResponse resp = JsonBinding.jsonb().fromJson(json, ChatResponse.class);

        Choice choice = resp.choices().get(0);
        assertNull(choice.finishReason());
        assertEquals(JsonValue.NULL, choice.extra().get("finish_reason"));
        assertEquals(parse(json), parse(JsonBinding.jsonb().toJson(resp)));
    }

    @Test
    void choice_without_finish_reason() {
        //language=JSON
        String json =
                """
                {
                  "id": "chatcmpl-2",
                  "object": "chat.completion",
                  "created": 1728933352,
                  "model": "llama-3",
                  "choices": [
                    {
                      "index": 0,
                      "message": { "role": "assistant", "content": "partial" }
                    }
                  ],
                  "usage": { "prompt_tokens": 1, "completion_tokens": 1, "total_tokens": 2 }
                }
                """;

        ChatResponse resp = JsonBinding.jsonb().fromJson(json, ChatResponse.class);

        Choice choice = resp.choices().get(0);
        assertNull(choice.finishReason());
        assertEquals(Map.of(), choice.extra());
        assertEquals(parse(json), parse(JsonBinding.jsonb().toJson(resp)));
    }

    @Test
    void response_extras_cannot_carry_modeled_keys() {
        Message msg = new AssistantMessage("hi");
        assertThrows(IllegalArgumentException.class,
                () -> new Choice(0, msg, "stop", null, Map.of("logprobs", JsonValue.NULL)));
        assertThrows(IllegalArgumentException.class,
                () -> new Choice(0, msg, "stop", null, Map.of("finish_reason", JsonValue.NULL)));
        assertThrows(IllegalArgumentException.class,
                () -> new Usage(1, 1, 2, null, null, Map.of("prompt_tokens_details", JsonValue.NULL)));
    }

    @Test
    void response_missing_usage_is_rejected() {
        JsonObject json = parse(
                """
                {
                  "id": "x",
                  "object": "chat.completion",
                  "created": 1,
                  "model": "m",
                  "choices": []
                }
                """);

        assertThrows(SchemaViolationException.class, () -> ChatResponse.fromJson(json));
    }

    @Test
    void request_with_unknown_role_is_rejected() {
        JsonObject json = parse(
                """
                { "model": "m", "messages": [ { "role": "narrator", "content": "once" } ] }
                """);

        SchemaViolationException e =
                assertThrows(SchemaViolationException.class, () -> ChatRequest.fromJson(json));
        assertInstanceOf(InvalidRoleException.class, e.getCause());
    }

    @Test
    void request_with_fractional_max_tokens_is_rejected() {
        JsonObject json = parse(
                """
                { "model": "m", "messages": [], "max_tokens": 1.5 }
                """);

        assertThrows(SchemaViolationException.class, () -> ChatRequest.fromJson(json));
    }

    static JsonObject parse(String json) {
        return Json.createReader(new StringReader(json)).readObject();
    }
}
