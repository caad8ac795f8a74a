package chatwire;

import jakarta.json.JsonObject;
import jakarta.json.bind.Jsonb;
import jakarta.json.bind.JsonbBuilder;
import jakarta.json.bind.JsonbConfig;
import jakarta.json.bind.adapter.JsonbAdapter;

/**
 * JSON-B entry point. Requests and responses are bound through their
 * JSON-P form, so {@code jsonb().toJson(request)} and
 * {@code jsonb().fromJson(body, ChatResponse.class)} keep unknown keys.
 */
public class JsonBinding
{
    private static final JsonbConfig jsonbConfig = new JsonbConfig()
            .withFormatting(true)
            .withAdapters(
                    new ChatRequestAdapter(),
                    new ChatResponseAdapter());

    public static Jsonb jsonb() {
        return JsonbBuilder.create(jsonbConfig);
    }

    public static class ChatRequestAdapter
            implements JsonbAdapter<ChatRequest, JsonObject>
    {
        @Override
        public JsonObject adaptToJson(ChatRequest request) {
            return request.toJson();
        }

        @Override
        public ChatRequest adaptFromJson(JsonObject json) {
            return ChatRequest.fromJson(json);
        }
    }

    public static class ChatResponseAdapter
            implements JsonbAdapter<ChatResponse, JsonObject>
    {
        @Override
        public JsonObject adaptToJson(ChatResponse response) {
            return response.toJson();
        }

        @Override
        public ChatResponse adaptFromJson(JsonObject json) {
            return ChatResponse.fromJson(json);
        }
    }
}
