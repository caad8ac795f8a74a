package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;
import jakarta.json.JsonValue;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Body of a chat completion call.
 * <p>
 * Optional parameters are {@code null} when absent and are then left out
 * of the JSON. Top-level keys this record does not model travel in
 * {@code extra} and are written flat next to the modeled ones.
 * The {@code with*} methods return an extended copy.
 *
 * @see <a href="https://platform.openai.com/docs/api-reference/chat/create"/>
 */
public record ChatRequest(
        String model,
        List<Message> messages,
        Integer maxTokens,
        Integer maxCompletionTokens,
        BigDecimal temperature,
        Boolean stream,
        String user,
        Map<String, JsonValue> extra
)
{
    public static final String DEFAULT_MODEL = "gpt-4o-mini";

    private static final Set<String> MODELED = Set.of(
            "model", "messages", "max_tokens", "max_completion_tokens", "temperature", "stream", "user");

    public ChatRequest {
        Objects.requireNonNull(model, "model");
        if (model.isBlank())
            throw new IllegalArgumentException("model must not be blank");
        messages = List.copyOf(messages);
        requirePositive(maxTokens, "max_tokens");
        requirePositive(maxCompletionTokens, "max_completion_tokens");
        extra = JsonFields.extra(extra, MODELED,
                "model",
                "messages",
                maxTokens != null ? "max_tokens" : null,
                maxCompletionTokens != null ? "max_completion_tokens" : null,
                temperature != null ? "temperature" : null,
                stream != null ? "stream" : null,
                user != null ? "user" : null);
    }

    public static ChatRequest of(String model) {
        return new ChatRequest(model, List.of(), null, null, null, null, null, Map.of());
    }

    public static ChatRequest create() {
        return of(DEFAULT_MODEL);
    }

    /**
     * @throws InvalidRoleException if {@code role} is not one of the known role labels
     */
    public ChatRequest withMessage(
            String role,
            String text
    ) {
        return withMessage(Message.of(role, text));
    }

    public ChatRequest withMessage(
            Role role,
            String text
    ) {
        return withMessage(Message.of(role, text));
    }

    public ChatRequest withMessage(Message message) {
        List<Message> extended = new ArrayList<>(messages);
        extended.add(Objects.requireNonNull(message, "message"));
        return new ChatRequest(model, extended, maxTokens, maxCompletionTokens, temperature, stream, user, extra);
    }

    public ChatRequest withToolResult(
            String toolCallId,
            String text
    ) {
        return withMessage(new ToolMessage(new TextContent(text), toolCallId));
    }

    public ChatRequest withFunctionResult(
            String name,
            String text
    ) {
        return withMessage(new FunctionMessage(new TextContent(text), name));
    }

    public ChatRequest withMaxTokens(Integer maxTokens) {
        return new ChatRequest(model, messages, maxTokens, maxCompletionTokens, temperature, stream, user, extra);
    }

    public ChatRequest withMaxCompletionTokens(Integer maxCompletionTokens) {
        return new ChatRequest(model, messages, maxTokens, maxCompletionTokens, temperature, stream, user, extra);
    }

    public ChatRequest withTemperature(double temperature) {
        return new ChatRequest(model, messages, maxTokens, maxCompletionTokens,
                BigDecimal.valueOf(temperature), stream, user, extra);
    }

    public ChatRequest withStream(Boolean stream) {
        return new ChatRequest(model, messages, maxTokens, maxCompletionTokens, temperature, stream, user, extra);
    }

    public ChatRequest withUser(String user) {
        return new ChatRequest(model, messages, maxTokens, maxCompletionTokens, temperature, stream, user, extra);
    }

    public ChatRequest withExtra(
            String key,
            JsonValue value
    ) {
        Map<String, JsonValue> extended = new LinkedHashMap<>(extra);
        extended.put(key, value);
        return new ChatRequest(model, messages, maxTokens, maxCompletionTokens, temperature, stream, user, extended);
    }

    public JsonObject toJson() {
        JsonArrayBuilder msgs = Json.createArrayBuilder();
        messages.forEach(m -> msgs.add(m.toJson()));
        JsonObjectBuilder json = Json.createObjectBuilder()
                .add("model", model)
                .add("messages", msgs);
        if (maxTokens != null)
            json.add("max_tokens", maxTokens);
        if (maxCompletionTokens != null)
            json.add("max_completion_tokens", maxCompletionTokens);
        if (temperature != null)
            json.add("temperature", temperature);
        if (stream != null)
            json.add("stream", stream);
        if (user != null)
            json.add("user", user);
        JsonFields.addExtra(json, extra);
        return json.build();
    }

    public static ChatRequest fromJson(JsonValue value) {
        JsonObject json = JsonFields.requireObject(value, "chat request");
        List<Message> messages = new ArrayList<>();
        for (JsonValue message : JsonFields.requireArray(json, "messages"))
            messages.add(Message.fromJson(message));
        try {
            return new ChatRequest(
                    JsonFields.requireString(json, "model"),
                    messages,
                    JsonFields.optionalInt(json, "max_tokens"),
                    JsonFields.optionalInt(json, "max_completion_tokens"),
                    JsonFields.optionalNumber(json, "temperature"),
                    JsonFields.optionalBoolean(json, "stream"),
                    JsonFields.optionalString(json, "user"),
                    JsonFields.remainder(json, MODELED));
        } catch (IllegalArgumentException e) {
            throw new SchemaViolationException(e.getMessage(), e);
        }
    }

    private static void requirePositive(
            Integer value,
            String key
    ) {
        if (value != null && value <= 0)
            throw new IllegalArgumentException(key + " must be positive, got " + value);
    }
}
