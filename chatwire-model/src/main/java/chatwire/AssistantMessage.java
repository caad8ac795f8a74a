package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;
import jakarta.json.JsonValue;

import java.util.Map;
import java.util.Set;

/**
 * Assistant turn. Content is optional, and every key the model does not
 * know (refusal, tool_calls, audio...) is kept in {@code extra} and
 * written back at the top level of the message object.
 */
public record AssistantMessage(
        Content content,
        String name,
        Map<String, JsonValue> extra
)
        implements Message
{
    private static final Set<String> MODELED = Set.of("role", "content", "name");

    public AssistantMessage {
        extra = JsonFields.extra(extra, MODELED,
                "role",
                content != null ? "content" : null,
                name != null ? "name" : null);
    }

    public AssistantMessage(String text) {
        this(new TextContent(text), null, Map.of());
    }

    @Override
    public Role role() {
        return Role.assistant;
    }

    @Override
    public JsonObject toJson() {
        JsonObjectBuilder json = Json.createObjectBuilder()
                .add("role", role().name());
        if (content != null)
            json.add("content", content.toJson());
        if (name != null)
            json.add("name", name);
        JsonFields.addExtra(json, extra);
        return json.build();
    }

    static AssistantMessage fromJson(JsonObject json) {
        JsonValue content = json.get("content");
        return new AssistantMessage(
                content == null || content.getValueType() == JsonValue.ValueType.NULL
                        ? null
                        : Content.fromJson(content),
                JsonFields.optionalString(json, "name"),
                JsonFields.remainder(json, MODELED));
    }
}
