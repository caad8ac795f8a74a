package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonObject;

import java.util.Objects;

/**
 * Result of a tool call, answering the call with id {@code toolCallId}.
 */
public record ToolMessage(
        Content content,
        String toolCallId
)
        implements Message
{
    public ToolMessage {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(toolCallId, "toolCallId");
    }

    @Override
    public Role role() {
        return Role.tool;
    }

    @Override
    public JsonObject toJson() {
        return Json.createObjectBuilder()
                .add("role", role().name())
                .add("content", content.toJson())
                .add("tool_call_id", toolCallId)
                .build();
    }

    static ToolMessage fromJson(JsonObject json) {
        return new ToolMessage(
                Content.fromJson(json.get("content")),
                JsonFields.requireString(json, "tool_call_id"));
    }
}
