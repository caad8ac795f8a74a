package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;

import java.util.Objects;

public record SystemMessage(
        Content content,
        String name
)
        implements Message
{
    public SystemMessage {
        Objects.requireNonNull(content, "content");
    }

    public SystemMessage(String text) {
        this(new TextContent(text), null);
    }

    @Override
    public Role role() {
        return Role.system;
    }

    @Override
    public JsonObject toJson() {
        JsonObjectBuilder json = Json.createObjectBuilder()
                .add("role", role().name())
                .add("content", content.toJson());
        if (name != null)
            json.add("name", name);
        return json.build();
    }

    static SystemMessage fromJson(JsonObject json) {
        return new SystemMessage(
                Content.fromJson(json.get("content")),
                JsonFields.absentOrString(json, "name"));
    }
}
