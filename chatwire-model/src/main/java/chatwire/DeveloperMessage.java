package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;

import java.util.Objects;

public record DeveloperMessage(
        Content content,
        String name
)
        implements Message
{
    public DeveloperMessage {
        Objects.requireNonNull(content, "content");
    }

    public DeveloperMessage(String text) {
        this(new TextContent(text), null);
    }

    @Override
    public Role role() {
        return Role.developer;
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

    static DeveloperMessage fromJson(JsonObject json) {
        return new DeveloperMessage(
                Content.fromJson(json.get("content")),
                JsonFields.absentOrString(json, "name"));
    }
}
