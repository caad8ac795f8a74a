package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;

import java.util.Objects;

public record UserMessage(
        Content content,
        String name
)
        implements Message
{
    public UserMessage {
        Objects.requireNonNull(content, "content");
    }

    public UserMessage(String text) {
        this(new TextContent(text), null);
    }

    @Override
    public Role role() {
        return Role.user;
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

    static UserMessage fromJson(JsonObject json) {
        return new UserMessage(
                Content.fromJson(json.get("content")),
                JsonFields.absentOrString(json, "name"));
    }
}
