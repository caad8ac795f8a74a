package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonObject;

import java.util.Objects;

public record FunctionMessage(
        Content content,
        String name
)
        implements Message
{
    public FunctionMessage {
        Objects.requireNonNull(content, "content");
        Objects.requireNonNull(name, "name");
    }

    @Override
    public Role role() {
        return Role.function;
    }

    @Override
    public JsonObject toJson() {
        return Json.createObjectBuilder()
                .add("role", role().name())
                .add("content", content.toJson())
                .add("name", name)
                .build();
    }

    static FunctionMessage fromJson(JsonObject json) {
        return new FunctionMessage(
                Content.fromJson(json.get("content")),
                JsonFields.requireString(json, "name"));
    }
}
