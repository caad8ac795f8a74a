package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonValue;

import java.util.Objects;

public record TextContent(
        String text
)
        implements Content
{
    public TextContent {
        Objects.requireNonNull(text, "text");
    }

    @Override
    public JsonValue toJson() {
        return Json.createValue(text);
    }
}
