package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonValue;

import java.util.List;

/**
 * Multi-part content (text and image parts and the like), kept verbatim.
 */
public record PartsContent(
        List<JsonValue> parts
)
        implements Content
{
    public PartsContent {
        parts = List.copyOf(parts);
    }

    @Override
    public String text() {
        throw new IllegalStateException(
                "Content is a list of " + parts.size() + " parts and has no plain-text form");
    }

    @Override
    public JsonValue toJson() {
        JsonArrayBuilder array = Json.createArrayBuilder();
        parts.forEach(array::add);
        return array.build();
    }
}
