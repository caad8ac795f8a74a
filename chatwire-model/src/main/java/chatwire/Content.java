package chatwire;

import jakarta.json.JsonString;
import jakarta.json.JsonValue;

/**
 * Message payload: either plain text or an opaque list of parts.
 * <p>
 * The wire format has no tag for this field. A JSON string decodes to
 * {@link TextContent}, a JSON array to {@link PartsContent}, and any
 * other kind of value is rejected.
 */
public sealed interface Content
        permits TextContent, PartsContent
{
    /**
     * @throws IllegalStateException if this content has no plain-text form
     */
    String text();

    JsonValue toJson();

    static Content fromJson(JsonValue json) {
        if (json == null)
            throw new SchemaViolationException("content must be a string or an array, got nothing");
        return switch (json.getValueType()) {
            case STRING -> new TextContent(((JsonString) json).getString());
            case ARRAY -> new PartsContent(json.asJsonArray());
            default -> throw new SchemaViolationException(
                    "content must be a string or an array, got " + JsonFields.kind(json));
        };
    }
}
