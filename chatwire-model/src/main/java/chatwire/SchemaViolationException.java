package chatwire;

import jakarta.json.JsonException;

/**
 * A JSON value does not have the shape the wire model expects for it.
 */
public class SchemaViolationException
        extends JsonException
{
    public SchemaViolationException(String message) {
        super(message);
    }

    public SchemaViolationException(
            String message,
            Throwable cause
    ) {
        super(message, cause);
    }
}
