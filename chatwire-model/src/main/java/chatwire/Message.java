package chatwire;

import jakarta.json.JsonObject;
import jakarta.json.JsonValue;

import java.util.Map;

/**
 * One conversation message. The {@code role} key selects the variant
 * and with it the set of keys the JSON object carries.
 */
public sealed interface Message
        permits DeveloperMessage, SystemMessage, UserMessage, AssistantMessage, ToolMessage, FunctionMessage
{
    Role role();

    /**
     * Null only for an assistant message that carries no content,
     * e.g. one made of tool or function calls.
     */
    Content content();

    JsonObject toJson();

    /**
     * @throws IllegalStateException if there is no content or it is a list of parts
     */
    default String contentText() {
        Content content = content();
        if (content == null)
            throw new IllegalStateException(role() + " message has no content");
        return content.text();
    }

    static Message of(
            String role,
            String text
    ) {
        return of(Role.fromLabel(role), text);
    }

    /**
     * Plain-text message for the given role. Tool and function messages
     * get an empty call id and name respectively.
     */
    static Message of(
            Role role,
            String text
    ) {
        Content content = new TextContent(text);
        return switch (role) {
            case developer -> new DeveloperMessage(content, null);
            case system -> new SystemMessage(content, null);
            case user -> new UserMessage(content, null);
            case assistant -> new AssistantMessage(content, null, Map.of());
            case tool -> new ToolMessage(content, "");
            case function -> new FunctionMessage(content, "");
        };
    }

    static Message fromJson(JsonValue value) {
        JsonObject json = JsonFields.requireObject(value, "message");
        String label = JsonFields.requireString(json, "role");
        Role role;
        try {
            role = Role.fromLabel(label);
        } catch (InvalidRoleException e) {
            throw new SchemaViolationException("Unknown message role \"" + label + "\"", e);
        }
        return switch (role) {
            case developer -> DeveloperMessage.fromJson(json);
            case system -> SystemMessage.fromJson(json);
            case user -> UserMessage.fromJson(json);
            case assistant -> AssistantMessage.fromJson(json);
            case tool -> ToolMessage.fromJson(json);
            case function -> FunctionMessage.fromJson(json);
        };
    }
}
