package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;
import jakarta.json.JsonValue;

import java.util.Map;
import java.util.Set;

/**
 * Token accounting of a completion. The two details objects are passed
 * through as they are; {@code null} means the key was absent.
 */
public record Usage(
        int promptTokens,
        int completionTokens,
        int totalTokens,
        JsonValue promptTokensDetails,
        JsonValue completionTokensDetails,
        Map<String, JsonValue> extra
)
{
    private static final Set<String> MODELED = Set.of(
            "prompt_tokens", "completion_tokens", "total_tokens",
            "prompt_tokens_details", "completion_tokens_details");

    public Usage {
        extra = JsonFields.extra(extra, MODELED,
                "prompt_tokens",
                "completion_tokens",
                "total_tokens",
                "prompt_tokens_details",
                "completion_tokens_details");
    }

    public Usage(
            int promptTokens,
            int completionTokens,
            int totalTokens
    ) {
        this(promptTokens, completionTokens, totalTokens, null, null, Map.of());
    }

    public JsonObject toJson() {
        JsonObjectBuilder json = Json.createObjectBuilder()
                .add("prompt_tokens", promptTokens)
                .add("completion_tokens", completionTokens)
                .add("total_tokens", totalTokens);
        if (promptTokensDetails != null)
            json.add("prompt_tokens_details", promptTokensDetails);
        if (completionTokensDetails != null)
            json.add("completion_tokens_details", completionTokensDetails);
        JsonFields.addExtra(json, extra);
        return json.build();
    }

    static Usage fromJson(JsonValue value) {
        JsonObject json = JsonFields.requireObject(value, "usage");
        Map<String, JsonValue> rest = JsonFields.remainder(json, MODELED);
        rest.remove("prompt_tokens_details");
        rest.remove("completion_tokens_details");
        return new Usage(
                JsonFields.requireInt(json, "prompt_tokens"),
                JsonFields.requireInt(json, "completion_tokens"),
                JsonFields.requireInt(json, "total_tokens"),
                json.get("prompt_tokens_details"),
                json.get("completion_tokens_details"),
                rest);
    }
}
