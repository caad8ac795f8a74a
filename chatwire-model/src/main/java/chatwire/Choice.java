package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;
import jakarta.json.JsonValue;

import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * One completion alternative. {@code finishReason} is kept as the raw
 * string ("stop", "length", "tool_calls"...) and is {@code null} when a
 * provider leaves it out. {@code logprobs} is opaque, {@code null}
 * meaning the key was absent.
 */
public record Choice(
        int index,
        Message message,
        String finishReason,
        JsonValue logprobs,
        Map<String, JsonValue> extra
)
{
    private static final Set<String> MODELED = Set.of("index", "message", "finish_reason", "logprobs");

    public Choice {
        Objects.requireNonNull(message, "message");
        extra = JsonFields.extra(extra, MODELED,
                "index",
                "message",
                "logprobs",
                finishReason != null ? "finish_reason" : null);
    }

    public JsonObject toJson() {
        JsonObjectBuilder json = Json.createObjectBuilder()
                .add("index", index)
                .add("message", message.toJson());
        if (finishReason != null)
            json.add("finish_reason", finishReason);
        if (logprobs != null)
            json.add("logprobs", logprobs);
        JsonFields.addExtra(json, extra);
        return json.build();
    }

    static Choice fromJson(JsonValue value) {
        JsonObject json = JsonFields.requireObject(value, "choice");
        Map<String, JsonValue> rest = JsonFields.remainder(json, MODELED);
        rest.remove("logprobs");
        return new Choice(
                JsonFields.requireInt(json, "index"),
                Message.fromJson(json.get("message")),
                JsonFields.optionalString(json, "finish_reason"),
                json.get("logprobs"),
                rest);
    }
}
