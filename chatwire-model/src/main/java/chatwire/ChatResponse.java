package chatwire;

import jakarta.json.Json;
import jakarta.json.JsonArrayBuilder;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;
import jakarta.json.JsonValue;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Body of a successful chat completion call. Unmodeled top-level keys
 * are kept in {@code extra}.
 */
public record ChatResponse(
        String id,
        String object,
        long created,
        String model,
        List<Choice> choices,
        Usage usage,
        String systemFingerprint,
        String serviceTier,
        Map<String, JsonValue> extra
)
{
    private static final Set<String> MODELED = Set.of(
            "id", "object", "created", "model", "choices", "usage", "system_fingerprint", "service_tier");

    public ChatResponse {
        Objects.requireNonNull(id, "id");
        Objects.requireNonNull(object, "object");
        Objects.requireNonNull(model, "model");
        Objects.requireNonNull(usage, "usage");
        choices = List.copyOf(choices);
        extra = JsonFields.extra(extra, MODELED,
                "id",
                "object",
                "created",
                "model",
                "choices",
                "usage",
                systemFingerprint != null ? "system_fingerprint" : null,
                serviceTier != null ? "service_tier" : null);
    }

    public JsonObject toJson() {
        JsonArrayBuilder choiceArray = Json.createArrayBuilder();
        choices.forEach(c -> choiceArray.add(c.toJson()));
        JsonObjectBuilder json = Json.createObjectBuilder()
                .add("id", id)
                .add("object", object)
                .add("created", created)
                .add("model", model)
                .add("choices", choiceArray)
                .add("usage", usage.toJson());
        if (systemFingerprint != null)
            json.add("system_fingerprint", systemFingerprint);
        if (serviceTier != null)
            json.add("service_tier", serviceTier);
        JsonFields.addExtra(json, extra);
        return json.build();
    }

    public static ChatResponse fromJson(JsonValue value) {
        JsonObject json = JsonFields.requireObject(value, "chat response");
        List<Choice> choices = new ArrayList<>();
        for (JsonValue choice : JsonFields.requireArray(json, "choices"))
            choices.add(Choice.fromJson(choice));
        return new ChatResponse(
                JsonFields.requireString(json, "id"),
                JsonFields.requireString(json, "object"),
                JsonFields.requireLong(json, "created"),
                JsonFields.requireString(json, "model"),
                choices,
                Usage.fromJson(json.get("usage")),
                JsonFields.optionalString(json, "system_fingerprint"),
                JsonFields.optionalString(json, "service_tier"),
                JsonFields.remainder(json, MODELED));
    }
}
