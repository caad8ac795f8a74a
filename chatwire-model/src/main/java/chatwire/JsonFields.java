package chatwire;

import jakarta.json.JsonArray;
import jakarta.json.JsonNumber;
import jakarta.json.JsonObject;
import jakarta.json.JsonObjectBuilder;
import jakarta.json.JsonString;
import jakarta.json.JsonValue;
import jakarta.json.JsonValue.ValueType;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Field access helpers shared by the wire records.
 * <p>
 * A modeled optional key that arrives as JSON {@code null} is not
 * treated as absent: it is left in the unknown-key remainder so that
 * it is written back unchanged.
 */
final class JsonFields
{
    private JsonFields() {
    }

    static JsonObject requireObject(
            JsonValue value,
            String what
    ) {
        if (value == null || value.getValueType() != ValueType.OBJECT)
            throw new SchemaViolationException(what + " must be a JSON object, got " + kind(value));
        return value.asJsonObject();
    }

    static String requireString(
            JsonObject json,
            String key
    ) {
        JsonValue value = json.get(key);
        if (value == null || value.getValueType() != ValueType.STRING)
            throw new SchemaViolationException("\"" + key + "\" must be a string, got " + kind(value));
        return ((JsonString) value).getString();
    }

    static String optionalString(
            JsonObject json,
            String key
    ) {
        JsonValue value = json.get(key);
        if (isAbsent(value))
            return null;
        return requireString(json, key);
    }

    /**
     * Absent gives {@code null}; a present key, JSON null included, must hold a string.
     */
    static String absentOrString(
            JsonObject json,
            String key
    ) {
        if (!json.containsKey(key))
            return null;
        return requireString(json, key);
    }

    static int requireInt(
            JsonObject json,
            String key
    ) {
        try {
            return integral(json, key).intValueExact();
        } catch (ArithmeticException e) {
            throw new SchemaViolationException("\"" + key + "\" is out of int range", e);
        }
    }

    static long requireLong(
            JsonObject json,
            String key
    ) {
        try {
            return integral(json, key).longValueExact();
        } catch (ArithmeticException e) {
            throw new SchemaViolationException("\"" + key + "\" is out of long range", e);
        }
    }

    static Integer optionalInt(
            JsonObject json,
            String key
    ) {
        if (isAbsent(json.get(key)))
            return null;
        return requireInt(json, key);
    }

    static BigDecimal optionalNumber(
            JsonObject json,
            String key
    ) {
        JsonValue value = json.get(key);
        if (isAbsent(value))
            return null;
        if (value.getValueType() != ValueType.NUMBER)
            throw new SchemaViolationException("\"" + key + "\" must be a number, got " + kind(value));
        return ((JsonNumber) value).bigDecimalValue();
    }

    static Boolean optionalBoolean(
            JsonObject json,
            String key
    ) {
        JsonValue value = json.get(key);
        if (isAbsent(value))
            return null;
        return switch (value.getValueType()) {
            case TRUE -> true;
            case FALSE -> false;
            default -> throw new SchemaViolationException(
                    "\"" + key + "\" must be a boolean, got " + kind(value));
        };
    }

    static JsonArray requireArray(
            JsonObject json,
            String key
    ) {
        JsonValue value = json.get(key);
        if (value == null || value.getValueType() != ValueType.ARRAY)
            throw new SchemaViolationException("\"" + key + "\" must be an array, got " + kind(value));
        return value.asJsonArray();
    }

    /**
     * Keys that are not in {@code modeled}, plus modeled keys holding JSON null.
     */
    static Map<String, JsonValue> remainder(
            JsonObject json,
            Set<String> modeled
    ) {
        Map<String, JsonValue> rest = new LinkedHashMap<>();
        json.forEach((key, value) -> {
            if (!modeled.contains(key) || value.getValueType() == ValueType.NULL)
                rest.put(key, value);
        });
        return rest;
    }

    /**
     * Immutable copy of {@code extra}. A modeled key may only appear there
     * as JSON null standing in for an unset field; keys listed in
     * {@code taken} (null entries skipped) may not appear at all.
     */
    static Map<String, JsonValue> extra(
            Map<String, JsonValue> extra,
            Set<String> modeled,
            String... taken
    ) {
        if (extra == null || extra.isEmpty())
            return Map.of();
        Set<String> written = new HashSet<>();
        for (String key : taken) {
            if (key != null)
                written.add(key);
        }
        extra.forEach((key, value) -> {
            if (!modeled.contains(key))
                return;
            if (written.contains(key) || value.getValueType() != ValueType.NULL)
                throw new IllegalArgumentException("Extra field collides with modeled field \"" + key + "\"");
        });
        return Collections.unmodifiableMap(new LinkedHashMap<>(extra));
    }

    static void addExtra(
            JsonObjectBuilder builder,
            Map<String, JsonValue> extra
    ) {
        extra.forEach(builder::add);
    }

    static String kind(JsonValue value) {
        return value == null ? "nothing" : value.getValueType().name().toLowerCase();
    }

    private static boolean isAbsent(JsonValue value) {
        return value == null || value.getValueType() == ValueType.NULL;
    }

    private static JsonNumber integral(
            JsonObject json,
            String key
    ) {
        JsonValue value = json.get(key);
        if (value == null || value.getValueType() != ValueType.NUMBER || !((JsonNumber) value).isIntegral())
            throw new SchemaViolationException("\"" + key + "\" must be an integer, got " + kind(value));
        return (JsonNumber) value;
    }
}
