package json.tree;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/// A JSON object: member names mapped to values.
///
/// Names are unique. Members keep the order in which they were first inserted, which
/// makes serialized output deterministic, but equality only compares the mappings.
///
/// @param members the members; copied, so later changes to the argument are not seen
public record JsonObject(Map<String, JsonValue> members) implements JsonValue {

    public JsonObject {
        Objects.requireNonNull(members, "members must not be null");
        var copy = new LinkedHashMap<String, JsonValue>(members.size() * 2);
        members.forEach((name, value) -> copy.put(
                Objects.requireNonNull(name, "member name must not be null"),
                Objects.requireNonNull(value, "member value must not be null")));
        members = Collections.unmodifiableMap(copy);
    }

    /// {@return an empty `JsonObject`}
    public static JsonObject of() {
        return new JsonObject(Map.of());
    }

    @Override
    public JsonType type() {
        return JsonType.OBJECT;
    }

    @Override
    public String toString() {
        return JsonSerializer.serialize(this, 0);
    }
}
