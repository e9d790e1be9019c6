package json.tree;

import java.util.List;
import java.util.Objects;

/// A JSON array. Element order is preserved.
///
/// @param elements the elements; copied, so later changes to the argument are not seen
public record JsonArray(List<JsonValue> elements) implements JsonValue {

    public JsonArray {
        Objects.requireNonNull(elements, "elements must not be null");
        elements = List.copyOf(elements); // rejects null elements
    }

    /// {@return a `JsonArray` holding the given values}
    public static JsonArray of(JsonValue... values) {
        return new JsonArray(List.of(values));
    }

    @Override
    public JsonType type() {
        return JsonType.ARRAY;
    }

    @Override
    public String toString() {
        return JsonSerializer.serialize(this, 0);
    }
}
