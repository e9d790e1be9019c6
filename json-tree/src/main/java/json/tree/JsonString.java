package json.tree;

import java.util.Objects;

/// A JSON string holding decoded text; escape sequences are already resolved.
///
/// @param value the decoded text
public record JsonString(String value) implements JsonValue {

    public JsonString {
        Objects.requireNonNull(value, "value must not be null");
    }

    @Override
    public String string() {
        return value;
    }

    @Override
    public JsonType type() {
        return JsonType.STRING;
    }

    @Override
    public String toString() {
        return JsonSerializer.serialize(this, 0);
    }
}
