package json.tree;

/// The JSON `null` value. All instances are equal; {@link #of()} returns a shared one.
public record JsonNull() implements JsonValue {

    private static final JsonNull INSTANCE = new JsonNull();

    /// {@return the shared `JsonNull`}
    public static JsonNull of() {
        return INSTANCE;
    }

    @Override
    public JsonType type() {
        return JsonType.NULL;
    }

    @Override
    public String toString() {
        return "null";
    }
}
