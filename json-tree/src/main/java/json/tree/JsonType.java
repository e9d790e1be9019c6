package json.tree;

/// The six JSON types, one per {@link JsonValue} implementation.
///
/// Switching on {@link JsonValue#type()} with a switch expression lets the compiler
/// check that every variant is handled.
public enum JsonType {
    OBJECT("JsonObject"),
    ARRAY("JsonArray"),
    STRING("JsonString"),
    NUMBER("JsonNumber"),
    BOOLEAN("JsonBoolean"),
    NULL("JsonNull");

    private final String displayName;

    JsonType(String displayName) {
        this.displayName = displayName;
    }

    /// {@return the name of the `JsonValue` type used in error messages}
    public String displayName() {
        return displayName;
    }
}
