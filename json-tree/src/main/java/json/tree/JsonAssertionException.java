package json.tree;

/// Thrown when a typed accessor on a {@link JsonValue} does not match the value,
/// for example calling {@link JsonValue#string()} on a number, reading a missing
/// member, or indexing past the end of an array.
public final class JsonAssertionException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    /// Creates a new assertion exception.
    /// @param message the error message
    public JsonAssertionException(String message) {
        super(message);
    }

    static JsonAssertionException typeError(JsonValue value, String expected) {
        return new JsonAssertionException(
                "%s is not a %s.".formatted(value.type().displayName(), expected));
    }
}
