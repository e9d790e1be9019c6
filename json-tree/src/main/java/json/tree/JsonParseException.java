package json.tree;

import java.util.Objects;

/// Thrown when a token sequence does not form a JSON document.
/// No partial value tree is ever returned alongside this exception.
public final class JsonParseException extends JsonTreeException {

    private static final long serialVersionUID = 1L;

    /// The grammar failure that was detected.
    public enum Kind {
        UNEXPECTED_TOKEN,
        UNEXPECTED_END_OF_INPUT,
        MALFORMED_NUMBER,
        NESTING_TOO_DEEP
    }

    private final Kind kind;

    /// Creates a new parse exception.
    /// @param kind the failure kind
    /// @param message a description of the failure
    /// @param offset the char offset of the offending token, or -1 if unknown
    public JsonParseException(Kind kind, String message, int offset) {
        super(message, offset);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Returns the failure kind.
    public Kind kind() {
        return kind;
    }
}
