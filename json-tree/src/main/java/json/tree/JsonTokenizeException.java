package json.tree;

import java.util.Objects;

/// Thrown when raw input cannot be split into tokens.
public final class JsonTokenizeException extends JsonTreeException {

    private static final long serialVersionUID = 1L;

    /// The lexical failure that was detected.
    public enum Kind {
        /// Input ended while a string was still open.
        UNTERMINATED_STRING,
        /// Input ended directly after a backslash.
        DANGLING_ESCAPE,
        /// A backslash was followed by a character that cannot be escaped, or appeared outside a string.
        INVALID_ESCAPE_SEQUENCE,
        /// A raw control character appeared inside a string.
        UNESCAPED_CONTROL_CHARACTER
    }

    private final Kind kind;

    /// Creates a new tokenize exception.
    /// @param kind the failure kind
    /// @param message a description of the failure
    /// @param offset the char offset of the failure, or -1 if unknown
    public JsonTokenizeException(Kind kind, String message, int offset) {
        super(message, offset);
        this.kind = Objects.requireNonNull(kind, "kind must not be null");
    }

    /// Returns the failure kind.
    public Kind kind() {
        return kind;
    }
}
