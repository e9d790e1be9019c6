package json.tree;

/// Base of the exceptions thrown when JSON text cannot be turned into a value tree.
/// Catching this type covers both tokenizing and parsing failures.
public abstract sealed class JsonTreeException extends RuntimeException
        permits JsonTokenizeException, JsonParseException {

    private static final long serialVersionUID = 1L;

    private final int offset;

    JsonTreeException(String message, int offset) {
        super(formatMessage(message, offset));
        this.offset = offset;
    }

    /// Returns the char offset in the decoded input where the failure was detected, or -1 if unknown.
    public int offset() {
        return offset;
    }

    private static String formatMessage(String message, int offset) {
        if (offset < 0) {
            return message;
        }
        return message + " at position " + offset;
    }
}
