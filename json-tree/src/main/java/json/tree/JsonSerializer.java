package json.tree;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/// Renders a {@link JsonValue} tree as JSON text.
///
/// With a positive indent, each member or element sits on its own line, nested
/// `indent` spaces deeper than its container:
/// ```
/// {
///     "name": "Alice",
///     "scores": [
///         85.0,
///         90.0
///     ]
/// }
/// ```
/// An indent of zero produces the compact single-line form used by `toString()`.
///
/// Output always parses back to an equal tree: quotes, backslashes and control
/// characters inside strings are escaped.
///
/// Trees nested deeper than {@link JsonTree#MAX_NESTING_DEPTH} containers are
/// rejected, the same limit the parser enforces.
final class JsonSerializer {

    static final int DEFAULT_INDENT = 4;

    private JsonSerializer() {}

    static String serialize(JsonValue value, int indent) {
        Objects.requireNonNull(value, "value must not be null");
        if (indent < 0) {
            throw new IllegalArgumentException("indent is negative");
        }
        return write(value, 0, 0, indent, new StringBuilder()).toString();
    }

    private static StringBuilder write(JsonValue value, int depth, int col, int indent, StringBuilder out) {
        return switch (value.type()) {
            case OBJECT -> writeObject(value.members(), enter(depth), col, indent, out);
            case ARRAY -> writeArray(value.elements(), enter(depth), col, indent, out);
            case STRING -> writeString(value.string(), out);
            case NUMBER -> out.append(Double.toString(value.toDouble()));
            case BOOLEAN -> out.append(value.bool());
            case NULL -> out.append("null");
        };
    }

    private static int enter(int depth) {
        if (depth >= JsonTree.MAX_NESTING_DEPTH) {
            throw new IllegalArgumentException("value nests deeper than " + JsonTree.MAX_NESTING_DEPTH + " levels");
        }
        return depth + 1;
    }

    private static StringBuilder writeObject(Map<String, JsonValue> members, int depth, int col, int indent,
                                             StringBuilder out) {
        if (members.isEmpty()) {
            return out.append("{}");
        }
        out.append('{');
        var separator = "";
        for (var member : members.entrySet()) {
            out.append(separator);
            newline(col + indent, indent, out);
            writeString(member.getKey(), out).append(indent == 0 ? ":" : ": ");
            write(member.getValue(), depth, col + indent, indent, out);
            separator = ",";
        }
        newline(col, indent, out);
        return out.append('}');
    }

    private static StringBuilder writeArray(List<JsonValue> elements, int depth, int col, int indent,
                                            StringBuilder out) {
        if (elements.isEmpty()) {
            return out.append("[]");
        }
        out.append('[');
        var separator = "";
        for (var element : elements) {
            out.append(separator);
            newline(col + indent, indent, out);
            write(element, depth, col + indent, indent, out);
            separator = ",";
        }
        newline(col, indent, out);
        return out.append(']');
    }

    private static StringBuilder writeString(String s, StringBuilder out) {
        out.append('"');
        for (int i = 0; i < s.length(); i++) {
            final char c = s.charAt(i);
            switch (c) {
                case '"' -> out.append("\\\"");
                case '\\' -> out.append("\\\\");
                case '\b' -> out.append("\\b");
                case '\f' -> out.append("\\f");
                case '\n' -> out.append("\\n");
                case '\r' -> out.append("\\r");
                case '\t' -> out.append("\\t");
                default -> {
                    if (c < 0x20) {
                        out.append(String.format("\\u%04x", (int) c));
                    } else {
                        out.append(c);
                    }
                }
            }
        }
        return out.append('"');
    }

    private static void newline(int col, int indent, StringBuilder out) {
        if (indent > 0) {
            out.append('\n').append(" ".repeat(col));
        }
    }
}
