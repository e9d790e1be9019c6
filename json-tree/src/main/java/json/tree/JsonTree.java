package json.tree;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Static entry points for turning JSON text into a {@link JsonValue} tree and back.
///
/// Every call is independent: no state is kept between calls and all methods are
/// safe to use from multiple threads.
///
/// ## Example Usage
/// ```java
/// JsonValue doc = JsonTree.parse("{\"x\":[1,2.5,-3e2,true,false,null,\"s\"]}");
/// double first = doc.get("x").element(0).toDouble(); // 1.0
///
/// System.out.println(JsonTree.serialize(doc));
/// // {
/// //     "x": [
/// //         1.0,
/// //         2.5,
/// // ...
/// ```
public final class JsonTree {

    private static final Logger LOG = Logger.getLogger(JsonTree.class.getName());

    /// The deepest container nesting that {@link #parse} accepts and {@link #serialize}
    /// renders. Deeper input fails with {@link JsonParseException.Kind#NESTING_TOO_DEEP}.
    public static final int MAX_NESTING_DEPTH = 1000;

    /// Splits a UTF-8 document into tokens without parsing it.
    ///
    /// @param bytes the raw document. Non-null.
    /// @return the tokens in input order; unmodifiable
    /// @throws JsonTokenizeException if the input is not lexically valid
    /// @throws NullPointerException if `bytes` is `null`
    public static List<Token> tokenize(byte[] bytes) {
        return JsonTokenizer.tokenize(bytes);
    }

    /// Splits a document into tokens without parsing it.
    ///
    /// @param text the document text. Non-null.
    /// @return the tokens in input order; unmodifiable
    /// @throws JsonTokenizeException if the input is not lexically valid
    /// @throws NullPointerException if `text` is `null`
    public static List<Token> tokenize(String text) {
        return JsonTokenizer.tokenize(text);
    }

    /// Parses a UTF-8 document into a value tree.
    ///
    /// Duplicate member names are allowed; the last value wins.
    ///
    /// @param bytes the raw document. Non-null.
    /// @return the root value
    /// @throws JsonTokenizeException if the input is not lexically valid
    /// @throws JsonParseException if the tokens do not form exactly one JSON value
    /// @throws NullPointerException if `bytes` is `null`
    public static JsonValue parse(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return parse(new String(bytes, StandardCharsets.UTF_8));
    }

    /// Parses a document into a value tree.
    ///
    /// @param text the document text. Non-null.
    /// @return the root value
    /// @throws JsonTokenizeException if the input is not lexically valid
    /// @throws JsonParseException if the tokens do not form exactly one JSON value
    /// @throws NullPointerException if `text` is `null`
    public static JsonValue parse(String text) {
        Objects.requireNonNull(text, "text must not be null");
        final var tokens = JsonTokenizer.tokenize(text);
        final var root = JsonParser.parse(tokens, text.length());
        LOG.fine(() -> "Parsed " + root.type() + " from " + text.length() + " chars");
        return root;
    }

    /// Parses tokens obtained earlier from {@link #tokenize}.
    ///
    /// @param tokens the tokens of one document. Non-null.
    /// @param length the length of the document text, reported as the offset when the
    ///               tokens run out
    /// @return the root value
    /// @throws JsonParseException if the tokens do not form exactly one JSON value
    /// @throws NullPointerException if `tokens` is `null`
    public static JsonValue parse(List<Token> tokens, int length) {
        return JsonParser.parse(tokens, length);
    }

    /// {@return indented JSON text for the given value, four spaces per level}
    ///
    /// @param value the value to render. Non-null.
    /// @throws NullPointerException if `value` is `null`
    /// @throws IllegalArgumentException if `value` nests deeper than {@link #MAX_NESTING_DEPTH}
    public static String serialize(JsonValue value) {
        return JsonSerializer.serialize(value, JsonSerializer.DEFAULT_INDENT);
    }

    /// {@return JSON text for the given value using the given indent}
    /// An indent of zero produces compact single-line output.
    ///
    /// @param value the value to render. Non-null.
    /// @param indent the number of spaces per nesting level. Zero or positive.
    /// @throws NullPointerException if `value` is `null`
    /// @throws IllegalArgumentException if `indent` is negative, or `value` nests deeper
    ///         than {@link #MAX_NESTING_DEPTH}
    public static String serialize(JsonValue value, int indent) {
        return JsonSerializer.serialize(value, indent);
    }

    private JsonTree() {}
}
