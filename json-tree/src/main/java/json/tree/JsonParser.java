package json.tree;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/// Recursive descent parser turning a token list into a {@link JsonValue} tree.
/// One procedure per grammar production, all sharing a single forward-only {@link Cursor}.
///
/// Each procedure is entered with the cursor just past the token that selected it
/// (the `{`, `[`, opening quote, or number mantissa) and leaves the cursor just past
/// the last token it consumed.
final class JsonParser {

    private static final Logger LOG = Logger.getLogger(JsonParser.class.getName());

    private static final Pattern MANTISSA = Pattern.compile("-?(0|[1-9][0-9]*)(\\.[0-9]+)?");
    private static final Pattern EXPONENT = Pattern.compile("[+-]?[0-9]+");

    private final Cursor cursor;
    private int depth;

    private JsonParser(Cursor cursor) {
        this.cursor = cursor;
    }

    /// Parses a complete document.
    /// @param tokens    tokens produced by {@link JsonTokenizer}
    /// @param endOffset the offset reported if the tokens run out
    /// @return the root value
    /// @throws JsonParseException if the tokens do not form exactly one JSON value
    static JsonValue parse(List<Token> tokens, int endOffset) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        LOG.fine(() -> "Parsing " + tokens.size() + " tokens");
        return new JsonParser(new Cursor(tokens, endOffset)).parseRoot();
    }

    private JsonValue parseRoot() {
        final var root = parseValue();
        if (cursor.hasNext()) {
            throw Cursor.unexpected(cursor.peek(), "Expected end of input");
        }
        LOG.finer(() -> "Parsed root " + root.type() + " from " + cursor.position() + " tokens");
        return root;
    }

    private JsonValue parseValue() {
        final var token = cursor.next();
        return switch (token.type()) {
            case STRUCTURAL -> {
                if (token.isStructural('{')) {
                    enter(token);
                    final var object = parseObject();
                    depth--;
                    yield object;
                }
                if (token.isStructural('[')) {
                    enter(token);
                    final var array = parseArray();
                    depth--;
                    yield array;
                }
                throw Cursor.unexpected(token, "Expected a value");
            }
            case QUOTE -> new JsonString(parseString());
            case LITERAL -> switch (token.text()) {
                case "true" -> JsonBoolean.TRUE;
                case "false" -> JsonBoolean.FALSE;
                case "null" -> JsonNull.of();
                default -> parseNumber(token);
            };
        };
    }

    private void enter(Token open) {
        if (++depth > JsonTree.MAX_NESTING_DEPTH) {
            throw new JsonParseException(JsonParseException.Kind.NESTING_TOO_DEEP,
                    "Nesting deeper than " + JsonTree.MAX_NESTING_DEPTH + " levels", open.offset());
        }
    }

    private JsonObject parseObject() {
        final var members = new LinkedHashMap<String, JsonValue>();
        if (cursor.peek().isStructural('}')) {
            cursor.next();
            return new JsonObject(members);
        }
        while (true) {
            final var open = cursor.next();
            if (!open.isQuote()) {
                throw Cursor.unexpected(open, "Expected a string member name");
            }
            final var name = parseString();
            cursor.expect(':');
            final var value = parseValue();
            if (members.put(name, value) != null) {
                LOG.fine(() -> "Duplicate member \"" + name + "\" at position " + open.offset()
                        + ", keeping the last value");
            }
            final var separator = cursor.next();
            if (separator.isStructural('}')) {
                return new JsonObject(members);
            }
            if (!separator.isStructural(',')) {
                throw Cursor.unexpected(separator, "Expected ',' or '}'");
            }
        }
    }

    private JsonArray parseArray() {
        final var elements = new ArrayList<JsonValue>();
        if (cursor.peek().isStructural(']')) {
            cursor.next();
            return new JsonArray(elements);
        }
        while (true) {
            elements.add(parseValue());
            final var separator = cursor.next();
            if (separator.isStructural(']')) {
                return new JsonArray(elements);
            }
            if (!separator.isStructural(',')) {
                throw Cursor.unexpected(separator, "Expected ',' or ']'");
            }
        }
    }

    /// Reads string content up to and including the closing quote.
    private String parseString() {
        final var token = cursor.next();
        if (token.isQuote()) {
            return "";
        }
        if (token.type() != Token.Type.LITERAL) {
            throw Cursor.unexpected(token, "Expected string content");
        }
        final var close = cursor.next();
        if (!close.isQuote()) {
            throw Cursor.unexpected(close, "Expected '\"'");
        }
        return token.text();
    }

    private JsonNumber parseNumber(Token mantissa) {
        final var text = new StringBuilder(mantissa.text());
        if (!MANTISSA.matcher(mantissa.text()).matches()) {
            throw malformed("Malformed number '" + text + "'", mantissa);
        }
        if (cursor.hasNext() && isExponentMarker(mantissa, cursor.peek())) {
            final var marker = cursor.next();
            text.append(marker.text());
            if (!cursor.hasNext()) {
                throw malformed("Missing exponent in '" + text + "'", mantissa);
            }
            final var exponent = cursor.next();
            if (exponent.type() != Token.Type.LITERAL
                    || exponent.offset() != marker.offset() + 1
                    || !EXPONENT.matcher(exponent.text()).matches()) {
                throw malformed("Malformed exponent in '" + text + "'", exponent);
            }
            text.append(exponent.text());
        }
        final double value = Double.parseDouble(text.toString());
        if (!Double.isFinite(value)) {
            throw malformed("Number '" + text + "' is out of range", mantissa);
        }
        LOG.finest(() -> "Number " + text + " -> " + value);
        return new JsonNumber(value);
    }

    /// An exponent marker only continues a number when nothing separated them in the input.
    private static boolean isExponentMarker(Token mantissa, Token candidate) {
        return candidate.type() == Token.Type.LITERAL
                && (candidate.text().equals("e") || candidate.text().equals("E"))
                && candidate.offset() == mantissa.offset() + mantissa.text().length();
    }

    private static JsonParseException malformed(String message, Token at) {
        return new JsonParseException(JsonParseException.Kind.MALFORMED_NUMBER, message, at.offset());
    }
}
