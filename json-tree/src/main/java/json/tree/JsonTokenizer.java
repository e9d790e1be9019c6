package json.tree;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.logging.Logger;

/// Single-pass state machine splitting JSON text into {@link Token}s.
///
/// Outside a string, whitespace separates tokens and each of `{ } [ ] : , "` is a
/// token of its own. Everything else accumulates into literal runs, except that an
/// `e`/`E` directly after a digit is split off as an exponent marker, so `1e10`
/// becomes `1`, `e`, `10`.
///
/// Inside a string, characters accumulate into a single literal with escape
/// sequences already decoded. The closing quote ends the literal.
final class JsonTokenizer {

    private static final Logger LOG = Logger.getLogger(JsonTokenizer.class.getName());

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    private final String input;
    private final List<Token> tokens = new ArrayList<>();
    private final StringBuilder current = new StringBuilder();
    private int currentStart = -1;
    private int stringStart = -1;
    private boolean inString;
    private boolean escape;
    private int pos;

    private JsonTokenizer(String input) {
        this.input = input;
    }

    /// Decodes the bytes as UTF-8 and tokenizes the result.
    /// @param bytes the raw document
    /// @return the tokens, in input order
    /// @throws NullPointerException if bytes is null
    /// @throws JsonTokenizeException if the input is not lexically valid
    static List<Token> tokenize(byte[] bytes) {
        Objects.requireNonNull(bytes, "bytes must not be null");
        return tokenize(new String(bytes, StandardCharsets.UTF_8));
    }

    /// Tokenizes already decoded text.
    /// @param input the document text
    /// @return the tokens, in input order
    /// @throws NullPointerException if input is null
    /// @throws JsonTokenizeException if the input is not lexically valid
    static List<Token> tokenize(String input) {
        Objects.requireNonNull(input, "input must not be null");
        final var tokens = new JsonTokenizer(input).run();
        LOG.fine(() -> "Tokenized " + input.length() + " chars into " + tokens.size() + " tokens");
        return tokens;
    }

    private List<Token> run() {
        if (!input.isEmpty() && input.charAt(0) == BYTE_ORDER_MARK) {
            pos = 1;
        }
        while (pos < input.length()) {
            final char c = input.charAt(pos);
            if (inString) {
                scanStringChar(c);
            } else {
                scanChar(c);
            }
            pos++;
        }
        if (escape) {
            throw error(JsonTokenizeException.Kind.DANGLING_ESCAPE, "Input ends after an escape character", pos);
        }
        if (inString) {
            throw error(JsonTokenizeException.Kind.UNTERMINATED_STRING, "Unterminated string", stringStart);
        }
        flush();
        return List.copyOf(tokens);
    }

    private void scanChar(char c) {
        switch (c) {
            case ' ', '\t', '\r', '\n' -> flush();
            case '{', '}', '[', ']', ':', ',' -> {
                flush();
                emit(Token.Type.STRUCTURAL, String.valueOf(c), pos);
            }
            case '"' -> {
                flush();
                emit(Token.Type.QUOTE, "\"", pos);
                inString = true;
                stringStart = pos;
            }
            case '\\' -> throw error(JsonTokenizeException.Kind.INVALID_ESCAPE_SEQUENCE,
                    "Backslash outside of a string", pos);
            case 'e', 'E' -> {
                if (endsWithDigit()) {
                    flush();
                    emit(Token.Type.LITERAL, String.valueOf(c), pos);
                } else {
                    append(c);
                }
            }
            default -> append(c);
        }
    }

    private void scanStringChar(char c) {
        if (escape) {
            escape = false;
            decodeEscape(c);
            return;
        }
        switch (c) {
            case '\\' -> {
                escape = true;
                if (currentStart < 0) {
                    currentStart = pos;
                }
            }
            case '"' -> {
                flush();
                emit(Token.Type.QUOTE, "\"", pos);
                inString = false;
            }
            default -> {
                if (c < 0x20) {
                    throw error(JsonTokenizeException.Kind.UNESCAPED_CONTROL_CHARACTER,
                            "Unescaped control character " + describe(c) + " in string", pos);
                }
                append(c);
            }
        }
    }

    private void decodeEscape(char c) {
        switch (c) {
            case '"', '\\', '/' -> append(c);
            case 'b' -> append('\b');
            case 'f' -> append('\f');
            case 'n' -> append('\n');
            case 'r' -> append('\r');
            case 't' -> append('\t');
            case 'u' -> append(readHexQuad());
            default -> throw error(JsonTokenizeException.Kind.INVALID_ESCAPE_SEQUENCE,
                    "Invalid escape sequence \\" + describe(c), pos - 1);
        }
    }

    /// Reads the four hex digits of a unicode escape, leaving `pos` on the last of them.
    /// Surrogate halves are appended as-is and pair up in the resulting string.
    private char readHexQuad() {
        final int escapeStart = pos - 1;
        if (pos + 4 >= input.length()) {
            throw error(JsonTokenizeException.Kind.INVALID_ESCAPE_SEQUENCE,
                    "Incomplete unicode escape", escapeStart);
        }
        int value = 0;
        for (int i = 1; i <= 4; i++) {
            final int digit = Character.digit(input.charAt(pos + i), 16);
            if (digit < 0) {
                throw error(JsonTokenizeException.Kind.INVALID_ESCAPE_SEQUENCE,
                        "Invalid unicode escape \\u" + input.substring(pos + 1, pos + 5), escapeStart);
            }
            value = (value << 4) | digit;
        }
        pos += 4;
        return (char) value;
    }

    private boolean endsWithDigit() {
        if (current.length() == 0) {
            return false;
        }
        final char last = current.charAt(current.length() - 1);
        return last >= '0' && last <= '9';
    }

    private void append(char c) {
        if (currentStart < 0) {
            currentStart = pos;
        }
        current.append(c);
    }

    private void flush() {
        if (current.length() > 0) {
            emit(Token.Type.LITERAL, current.toString(), currentStart);
            current.setLength(0);
        }
        currentStart = -1;
    }

    private void emit(Token.Type type, String text, int offset) {
        final var token = new Token(type, text, offset);
        tokens.add(token);
        LOG.finest(() -> "Token " + tokens.size() + ": " + token);
    }

    private static String describe(char c) {
        if (c < 0x20 || c == 0x7F) {
            return "U+%04X".formatted((int) c);
        }
        return "'" + c + "'";
    }

    private static JsonTokenizeException error(JsonTokenizeException.Kind kind, String message, int offset) {
        return new JsonTokenizeException(kind, message, offset);
    }
}
