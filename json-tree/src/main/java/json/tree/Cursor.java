package json.tree;

import java.util.List;
import java.util.Objects;

/// Read position into a token list. Advances forward only and is never reset;
/// one instance is threaded through every recursive call of a single parse.
final class Cursor {

    private final List<Token> tokens;
    private final int endOffset;
    private int position;

    /// @param tokens    the tokens to read
    /// @param endOffset the offset reported when input runs out
    Cursor(List<Token> tokens, int endOffset) {
        this.tokens = Objects.requireNonNull(tokens, "tokens must not be null");
        this.endOffset = endOffset;
    }

    boolean hasNext() {
        return position < tokens.size();
    }

    int position() {
        return position;
    }

    /// Returns the current token without consuming it.
    /// @throws JsonParseException if no tokens remain
    Token peek() {
        if (!hasNext()) {
            throw endOfInput();
        }
        return tokens.get(position);
    }

    /// Consumes and returns the current token.
    /// @throws JsonParseException if no tokens remain
    Token next() {
        Token token = peek();
        position++;
        return token;
    }

    /// Consumes the current token, which must be the given structural character.
    /// @throws JsonParseException if it is anything else
    Token expect(char structural) {
        Token token = next();
        if (!token.isStructural(structural)) {
            throw unexpected(token, "Expected '" + structural + "'");
        }
        return token;
    }

    JsonParseException endOfInput() {
        return new JsonParseException(JsonParseException.Kind.UNEXPECTED_END_OF_INPUT,
                "Unexpected end of input", endOffset);
    }

    static JsonParseException unexpected(Token token, String detail) {
        return new JsonParseException(JsonParseException.Kind.UNEXPECTED_TOKEN,
                detail + " but found '" + token.text() + "'", token.offset());
    }
}
