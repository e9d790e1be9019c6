package json.tree;

import java.util.Objects;

/// A lexical unit produced by {@link JsonTokenizer}.
///
/// @param type   what kind of token this is
/// @param text   the token text; never empty
/// @param offset the char offset in the decoded input where the token starts
public record Token(Type type, String text, int offset) {

    /// Token categories.
    public enum Type {
        /// One of `{ } [ ] : ,`
        STRUCTURAL,
        /// The `"` delimiter opening or closing a string.
        QUOTE,
        /// A run of literal text: number parts, a keyword, or decoded string content.
        LITERAL
    }

    public Token {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
        if (text.isEmpty()) {
            throw new IllegalArgumentException("token text must not be empty");
        }
    }

    /// {@return true if this is a structural token with the given character}
    public boolean isStructural(char c) {
        return type == Type.STRUCTURAL && text.charAt(0) == c;
    }

    /// {@return true if this is a quote delimiter}
    public boolean isQuote() {
        return type == Type.QUOTE;
    }

    @Override
    public String toString() {
        return type + "[" + text + "]@" + offset;
    }
}
