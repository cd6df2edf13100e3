package org.pragmatica.tinyc.lexer;

import org.pragmatica.tinyc.tree.SourceLocation;

import java.util.Objects;

/**
 * A classified piece of source text with its position.
 */
public record Token(TokenKind kind, String text, SourceLocation location) {

    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(location, "location");
    }

    public static Token eof(SourceLocation location) {
        return new Token(TokenKind.EOF, "", location);
    }

    public int line() {
        return location.line();
    }

    public int column() {
        return location.column();
    }

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean hasText(String expected) {
        return text.equals(expected);
    }

    /**
     * Short description for error messages, e.g. {@code identifier 'foo'}.
     */
    public String describe() {
        return switch (kind) {
            case EOF -> kind.description();
            case ID, NUMBER, STRING, OP -> kind.description() + " '" + text + "'";
            default -> "'" + text + "'";
        };
    }

    @Override
    public String toString() {
        return kind + "('" + text + "')@" + location;
    }
}
