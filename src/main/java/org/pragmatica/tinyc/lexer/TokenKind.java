package org.pragmatica.tinyc.lexer;

/**
 * Token kinds in matching priority order.
 *
 * <p>The lexer tries the patterns in declaration order and the first one that
 * matches decides the kind, so order is part of the grammar. {@code <} and
 * {@code >} are claimed by {@link #OP} before {@link #LANGLE} and {@link #RANGLE}
 * get a chance; the angle kinds are never produced.
 */
public enum TokenKind {
    NUMBER("\\d+(\\.\\d*)?", "number"),
    STRING("\"[^\"\\\\]*+(?:\\\\.[^\"\\\\]*+)*+\"", "string literal"),
    ID("[A-Za-z_][A-Za-z0-9_]*", "identifier"),
    OP("[+\\-*/=<>!]", "operator"),
    LPAREN("\\(", "'('"),
    RPAREN("\\)", "')'"),
    LBRACE("\\{", "'{'"),
    RBRACE("\\}", "'}'"),
    LANGLE("<", "'<'"),
    RANGLE(">", "'>'"),
    COLON(":", "':'"),
    SEMICOLON(";", "';'"),
    COMMA(",", "','"),
    NEWLINE("\\n", "newline"),
    SKIP("[ \\t\\r]+", "whitespace"),
    MISMATCH("(?s:.)", "unknown character"),
    EOF(null, "end of input");

    private final String pattern;
    private final String description;

    TokenKind(String pattern, String description) {
        this.pattern = pattern;
        this.description = description;
    }

    /**
     * Regular expression for this kind, or {@code null} for the synthetic {@link #EOF}.
     */
    public String pattern() {
        return pattern;
    }

    /**
     * Human readable name used in error messages.
     */
    public String description() {
        return description;
    }

    public boolean isScanned() {
        return pattern != null;
    }
}
