package org.pragmatica.tinyc.lexer;

import io.vavr.control.Either;
import org.pragmatica.tinyc.error.CompileError;
import org.pragmatica.tinyc.tree.SourceLocation;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Lexer for tinyc source text.
 *
 * <p>All token kinds are combined into one alternation of named groups and the
 * input is scanned in a single left-to-right pass. Whitespace and newlines are
 * dropped, the first unknown character stops the scan.
 */
public final class Lexer {
    public static final int DEFAULT_MAX_INPUT_SIZE = 1_000_000;

    private static final int DEFAULT_TOKEN_CAPACITY = 64;
    private static final TokenKind[] SCANNED_KINDS = scannedKinds();
    private static final Pattern TOKEN_PATTERN = combinedPattern();

    private final String input;
    private int line;
    private int lineStart;

    private Lexer(String input) {
        this.input = input;
        this.line = 1;
        this.lineStart = 0;
    }

    public static Either<CompileError, List<Token>> tokenize(String input) {
        return tokenize(input, DEFAULT_MAX_INPUT_SIZE);
    }

    public static Either<CompileError, List<Token>> tokenize(String input, int maxInputSize) {
        if (input.length() > maxInputSize) {
            throw new IllegalArgumentException(
            "Source input exceeds maximum size of " + maxInputSize + " characters");
        }
        return new Lexer(input).tokenizeAll();
    }

    private Either<CompileError, List<Token>> tokenizeAll() {
        var tokens = new ArrayList<Token>(DEFAULT_TOKEN_CAPACITY);
        var matcher = TOKEN_PATTERN.matcher(input);

        while (matcher.find()) {
            var kind = matchedKind(matcher);
            var location = SourceLocation.at(line, matcher.start() - lineStart, matcher.start());

            switch (kind) {
                case SKIP -> {
                    // dropped
                }
                case NEWLINE -> {
                    line++;
                    lineStart = matcher.end();
                }
                case MISMATCH -> {
                    return Either.left(new CompileError.LexError(location, matcher.group()));
                }
                default -> {
                    tokens.add(new Token(kind, matcher.group(), location));
                    if (kind == TokenKind.STRING) {
                        skipEmbeddedNewlines(matcher);
                    }
                }
            }
        }
        // Offset stays at the input length so EOF diagnostics underline past the last character.
        tokens.add(Token.eof(SourceLocation.at(line, 0, input.length())));
        return Either.right(List.copyOf(tokens));
    }

    // String literals may span lines; later positions must still be right.
    private void skipEmbeddedNewlines(Matcher matcher) {
        for (int i = matcher.start(); i < matcher.end(); i++) {
            if (input.charAt(i) == '\n') {
                line++;
                lineStart = i + 1;
            }
        }
    }

    private static TokenKind matchedKind(Matcher matcher) {
        for (var kind : SCANNED_KINDS) {
            if (matcher.start(kind.name()) != -1) {
                return kind;
            }
        }
        throw new IllegalStateException("No token group matched at offset " + matcher.start());
    }

    private static TokenKind[] scannedKinds() {
        var kinds = new ArrayList<TokenKind>();
        for (var kind : TokenKind.values()) {
            if (kind.isScanned()) {
                kinds.add(kind);
            }
        }
        return kinds.toArray(new TokenKind[0]);
    }

    private static Pattern combinedPattern() {
        var joiner = new StringJoiner("|");
        for (var kind : SCANNED_KINDS) {
            joiner.add("(?<" + kind.name() + ">" + kind.pattern() + ")");
        }
        return Pattern.compile(joiner.toString());
    }
}
