package org.pragmatica.tinyc.error;

import org.pragmatica.tinyc.tree.SourceLocation;
import org.pragmatica.tinyc.tree.SourceSpan;

/**
 * Fault that stops the pipeline. Either the lexer met a character it cannot
 * classify, or the parser met a token the grammar does not allow.
 */
public sealed interface CompileError permits CompileError.LexError, ParseError {
    SourceLocation location();

    String message();

    /**
     * Convert into a diagnostic that can be rendered against the source text.
     */
    Diagnostic toDiagnostic();

    /**
     * Input character that matches no token kind.
     */
    record LexError(SourceLocation location, String text) implements CompileError {
        @Override
        public String message() {
            return "Unexpected character '" + text + "' at line " + location.line()
                   + ", column " + location.column();
        }

        @Override
        public Diagnostic toDiagnostic() {
            var span = SourceSpan.of(location, location.advance(text.length()));
            return Diagnostic.error("E0001", "unexpected character '" + text + "'", span)
                             .withLabel("not a valid token")
                             .withHelp("tokens are numbers, strings, identifiers, operators + - * / = < > ! and ( ) { } : ; ,");
        }
    }
}
