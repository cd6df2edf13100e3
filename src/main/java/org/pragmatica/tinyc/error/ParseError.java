package org.pragmatica.tinyc.error;

import org.pragmatica.tinyc.tree.SourceLocation;
import org.pragmatica.tinyc.tree.SourceSpan;

/**
 * Token that does not fit the grammar at the current position.
 */
public sealed interface ParseError extends CompileError {

    /**
     * Token of the wrong kind or text.
     */
    record UnexpectedInput(
    SourceLocation location,
    int length,
    String found,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Expected " + expected + " but found " + found + " at line " + location.line();
        }

        @Override
        public Diagnostic toDiagnostic() {
            var span = SourceSpan.of(location, location.advance(Math.max(1, length)));
            return Diagnostic.error("E0002", "unexpected " + found, span)
                             .withLabel("expected " + expected);
        }
    }

    /**
     * Input ended where more tokens are required.
     */
    record UnexpectedEof(
    SourceLocation location,
    String expected) implements ParseError {
        @Override
        public String message() {
            return "Unexpected end of input at line " + location.line() + ", expected " + expected;
        }

        @Override
        public Diagnostic toDiagnostic() {
            return Diagnostic.error("E0003", "unexpected end of input", SourceSpan.at(location))
                             .withLabel("expected " + expected);
        }
    }
}
