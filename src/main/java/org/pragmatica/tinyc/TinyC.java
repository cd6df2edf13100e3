package org.pragmatica.tinyc;

import io.vavr.control.Either;
import org.pragmatica.tinyc.ast.Node.Program;
import org.pragmatica.tinyc.codegen.CGenerator;
import org.pragmatica.tinyc.error.CompileError;
import org.pragmatica.tinyc.lexer.Lexer;
import org.pragmatica.tinyc.lexer.Token;
import org.pragmatica.tinyc.parser.Parser;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Entry point for translating tinyc source into C.
 *
 * <p>Example usage:
 * <pre>{@code
 * var c = TinyC.compile("""
 *     class Point { int x; int y; }
 *     int main() { 0; }
 *     """).get();
 * }</pre>
 *
 * <p>Each stage stops at its first fault, which is returned as the left side
 * of the result.
 */
public final class TinyC {
    private static final Logger log = LoggerFactory.getLogger(TinyC.class);

    private TinyC() {}

    /**
     * Translate source text into C with the default configuration.
     */
    public static Either<CompileError, String> compile(String source) {
        return compile(source, TinyCConfig.DEFAULT);
    }

    /**
     * Translate source text into C.
     */
    public static Either<CompileError, String> compile(String source, TinyCConfig config) {
        return parse(source, config).map(program -> generate(program, config));
    }

    /**
     * Run only the lexer.
     */
    public static Either<CompileError, List<Token>> tokenize(String source) {
        return tokenize(source, TinyCConfig.DEFAULT);
    }

    public static Either<CompileError, List<Token>> tokenize(String source, TinyCConfig config) {
        return Lexer.tokenize(source, config.maxSourceLength())
                    .peek(tokens -> log.debug("Lexed {} tokens", tokens.size()));
    }

    /**
     * Run the lexer and the parser.
     */
    public static Either<CompileError, Program> parse(String source) {
        return parse(source, TinyCConfig.DEFAULT);
    }

    public static Either<CompileError, Program> parse(String source, TinyCConfig config) {
        return tokenize(source, config)
            .flatMap(Parser::parse)
            .peek(program -> log.debug("Parsed {} declarations", program.declarations().size()))
            .peekLeft(error -> log.debug("Compilation stopped: {}", error.message()));
    }

    /**
     * Generate C for an already parsed program.
     */
    public static String generate(Program program) {
        return generate(program, TinyCConfig.DEFAULT);
    }

    public static String generate(Program program, TinyCConfig config) {
        var text = CGenerator.create(config).generate(program);
        log.debug("Generated {} characters of C", text.length());
        return text;
    }

    /**
     * Create a builder for a custom configuration.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String indentUnit = TinyCConfig.DEFAULT.indentUnit();
        private List<String> includes = new ArrayList<>(TinyCConfig.DEFAULT.includes());
        private String receiverName = TinyCConfig.DEFAULT.receiverName();
        private int maxSourceLength = TinyCConfig.DEFAULT.maxSourceLength();

        private Builder() {}

        public Builder indentUnit(String indentUnit) {
            this.indentUnit = indentUnit;
            return this;
        }

        public Builder includes(List<String> includes) {
            this.includes = new ArrayList<>(includes);
            return this;
        }

        public Builder include(String header) {
            this.includes.add(header);
            return this;
        }

        public Builder noIncludes() {
            this.includes = new ArrayList<>();
            return this;
        }

        public Builder receiverName(String receiverName) {
            this.receiverName = receiverName;
            return this;
        }

        public Builder maxSourceLength(int maxSourceLength) {
            this.maxSourceLength = maxSourceLength;
            return this;
        }

        public TinyCConfig build() {
            return new TinyCConfig(indentUnit, includes, receiverName, maxSourceLength);
        }

        /**
         * Shortcut for {@code TinyC.compile(source, build())}.
         */
        public Either<CompileError, String> compile(String source) {
            return TinyC.compile(source, build());
        }
    }
}
