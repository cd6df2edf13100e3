package org.pragmatica.tinyc;

import org.pragmatica.tinyc.lexer.Lexer;

import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Compiler configuration options.
 *
 * @param indentUnit      text emitted once per nesting level
 * @param includes        headers emitted as {@code #include <...>} before any declaration
 * @param receiverName    name of the instance parameter added to every method
 * @param maxSourceLength largest accepted source, in characters
 */
public record TinyCConfig(
    String indentUnit,
    List<String> includes,
    String receiverName,
    int maxSourceLength
) {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    public static final TinyCConfig DEFAULT = new TinyCConfig(
        "    ",
        List.of("stdio.h", "stdlib.h", "string.h"),
        "this",
        Lexer.DEFAULT_MAX_INPUT_SIZE
    );

    public TinyCConfig {
        Objects.requireNonNull(indentUnit, "indentUnit");
        Objects.requireNonNull(receiverName, "receiverName");
        includes = List.copyOf(includes);
        if (!IDENTIFIER.matcher(receiverName).matches()) {
            throw new IllegalArgumentException("Receiver name must be an identifier: '" + receiverName + "'");
        }
        if (maxSourceLength <= 0) {
            throw new IllegalArgumentException("Maximum source length must be positive: " + maxSourceLength);
        }
    }
}
