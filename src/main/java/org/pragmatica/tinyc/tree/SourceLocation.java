package org.pragmatica.tinyc.tree;

/**
 * A position in source text. Lines are 1-based, columns are 0-based and
 * offsets are absolute character indexes into the source.
 */
public record SourceLocation(int line, int column, int offset) {

    public static SourceLocation at(int line, int column, int offset) {
        return new SourceLocation(line, column, offset);
    }

    /**
     * Location {@code length} characters further on the same line.
     */
    public SourceLocation advance(int length) {
        return new SourceLocation(line, column + length, offset + length);
    }

    @Override
    public String toString() {
        return line + ":" + column;
    }
}
