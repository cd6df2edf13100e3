package org.pragmatica.tinyc.codegen;

/**
 * Output buffer and indentation depth for one generation run.
 */
final class Emitter {
    private final StringBuilder out = new StringBuilder();
    private final String indentUnit;
    private int depth;

    Emitter(String indentUnit) {
        this.indentUnit = indentUnit;
    }

    /**
     * Append one line at the current indentation.
     */
    Emitter line(String text) {
        out.append(indentUnit.repeat(depth)).append(text).append('\n');
        return this;
    }

    Emitter blankLine() {
        out.append('\n');
        return this;
    }

    Emitter indent() {
        depth++;
        return this;
    }

    Emitter dedent() {
        if (depth > 0) {
            depth--;
        }
        return this;
    }

    String text() {
        return out.toString();
    }
}
