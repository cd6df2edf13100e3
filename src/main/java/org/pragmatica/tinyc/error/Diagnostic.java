package org.pragmatica.tinyc.error;

import org.pragmatica.tinyc.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;

/**
 * Compiler error rendered against the source it refers to.
 *
 * <p>Example output:
 * <pre>
 * error[E0002]: unexpected identifier 'x'
 *   --> shapes.tc:3:11
 *   |
 * 3 |     int y x;
 *   |           ^ expected ';'
 *   |
 * </pre>
 *
 * <p>The header shows 1-based columns, as editors do. Underlines are placed
 * by source offset, so they stay correct whatever column origin the span uses.
 *
 * @param code    error code, e.g. "E0001"
 * @param message primary message
 * @param span    source range the error refers to
 * @param labels  messages attached to underlined ranges
 * @param notes   trailing notes and suggestions
 */
public record Diagnostic(
    String code,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    /**
     * A message attached to an underlined range.
     */
    public record Label(SourceSpan span, String message) {}

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(code, message, span, List.of(), List.of());
    }

    public Diagnostic withLabel(String labelMessage) {
        var newLabels = new ArrayList<>(labels);
        newLabels.add(new Label(span, labelMessage));
        return new Diagnostic(code, message, span, List.copyOf(newLabels), notes);
    }

    public Diagnostic withNote(String note) {
        var newNotes = new ArrayList<>(notes);
        newNotes.add(note);
        return new Diagnostic(code, message, span, labels, List.copyOf(newNotes));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    /**
     * Format with the offending source line and underlines.
     *
     * @param source   the source text the span refers to
     * @param filename name shown in the location line, may be {@code null}
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);
        var start = span.start();

        sb.append("error");
        if (code != null) {
            sb.append("[").append(code).append("]");
        }
        sb.append(": ").append(message).append("\n");

        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename).append(":");
        }
        sb.append(start.line()).append(":").append(columnOf(source, start.offset()) + 1).append("\n");

        int gutterWidth = String.valueOf(start.line()).length();
        var gutter = " ".repeat(gutterWidth + 1) + "|";
        sb.append(gutter).append("\n");

        if (start.line() >= 1 && start.line() <= lines.length) {
            var lineContent = stripCarriageReturn(lines[start.line() - 1]);
            sb.append(String.format("%" + gutterWidth + "d", start.line()))
              .append(" | ")
              .append(lineContent)
              .append("\n");
            sb.append(gutter).append(" ")
              .append(underline(source, lineContent))
              .append("\n");
        }

        sb.append(gutter).append("\n");

        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1)).append("= ").append(note).append("\n");
        }
        return sb.toString();
    }

    /**
     * Single-line form: {@code file:line:column: error[code]: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: error[%s]: %s",
                             filename == null ? "input" : filename,
                             loc.line(), loc.column() + 1, code, message);
    }

    private String underline(String source, String lineContent) {
        var shown = labels.isEmpty() ? List.of(new Label(span, "")) : labels;
        var sb = new StringBuilder();
        int current = 0;

        for (var label : shown) {
            int startCol = Math.min(columnOf(source, label.span().start().offset()), lineContent.length());
            int endCol = Math.min(startCol + label.span().length(), lineContent.length());

            while (current < startCol) {
                sb.append(' ');
                current++;
            }
            int width = Math.max(1, endCol - startCol);
            sb.append("^".repeat(width));
            current += width;

            if (!label.message().isEmpty()) {
                sb.append(' ').append(label.message());
            }
        }
        return sb.toString();
    }

    private static int columnOf(String source, int offset) {
        int clamped = Math.min(offset, source.length());
        return clamped - (source.lastIndexOf('\n', clamped - 1) + 1);
    }

    private static String stripCarriageReturn(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }
}
