package org.pragmatica.reduce.error;

import org.pragmatica.reduce.tree.SourceSpan;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Rich diagnostic message for Rust-style error reporting.
 *
 * <p>Example output:
 * <pre>
 * error[E0001]: Unterminated string literal
 *   --> program.bas:2:10
 *   |
 * 2 | 20 PRINT "What is your name?
 *   |          ^ rejected by QuotedStringRecognizer
 *   |
 * </pre>
 *
 * @param severity    Error severity level
 * @param code        Optional error code (e.g., "E0001")
 * @param message     Primary error message
 * @param span        Source span where error occurred
 * @param labels      Additional labeled spans for context
 * @param notes       Additional notes or suggestions
 */
public record Diagnostic(
    Severity severity,
    String code,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes
) {
    public enum Severity {
        ERROR("error"),
        WARNING("warning");

        private final String display;

        Severity(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * A labeled span providing additional context.
     *
     * @param span    Source span for this label
     * @param message Label message
     * @param primary Whether this is the primary label (shown with ^^^)
     */
    public record Label(SourceSpan span, String message, boolean primary) {
        public static Label primary(SourceSpan span, String message) {
            return new Label(span, message, true);
        }

        public static Label secondary(SourceSpan span, String message) {
            return new Label(span, message, false);
        }
    }

    public static Diagnostic error(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.ERROR, code, message, span, List.of(), List.of());
    }

    public static Diagnostic warning(String code, String message, SourceSpan span) {
        return new Diagnostic(Severity.WARNING, code, message, span, List.of(), List.of());
    }

    /**
     * Add a primary label under the diagnostic's own span.
     */
    public Diagnostic withLabel(String message) {
        return plusLabel(Label.primary(span, message));
    }

    /**
     * Add a secondary label at a different span.
     */
    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String message) {
        return plusLabel(Label.secondary(labelSpan, message));
    }

    public Diagnostic withNote(String note) {
        return new Diagnostic(severity, code, message, span, labels, append(notes, note));
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    private Diagnostic plusLabel(Label label) {
        return new Diagnostic(severity, code, message, span, append(labels, label), notes);
    }

    private static <E> List<E> append(List<E> list, E element) {
        var copy = new ArrayList<E>(list.size() + 1);
        copy.addAll(list);
        copy.add(element);
        return List.copyOf(copy);
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The source text
     * @param filename Optional filename for display, may be {@code null}
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sourceLines = source.split("\n", -1);
        int firstLine = labels.stream()
                              .mapToInt(label -> label.span().start().line())
                              .reduce(span.start().line(), Math::min);
        int lastLine = labels.stream()
                             .mapToInt(label -> label.span().end().line())
                             .reduce(span.end().line(), Math::max);
        var margin = " ".repeat(String.valueOf(lastLine).length());

        var out = new StringBuilder();
        appendHeader(out, filename);
        out.append(margin).append(" |\n");
        for (int line = Math.max(1, firstLine); line <= Math.min(lastLine, sourceLines.length); line++) {
            appendSourceLine(out, margin, line, sourceLines[line - 1]);
        }
        out.append(margin).append(" |\n");
        notes.forEach(note -> out.append(margin).append(" = ").append(note).append("\n"));
        return out.toString();
    }

    private void appendHeader(StringBuilder out, String filename) {
        out.append(severity.display());
        if (code != null) {
            out.append('[').append(code).append(']');
        }
        out.append(": ").append(message).append("\n");
        out.append("  --> ");
        if (filename != null) {
            out.append(filename).append(':');
        }
        out.append(span.start()).append("\n");
    }

    private void appendSourceLine(StringBuilder out, String margin, int line, String text) {
        var number = String.valueOf(line);
        out.append(" ".repeat(margin.length() - number.length()))
           .append(number)
           .append(" | ")
           .append(text)
           .append("\n");
        var marks = labelsOn(line);
        if (!marks.isEmpty()) {
            out.append(margin).append(" | ").append(underline(line, text, marks)).append("\n");
        }
    }

    // Without explicit labels the primary span is underlined bare.
    private List<Label> labelsOn(int line) {
        var all = labels.isEmpty()
                  ? List.of(Label.primary(span, ""))
                  : labels;
        return all.stream()
                  .filter(label -> label.span().start().line() <= line && line <= label.span().end().line())
                  .sorted(Comparator.comparingInt(label -> label.span().start().column()))
                  .toList();
    }

    private static String underline(int line, String text, List<Label> marks) {
        var out = new StringBuilder();
        int column = 1;
        for (var label : marks) {
            var labelSpan = label.span();
            int from = labelSpan.start().line() == line ? labelSpan.start().column() : 1;
            int to = labelSpan.end().line() == line ? labelSpan.end().column() : text.length() + 1;
            if (column < from) {
                out.append(" ".repeat(from - column));
                column = from;
            }
            int width = Math.max(1, to - from);
            out.append(String.valueOf(label.primary() ? '^' : '-').repeat(width));
            column += width;
            if (!label.message().isEmpty()) {
                out.append(' ').append(label.message());
            }
        }
        return out.toString();
    }

    /**
     * Simple single-line format for quick display.
     */
    public String formatSimple(String filename) {
        return filename + ":" + span.start() + ": " + severity.display() + ": " + message;
    }
}
