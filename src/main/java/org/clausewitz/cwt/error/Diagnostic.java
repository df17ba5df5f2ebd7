package org.clausewitz.cwt.error;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.clausewitz.cwt.tree.SourceSpan;

import java.util.List;
import java.util.Map;

/**
 * Diagnostic reported against a script or schema file, renderable in Rust style.
 *
 * <p>Example output:
 * <pre>
 * error[cardinality-violation]: 'hidden' occurs 2 times, at most 1 allowed
 *   --> common/buildings/00_buildings.txt:4:5
 *    |
 *  4 |     hidden = yes
 *    |     ^^^^^^^^^^^^
 *    |
 * </pre>
 *
 * @param severity Severity level
 * @param code     Rule code
 * @param message  Primary message
 * @param span     Source span the diagnostic points at
 * @param labels   Additional labeled spans for context
 * @param notes    Additional notes or suggestions
 * @param details  Structured values behind the message (e.g. {@code count}, {@code max})
 */
public record Diagnostic(
    Severity severity,
    DiagnosticCode code,
    String message,
    SourceSpan span,
    List<Label> labels,
    List<String> notes,
    Map<String, String> details
) {
    public Diagnostic {
        labels = ImmutableList.copyOf(labels);
        notes = ImmutableList.copyOf(notes);
        details = ImmutableMap.copyOf(details);
    }

    /**
     * Severity levels, most severe first.
     */
    public enum Severity {
        ERROR("error"),
        WARNING("warning"),
        INFO("info"),
        HINT("hint");

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

    public static Diagnostic of(Severity severity, DiagnosticCode code, String message, SourceSpan span) {
        return new Diagnostic(severity, code, message, span, List.of(), List.of(), Map.of());
    }

    public static Diagnostic error(DiagnosticCode code, String message, SourceSpan span) {
        return of(Severity.ERROR, code, message, span);
    }

    public static Diagnostic warning(DiagnosticCode code, String message, SourceSpan span) {
        return of(Severity.WARNING, code, message, span);
    }

    public Diagnostic withSeverity(Severity newSeverity) {
        return new Diagnostic(newSeverity, code, message, span, labels, notes, details);
    }

    public Diagnostic withLabel(String labelMessage) {
        return withLabels(Label.primary(span, labelMessage));
    }

    public Diagnostic withSecondaryLabel(SourceSpan labelSpan, String labelMessage) {
        return withLabels(Label.secondary(labelSpan, labelMessage));
    }

    private Diagnostic withLabels(Label label) {
        var newLabels = ImmutableList.<Label>builder()
                                     .addAll(labels)
                                     .add(label)
                                     .build();
        return new Diagnostic(severity, code, message, span, newLabels, notes, details);
    }

    public Diagnostic withNote(String note) {
        var newNotes = ImmutableList.<String>builder()
                                    .addAll(notes)
                                    .add(note)
                                    .build();
        return new Diagnostic(severity, code, message, span, labels, newNotes, details);
    }

    public Diagnostic withHelp(String help) {
        return withNote("help: " + help);
    }

    public Diagnostic withDetail(String key, Object value) {
        var newDetails = ImmutableMap.<String, String>builder()
                                     .putAll(details)
                                     .put(key, String.valueOf(value))
                                     .buildKeepingLast();
        return new Diagnostic(severity, code, message, span, labels, notes, newDetails);
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    /**
     * Format this diagnostic in Rust style.
     *
     * @param source   The source text the span refers to
     * @param filename Optional filename for display
     * @return Formatted diagnostic string
     */
    public String format(String source, String filename) {
        var sb = new StringBuilder();
        var lines = source.split("\n", -1);

        // Header: error[code]: message
        sb.append(severity.display())
          .append('[')
          .append(code.id())
          .append("]: ")
          .append(message)
          .append('\n');

        var loc = span.start();
        sb.append("  --> ");
        if (filename != null) {
            sb.append(filename)
              .append(':');
        }
        sb.append(loc.line())
          .append(':')
          .append(loc.column())
          .append('\n');

        int minLine = span.start()
                          .line();
        int maxLine = span.end()
                          .line();
        for (var label : labels) {
            minLine = Math.min(minLine,
                               label.span()
                                    .start()
                                    .line());
            maxLine = Math.max(maxLine,
                               label.span()
                                    .end()
                                    .line());
        }
        int gutterWidth = String.valueOf(maxLine)
                                .length();

        sb.append(" ".repeat(gutterWidth + 1))
          .append("|\n");
        for (int lineNum = minLine; lineNum <= maxLine; lineNum++) {
            if (lineNum < 1 || lineNum > lines.length) continue;
            var lineContent = lines[lineNum - 1];
            sb.append(String.format("%" + gutterWidth + "d", lineNum))
              .append(" | ")
              .append(lineContent)
              .append('\n');
            var lineLabels = labelsOnLine(lineNum);
            if (!lineLabels.isEmpty()) {
                sb.append(" ".repeat(gutterWidth))
                  .append(" | ")
                  .append(formatUnderlines(lineNum, lineContent, lineLabels))
                  .append('\n');
            }
        }
        sb.append(" ".repeat(gutterWidth + 1))
          .append("|\n");
        for (var note : notes) {
            sb.append(" ".repeat(gutterWidth + 1))
              .append("= ")
              .append(note)
              .append('\n');
        }
        return sb.toString();
    }

    /**
     * Single-line form: {@code file:line:col: severity[code]: message}.
     */
    public String formatSimple(String filename) {
        var loc = span.start();
        return String.format("%s:%d:%d: %s[%s]: %s",
                             filename,
                             loc.line(),
                             loc.column(),
                             severity.display(),
                             code.id(),
                             message);
    }

    private List<Label> labelsOnLine(int lineNum) {
        var result = new java.util.ArrayList<Label>();
        if (span.start()
                .line() <= lineNum && span.end()
                                          .line() >= lineNum && labels.isEmpty()) {
            result.add(Label.primary(span, ""));
        }
        for (var label : labels) {
            if (label.span()
                     .start()
                     .line() <= lineNum && label.span()
                                                .end()
                                                .line() >= lineNum) {
                result.add(label);
            }
        }
        return result;
    }

    private String formatUnderlines(int lineNum, String lineContent, List<Label> lineLabels) {
        var sb = new StringBuilder();
        int currentCol = 1;
        var sorted = lineLabels.stream()
                               .sorted((a, b) -> Integer.compare(a.span()
                                                                  .start()
                                                                  .column(),
                                                                 b.span()
                                                                  .start()
                                                                  .column()))
                               .toList();
        for (var label : sorted) {
            int startCol = label.span()
                                .start()
                                .line() == lineNum
                           ? label.span()
                                  .start()
                                  .column()
                           : 1;
            int endCol = label.span()
                              .end()
                              .line() == lineNum
                         ? label.span()
                                .end()
                                .column()
                         : lineContent.length() + 1;
            while (currentCol < startCol) {
                sb.append(' ');
                currentCol++;
            }
            char underlineChar = label.primary()
                                 ? '^'
                                 : '-';
            int underlineLen = Math.max(1, endCol - startCol);
            sb.append(String.valueOf(underlineChar)
                            .repeat(underlineLen));
            currentCol += underlineLen;
            if (!label.message()
                      .isEmpty()) {
                sb.append(' ')
                  .append(label.message());
            }
        }
        return sb.toString();
    }
}
