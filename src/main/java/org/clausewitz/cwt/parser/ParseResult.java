package org.clausewitz.cwt.parser;

import org.clausewitz.cwt.error.Diagnostic;
import org.clausewitz.cwt.lexer.Token;
import org.clausewitz.cwt.tree.AstNode;

import java.util.List;

/**
 * Result of parsing one script buffer: the root block (always present, possibly partial) and the
 * syntax diagnostics collected during recovery.
 *
 * @param root        File root block
 * @param diagnostics Parse diagnostics (empty on full success)
 * @param comments    Comment tokens in source order, when requested by {@link ParserConfig#keepComments()}
 * @param source      The parsed text (for formatting diagnostics)
 */
public record ParseResult(
    AstNode.Block root,
    List<Diagnostic> diagnostics,
    List<Token> comments,
    String source
) {
    public ParseResult {
        diagnostics = List.copyOf(diagnostics);
        comments = List.copyOf(comments);
    }

    public boolean isSuccess() {
        return diagnostics.isEmpty();
    }

    public boolean hasErrors() {
        return !diagnostics.isEmpty();
    }

    /**
     * Format all diagnostics in Rust style.
     */
    public String formatDiagnostics(String filename) {
        if (diagnostics.isEmpty()) {
            return "";
        }
        var sb = new StringBuilder();
        for (var diag : diagnostics) {
            sb.append(diag.format(source, filename));
            sb.append('\n');
        }
        return sb.toString();
    }

    public String formatDiagnostics() {
        return formatDiagnostics("input");
    }
}
