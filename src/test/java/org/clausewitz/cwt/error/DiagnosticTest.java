package org.clausewitz.cwt.error;

import org.clausewitz.cwt.tree.SourceLocation;
import org.clausewitz.cwt.tree.SourceSpan;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DiagnosticTest {

    private static final String SOURCE = """
        building_farm = {
            hidden = yes
            hidden = yes
        }
        """;

    private static SourceSpan lineSpan(int line, int fromColumn, int toColumn, int lineOffset) {
        return SourceSpan.of(SourceLocation.at(line, fromColumn, lineOffset + fromColumn - 1),
                             SourceLocation.at(line, toColumn, lineOffset + toColumn - 1));
    }

    @Test
    void formatsRustStyle() {
        var span = lineSpan(3, 5, 17, SOURCE.indexOf("    hidden = yes\n}"));
        var diagnostic = Diagnostic.error(DiagnosticCode.CARDINALITY_VIOLATION,
                                          "'hidden' occurs 2 times, at most 1 allowed",
                                          span)
                                   .withHelp("remove the duplicate");

        var formatted = diagnostic.format(SOURCE, "common/buildings/farm.txt");

        assertTrue(formatted.startsWith("error[cardinality-violation]: 'hidden' occurs 2 times"));
        assertTrue(formatted.contains("--> common/buildings/farm.txt:3:5"));
        assertTrue(formatted.contains("3 |     hidden = yes"));
        assertTrue(formatted.contains("^^^^^^^^^^^^"));
        assertTrue(formatted.contains("= help: remove the duplicate"));
    }

    @Test
    void formatsSecondaryLabels() {
        int first = SOURCE.indexOf("    hidden");
        int second = SOURCE.indexOf("    hidden = yes\n}");
        var diagnostic = Diagnostic.warning(DiagnosticCode.CARDINALITY_VIOLATION, "duplicate", lineSpan(3, 5, 11, second))
                                   .withLabel("second here")
                                   .withSecondaryLabel(lineSpan(2, 5, 11, first), "first here");

        var formatted = diagnostic.format(SOURCE, null);

        assertTrue(formatted.startsWith("warning[cardinality-violation]"));
        assertTrue(formatted.contains("second here"));
        assertTrue(formatted.contains("first here"));
        assertTrue(formatted.contains("--> 2:5") || formatted.contains("--> 3:5"));
    }

    @Test
    void formatsSingleLine() {
        var diagnostic = Diagnostic.error(DiagnosticCode.UNEXPECTED_KEY,
                                          "Unexpected key 'foo'",
                                          lineSpan(2, 5, 8, 18));

        assertEquals("farm.txt:2:5: error[unexpected-key]: Unexpected key 'foo'",
                     diagnostic.formatSimple("farm.txt"));
    }

    @Test
    void detailsAreStrings() {
        var diagnostic = Diagnostic.error(DiagnosticCode.CARDINALITY_VIOLATION, "x", SourceSpan.EMPTY)
                                   .withDetail("count", 2)
                                   .withDetail("max", "1")
                                   .withDetail("count", 3);

        assertEquals("3", diagnostic.details().get("count"));
        assertEquals("1", diagnostic.details().get("max"));
    }

    @Test
    void severityCanBeOverridden() {
        var diagnostic = Diagnostic.error(DiagnosticCode.UNEXPECTED_KEY, "x", SourceSpan.EMPTY)
                                   .withSeverity(Diagnostic.Severity.HINT);

        assertFalse(diagnostic.isError());
        assertEquals("hint", diagnostic.severity().display());
    }

    @Test
    void loadExceptionSummarisesErrors() {
        var errors = List.<SchemaError>of(new SchemaError.UndefinedName("a.cwt", SourceSpan.EMPTY, "enum", "colours"),
                                          new SchemaError.DuplicateType("b.cwt", SourceSpan.EMPTY, "building"));
        var exception = new SchemaLoadException(errors);

        assertEquals(2, exception.errors().size());
        assertTrue(exception.getMessage().contains("Undefined enum 'colours'"));
        assertTrue(exception.getMessage().contains("Type 'building' is declared more than once"));
    }
}
