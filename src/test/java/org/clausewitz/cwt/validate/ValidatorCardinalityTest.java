package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.error.Diagnostic;
import org.clausewitz.cwt.error.Diagnostic.Severity;
import org.clausewitz.cwt.error.DiagnosticCode;
import org.clausewitz.cwt.error.SchemaLoadException;
import org.clausewitz.cwt.parser.ScriptParser;
import org.clausewitz.cwt.schema.SchemaLoader;
import org.clausewitz.cwt.schema.SchemaSource;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ValidatorCardinalityTest {
    private static final String PATH = "common/buildings/farm.txt";

    private static Validator validator;

    @BeforeAll
    static void loadSchema() throws SchemaLoadException {
        validator = Validator.of(SchemaLoader.load(SchemaSource.of("buildings.cwt", """
            types = { type[building] = { path = "game/common/buildings" } }
            building = {
                ## cardinality = 0..1
                hidden = yes
                ## cardinality = 2..3
                tag = scalar
                ## cardinality = ~0..1
                icon = scalar
                ## cardinality = 0..inf
                modifier = scalar
            }
            """)));
    }

    private static List<Diagnostic> validate(String script) {
        return validator.validateFile(ScriptParser.parse(script)
                                                  .root(), PATH, CancellationToken.NEVER)
                        .diagnostics();
    }

    @Test
    void repeatedOptionalKeyIsOneViolationAtTheExcessEntry() {
        var diagnostics = validate("""
            farm = {
                hidden = yes
                hidden = yes
                tag = a
                tag = b
            }
            """);

        assertThat(diagnostics).singleElement()
                               .satisfies(d -> {
                                   assertEquals(DiagnosticCode.CARDINALITY_VIOLATION, d.code());
                                   assertEquals(Severity.ERROR, d.severity());
                                   assertEquals(3, d.span()
                                                    .start()
                                                    .line());
                                   assertEquals("hidden", d.details()
                                                           .get("key"));
                                   assertEquals("2", d.details()
                                                      .get("count"));
                                   assertEquals("0", d.details()
                                                      .get("min"));
                                   assertEquals("1", d.details()
                                                      .get("max"));
                                   assertThat(d.notes()).singleElement()
                                                        .asString()
                                                        .startsWith("rule declared at buildings.cwt:");
                               });
    }

    @Test
    void oneBelowMinimumIsOneViolationAtTheBlock() {
        var diagnostics = validate("""
            farm = {
                tag = a
            }
            """);

        assertThat(diagnostics).singleElement()
                               .satisfies(d -> {
                                   assertEquals(DiagnosticCode.CARDINALITY_VIOLATION, d.code());
                                   assertEquals(1, d.span()
                                                    .start()
                                                    .line());
                                   assertEquals("1", d.details()
                                                      .get("count"));
                                   assertEquals("2", d.details()
                                                      .get("min"));
                               });
    }

    @Test
    void oneAboveMaximumIsOneViolationAtTheFirstExcessEntry() {
        var diagnostics = validate("""
            farm = {
                tag = a
                tag = b
                tag = c
                tag = d
                tag = e
            }
            """);

        assertThat(diagnostics).singleElement()
                               .satisfies(d -> {
                                   assertEquals(DiagnosticCode.CARDINALITY_VIOLATION, d.code());
                                   assertEquals(5, d.span()
                                                    .start()
                                                    .line());
                                   assertEquals("4", d.details()
                                                      .get("count"));
                                   assertEquals("3", d.details()
                                                      .get("max"));
                               });
    }

    @Test
    void absentKeyWithPositiveMinimumIsMissing() {
        var diagnostics = validate("farm = { }");

        assertThat(diagnostics).singleElement()
                               .satisfies(d -> {
                                   assertEquals(DiagnosticCode.MISSING_REQUIRED_KEY, d.code());
                                   assertEquals("0", d.details()
                                                      .get("count"));
                               });
    }

    @Test
    void softCardinalityIsAWarning() {
        var diagnostics = validate("farm = { tag = a tag = b icon = x icon = y }");

        assertThat(diagnostics).singleElement()
                               .satisfies(d -> {
                                   assertEquals(DiagnosticCode.CARDINALITY_VIOLATION, d.code());
                                   assertEquals(Severity.WARNING, d.severity());
                               });
    }

    @Test
    void unboundedMaximumNeverOverflows() {
        var script = new StringBuilder("farm = { tag = a tag = b");
        for (int i = 0; i < 200; i++) {
            script.append(" modifier = m")
                  .append(i);
        }
        script.append(" }");

        assertThat(validate(script.toString())).isEmpty();
    }

    @Test
    void withinBoundsIsClean() {
        assertThat(validate("farm = { tag = a tag = b tag = c hidden = yes }")).isEmpty();
    }
}
