package org.clausewitz.cwt.parser;

import org.clausewitz.cwt.error.DiagnosticCode;
import org.clausewitz.cwt.lexer.TokenKind;
import org.clausewitz.cwt.tree.AstNode;
import org.clausewitz.cwt.tree.AstPrinter;
import org.clausewitz.cwt.tree.Entry;
import org.clausewitz.cwt.tree.Operator;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class ScriptParserTest {

    private static final String BUILDINGS = """
        # Farm buildings
        building_farm = {
            cost = 100
            category = resource
            potential = {
                has_technology = tech_farming
                num_pops >= 5
            }
            allow = { always = yes }
            flags = { cheap early }
            color = rgb { 10 200 30 }
            upkeep = @upkeep_small
            production = @[ base_output * 2 ]
            icon = $ICON$
            name = "Farm of the \\"North\\""
            mixed = { a = 1 loose }
        }
        building_mine = {
            cost = 250
        }
        """;

    @Test
    void parsesNestedBlocks() {
        var result = ScriptParser.parse(BUILDINGS);

        assertTrue(result.isSuccess(), result.formatDiagnostics());
        var root = result.root();
        assertEquals(2, root.entries().size());
        var farm = (AstNode.Block) root.entries().get(0).value();
        assertEquals("100", farm.first("cost").orElseThrow().scalarText());
        var potential = (AstNode.Block) farm.first("potential").orElseThrow().value();
        assertEquals(2, potential.entries().size());
        assertEquals(Operator.GREATER_OR_EQUAL, potential.entries().get(1).operator());
    }

    @Test
    void parsesValueKinds() {
        var farm = (AstNode.Block) ScriptParser.parse(BUILDINGS).root().entries().get(0).value();

        var flags = assertInstanceOf(AstNode.Array.class, farm.first("flags").orElseThrow().value());
        assertEquals(Optional.empty(), flags.tag());
        assertEquals(2, flags.elements().size());

        var color = assertInstanceOf(AstNode.Array.class, farm.first("color").orElseThrow().value());
        assertEquals(Optional.of("rgb"), color.tag());
        assertEquals(3, color.elements().size());

        var upkeep = assertInstanceOf(AstNode.Reference.class, farm.first("upkeep").orElseThrow().value());
        assertEquals(AstNode.ReferenceKind.VARIABLE, upkeep.kind());
        assertEquals("upkeep_small", upkeep.name());

        var production = assertInstanceOf(AstNode.Reference.class, farm.first("production").orElseThrow().value());
        assertEquals(AstNode.ReferenceKind.INLINE_MATH, production.kind());

        var icon = assertInstanceOf(AstNode.Reference.class, farm.first("icon").orElseThrow().value());
        assertEquals(AstNode.ReferenceKind.PARAMETER, icon.kind());
        assertEquals("ICON", icon.name());

        var name = assertInstanceOf(AstNode.Scalar.class, farm.first("name").orElseThrow().value());
        assertTrue(name.quoted());
        assertEquals("Farm of the \"North\"", name.text());

        var mixed = assertInstanceOf(AstNode.Block.class, farm.first("mixed").orElseThrow().value());
        assertEquals(1, mixed.entries().size());
        assertEquals(1, mixed.values().size());
    }

    @Test
    void keysAreCaseInsensitive() {
        var root = ScriptParser.parse("Cost = 1 COST = 2").root();

        assertEquals(2, root.entries("cost").size());
        assertEquals("Cost", root.entries().get(0).key().text());
        assertSame(root.entries().get(0).key().folded(), root.entries().get(1).key().folded());
    }

    @Test
    void acceptsBlockWithoutEquals() {
        var root = ScriptParser.parse("trigger { always = yes }").root();

        assertEquals(1, root.entries().size());
        assertEquals(Operator.EQUALS, root.entries().get(0).operator());
        assertInstanceOf(AstNode.Block.class, root.entries().get(0).value());
    }

    @Test
    void childSpansLieInsideParentSpans() {
        var root = ScriptParser.parse(BUILDINGS).root();

        assertSpansNested(root);
    }

    private static void assertSpansNested(AstNode node) {
        if (node instanceof AstNode.Block block) {
            for (Entry entry : block.entries()) {
                assertTrue(block.span().encloses(entry.span()), entry + " outside " + block.span());
                assertTrue(entry.span().encloses(entry.value().span()));
                assertSpansNested(entry.value());
            }
            for (var value : block.values()) {
                assertTrue(block.span().encloses(value.span()));
                assertSpansNested(value);
            }
        } else if (node instanceof AstNode.Array array) {
            for (var element : array.elements()) {
                assertTrue(array.span().encloses(element.span()));
            }
        }
    }

    @Test
    void printedTreeReparsesToEqualTree() {
        var first = ScriptParser.parse(BUILDINGS).root();
        var printed = AstPrinter.file(first);
        var second = ScriptParser.parse(printed);

        assertTrue(second.isSuccess(), second.formatDiagnostics());
        assertTrue(AstNode.structurallyEqual(first, second.root()), printed);
    }

    @Test
    void keepsCommentsWhenAsked() {
        var withComments = ScriptParser.parse("## cardinality = 0..1\nhidden = yes # trailing", ParserConfig.SCHEMA);
        var without = ScriptParser.parse("## cardinality = 0..1\nhidden = yes # trailing");

        assertThat(withComments.comments()).extracting(t -> t.kind())
                                           .containsExactly(TokenKind.OPTION_COMMENT, TokenKind.COMMENT);
        assertThat(without.comments()).isEmpty();
    }

    @Test
    void emptyInputGivesEmptyRoot() {
        var result = ScriptParser.parse("");

        assertTrue(result.isSuccess());
        assertTrue(result.root().isEmpty());
    }

    @Test
    void recoversFromStrayOperator() {
        var result = ScriptParser.parse("a = 1\n= oops\nb = 2");

        assertEquals(1, result.diagnostics().size());
        assertEquals(DiagnosticCode.PARSE_ERROR, result.diagnostics().get(0).code());
        assertEquals(2, result.diagnostics().get(0).span().start().line());
        assertThat(result.root().entries()).extracting(e -> e.key().text())
                                           .containsExactly("a", "b");
    }

    @Test
    void recoversFromMissingValue() {
        var result = ScriptParser.parse("a = = b = 2");

        assertEquals(1, result.diagnostics().size());
        assertThat(result.root().entries()).extracting(e -> e.key().text())
                                           .containsExactly("b");
    }

    @Test
    void reportsUnclosedBlockOnce() {
        var result = ScriptParser.parse("a = {\n    b = 1\n");

        assertEquals(1, result.diagnostics().size());
        assertTrue(result.diagnostics().get(0).message().startsWith("Unclosed"));
        var a = (AstNode.Block) result.root().entries().get(0).value();
        assertEquals("1", a.first("b").orElseThrow().scalarText());
    }

    @Test
    void reportsStrayClosingBraceOnce() {
        var result = ScriptParser.parse("a = 1 } b = 2");

        assertEquals(1, result.diagnostics().size());
        assertEquals(2, result.root().entries().size());
    }

    @Test
    void recoveryNoneStopsAtFirstError() {
        var config = new ParserConfig(RecoveryStrategy.NONE, false);
        var result = ScriptParser.parse("a = 1 } b = 2 } c = 3", config);

        assertEquals(1, result.diagnostics().size());
        assertEquals(List.of("a"),
                     result.root()
                           .entries()
                           .stream()
                           .map(e -> e.key().text())
                           .toList());
    }

    @Test
    void reportsEachBrokenLineOnce() {
        var result = ScriptParser.parse("""
            a = 1
            = x
            b = 2
            = y
            c = 3
            """);

        assertEquals(2, result.diagnostics().size());
        assertEquals(3, result.root().entries().size());
    }

    @Test
    void formatsDiagnosticsWithFileName() {
        var result = ScriptParser.parse("a = 1 }");
        var formatted = result.formatDiagnostics("common/test.txt");

        assertTrue(formatted.contains("error[parse-error]"));
        assertTrue(formatted.contains("--> common/test.txt:1:7"));
    }

    @Test
    void conditionalSectionKeepsItsEntriesApartFromTheBlock() {
        var result = ScriptParser.parse("farm = { category = x [[HAS_Y] category = y ] }");

        assertTrue(result.isSuccess());
        var farm = (AstNode.Block) result.root().entries().get(0).value();
        assertThat(farm.entries("category")).extracting(Entry::scalarText)
                                            .containsExactly("x");
        assertEquals(1, farm.conditionals().size());
        var conditional = farm.conditionals().get(0);
        assertEquals("HAS_Y", conditional.parameter());
        assertFalse(conditional.negated());
        assertEquals("y", conditional.body().first("category").orElseThrow().scalarText());
    }

    @Test
    void parsesNegatedAndNestedConditionals() {
        var result = ScriptParser.parse("[[!NO_Z] z = 1 [[DEEP] w = { v = 2 } ] ]");

        assertTrue(result.isSuccess());
        var outer = result.root().conditionals().get(0);
        assertTrue(outer.negated());
        assertEquals("NO_Z", outer.parameter());
        assertEquals("[[!NO_Z]", outer.header());
        var inner = outer.body().conditionals().get(0);
        assertEquals("DEEP", inner.parameter());
        assertTrue(inner.body().has("w"));
    }

    @Test
    void blockHoldingOnlyAConditionalStaysABlock() {
        var result = ScriptParser.parse("a = { [[P] b ] }");

        assertTrue(result.isSuccess());
        assertInstanceOf(AstNode.Block.class, result.root().entries().get(0).value());
    }

    @Test
    void closingBraceEndsAnUnclosedConditional() {
        var result = ScriptParser.parse("a = { [[P] b = 1 }\nc = 2");

        assertEquals(1, result.diagnostics().size());
        assertTrue(result.diagnostics().get(0).message().startsWith("Unclosed '[[P]'"));
        var a = (AstNode.Block) result.root().entries().get(0).value();
        assertTrue(a.conditionals().get(0).body().has("b"));
        assertTrue(result.root().has("c"));
    }

    @Test
    void reportsStrayClosingBracketOnce() {
        var result = ScriptParser.parse("a = 1 ] b = 2");

        assertEquals(1, result.diagnostics().size());
        assertEquals(2, result.root().entries().size());
    }

    @Test
    void unterminatedStringIsReportedAndKeptToEndOfLine() {
        var result = ScriptParser.parse("name = \"Broken\nb = 1");

        assertEquals(1, result.diagnostics().size());
        assertEquals("Unterminated string", result.diagnostics().get(0).message());
        var name = (AstNode.Scalar) result.root().first("name").orElseThrow().value();
        assertEquals("Broken", name.text());
        assertTrue(name.quoted());
        assertTrue(result.root().has("b"));
    }

    @Test
    void printedConditionalReparsesToEqualTree() {
        var first = ScriptParser.parse("farm = { cost = 1 [[HAS_Y] category = y [[!Z] a = { b = c } ] ] }").root();
        var printed = AstPrinter.file(first);
        var second = ScriptParser.parse(printed);

        assertTrue(second.isSuccess(), printed);
        assertTrue(AstNode.structurallyEqual(first, second.root()), printed);
    }
}
