package org.clausewitz.cwt.error;

import org.clausewitz.cwt.tree.SourceSpan;

import java.util.List;

/**
 * Problems that make a schema set unusable. Any one of them aborts the load.
 */
public sealed interface SchemaError {
    String origin();

    SourceSpan span();

    String message();

    default String describe() {
        return origin() + ":" + span().start() + ": " + message();
    }

    /**
     * The schema text itself could not be parsed.
     */
    record Syntax(String origin, SourceSpan span, String detail) implements SchemaError {
        @Override
        public String message() {
            return "Syntax error: " + detail;
        }
    }

    /**
     * A directive or rule whose form is not understood, e.g. a malformed cardinality.
     */
    record InvalidDirective(String origin, SourceSpan span, String directive, String reason) implements SchemaError {
        @Override
        public String message() {
            return "Invalid directive '" + directive + "': " + reason;
        }
    }

    /**
     * A rule refers to an alias category, single alias, enum or type that no loaded file defines.
     */
    record UndefinedName(String origin, SourceSpan span, String kind, String name) implements SchemaError {
        @Override
        public String message() {
            return "Undefined " + kind + " '" + name + "'";
        }
    }

    /**
     * Alias categories whose expansions only ever lead back into each other and never reach a
     * terminal rule.
     */
    record AliasCycle(String origin, SourceSpan span, List<String> categories) implements SchemaError {
        public AliasCycle {
            categories = List.copyOf(categories);
        }

        @Override
        public String message() {
            return "Alias cycle without a terminating rule: " + String.join(" -> ", categories);
        }
    }

    /**
     * The same type is declared twice with conflicting definitions.
     */
    record DuplicateType(String origin, SourceSpan span, String name) implements SchemaError {
        @Override
        public String message() {
            return "Type '" + name + "' is declared more than once";
        }
    }
}
