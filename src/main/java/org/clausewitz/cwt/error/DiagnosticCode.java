package org.clausewitz.cwt.error;

/**
 * Machine-checkable rule codes carried by every {@link Diagnostic}.
 */
public enum DiagnosticCode {
    PARSE_ERROR("parse-error"),
    MISSING_REQUIRED_KEY("missing-required-key"),
    UNEXPECTED_KEY("unexpected-key"),
    CARDINALITY_VIOLATION("cardinality-violation"),
    TYPE_MISMATCH("type-mismatch"),
    UNKNOWN_ENUM_VALUE("unknown-enum-value"),
    UNDEFINED_REFERENCE("undefined-reference"),
    MISSING_LOCALISATION_KEY("missing-localisation-key"),
    UNRESOLVED_ALIAS("unresolved-alias"),
    SCOPE_MISMATCH("scope-mismatch"),
    DUPLICATE_DEFINITION("duplicate-definition");

    private final String id;

    DiagnosticCode(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    @Override
    public String toString() {
        return id;
    }
}
