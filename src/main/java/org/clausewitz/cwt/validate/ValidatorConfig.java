package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.error.Diagnostic.Severity;

import java.util.Optional;

/**
 * Validator configuration options.
 *
 * @param unexpectedKeySeverity  Severity of unexpected-key diagnostics; empty to suppress them
 * @param lenientWildcardBlocks  Do not report unexpected keys in blocks whose rules include a
 *                               type-pattern key such as {@code <resource> = int}
 * @param localisationSeverity   Severity of missing-localisation-key diagnostics
 * @param maxAliasDepth          Bound on nested single-alias resolution; exceeding it is an engine defect
 */
public record ValidatorConfig(
    Optional<Severity> unexpectedKeySeverity,
    boolean lenientWildcardBlocks,
    Severity localisationSeverity,
    int maxAliasDepth
) {
    public static final ValidatorConfig DEFAULT = new ValidatorConfig(
        Optional.of(Severity.WARNING),
        false,
        Severity.WARNING,
        64
    );

    public ValidatorConfig withUnexpectedKeys(Severity severity) {
        return new ValidatorConfig(Optional.of(severity), lenientWildcardBlocks, localisationSeverity, maxAliasDepth);
    }

    public ValidatorConfig ignoringUnexpectedKeys() {
        return new ValidatorConfig(Optional.empty(), lenientWildcardBlocks, localisationSeverity, maxAliasDepth);
    }

    public ValidatorConfig withLenientWildcardBlocks(boolean lenient) {
        return new ValidatorConfig(unexpectedKeySeverity, lenient, localisationSeverity, maxAliasDepth);
    }
}
