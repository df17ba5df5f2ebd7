package org.clausewitz.cwt.parser;

/**
 * Parser configuration options.
 *
 * @param recoveryStrategy How to continue after a syntax error
 * @param keepComments     Whether comment tokens are collected into {@link ParseResult#comments()}
 */
public record ParserConfig(
    RecoveryStrategy recoveryStrategy,
    boolean keepComments
) {
    public static final ParserConfig DEFAULT = new ParserConfig(
        RecoveryStrategy.RESYNC,
        false
    );

    /**
     * Configuration used for CWT schema text, where {@code ##} and {@code ###} comments carry metadata.
     */
    public static final ParserConfig SCHEMA = new ParserConfig(
        RecoveryStrategy.RESYNC,
        true
    );
}
