package org.clausewitz.cwt.lexer;

/**
 * Token kinds produced by {@link Lexer}.
 */
public enum TokenKind {
    IDENTIFIER,
    STRING,
    /** A string missing its closing quote; the text runs to the end of the line */
    UNTERMINATED_STRING,
    NUMBER,
    OPERATOR,
    LBRACE,
    RBRACE,
    /** {@code [[PARAM]} or {@code [[!PARAM]}; the text is the parameter, with the {@code !} */
    CONDITIONAL_OPEN,
    /** {@code ]} closing a conditional section */
    CONDITIONAL_CLOSE,
    /** {@code # text} */
    COMMENT,
    /** {@code ## key = value}, schema option directive */
    OPTION_COMMENT,
    /** {@code ### text}, schema documentation */
    DOC_COMMENT,
    INVALID,
    EOF;

    public boolean isComment() {
        return this == COMMENT || this == OPTION_COMMENT || this == DOC_COMMENT;
    }

    /**
     * Kinds that may appear as an entry key or a bare value.
     */
    public boolean isAtom() {
        return this == IDENTIFIER || isString() || this == NUMBER;
    }

    public boolean isString() {
        return this == STRING || this == UNTERMINATED_STRING;
    }
}
