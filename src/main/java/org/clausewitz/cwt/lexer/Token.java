package org.clausewitz.cwt.lexer;

import org.clausewitz.cwt.tree.SourceSpan;

/**
 * A lexed token. {@code text} is interned; for strings it is the unquoted, unescaped content and
 * for comments it is the text after the leading hash marks.
 */
public record Token(TokenKind kind, String text, SourceSpan span) {

    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    public boolean isOperator(String symbol) {
        return kind == TokenKind.OPERATOR && text.equals(symbol);
    }

    /**
     * Human-readable description for diagnostics.
     */
    public String describe() {
        return switch (kind) {
            case EOF -> "end of input";
            case LBRACE -> "'{'";
            case RBRACE -> "'}'";
            case STRING, UNTERMINATED_STRING -> "string \"" + text + "\"";
            case CONDITIONAL_OPEN -> "'[[" + text + "]'";
            case CONDITIONAL_CLOSE -> "']'";
            case COMMENT, OPTION_COMMENT, DOC_COMMENT -> "comment";
            case INVALID -> "invalid input '" + text + "'";
            default -> "'" + text + "'";
        };
    }

    @Override
    public String toString() {
        return kind + "(" + text + ")@" + span.start();
    }
}
