package org.clausewitz.cwt.tree;

/**
 * One {@code key op value} assignment inside a block.
 */
public record Entry(Key key, Operator operator, AstNode value, SourceSpan span) {

    public static Entry of(Key key, Operator operator, AstNode value) {
        return new Entry(key, operator, value, key.span()
                                                  .merge(value.span()));
    }

    /**
     * Scalar text of the value, or empty string for non-scalar values.
     */
    public String scalarText() {
        return value instanceof AstNode.Scalar scalar
               ? scalar.text()
               : "";
    }
}
