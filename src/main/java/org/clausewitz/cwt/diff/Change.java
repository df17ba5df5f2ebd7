package org.clausewitz.cwt.diff;

import org.clausewitz.cwt.tree.AstNode;
import org.clausewitz.cwt.tree.Operator;

import java.util.Optional;

/**
 * One difference between two trees.
 */
public sealed interface Change {
    ChangePath path();

    /**
     * The same difference seen from the other tree.
     */
    Change inverse();

    /**
     * An entry or bare value present only in the new tree.
     */
    record Added(ChangePath path, Optional<Operator> operator, AstNode value) implements Change {
        @Override
        public Change inverse() {
            return new Removed(path, operator, value);
        }
    }

    /**
     * An entry or bare value present only in the old tree.
     */
    record Removed(ChangePath path, Optional<Operator> operator, AstNode value) implements Change {
        @Override
        public Change inverse() {
            return new Added(path, operator, value);
        }
    }

    /**
     * A matched entry or value whose operator, scalar text or node kind differs. Operators are
     * empty for bare values.
     */
    record Changed(ChangePath path,
                   Optional<Operator> beforeOperator,
                   AstNode before,
                   Optional<Operator> afterOperator,
                   AstNode after) implements Change {
        @Override
        public Change inverse() {
            return new Changed(path, afterOperator, after, beforeOperator, before);
        }
    }
}
