package org.clausewitz.cwt.diff;

import com.google.common.collect.ImmutableList;
import org.clausewitz.cwt.tree.AstNode;
import org.clausewitz.cwt.tree.AstPrinter;
import org.clausewitz.cwt.tree.Operator;

import java.util.List;
import java.util.Optional;

/**
 * Ordered differences between two trees: changes reachable from the old tree in its document
 * order, then additions that exist only in the new tree.
 */
public record Changeset(List<Change> changes) {
    public Changeset {
        changes = ImmutableList.copyOf(changes);
    }

    public boolean isEmpty() {
        return changes.isEmpty();
    }

    public int size() {
        return changes.size();
    }

    public Changeset inverse() {
        return new Changeset(changes.stream()
                                    .map(Change::inverse)
                                    .toList());
    }

    /**
     * One line per change:
     * <pre>
     * + path = value
     * - path = value
     * ~ path = old -> = new
     * </pre>
     */
    public String render() {
        var sb = new StringBuilder();
        for (var change : changes) {
            if (change instanceof Change.Added added) {
                line(sb.append("+ "), added.path(), added.operator(), added.value());
            } else if (change instanceof Change.Removed removed) {
                line(sb.append("- "), removed.path(), removed.operator(), removed.value());
            } else if (change instanceof Change.Changed changed) {
                line(sb.append("~ "), changed.path(), changed.beforeOperator(), changed.before());
                sb.append(" ->");
                value(sb, changed.afterOperator(), changed.after());
            }
            sb.append('\n');
        }
        return sb.toString();
    }

    private static void line(StringBuilder sb, ChangePath path, Optional<Operator> operator, AstNode value) {
        sb.append(path);
        value(sb, operator, value);
    }

    private static void value(StringBuilder sb, Optional<Operator> operator, AstNode value) {
        sb.append(' ')
          .append(operator.map(Operator::symbol)
                          .orElse(":"))
          .append(' ')
          .append(AstPrinter.oneLine(value));
    }

    @Override
    public String toString() {
        return render();
    }
}
