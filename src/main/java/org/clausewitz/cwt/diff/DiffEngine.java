package org.clausewitz.cwt.diff;

import org.clausewitz.cwt.tree.AstNode;
import org.clausewitz.cwt.tree.Entry;
import org.clausewitz.cwt.tree.Operator;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Structural diff of two script trees.
 *
 * <p>Entries are matched by key and occurrence: the n-th {@code key} of a block in one tree pairs
 * with the n-th {@code key} of the same block in the other, keys compared case-insensitively.
 * Matched blocks are compared recursively; bare values and array elements are compared by index.
 * Conditional sections pair by header ({@code [[NAME]} or {@code [[!NAME]}) and occurrence, the
 * same way entries pair by key, and their bodies are diffed as blocks.
 * Spans, whitespace, comments and quoting never produce a change, so reformatting a file yields an
 * empty changeset, and {@code diff(b, a)} holds exactly the {@link Change#inverse() inverses} of
 * the changes in {@code diff(a, b)}.
 */
public final class DiffEngine {
    private DiffEngine() {}

    public static Changeset diff(AstNode.Block before, AstNode.Block after) {
        var changes = new ArrayList<Change>();
        diffBlock(ChangePath.ROOT, before, after, changes);
        return new Changeset(changes);
    }

    private static void diffBlock(ChangePath path, AstNode.Block before, AstNode.Block after, List<Change> out) {
        var afterByKey = byKey(after.entries());
        var beforeSeen = new HashMap<String, Integer>();
        for (var entry : before.entries()) {
            var key = entry.key()
                           .folded();
            int occurrence = beforeSeen.merge(key, 1, Integer::sum) - 1;
            var entryPath = path.key(key, occurrence);
            var candidates = afterByKey.getOrDefault(key, List.of());
            if (occurrence < candidates.size()) {
                diffEntry(entryPath, entry, candidates.get(occurrence), out);
            } else {
                out.add(new Change.Removed(entryPath, Optional.of(entry.operator()), entry.value()));
            }
        }
        var afterSeen = new HashMap<String, Integer>();
        for (var entry : after.entries()) {
            var key = entry.key()
                           .folded();
            int occurrence = afterSeen.merge(key, 1, Integer::sum) - 1;
            if (occurrence >= beforeSeen.getOrDefault(key, 0)) {
                out.add(new Change.Added(path.key(key, occurrence), Optional.of(entry.operator()), entry.value()));
            }
        }
        diffElements(path, before.values(), after.values(), out);
        diffConditionals(path, before.conditionals(), after.conditionals(), out);
    }

    private static void diffConditionals(ChangePath path,
                                         List<AstNode.Conditional> before,
                                         List<AstNode.Conditional> after,
                                         List<Change> out) {
        var afterByHeader = new HashMap<String, List<AstNode.Conditional>>();
        for (var conditional : after) {
            afterByHeader.computeIfAbsent(conditional.header(), k -> new ArrayList<>())
                         .add(conditional);
        }
        var beforeSeen = new HashMap<String, Integer>();
        for (var conditional : before) {
            var header = conditional.header();
            int occurrence = beforeSeen.merge(header, 1, Integer::sum) - 1;
            var candidates = afterByHeader.getOrDefault(header, List.of());
            if (occurrence < candidates.size()) {
                diffBlock(path.key(header, occurrence), conditional.body(), candidates.get(occurrence)
                                                                                      .body(), out);
            } else {
                out.add(new Change.Removed(path.key(header, occurrence), Optional.empty(), conditional));
            }
        }
        var afterSeen = new HashMap<String, Integer>();
        for (var conditional : after) {
            var header = conditional.header();
            int occurrence = afterSeen.merge(header, 1, Integer::sum) - 1;
            if (occurrence >= beforeSeen.getOrDefault(header, 0)) {
                out.add(new Change.Added(path.key(header, occurrence), Optional.empty(), conditional));
            }
        }
    }

    private static Map<String, List<Entry>> byKey(List<Entry> entries) {
        var result = new HashMap<String, List<Entry>>();
        for (var entry : entries) {
            result.computeIfAbsent(entry.key()
                                        .folded(), k -> new ArrayList<>())
                  .add(entry);
        }
        return result;
    }

    private static void diffEntry(ChangePath path, Entry before, Entry after, List<Change> out) {
        if (before.operator() != after.operator()) {
            out.add(new Change.Changed(path,
                                       Optional.of(before.operator()),
                                       before.value(),
                                       Optional.of(after.operator()),
                                       after.value()));
            return;
        }
        diffValue(path, Optional.of(before.operator()), before.value(), after.value(), out);
    }

    private static void diffValue(ChangePath path,
                                  Optional<Operator> operator,
                                  AstNode before,
                                  AstNode after,
                                  List<Change> out) {
        if (before instanceof AstNode.Block a && after instanceof AstNode.Block b) {
            diffBlock(path, a, b, out);
        } else if (before instanceof AstNode.Array a && after instanceof AstNode.Array b && a.tag()
                                                                                              .equals(b.tag())) {
            diffElements(path, a.elements(), b.elements(), out);
        } else if (!leafEqual(before, after)) {
            out.add(new Change.Changed(path, operator, before, operator, after));
        }
    }

    private static void diffElements(ChangePath path, List<AstNode> before, List<AstNode> after, List<Change> out) {
        int common = Math.min(before.size(), after.size());
        for (int i = 0; i < common; i++) {
            diffValue(path.index(i), Optional.empty(), before.get(i), after.get(i), out);
        }
        for (int i = common; i < before.size(); i++) {
            out.add(new Change.Removed(path.index(i), Optional.empty(), before.get(i)));
        }
        for (int i = common; i < after.size(); i++) {
            out.add(new Change.Added(path.index(i), Optional.empty(), after.get(i)));
        }
    }

    // different node kinds, or arrays whose colour tags differ, are never equal
    private static boolean leafEqual(AstNode before, AstNode after) {
        if (before instanceof AstNode.Scalar a && after instanceof AstNode.Scalar b) {
            return a.text()
                    .equals(b.text());
        }
        if (before instanceof AstNode.Reference a && after instanceof AstNode.Reference b) {
            return a.kind() == b.kind() && a.name()
                                            .equals(b.name());
        }
        return false;
    }
}
