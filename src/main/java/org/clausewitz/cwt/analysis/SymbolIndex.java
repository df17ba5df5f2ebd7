package org.clausewitz.cwt.analysis;

import org.clausewitz.cwt.tree.Names;
import org.clausewitz.cwt.validate.SymbolLookup;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Workspace-wide index of declared definitions, keyed by type and then by folded name.
 *
 * <p>Each document owns the entries it declared; {@link #replace} swaps one owner's entries as a
 * unit, and {@link #replaceAll} swaps the whole index at once. Reads never block and may run while
 * another owner is being replaced.
 */
public final class SymbolIndex implements SymbolLookup {
    private volatile Tables tables = new Tables();

    /**
     * Replace everything {@code path} declares.
     *
     * @return whether the set of declared (type, name) pairs changed
     */
    public synchronized boolean replace(String path, List<SymbolLocation> symbols) {
        var current = tables;
        var previous = current.byOwner.put(path, List.copyOf(symbols));
        if (previous != null) {
            previous.forEach(current::unlink);
        }
        symbols.forEach(current::link);
        return !sameNames(previous == null ? List.of() : previous, symbols);
    }

    /**
     * Drop everything {@code path} declares.
     *
     * @return whether the document declared anything
     */
    public synchronized boolean remove(String path) {
        var current = tables;
        var previous = current.byOwner.remove(path);
        if (previous == null) {
            return false;
        }
        previous.forEach(current::unlink);
        return !previous.isEmpty();
    }

    /**
     * Replace the whole index with the declarations of {@code symbolsByOwner}. The new index is
     * built aside and published in one step, so readers see either the old or the new one.
     */
    public synchronized void replaceAll(Map<String, List<SymbolLocation>> symbolsByOwner) {
        var fresh = new Tables();
        symbolsByOwner.forEach((path, symbols) -> {
            fresh.byOwner.put(path, List.copyOf(symbols));
            symbols.forEach(fresh::link);
        });
        tables = fresh;
    }

    /**
     * Declarations of {@code name} as a {@code type}, possibly from several documents.
     */
    public List<SymbolLocation> lookup(String type, String name) {
        return tables.byType.getOrDefault(Names.folded(type), Map.of())
                            .getOrDefault(Names.folded(name), List.of());
    }

    /**
     * All declarations of a type.
     */
    public List<SymbolLocation> definitions(String type) {
        var result = new ArrayList<SymbolLocation>();
        tables.byType.getOrDefault(Names.folded(type), Map.of())
                     .values()
                     .forEach(result::addAll);
        return result;
    }

    public List<SymbolLocation> declaredBy(String path) {
        return tables.byOwner.getOrDefault(path, List.of());
    }

    @Override
    public boolean exists(String type, String name) {
        return !lookup(type, name).isEmpty();
    }

    @Override
    public boolean hasAny(String type) {
        return !tables.byType.getOrDefault(Names.folded(type), Map.of())
                             .isEmpty();
    }

    @Override
    public Collection<String> names(String type) {
        return definitions(type).stream()
                                .map(SymbolLocation::name)
                                .distinct()
                                .toList();
    }

    private static List<SymbolLocation> concat(List<SymbolLocation> head, List<SymbolLocation> tail) {
        var all = new ArrayList<SymbolLocation>(head);
        all.addAll(tail);
        return List.copyOf(all);
    }

    private static boolean sameNames(List<SymbolLocation> a, List<SymbolLocation> b) {
        if (a.size() != b.size()) {
            return false;
        }
        for (int i = 0; i < a.size(); i++) {
            if (!a.get(i)
                  .type()
                  .equals(b.get(i)
                           .type()) || !Names.folded(a.get(i)
                                                      .name())
                                             .equals(Names.folded(b.get(i)
                                                                   .name()))) {
                return false;
            }
        }
        return true;
    }

    private static final class Tables {
        final Map<String, Map<String, List<SymbolLocation>>> byType = new ConcurrentHashMap<>();
        final Map<String, List<SymbolLocation>> byOwner = new ConcurrentHashMap<>();

        void link(SymbolLocation symbol) {
            byType.computeIfAbsent(Names.folded(symbol.type()), k -> new ConcurrentHashMap<>())
                  .merge(Names.folded(symbol.name()), List.of(symbol), SymbolIndex::concat);
        }

        void unlink(SymbolLocation symbol) {
            var names = byType.get(Names.folded(symbol.type()));
            if (names == null) {
                return;
            }
            names.computeIfPresent(Names.folded(symbol.name()), (name, locations) -> {
                var rest = locations.stream()
                                    .filter(l -> l != symbol)
                                    .toList();
                return rest.isEmpty() ? null : rest;
            });
        }
    }
}
