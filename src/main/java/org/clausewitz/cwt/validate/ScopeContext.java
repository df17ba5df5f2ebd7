package org.clausewitz.cwt.validate;

import com.google.common.collect.ImmutableMap;
import org.clausewitz.cwt.schema.LinkDefinition;
import org.clausewitz.cwt.schema.Schema;
import org.clausewitz.cwt.tree.Names;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Scope bindings in effect at one point of a traversal: {@code this}, {@code root}, {@code from},
 * {@code fromfrom}, {@code prev} and {@code prevprev}, each mapped to a folded scope type such as
 * {@code country}.
 *
 * <p>Instances are immutable. {@link #push} and {@link #replace} return the bindings for a
 * subtree and leave the caller's bindings untouched, so rebinding never leaks past the subtree.
 */
public final class ScopeContext {
    public static final String ANY = "any";
    public static final String THIS = "this";
    public static final String ROOT = "root";
    public static final String FROM = "from";
    public static final String FROMFROM = "fromfrom";
    public static final String PREV = "prev";
    public static final String PREVPREV = "prevprev";

    private static final String EVENT_TARGET = "event_target:";

    public static final ScopeContext UNKNOWN = new ScopeContext(ImmutableMap.of());

    private final ImmutableMap<String, String> bindings;

    private ScopeContext(ImmutableMap<String, String> bindings) {
        this.bindings = bindings;
    }

    /**
     * Bindings at the top of a definition: {@code this} and {@code root} are {@code scope}.
     */
    public static ScopeContext of(String scope) {
        var folded = Names.folded(scope);
        return new ScopeContext(ImmutableMap.of(THIS, folded, ROOT, folded));
    }

    public static ScopeContext of(Map<String, String> bindings) {
        var folded = new LinkedHashMap<String, String>();
        bindings.forEach((name, scope) -> folded.put(Names.folded(name), Names.folded(scope)));
        return new ScopeContext(ImmutableMap.copyOf(folded));
    }

    /**
     * Current {@code this} scope, empty when unknown.
     */
    public Optional<String> current() {
        return binding(THIS);
    }

    public Optional<String> binding(String name) {
        return Optional.ofNullable(bindings.get(Names.folded(name)));
    }

    public Map<String, String> bindings() {
        return bindings;
    }

    /**
     * Bindings inside a {@code push_scope}: {@code this} becomes {@code scope}, the old {@code this}
     * becomes {@code prev}.
     */
    public ScopeContext push(String scope) {
        var next = new LinkedHashMap<>(bindings);
        binding(PREV).ifPresentOrElse(prev -> next.put(PREVPREV, prev), () -> next.remove(PREVPREV));
        current().ifPresentOrElse(current -> next.put(PREV, current), () -> next.remove(PREV));
        next.put(THIS, Names.folded(scope));
        return new ScopeContext(ImmutableMap.copyOf(next));
    }

    /**
     * Bindings inside a {@code replace_scope}: each named scope is rebound.
     */
    public ScopeContext replace(Map<String, String> replacements) {
        if (replacements.isEmpty()) {
            return this;
        }
        var next = new LinkedHashMap<>(bindings);
        replacements.forEach((name, scope) -> next.put(Names.folded(name), Names.folded(scope)));
        return new ScopeContext(ImmutableMap.copyOf(next));
    }

    /**
     * Whether {@code name} is a scope keyword that {@link #resolve} understands.
     */
    public static boolean isScopeKeyword(String name) {
        var folded = Names.folded(name);
        return isBinding(folded) || folded.startsWith(EVENT_TARGET);
    }

    private static boolean isBinding(String folded) {
        return folded.equals(THIS) || folded.equals(ROOT) || folded.equals(FROM) || folded.equals(FROMFROM)
               || folded.equals(PREV) || folded.equals(PREVPREV);
    }

    /**
     * Whether every segment of a dotted path is a scope keyword or a link the schema declares.
     */
    public static boolean isScopePath(String path, Schema schema) {
        if (path.isEmpty()) {
            return false;
        }
        for (var part : path.split("\\.", -1)) {
            if (!isScopeKeyword(part) && schema.link(part)
                                               .isEmpty()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Resolve a dotted scope path made of keywords only.
     *
     * @see #resolve(String, Schema)
     */
    public Optional<String> resolve(String path) {
        return resolve(path, Schema.EMPTY);
    }

    /**
     * Resolve a dotted scope path such as {@code root.owner} to a scope type.
     *
     * <p>The first segment may name any binding. Later segments may only be {@code this}, which
     * stays put, {@code root}, or a link, which leads to its output scope. {@code from} and the
     * other history keywords only make sense at the start, so {@code root.from} is unknown.
     *
     * @return the scope type, or empty when any step is unknown (event targets and undeclared
     *         links resolve to unknown)
     */
    public Optional<String> resolve(String path, Schema schema) {
        return walk(path, schema).scope();
    }

    /**
     * The first link in {@code path} followed from a scope it does not accept.
     */
    public Optional<LinkMisuse> misusedLink(String path, Schema schema) {
        return walk(path, schema).misuse();
    }

    private Walk walk(String path, Schema schema) {
        Optional<String> scope = current();
        Optional<LinkMisuse> misuse = Optional.empty();
        var parts = path.split("\\.", -1);
        for (int i = 0; i < parts.length; i++) {
            var folded = Names.folded(parts[i]);
            if (isBinding(folded)) {
                if (i == 0 || folded.equals(ROOT)) {
                    scope = binding(folded);
                } else if (!folded.equals(THIS)) {
                    return new Walk(Optional.empty(), misuse);
                }
            } else {
                var link = schema.link(folded);
                if (link.isEmpty()) {
                    return new Walk(Optional.empty(), misuse);
                }
                if (misuse.isEmpty() && !link.get()
                                             .usableFrom(scope)) {
                    misuse = Optional.of(new LinkMisuse(parts[i], scope.orElseThrow(), link.get()));
                }
                scope = Optional.of(link.get()
                                        .outputScope());
            }
            if (scope.isEmpty()) {
                return new Walk(scope, misuse);
            }
        }
        return new Walk(scope, misuse);
    }

    private record Walk(Optional<String> scope, Optional<LinkMisuse> misuse) {}

    /**
     * A link used from a scope outside its {@code input_scopes}.
     *
     * @param segment Path segment as written
     * @param scope   Scope the link was followed from
     */
    public record LinkMisuse(String segment, String scope, LinkDefinition link) {}

    /**
     * Whether the current scope is one of {@code allowed}. Unknown scopes and {@code any} pass.
     */
    public boolean allows(Iterable<String> allowed) {
        var current = current();
        if (current.isEmpty() || current.get()
                                        .equals(ANY)) {
            return true;
        }
        for (var scope : allowed) {
            if (scope.equals(ANY) || scope.equals(current.get())) {
                return true;
            }
        }
        return false;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ScopeContext other && bindings.equals(other.bindings);
    }

    @Override
    public int hashCode() {
        return bindings.hashCode();
    }

    @Override
    public String toString() {
        return "Scope" + bindings;
    }
}
