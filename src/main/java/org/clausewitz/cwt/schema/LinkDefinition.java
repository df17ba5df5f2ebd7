package org.clausewitz.cwt.schema;

import com.google.common.collect.ImmutableList;
import org.clausewitz.cwt.tree.Names;
import org.clausewitz.cwt.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * A scope link declared in the {@code links} section, e.g.
 * <pre>
 * links = {
 *     owner = {
 *         input_scopes = { planet fleet }
 *         output_scope = country
 *     }
 * }
 * </pre>
 *
 * <p>A link with a {@code prefix} and {@code from_data = yes} matches any path segment that starts
 * with the prefix, such as {@code event_target:my_target}.
 *
 * @param inputScopes Folded scopes the link may be used from; empty means any
 * @param outputScope Folded scope the link leads to
 */
public record LinkDefinition(
    String name,
    List<String> inputScopes,
    String outputScope,
    Optional<String> prefix,
    boolean fromData,
    SourceSpan span,
    String origin
) {
    public static final String ANY = "any";

    public LinkDefinition {
        name = Names.folded(name);
        inputScopes = inputScopes.stream()
                                 .map(Names::folded)
                                 .collect(ImmutableList.toImmutableList());
        outputScope = Names.folded(outputScope);
        prefix = prefix.map(Names::folded);
    }

    /**
     * Whether the link may be followed from {@code scope}. Unknown and {@code any} scopes may use
     * every link.
     */
    public boolean usableFrom(Optional<String> scope) {
        if (scope.isEmpty() || scope.get()
                                    .equals(ANY) || inputScopes.isEmpty() || inputScopes.contains(ANY)) {
            return true;
        }
        return inputScopes.contains(scope.get());
    }

    /**
     * Whether a folded path segment names this link.
     */
    public boolean matches(String segment) {
        if (prefix.isPresent() && fromData) {
            return segment.startsWith(prefix.get()) && segment.length() > prefix.get()
                                                                              .length();
        }
        return segment.equals(name);
    }
}
