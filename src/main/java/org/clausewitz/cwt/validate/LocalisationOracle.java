package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.tree.Names;

import java.util.Collection;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Answers whether a localisation key exists. Supplied by the host; the engine never reads
 * localisation files.
 */
@FunctionalInterface
public interface LocalisationOracle {
    /**
     * Oracle for hosts without localisation data: every key exists.
     */
    LocalisationOracle ACCEPT_ALL = key -> true;

    boolean exists(String key);

    /**
     * Oracle over a fixed key set, compared case-insensitively.
     */
    static LocalisationOracle of(Collection<String> keys) {
        Set<String> folded = keys.stream()
                                 .map(Names::folded)
                                 .collect(Collectors.toUnmodifiableSet());
        return key -> folded.contains(Names.folded(key));
    }
}
