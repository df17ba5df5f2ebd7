package org.clausewitz.cwt.validate;

import org.clausewitz.cwt.tree.SourceSpan;

/**
 * A value a script declares for {@code value_set[set]}, e.g. a flag name set by an effect.
 */
public record DeclaredValue(String set, String name, SourceSpan span) {}
