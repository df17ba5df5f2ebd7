package org.clausewitz.cwt.tree;

import com.google.common.collect.Interner;
import com.google.common.collect.Interners;

import java.util.Locale;

/**
 * Process-wide string interner for identifiers and keys.
 *
 * <p>Every key, scalar text and schema name passes through here, so two equal names from any two
 * documents are the same instance. Entries are never evicted; the table grows with the number of
 * distinct identifiers seen during the session.
 */
public final class Names {
    private static final Interner<String> INTERNER = Interners.newStrongInterner();

    private Names() {}

    public static String intern(String name) {
        return INTERNER.intern(name);
    }

    /**
     * Interned lower-case form. Clausewitz keys and identifiers compare case-insensitively.
     */
    public static String folded(String name) {
        return INTERNER.intern(name.toLowerCase(Locale.ROOT));
    }
}
