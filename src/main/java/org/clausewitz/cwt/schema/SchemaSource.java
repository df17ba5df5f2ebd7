package org.clausewitz.cwt.schema;

import java.util.Objects;

/**
 * One CWT schema file: its text and the name used in error messages.
 */
public record SchemaSource(String origin, String text) {
    public SchemaSource {
        Objects.requireNonNull(origin, "origin");
        Objects.requireNonNull(text, "text");
    }

    public static SchemaSource of(String origin, String text) {
        return new SchemaSource(origin, text);
    }
}
