package org.clausewitz.cwt.schema;

import org.clausewitz.cwt.tree.SourceSpan;

import java.util.Optional;

/**
 * Localisation key a definition is expected to have, e.g. {@code desc = "$_desc"} where {@code $}
 * stands for the definition name.
 *
 * @param name     Requirement name ({@code name}, {@code desc}, ...)
 * @param pattern  Key pattern containing {@code $}
 * @param required Missing keys are reported ({@code ## required})
 * @param primary  The key shown as the definition's display name ({@code ## primary})
 * @param subtype  Only applies to definitions of this subtype
 */
public record LocalisationRequirement(
    String name,
    String pattern,
    boolean required,
    boolean primary,
    Optional<String> subtype,
    SourceSpan span
) {
    public String resolve(String definitionName) {
        return pattern.replace("$", definitionName);
    }
}
