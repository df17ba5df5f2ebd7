package org.clausewitz.cwt.schema;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import org.clausewitz.cwt.error.SchemaError;

import java.util.List;
import java.util.Map;

/**
 * Declarations read from a single schema file, before merging and cross-checking.
 *
 * @param shapes Top-level {@code name = { ... }} blocks keyed by folded name
 * @param errors Problems found in this file alone
 */
public record SchemaFile(
    String origin,
    List<SchemaType> types,
    Map<String, List<SchemaRule>> shapes,
    List<EnumDefinition> enums,
    List<AliasDefinition> aliases,
    List<SingleAlias> singleAliases,
    List<LinkDefinition> links,
    List<SchemaError> errors
) {
    public SchemaFile {
        types = ImmutableList.copyOf(types);
        shapes = ImmutableMap.copyOf(shapes);
        enums = ImmutableList.copyOf(enums);
        aliases = ImmutableList.copyOf(aliases);
        singleAliases = ImmutableList.copyOf(singleAliases);
        links = ImmutableList.copyOf(links);
        errors = ImmutableList.copyOf(errors);
    }

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
