package org.clausewitz.cwt.schema;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Where the members of a {@code complex_enum[name]} come from.
 *
 * <pre>
 * complex_enum[policy_option] = {
 *     path = "game/common/policies"
 *     name = {
 *         option = { name = enum_name }
 *     }
 * }
 * </pre>
 *
 * <p>The {@code name} structure is matched against the block of every top-level entry of the
 * files under {@code path}, or against the file root itself when {@code start_from_root = yes}.
 * The literal {@code enum_name} marks where members sit: as a bare value, as a key, or as the
 * value of an entry.
 *
 * @param paths         Normalized directories, {@code game/} stripped
 * @param nameStructure Shape leading to the members
 */
public record ComplexEnumSource(List<String> paths, boolean startFromRoot, ValueSpec.Block nameStructure) {
    public static final String ENUM_NAME = "enum_name";

    public ComplexEnumSource {
        paths = paths.stream()
                     .map(SchemaType::normalizePath)
                     .collect(ImmutableList.toImmutableList());
    }

    /**
     * Whether a workspace-relative file lies under one of the source directories.
     */
    public boolean matchesPath(String relativePath) {
        var path = SchemaType.normalizePath(relativePath);
        for (var directory : paths) {
            if (path.startsWith(directory + "/")) {
                return true;
            }
        }
        return false;
    }
}
