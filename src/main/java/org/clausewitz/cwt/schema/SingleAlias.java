package org.clausewitz.cwt.schema;

import org.clausewitz.cwt.tree.SourceSpan;

/**
 * Named value fragment declared as {@code single_alias[name] = value} and used through
 * {@code single_alias_right[name]}.
 */
public record SingleAlias(String name, ValueSpec value, RuleOptions options, SourceSpan span, String origin) {}
