package org.clausewitz.cwt.analysis;

import org.clausewitz.cwt.tree.SourceSpan;

/**
 * Where a named definition is declared.
 *
 * @param type Schema type name
 * @param name Definition name as written
 * @param path Workspace-relative path of the declaring document
 * @param span Span of the definition key
 */
public record SymbolLocation(String type, String name, String path, SourceSpan span) {}
