package org.clausewitz.cwt.analysis;

import org.clausewitz.cwt.parser.ParseResult;
import org.clausewitz.cwt.tree.AstNode;

import java.util.List;

/**
 * Immutable snapshot of one open document at one revision.
 *
 * @param path     Workspace-relative path
 * @param revision Store-wide increasing number; a newer snapshot of the same path always has a
 *                 larger one
 * @param parse    Parse tree and syntax diagnostics of {@code text}
 * @param symbols  Definitions the document declares under the schema it was indexed with
 */
public record Document(String path, String text, long revision, ParseResult parse, List<SymbolLocation> symbols) {
    public Document {
        symbols = List.copyOf(symbols);
    }

    public AstNode.Block root() {
        return parse.root();
    }

    Document withRevision(long newRevision, List<SymbolLocation> newSymbols) {
        return new Document(path, text, newRevision, parse, newSymbols);
    }
}
