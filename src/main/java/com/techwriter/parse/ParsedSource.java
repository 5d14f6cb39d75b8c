package com.techwriter.parse;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * A parsed file. Holds the tree so its native memory lives as long as the nodes taken from it.
 */
public record ParsedSource(LanguageGrammar grammar, SourceText source, TSTree tree) {

    public TSNode root() {
        return tree.getRootNode();
    }

    public String language() {
        return grammar.name();
    }
}
