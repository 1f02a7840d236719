package com.suitemender.core.source;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

/**
 * One source file and its structural tree.
 *
 * Holds the TSTree reference for as long as any TSNode from it is in use; the
 * native tree is released when the TSTree is collected.
 */
public final class ParsedSource {

    private final String     path;
    private final SourceText content;
    private final TSTree     tree;
    private final TSNode     root;

    ParsedSource(String path, SourceText content, TSTree tree) {
        this.path    = path;
        this.content = content;
        this.tree    = tree;
        this.root    = tree.getRootNode();
    }

    public String     getPath()    { return path; }
    public String     getText()    { return content.text(); }
    public TSNode     getRoot()    { return root; }

    /** True when the tree contains ERROR or MISSING nodes. */
    public boolean hasSyntaxErrors() {
        return root == null || root.isNull() || root.hasError();
    }

    public String textOf(TSNode node) {
        return content.textOf(node);
    }

    @Override
    public String toString() {
        return "ParsedSource{" + path + ", bytes=" + content.byteLength() + ", errors=" + hasSyntaxErrors() + "}";
    }
}
