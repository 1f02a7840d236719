package com.suitemender.core.source;

/**
 * Symbol: one indexed definition with a known location.
 *
 * Lines are 1-based and inclusive, as reported to users and matched against
 * coverage data. {@link #getRange()} exposes the same extent as a half-open
 * {@link LineRange} for interval arithmetic.
 *
 * parentName is the name of the enclosing definition (class or function), or
 * null for a top-level symbol. depth is 0 for top-level symbols.
 */
public final class Symbol {

    private final String     name;
    private final String     file;
    private final SymbolKind kind;
    private final int        startLine;
    private final int        endLine;
    private final int        argCount;
    private final boolean    async;
    private final String     parentName;
    private final int        depth;

    public Symbol(
            String     name,
            String     file,
            SymbolKind kind,
            int        startLine,
            int        endLine,
            int        argCount,
            boolean    async,
            String     parentName,
            int        depth
    ) {
        if (endLine < startLine) {
            throw new IllegalArgumentException(
                    "Symbol " + name + " ends (" + endLine + ") before it starts (" + startLine + ")");
        }
        this.name       = name;
        this.file       = file;
        this.kind       = kind;
        this.startLine  = startLine;
        this.endLine    = endLine;
        this.argCount   = argCount;
        this.async      = async;
        this.parentName = parentName;
        this.depth      = depth;
    }

    public String     getName()       { return name; }
    public String     getFile()       { return file; }
    public SymbolKind getKind()       { return kind; }
    public int        getStartLine()  { return startLine; }
    public int        getEndLine()    { return endLine; }
    public int        getArgCount()   { return argCount; }
    public boolean    isAsync()       { return async; }
    public String     getParentName() { return parentName; }
    public int        getDepth()      { return depth; }

    public boolean isTopLevel() { return depth == 0; }

    public LineRange getRange() {
        return LineRange.inclusive(startLine, endLine);
    }

    public SymbolKey getKey() {
        return new SymbolKey(file, name);
    }

    /** Name qualified by the enclosing definition, e.g. {@code UserService.create}. */
    public String getQualifiedName() {
        return parentName != null ? parentName + "." + name : name;
    }

    @Override
    public String toString() {
        return String.format("Symbol{%s %s:%s lines %d-%d, args=%d%s}",
                kind, file, getQualifiedName(), startLine, endLine, argCount, async ? ", async" : "");
    }
}
