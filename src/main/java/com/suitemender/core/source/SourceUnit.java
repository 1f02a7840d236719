package com.suitemender.core.source;

import java.util.List;

/**
 * One indexed file: root-relative path, the text it was parsed from and its symbols.
 */
public final class SourceUnit {

    private final String       path;
    private final String       text;
    private final List<Symbol> symbols;

    public SourceUnit(String path, String text, List<Symbol> symbols) {
        this.path    = path;
        this.text    = text;
        this.symbols = List.copyOf(symbols);
    }

    public String       getPath()    { return path; }
    public String       getText()    { return text; }
    public List<Symbol> getSymbols() { return symbols; }

    @Override
    public String toString() {
        return "SourceUnit{" + path + ", symbols=" + symbols.size() + "}";
    }
}
