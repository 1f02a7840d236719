package com.suitemender.core.source;

import java.util.Objects;

/**
 * (file, name) identity of a symbol.
 *
 * Every component boundary that refers to a symbol uses this key, never a bare
 * name: the same name defined in two files is two different symbols.
 */
public final class SymbolKey implements Comparable<SymbolKey> {

    private final String file;
    private final String name;

    public SymbolKey(String file, String name) {
        this.file = Objects.requireNonNull(file, "file");
        this.name = Objects.requireNonNull(name, "name");
    }

    public String getFile() { return file; }
    public String getName() { return name; }

    @Override
    public int compareTo(SymbolKey other) {
        int byFile = file.compareTo(other.file);
        return byFile != 0 ? byFile : name.compareTo(other.name);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SymbolKey)) return false;
        SymbolKey that = (SymbolKey) o;
        return file.equals(that.file) && name.equals(that.name);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, name);
    }

    @Override
    public String toString() {
        return file + "::" + name;
    }
}
