package com.suitemender.core.shard;

import com.suitemender.core.source.Symbol;
import com.suitemender.core.source.SymbolKey;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * A contiguous slice of the ordered target list, sized to fit one model request.
 */
public final class Shard {

    private final int          index;
    private final List<Symbol> targets;
    private final Set<String>  files;

    public Shard(int index, List<Symbol> targets) {
        this.index   = index;
        this.targets = List.copyOf(targets);
        Set<String> ordered = new LinkedHashSet<>();
        for (Symbol target : targets) ordered.add(target.getFile());
        this.files = Collections.unmodifiableSet(ordered);
    }

    public int          getIndex()   { return index; }
    public List<Symbol> getTargets() { return targets; }
    /** Files containing at least one target, in first-appearance order. */
    public Set<String>  getFiles()   { return files; }

    public boolean isEmpty() {
        return targets.isEmpty();
    }

    public List<SymbolKey> getTargetKeys() {
        return targets.stream().map(Symbol::getKey).collect(Collectors.toList());
    }

    @Override
    public String toString() {
        return "Shard{" + index + ", targets=" + targets.size() + ", files=" + files.size() + "}";
    }
}
