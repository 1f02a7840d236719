package com.suitemender.core.shard;

import com.suitemender.core.source.Symbol;
import com.suitemender.core.source.SymbolIndex;
import com.suitemender.core.source.SymbolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Splits an ordered target list into ceil(n / batchSize) contiguous shards.
 * Concatenating the shards' targets gives back the input list exactly.
 */
@Component
public class TargetSharder {

    private static final Logger log = LoggerFactory.getLogger(TargetSharder.class);

    /** Methods travel with their class. */
    public static final Set<SymbolKind> UNIT_TARGET_KINDS =
            EnumSet.of(SymbolKind.FUNCTION, SymbolKind.CLASS, SymbolKind.ROUTE);

    public static final Set<SymbolKind> E2E_TARGET_KINDS = EnumSet.of(SymbolKind.ROUTE);

    public List<Shard> shard(List<Symbol> targets, int batchSize) {
        if (batchSize < 1) {
            throw new IllegalArgumentException("batchSize must be >= 1, got " + batchSize);
        }
        if (targets.isEmpty()) {
            return List.of(new Shard(0, List.of()));
        }

        int numShards = (targets.size() + batchSize - 1) / batchSize;
        List<Shard> shards = new ArrayList<>(numShards);
        for (int i = 0; i < numShards; i++) {
            int from = i * batchSize;
            int to   = Math.min(from + batchSize, targets.size());
            shards.add(new Shard(i, targets.subList(from, to)));
        }
        log.info("[Sharder] {} target(s) → {} shard(s) of at most {}", targets.size(), numShards, batchSize);
        return shards;
    }

    /** Targets of the given kinds, top-level only, in discovery order. */
    public List<Symbol> selectTargets(SymbolIndex index, Set<SymbolKind> kinds) {
        List<Symbol> targets = new ArrayList<>();
        for (Symbol symbol : index.symbolsOfKind(kinds)) {
            if (symbol.isTopLevel() || symbol.getKind() == SymbolKind.ROUTE) {
                targets.add(symbol);
            }
        }
        return targets;
    }
}
