package com.suitemender.core.source;

import java.util.*;
import java.util.stream.Collectors;

/**
 * Result of one indexing pass. Built fresh every pass and passed explicitly;
 * nothing caches it between passes.
 *
 * Symbols are in discovery order: files sorted by path, then pre-order
 * definition order inside each file.
 */
public final class SymbolIndex {

    private final Map<String, SourceUnit> units;
    private final List<Symbol>            symbols;
    private final List<Route>             routes;
    private final Map<String, String>     parseFailures;

    public SymbolIndex(List<SourceUnit> units, List<Route> routes, Map<String, String> parseFailures) {
        Map<String, SourceUnit> byPath = new LinkedHashMap<>();
        List<Symbol> all = new ArrayList<>();
        for (SourceUnit unit : units) {
            byPath.put(unit.getPath(), unit);
            all.addAll(unit.getSymbols());
        }
        this.units         = Collections.unmodifiableMap(byPath);
        this.symbols       = List.copyOf(all);
        this.routes        = List.copyOf(routes);
        this.parseFailures = Collections.unmodifiableMap(new LinkedHashMap<>(parseFailures));
    }

    public static SymbolIndex empty() {
        return new SymbolIndex(List.of(), List.of(), Map.of());
    }

    public List<Symbol>            getSymbols()       { return symbols; }
    public List<Route>             getRoutes()        { return routes; }
    /** Path → reason, for files that were skipped. */
    public Map<String, String>     getParseFailures() { return parseFailures; }

    private List<Symbol> symbolsIn(String path) {
        SourceUnit unit = units.get(path);
        return unit == null ? List.of() : unit.getSymbols();
    }

    public Optional<Symbol> find(SymbolKey key) {
        return symbolsIn(key.getFile()).stream()
                .filter(s -> s.getName().equals(key.getName()))
                .findFirst();
    }

    public List<Symbol> symbolsOfKind(Set<SymbolKind> kinds) {
        return symbols.stream()
                .filter(s -> kinds.contains(s.getKind()))
                .collect(Collectors.toList());
    }

    public List<Route> routesMatching(String httpMethod, String path) {
        return routes.stream()
                .filter(r -> r.matches(httpMethod, path))
                .collect(Collectors.toList());
    }

    public int fileCount() {
        return units.size();
    }

    @Override
    public String toString() {
        return "SymbolIndex{files=" + units.size() + ", symbols=" + symbols.size()
                + ", routes=" + routes.size() + ", parseFailures=" + parseFailures.size() + "}";
    }
}
