package com.suitemender.core.source;

import com.suitemender.core.filesystem.FileSystemManager;
import com.suitemender.core.filesystem.FileSystemManager.FileSystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.function.Predicate;

/**
 * SymbolIndexer: walks the workspace and builds a {@link SymbolIndex}.
 *
 * A file that cannot be read or parses with errors is logged, recorded as a
 * parse failure and skipped. Indexing itself never fails on a bad file.
 */
@Component
public class SymbolIndexer {

    private static final Logger log = LoggerFactory.getLogger(SymbolIndexer.class);

    private final FileSystemManager fileSystem;
    private final FrontEndRegistry  frontEnds;
    private final SourceExclusions  exclusions;

    public SymbolIndexer(
            FileSystemManager fileSystem,
            FrontEndRegistry frontEnds,
            @Value("${suitemender.tests.directory:tests}") String testsDirectory
    ) {
        this.fileSystem = fileSystem;
        this.frontEnds  = frontEnds;
        this.exclusions = SourceExclusions.withExtraSegments(Set.of(lastSegment(testsDirectory)));
    }

    public SymbolIndex index() {
        return index(exclusions);
    }

    public SymbolIndex index(Predicate<String> include) {
        log.info("[Indexer] Indexing {}", fileSystem.getWorkspaceRoot());

        SortedMap<String, LanguageFrontEnd> files = new TreeMap<>();
        for (LanguageFrontEnd frontEnd : frontEnds.all()) {
            try {
                for (String path : fileSystem.listFiles(frontEnd.fileExtension(), include)) {
                    files.putIfAbsent(path, frontEnd);
                }
            } catch (FileSystemException e) {
                log.error("[Indexer] Could not enumerate {} files: {}", frontEnd.fileExtension(), e.getMessage());
            }
        }

        List<SourceUnit>    units    = new ArrayList<>();
        List<Route>         routes   = new ArrayList<>();
        Map<String, String> failures = new LinkedHashMap<>();

        for (Map.Entry<String, LanguageFrontEnd> entry : files.entrySet()) {
            String path = entry.getKey();
            LanguageFrontEnd frontEnd = entry.getValue();
            try {
                String text = fileSystem.readFile(path);
                ParsedSource parsed = frontEnd.parseFile(path, text);
                units.add(new SourceUnit(path, parsed.getText(), frontEnd.extractSymbols(parsed)));
                routes.addAll(frontEnd.extractRoutes(parsed));
            } catch (FileSystemException | SourceParseException e) {
                log.warn("[Indexer] Skipping {}: {}", path, e.getMessage());
                failures.put(path, e.getMessage());
            }
        }

        SymbolIndex index = new SymbolIndex(units, routes, failures);
        log.info("[Indexer] {}", index);
        return index;
    }

    private static String lastSegment(String directory) {
        String normalized = directory.replace('\\', '/');
        while (normalized.endsWith("/")) normalized = normalized.substring(0, normalized.length() - 1);
        int slash = normalized.lastIndexOf('/');
        return slash == -1 ? normalized : normalized.substring(slash + 1);
    }
}
