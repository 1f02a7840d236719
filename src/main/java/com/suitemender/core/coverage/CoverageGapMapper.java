package com.suitemender.core.coverage;

import com.suitemender.core.source.Symbol;
import com.suitemender.core.source.SymbolIndex;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Intersects every indexed symbol's line range with its file's uncovered lines.
 *
 * Nested symbols are evaluated on their own, so an uncovered line inside a
 * method shows up for both the method and its class.
 */
@Component
public class CoverageGapMapper {

    private static final Logger log = LoggerFactory.getLogger(CoverageGapMapper.class);

    public List<GapRecord> mapGaps(SymbolIndex index, CoverageMap coverage) {
        List<GapRecord> gaps = new ArrayList<>();
        Set<String> filesWithGaps = new LinkedHashSet<>();
        Set<String> unmeasured = new LinkedHashSet<>();

        for (Symbol symbol : index.getSymbols()) {
            Optional<FileCoverage> file = coverage.forPath(symbol.getFile());
            if (file.isEmpty()) {
                unmeasured.add(symbol.getFile());
                continue;
            }
            SortedSet<Integer> uncovered = symbol.getRange().intersect(file.get().getUncoveredLines());
            if (!uncovered.isEmpty()) {
                gaps.add(new GapRecord(symbol, uncovered));
                filesWithGaps.add(symbol.getFile());
            }
        }

        if (!unmeasured.isEmpty()) {
            log.info("[GapMapper] {} indexed file(s) absent from coverage report: {}", unmeasured.size(), unmeasured);
        }
        log.info("[GapMapper] {} gap(s) across {} file(s); overall coverage {}%",
                gaps.size(), filesWithGaps.size(), String.format("%.1f", coverage.getOverallLineRate() * 100));
        for (GapRecord gap : gaps) {
            log.debug("[GapMapper]   {}", gap);
        }
        return gaps;
    }
}
