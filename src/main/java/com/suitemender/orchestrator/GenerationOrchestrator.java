package com.suitemender.orchestrator;

import com.suitemender.config.GenerationMode;
import com.suitemender.config.GenerationModeResolver;
import com.suitemender.core.coverage.CoverageGapMapper;
import com.suitemender.core.coverage.CoverageMap;
import com.suitemender.core.coverage.CoverageReportParser;
import com.suitemender.core.coverage.CoverageReportParser.CoverageReportException;
import com.suitemender.core.coverage.GapRecord;
import com.suitemender.core.filesystem.FileSystemManager;
import com.suitemender.core.generation.ConftestWriter;
import com.suitemender.core.generation.TestGenerator;
import com.suitemender.core.shard.Shard;
import com.suitemender.core.shard.TargetSharder;
import com.suitemender.core.source.Symbol;
import com.suitemender.core.source.SymbolIndex;
import com.suitemender.core.source.SymbolIndexer;
import com.suitemender.core.source.SymbolKey;
import com.suitemender.core.source.SymbolKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * GenerationOrchestrator: index → (gap-focused: coverage → gaps) → shard → conftest → generate per shard.
 */
@Component
public class GenerationOrchestrator {

    private static final Logger log = LoggerFactory.getLogger(GenerationOrchestrator.class);

    private final SymbolIndexer          indexer;
    private final CoverageReportParser   coverageParser;
    private final CoverageGapMapper      gapMapper;
    private final TargetSharder          sharder;
    private final TestGenerator          generator;
    private final ConftestWriter         conftestWriter;
    private final GenerationModeResolver modeResolver;
    private final FileSystemManager      fileSystem;
    private final String                 coverageReport;
    private final boolean                gapFocusedByDefault;

    public GenerationOrchestrator(
            SymbolIndexer          indexer,
            CoverageReportParser   coverageParser,
            CoverageGapMapper      gapMapper,
            TargetSharder          sharder,
            TestGenerator          generator,
            ConftestWriter         conftestWriter,
            GenerationModeResolver modeResolver,
            FileSystemManager      fileSystem,
            @Value("${suitemender.coverage.report:coverage.xml}") String coverageReport,
            @Value("${suitemender.generation.gap-focused:true}") boolean gapFocusedByDefault
    ) {
        this.indexer             = indexer;
        this.coverageParser      = coverageParser;
        this.gapMapper           = gapMapper;
        this.sharder             = sharder;
        this.generator           = generator;
        this.conftestWriter      = conftestWriter;
        this.modeResolver        = modeResolver;
        this.fileSystem          = fileSystem;
        this.coverageReport      = coverageReport;
        this.gapFocusedByDefault = gapFocusedByDefault;
    }

    /** Runs with the configured mode and gap setting. */
    public GenerationReport run() {
        return run(modeResolver.getMode());
    }

    /** Runs in the given mode with the configured gap setting. */
    public GenerationReport run(GenerationMode mode) {
        return run(mode, gapFocusedByDefault);
    }

    public GenerationReport run(GenerationMode mode, boolean gapFocused) {
        log.info("========== SUITEMENDER GENERATION START ({}, gap-focused={}) ==========", mode.slug(), gapFocused);
        GenerationReport report = new GenerationReport(mode, gapFocused);

        SymbolIndex index = indexer.index();
        Set<SymbolKind> kinds = mode == GenerationMode.E2E
                ? TargetSharder.E2E_TARGET_KINDS
                : TargetSharder.UNIT_TARGET_KINDS;
        List<Symbol> targets = sharder.selectTargets(index, kinds);

        Map<SymbolKey, GapRecord> gaps = new LinkedHashMap<>();
        if (gapFocused) {
            Optional<CoverageMap> coverage = loadCoverage();
            if (coverage.isEmpty()) {
                report.abort("coverage report unavailable: " + coverageReport);
                return report;
            }
            for (GapRecord gap : gapMapper.mapGaps(index, coverage.get())) {
                gaps.put(gap.getSymbol().getKey(), gap);
            }
            report.setGaps(gaps.size());
            targets = targets.stream().filter(t -> gaps.containsKey(t.getKey())).collect(Collectors.toList());
        }
        report.setTargets(targets.size());

        List<Shard> shards = sharder.shard(targets, modeResolver.batchSizeFor(mode));
        report.setShards(shards.size());

        if (shards.stream().anyMatch(shard -> !shard.isEmpty())) {
            conftestWriter.ensureConftest().ifPresent(report::setConftest);
        }

        for (Shard shard : shards) {
            if (shard.isEmpty()) {
                log.info("[Generation] Nothing to generate");
                continue;
            }
            Optional<String> written = generator.generate(shard, mode, gaps);
            if (written.isPresent()) {
                report.generated(written.get());
            } else {
                report.rejected();
            }
        }

        log.info("========== SUITEMENDER GENERATION END: {} ==========", report);
        return report;
    }

    private Optional<CoverageMap> loadCoverage() {
        Path path = Paths.get(coverageReport);
        if (!path.isAbsolute()) {
            path = fileSystem.getWorkspaceRoot().resolve(path).normalize();
        }
        try {
            return Optional.of(coverageParser.parse(path));
        } catch (CoverageReportException e) {
            log.error("[Generation] Cannot read coverage report {}: {}", path, e.getMessage());
            return Optional.empty();
        }
    }
}
