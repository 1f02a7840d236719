package com.suitemender.orchestrator;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.suitemender.core.filesystem.FileSystemManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;

/**
 * Serializes run reports as pretty-printed JSON. A relative report path is
 * taken against the workspace root.
 */
@Component
public class ReportWriter {

    private static final Logger log = LoggerFactory.getLogger(ReportWriter.class);

    private final ObjectMapper      objectMapper;
    private final FileSystemManager fileSystem;
    private final String            reportPath;

    public ReportWriter(
            ObjectMapper objectMapper,
            FileSystemManager fileSystem,
            @Value("${suitemender.report.path:suitemender_report.json}") String reportPath
    ) {
        this.objectMapper = objectMapper;
        this.fileSystem   = fileSystem;
        this.reportPath   = reportPath;
    }

    public Optional<Path> write(Object report) {
        Path target = Paths.get(reportPath);
        if (!target.isAbsolute()) {
            target = fileSystem.getWorkspaceRoot().resolve(target).normalize();
        }
        try {
            Path parent = target.getParent();
            if (parent != null) Files.createDirectories(parent);
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), report);
        } catch (IOException e) {
            log.error("[Report] Could not write report to {}: {}", target, e.getMessage());
            return Optional.empty();
        }
        log.info("[Report] Written to {}", target);
        return Optional.of(target);
    }
}
