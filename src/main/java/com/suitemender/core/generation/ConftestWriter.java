package com.suitemender.core.generation;

import com.suitemender.core.filesystem.FileSystemManager;
import com.suitemender.core.filesystem.FileSystemManager.FileSystemException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;
import org.springframework.util.StreamUtils;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Optional;

/**
 * Writes conftest.py into the generated-tests directory so generated modules
 * can import the project under test and use the {@code app_client} fixture.
 *
 * A conftest.py that lacks the generated header belongs to the user and is
 * left alone.
 */
@Component
public class ConftestWriter {

    private static final Logger log = LoggerFactory.getLogger(ConftestWriter.class);

    static final String TEMPLATE          = "generation/conftest.py";
    static final String GENERATED_MARK    = "# Generated by SuiteMender.";
    static final String DEPTH_PLACEHOLDER = "@ROOT_DEPTH@";

    private final FileSystemManager fileSystem;
    private final String            outputDir;
    private final boolean           enabled;

    public ConftestWriter(
            FileSystemManager fileSystem,
            @Value("${suitemender.generation.output-dir:tests/generated}") String outputDir,
            @Value("${suitemender.generation.conftest:true}") boolean enabled
    ) {
        this.fileSystem = fileSystem;
        this.outputDir  = outputDir.endsWith("/") ? outputDir.substring(0, outputDir.length() - 1) : outputDir;
        this.enabled    = enabled;
    }

    /** @return the conftest path when it was written, empty when disabled or user-owned */
    public Optional<String> ensureConftest() {
        if (!enabled) {
            return Optional.empty();
        }
        String path = outputDir.isEmpty() ? "conftest.py" : outputDir + "/conftest.py";

        try {
            if (fileSystem.fileExists(path) && !fileSystem.readFile(path).startsWith(GENERATED_MARK)) {
                log.info("[Conftest] {} exists and is not generated; leaving it", path);
                return Optional.empty();
            }
            fileSystem.writeFile(path, render());
        } catch (FileSystemException e) {
            log.warn("[Conftest] Could not write {}: {}", path, e.getMessage());
            return Optional.empty();
        }
        log.info("[Conftest] Wrote {}", path);
        return Optional.of(path);
    }

    String render() {
        return loadTemplate().replace(DEPTH_PLACEHOLDER, String.valueOf(rootDepth()));
    }

    /** Directories between the workspace root and the conftest: parents[n] of the file is the root. */
    int rootDepth() {
        return (int) Arrays.stream(outputDir.split("/"))
                .filter(segment -> !segment.isEmpty() && !segment.equals("."))
                .count();
    }

    private static String loadTemplate() {
        try (InputStream in = new ClassPathResource(TEMPLATE).getInputStream()) {
            return StreamUtils.copyToString(in, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new UncheckedIOException("conftest template missing from classpath: " + TEMPLATE, e);
        }
    }
}
