package com.suitemender.core.generation;

import com.suitemender.config.GenerationMode;
import com.suitemender.core.context.ContextBundle;
import com.suitemender.core.context.ContextExtractor;
import com.suitemender.core.coverage.GapRecord;
import com.suitemender.core.filesystem.FileSystemManager;
import com.suitemender.core.filesystem.FileSystemManager.FileSystemException;
import com.suitemender.core.shard.Shard;
import com.suitemender.core.source.FrontEndRegistry;
import com.suitemender.core.source.LanguageFrontEnd;
import com.suitemender.core.source.Symbol;
import com.suitemender.core.source.SymbolKey;
import com.suitemender.llm.LLMClient;
import com.suitemender.llm.ModelCallException;
import com.suitemender.llm.ModelOutput;
import com.suitemender.llm.ModelRole;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * TestGenerator: one test module per shard.
 *
 * An answer is accepted only when it parses and defines at least one test
 * function. A rejected answer is sent back to the model with the rejection
 * reason, up to maxAttempts requests per shard; nothing is written until an
 * answer is accepted.
 */
@Component
public class TestGenerator {

    private static final Logger log = LoggerFactory.getLogger(TestGenerator.class);

    static final int MAX_PREVIOUS_CHARS = 4000;

    private static final Pattern TEST_FUNCTION = Pattern.compile("(?m)^\\s*(async\\s+)?def\\s+test_\\w*\\s*\\(");

    private final LLMClient         llmClient;
    private final ContextExtractor  contextExtractor;
    private final FrontEndRegistry  frontEnds;
    private final FileSystemManager fileSystem;
    private final String            outputDir;
    private final int               maxContextChars;
    private final int               maxAttempts;

    public TestGenerator(
            LLMClient llmClient,
            ContextExtractor contextExtractor,
            FrontEndRegistry frontEnds,
            FileSystemManager fileSystem,
            @Value("${suitemender.generation.output-dir:tests/generated}") String outputDir,
            @Value("${suitemender.context.max-chars:120000}") int maxContextChars,
            @Value("${suitemender.generation.max-attempts:3}") int maxAttempts
    ) {
        if (maxAttempts < 1) {
            throw new IllegalArgumentException("suitemender.generation.max-attempts must be at least 1, got " + maxAttempts);
        }
        this.llmClient        = llmClient;
        this.contextExtractor = contextExtractor;
        this.frontEnds        = frontEnds;
        this.fileSystem       = fileSystem;
        this.outputDir        = outputDir.endsWith("/") ? outputDir.substring(0, outputDir.length() - 1) : outputDir;
        this.maxContextChars  = maxContextChars;
        this.maxAttempts      = maxAttempts;
    }

    /**
     * @param gaps uncovered lines per target; empty when generation is not gap-focused
     * @return the written file's relative path, empty when the shard was skipped or rejected
     */
    public Optional<String> generate(Shard shard, GenerationMode mode, Map<SymbolKey, GapRecord> gaps) {
        if (shard.isEmpty()) {
            log.info("[Generator] Shard {} has no targets; skipping", shard.getIndex());
            return Optional.empty();
        }

        ContextBundle bundle = contextExtractor.forTargets(shard.getTargetKeys());
        String path = outputPath(mode, shard.getIndex());

        String previous  = null;
        String rejection = null;
        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            String prompt = buildPrompt(shard, mode, gaps, bundle)
                    + retrySection(previous, rejection, attempt);

            String response;
            try {
                response = llmClient.generate(ModelRole.GENERATOR, prompt);
            } catch (ModelCallException e) {
                log.error("[Generator] Model call failed for shard {}: {}", shard.getIndex(), e.getMessage());
                return Optional.empty();
            }

            String code = ModelOutput.extractCode(response);
            Optional<String> problem = validate(path, code);
            if (problem.isEmpty()) {
                return write(shard, path, code);
            }

            log.warn("[Generator] Shard {} attempt {}/{} rejected: {}",
                    shard.getIndex(), attempt, maxAttempts, problem.get());
            previous  = code;
            rejection = problem.get();
        }

        log.warn("[Generator] Rejected shard {} after {} attempt(s): {}", shard.getIndex(), maxAttempts, rejection);
        return Optional.empty();
    }

    private Optional<String> write(Shard shard, String path, String code) {
        try {
            fileSystem.writeFile(path, code.endsWith("\n") ? code : code + "\n");
        } catch (FileSystemException e) {
            log.error("[Generator] Could not write {}: {}", path, e.getMessage());
            return Optional.empty();
        }
        log.info("[Generator] Shard {} → {} ({} targets)", shard.getIndex(), path, shard.getTargets().size());
        return Optional.of(path);
    }

    /** tests/generated/test_generated_unit_0.py */
    public String outputPath(GenerationMode mode, int shardIndex) {
        return outputDir + "/test_generated_" + mode.slug() + "_" + shardIndex + ".py";
    }

    Optional<String> validate(String path, String code) {
        if (code == null || code.isBlank()) {
            return Optional.of("empty output");
        }
        Optional<LanguageFrontEnd> frontEnd = frontEnds.forPath(path);
        if (frontEnd.isEmpty()) {
            return Optional.of("no front end for " + path);
        }
        if (!frontEnd.get().isSyntaxValid(code)) {
            return Optional.of("syntax errors: the module does not parse");
        }
        if (!TEST_FUNCTION.matcher(code).find()) {
            return Optional.of("no test functions");
        }
        return Optional.empty();
    }

    String buildPrompt(Shard shard, GenerationMode mode, Map<SymbolKey, GapRecord> gaps, ContextBundle bundle) {
        StringBuilder sb = new StringBuilder();

        if (mode == GenerationMode.E2E) {
            sb.append("Write end-to-end pytest tests that call these route handlers through the framework's test client.\n");
        } else {
            sb.append("Write unit pytest tests for these targets.\n");
        }

        sb.append("\n## Targets\n");
        for (Symbol target : shard.getTargets()) {
            sb.append("- ").append(target.getKind().name().toLowerCase())
              .append(" `").append(target.getQualifiedName()).append("`")
              .append(" in ").append(target.getFile())
              .append(" (lines ").append(target.getStartLine()).append("-").append(target.getEndLine()).append(")");
            GapRecord gap = gaps.get(target.getKey());
            if (gap != null) {
                sb.append("; uncovered lines: ").append(gap.describeLines());
            }
            sb.append("\n");
        }

        sb.append("\n## Source\n").append(bundle.render(maxContextChars));
        sb.append("\nImport targets by their module path relative to the project root.\n");
        if (mode == GenerationMode.E2E) {
            sb.append("The `app_client` fixture from conftest.py gives a test client for the application.\n");
        }
        return sb.toString();
    }

    /** Empty on the first attempt; afterwards the rejected answer and why it was rejected. */
    static String retrySection(String previous, String rejection, int attempt) {
        if (attempt == 1 || rejection == null) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        if (previous != null && !previous.isBlank()) {
            String clipped = previous.length() <= MAX_PREVIOUS_CHARS
                    ? previous : previous.substring(0, MAX_PREVIOUS_CHARS);
            sb.append("\n## Previous attempt\n```python\n").append(clipped).append("\n```\n");
        }
        sb.append("\n## Why it was rejected\n").append(rejection).append("\n");
        sb.append("\nAttempt ").append(attempt).append(": return the complete corrected module in a single ```python block,")
          .append(" with at least one `test_` function.\n");
        return sb.toString();
    }
}
