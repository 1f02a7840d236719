package com.suitemender.core.patch;

import com.suitemender.core.filesystem.FileSystemManager;
import com.suitemender.core.filesystem.FileSystemManager.FileSnapshot;
import com.suitemender.core.filesystem.FileSystemManager.FileSystemException;
import com.suitemender.core.runner.TestFailure;
import com.suitemender.core.runner.TestRunReport;
import com.suitemender.core.runner.TestRunner;
import com.suitemender.core.source.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Optional;

/**
 * SymbolPatcher: replaces one definition in a file, using the syntax tree to
 * find exactly which lines it occupies.
 *
 * Sequence per patch:
 *   snapshot bytes → parse → locate → normalize indentation → splice → write
 *   → re-parse → (optionally) re-run the test node
 *
 * Any check failing after the write restores the snapshot, so the file on
 * disk is always either the original bytes or a clean parse containing the
 * replacement.
 */
@Component
public class SymbolPatcher {

    private static final Logger log = LoggerFactory.getLogger(SymbolPatcher.class);

    private static final int MAX_FEEDBACK_CHARS = 2000;

    private final FileSystemManager fileSystem;
    private final FrontEndRegistry  frontEnds;
    private final TestRunner        testRunner;
    private final boolean           verifyWithRunner;

    public SymbolPatcher(
            FileSystemManager fileSystem,
            FrontEndRegistry frontEnds,
            TestRunner testRunner,
            @Value("${suitemender.repair.verify-with-runner:true}") boolean verifyWithRunner
    ) {
        this.fileSystem       = fileSystem;
        this.frontEnds        = frontEnds;
        this.testRunner       = testRunner;
        this.verifyWithRunner = verifyWithRunner;
    }

    /** Patches the failing test's definition and, when enabled, re-runs its node. */
    public PatchOutcome patchTest(TestFailure failure, String replacement) {
        return patch(failure.getTestFile(), failure.getTestName(), failure.getEnclosingClass(),
                replacement, verifyWithRunner ? failure.getNodeId() : null);
    }

    /**
     * @param enclosingName class (or function) the target lives in, to break ties; may be null
     * @param verifyNodeId  test node to re-run after a clean re-parse; null skips the run
     */
    public PatchOutcome patch(String file, String name, String enclosingName,
                              String replacement, String verifyNodeId) {
        SymbolKey target = new SymbolKey(file, name);

        if (replacement == null || replacement.isBlank()) {
            return PatchOutcome.notApplied(target, "empty replacement");
        }
        Optional<LanguageFrontEnd> frontEnd = frontEnds.forPath(file);
        if (frontEnd.isEmpty()) {
            return PatchOutcome.notApplied(target, "no front end for " + file);
        }

        FileSnapshot snapshot;
        try {
            snapshot = fileSystem.snapshot(file);
        } catch (FileSystemException e) {
            return PatchOutcome.notApplied(target, "cannot read file: " + e.getMessage());
        }
        if (!snapshot.existed()) {
            return PatchOutcome.notApplied(target, "file does not exist");
        }

        String original = snapshot.getText();
        ParsedSource parsed = frontEnd.get().parse(file, original);
        if (parsed.hasSyntaxErrors()) {
            return PatchOutcome.notApplied(target, "original file does not parse");
        }

        Optional<DefinitionSite> site = frontEnd.get().findDefinition(parsed, name, enclosingName);
        if (site.isEmpty()) {
            return PatchOutcome.notApplied(target, "definition '" + name + "' not found");
        }

        String patched = splice(original, site.get(), replacement);

        // ---- write, then every failed check below restores the snapshot ----
        try {
            fileSystem.writeFile(file, patched);
        } catch (FileSystemException e) {
            return restoreAfter(snapshot, target, "write failed: " + e.getMessage(), "");
        }

        ParsedSource reparsed = frontEnd.get().parse(file, patched);
        if (reparsed.hasSyntaxErrors()) {
            log.warn("[Patcher] Replacement for {} does not parse; restoring", target);
            return restoreAfter(snapshot, target, "patched file does not parse",
                    "The replacement produced a syntax error in " + file + ".");
        }
        if (frontEnd.get().findDefinitions(reparsed, name).isEmpty()) {
            return restoreAfter(snapshot, target, "replacement does not define '" + name + "'",
                    "The replacement must define '" + name + "'.");
        }

        if (verifyNodeId != null) {
            TestRunReport report = testRunner.runNode(verifyNodeId);
            if (!report.allPassed()) {
                log.info("[Patcher] {} still failing after patch: {}", verifyNodeId, report.getSummary());
                return restoreAfter(snapshot, target, "test still fails after patch", describe(report));
            }
        }

        log.info("[Patcher] Patched {} at {}", target, site.get().getDecoratedRange());
        return PatchOutcome.validated(target, verifyNodeId != null ? "patched; test passes" : "patched; file parses");
    }

    // ========================================================================
    // SPLICING
    // ========================================================================

    /**
     * Replaces the definition's lines with the replacement, re-indented to the
     * definition's column.
     *
     * Decorators are replaced only when the replacement brings its own. Lines
     * the replacement puts before its def/class (an added import, say) go
     * above the original decorators, which are then re-inserted unchanged
     * directly over the new header. Text outside the replaced lines keeps its
     * exact bytes, line endings included.
     */
    static String splice(String original, DefinitionSite site, String replacement) {
        String newline = original.contains("\r\n") ? "\r\n" : "\n";
        List<Integer> lineStarts = lineStarts(original);

        LineRange definition = site.getDefinitionRange();
        LineRange decorated  = site.getDecoratedRange();

        String firstLine = lineAt(original, lineStarts, definition.startIndex());
        String indent = firstLine.substring(0, firstLine.length() - firstLine.stripLeading().length());

        List<String> block = normalizeIndentation(replacement, indent);
        int header = headerIndex(block);
        List<String> leading = block.subList(0, header);
        boolean ownDecorators = header == 0
                ? block.get(0).stripLeading().startsWith("@")
                : leading.stream().anyMatch(l -> l.stripLeading().startsWith("@"));

        LineRange range = definition;
        String keptDecorators = "";
        if (ownDecorators) {
            range = decorated;
        } else if (!leading.isEmpty() && site.hasDecorators()) {
            range = decorated;
            keptDecorators = original.substring(
                    offsetOf(original, lineStarts, decorated.startIndex()),
                    offsetOf(original, lineStarts, definition.startIndex()));
        }

        int from = offsetOf(original, lineStarts, range.startIndex());
        int to   = offsetOf(original, lineStarts, range.endIndex());
        boolean terminated = to > from && original.charAt(to - 1) == '\n';

        StringBuilder out = new StringBuilder(original.length() + replacement.length());
        out.append(original, 0, from);
        appendLines(out, leading, newline);
        out.append(keptDecorators);
        appendLines(out, block.subList(header, block.size()), newline);
        if (!terminated) {
            out.setLength(out.length() - newline.length());
        }
        out.append(original, to, original.length());
        return out.toString();
    }

    /** Index of the first def/class line, or 0 when the block has none. */
    private static int headerIndex(List<String> block) {
        for (int i = 0; i < block.size(); i++) {
            String line = block.get(i).stripLeading();
            if (line.startsWith("def ") || line.startsWith("async def ") || line.startsWith("class ")) {
                return i;
            }
        }
        return 0;
    }

    /** Offsets where each line begins; a trailing newline does not open a new line. */
    private static List<Integer> lineStarts(String text) {
        List<Integer> starts = new ArrayList<>();
        starts.add(0);
        for (int i = 0; i < text.length() - 1; i++) {
            if (text.charAt(i) == '\n') starts.add(i + 1);
        }
        return starts;
    }

    private static int offsetOf(String text, List<Integer> lineStarts, int lineIndex) {
        return lineIndex < lineStarts.size() ? lineStarts.get(lineIndex) : text.length();
    }

    private static String lineAt(String text, List<Integer> lineStarts, int lineIndex) {
        int start = offsetOf(text, lineStarts, lineIndex);
        int end = text.indexOf('\n', start);
        return stripTrailing(text.substring(start, end < 0 ? text.length() : end));
    }

    private static void appendLines(StringBuilder out, List<String> lines, String newline) {
        for (String line : lines) {
            out.append(line).append(newline);
        }
    }

    /**
     * Shifts the block so its least-indented line sits at targetIndent.
     * Relative indentation is kept; blank lines become empty.
     */
    static List<String> normalizeIndentation(String code, String targetIndent) {
        List<String> lines = Arrays.asList(code.replace("\r\n", "\n").split("\n", -1));

        int end = lines.size();
        while (end > 0 && lines.get(end - 1).isBlank()) end--;
        int start = 0;
        while (start < end && lines.get(start).isBlank()) start++;
        lines = lines.subList(start, end);

        int minIndent = Integer.MAX_VALUE;
        for (String line : lines) {
            if (line.isBlank()) continue;
            minIndent = Math.min(minIndent, line.length() - line.stripLeading().length());
        }
        if (minIndent == Integer.MAX_VALUE) minIndent = 0;

        List<String> out = new ArrayList<>(lines.size());
        for (String line : lines) {
            if (line.isBlank()) {
                out.add("");
            } else {
                out.add(targetIndent + stripTrailing(line.substring(minIndent)));
            }
        }
        return out;
    }

    private static String stripTrailing(String line) {
        return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
    }

    // ========================================================================
    // ROLLBACK
    // ========================================================================

    private PatchOutcome restoreAfter(FileSnapshot snapshot, SymbolKey target, String reason, String feedback) {
        try {
            fileSystem.restore(snapshot);
        } catch (FileSystemException e) {
            log.error("[Patcher] RESTORE FAILED for {}: {}", snapshot.getRelativePath(), e.getMessage());
            return PatchOutcome.rolledBack(target, reason + "; restore failed: " + e.getMessage(), feedback);
        }
        return PatchOutcome.rolledBack(target, reason, feedback);
    }

    private static String describe(TestRunReport report) {
        StringBuilder sb = new StringBuilder(report.getSummary());
        if (!report.isCompleted()) {
            sb.append("\n").append(report.getStatusDetail());
        }
        for (TestFailure failure : report.getFailures()) {
            sb.append("\n").append(failure.getNodeId()).append(": ").append(failure.headline());
            sb.append("\n").append(failure.getRawTrace());
        }
        String text = sb.toString();
        return text.length() <= MAX_FEEDBACK_CHARS ? text : text.substring(0, MAX_FEEDBACK_CHARS) + "\n...";
    }
}
