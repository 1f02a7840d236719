package com.suitemender.core.context;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Source code handed to the model alongside a failure or a generation shard.
 *
 * files always holds complete file texts. In failure-repair mode a file may
 * also have an excerpt (its top-level definitions), which is what gets
 * rendered in place of the full text.
 */
public final class ContextBundle {

    private static final Logger log = LoggerFactory.getLogger(ContextBundle.class);

    static final String TRUNCATION_MARKER = "\n# ... (truncated)\n";

    private final List<String>        targetNames;
    private final Map<String, String> files;
    private final Map<String, String> excerpts;

    private ContextBundle(List<String> targetNames, Map<String, String> files, Map<String, String> excerpts) {
        this.targetNames = List.copyOf(targetNames);
        this.files       = Collections.unmodifiableMap(new LinkedHashMap<>(files));
        this.excerpts    = Collections.unmodifiableMap(new LinkedHashMap<>(excerpts));
    }

    public static ContextBundle of(List<String> targetNames, Map<String, String> files) {
        return new ContextBundle(targetNames, files, Map.of());
    }

    public static ContextBundle withExcerpts(List<String> targetNames, Map<String, String> files,
                                             Map<String, String> excerpts) {
        return new ContextBundle(targetNames, files, excerpts);
    }

    public static ContextBundle empty(List<String> targetNames) {
        return new ContextBundle(targetNames, Map.of(), Map.of());
    }

    public Map<String, String> getFiles() { return files; }

    public boolean isEmpty() {
        return files.isEmpty();
    }

    /**
     * Labelled per-file blocks, at most maxChars long. Whole trailing files
     * are dropped to fit; only a first file that alone exceeds the budget is
     * cut, and then it ends with a truncation marker.
     */
    public String render(int maxChars) {
        StringBuilder out = new StringBuilder();
        int rendered = 0;

        for (Map.Entry<String, String> entry : files.entrySet()) {
            String body  = excerpts.getOrDefault(entry.getKey(), entry.getValue());
            String block = "# ===== File: " + entry.getKey() + " =====\n" + body
                    + (body.endsWith("\n") ? "" : "\n") + "\n";

            if (out.length() + block.length() <= maxChars) {
                out.append(block);
                rendered++;
                continue;
            }
            if (rendered == 0) {
                int keep = Math.max(0, maxChars - TRUNCATION_MARKER.length());
                out.append(block, 0, Math.min(keep, block.length())).append(TRUNCATION_MARKER);
                rendered++;
                log.warn("[Context] {} alone exceeds {} chars; truncated", entry.getKey(), maxChars);
            } else {
                log.warn("[Context] Dropped {} trailing file(s) to stay within {} chars",
                        files.size() - rendered, maxChars);
            }
            break;
        }
        return out.toString();
    }

    @Override
    public String toString() {
        return "ContextBundle{targets=" + targetNames + ", files=" + files.keySet() + "}";
    }
}
