package com.suitemender.llm;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pulls code and JSON out of free-form model text.
 *
 * Models wrap answers in markdown fences, add prose before and after, or
 * return a bare object. Extraction is tolerant; validation happens at the
 * caller.
 */
public final class ModelOutput {

    //   ```python\n ... \n```    ```py ...```    ``` ... ```
    private static final Pattern FENCED_BLOCK =
            Pattern.compile("```[ \\t]*([A-Za-z0-9_+-]*)[ \\t]*\\r?\\n(.*?)```", Pattern.DOTALL);

    private static final Pattern STRAY_FENCE =
            Pattern.compile("^[ \\t]*```[A-Za-z0-9_+-]*[ \\t]*$", Pattern.MULTILINE);

    private ModelOutput() {
    }

    /**
     * Contents of the first fenced block. Without any fence, the whole text
     * with stray fence lines removed.
     */
    public static String extractCode(String text) {
        if (text == null) return "";

        Matcher m = FENCED_BLOCK.matcher(text);
        if (m.find()) {
            return trimTrailingNewlines(m.group(2));
        }
        return trimTrailingNewlines(dropLeadingBlankLines(STRAY_FENCE.matcher(text).replaceAll("")));
    }

    /**
     * The JSON object in the text: a ```json block, else any fenced block that
     * holds an object, else everything from the first '{' to the last '}'.
     */
    public static Optional<String> extractJsonObject(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        Matcher m = FENCED_BLOCK.matcher(text);
        String anyObject = null;
        while (m.find()) {
            String body = m.group(2).strip();
            if (!body.startsWith("{")) continue;
            if ("json".equalsIgnoreCase(m.group(1))) return Optional.of(body);
            if (anyObject == null) anyObject = body;
        }
        if (anyObject != null) return Optional.of(anyObject);

        int start = text.indexOf('{');
        int end   = text.lastIndexOf('}');
        if (start == -1 || end <= start) return Optional.empty();
        return Optional.of(text.substring(start, end + 1));
    }

    private static String dropLeadingBlankLines(String s) {
        int start = 0;
        while (true) {
            int nl = s.indexOf('\n', start);
            if (nl == -1 || !s.substring(start, nl).isBlank()) return s.substring(start);
            start = nl + 1;
        }
    }

    private static String trimTrailingNewlines(String s) {
        int end = s.length();
        while (end > 0 && (s.charAt(end - 1) == '\n' || s.charAt(end - 1) == '\r')) end--;
        return s.substring(0, end);
    }
}
