package com.suitemender.core.runner;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a pytest-json-report document into a {@link TestRunReport}.
 *
 * Exit codes (pytest): 0 all passed, 1 some failed, 2 interrupted (collection
 * errors), 3 internal error, 4 usage error, 5 no tests collected.
 */
@Component
public class TestRunReportParser {

    private static final Logger log = LoggerFactory.getLogger(TestRunReportParser.class);

    //   E   NameError: name 'User' is not defined
    private static final Pattern E_LINE_EXCEPTION =
            Pattern.compile("^E\\s+([A-Za-z_][\\w.]*):\\s?(.*)$");

    private static final Pattern E_LINE_ASSERT =
            Pattern.compile("^E\\s+(assert\\b.*)$");

    private static final Pattern LINE_WORD = Pattern.compile("line (\\d+)", Pattern.CASE_INSENSITIVE);

    private static final Pattern PARAM_SUFFIX = Pattern.compile("\\[.*]$");

    private final ObjectMapper objectMapper;

    public TestRunReportParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public TestRunReport parse(String json) {
        JsonNode root;
        try {
            root = objectMapper.readTree(json);
        } catch (JsonProcessingException e) {
            log.error("[ReportParser] Unreadable report: {}", e.getOriginalMessage());
            return TestRunReport.notRunnable(RunStatus.RUNNER_ERROR, -1,
                    "pytest-json-report output is not valid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            return TestRunReport.notRunnable(RunStatus.RUNNER_ERROR, -1, "pytest-json-report output is empty");
        }

        int exitCode = root.path("exitcode").asInt(-1);

        String collectionErrors = collectionErrors(root);
        if (!collectionErrors.isEmpty() || exitCode == 2) {
            String detail = collectionErrors.isEmpty() ? "pytest run was interrupted (exit code 2)" : collectionErrors;
            log.warn("[ReportParser] Collection error:\n{}", detail);
            return TestRunReport.notRunnable(RunStatus.COLLECTION_ERROR, exitCode, detail);
        }
        if (exitCode == 3 || exitCode == 4) {
            return TestRunReport.notRunnable(RunStatus.RUNNER_ERROR, exitCode,
                    exitCode == 3 ? "pytest internal error" : "pytest usage error");
        }

        JsonNode tests = root.path("tests");
        int collected = root.path("summary").path("collected").asInt(tests.size());
        if (exitCode == 5 || collected == 0 || tests.size() == 0) {
            return TestRunReport.notRunnable(RunStatus.NO_TESTS_COLLECTED, exitCode, "no tests collected");
        }

        int passed = 0;
        List<TestFailure> failures = new ArrayList<>();
        for (JsonNode test : tests) {
            TestOutcome outcome = TestOutcome.fromReport(test.path("outcome").asText());
            if (outcome == TestOutcome.PASSED) passed++;
            if (outcome.isFailure()) {
                failures.add(toFailure(test));
            }
        }

        TestRunReport report = TestRunReport.completed(exitCode, collected, passed, failures);
        log.info("[ReportParser] {}", report.getSummary());
        return report;
    }

    // ========================================================================
    // FAILURE EXTRACTION
    // ========================================================================

    TestFailure toFailure(JsonNode test) {
        String nodeId = test.path("nodeid").asText("");
        String[] parts = nodeId.split("::");

        String testFile = parts.length > 0 ? parts[0] : "";
        String rawName  = parts.length > 1 ? parts[parts.length - 1] : "";
        String testName = PARAM_SUFFIX.matcher(rawName).replaceFirst("");
        String enclosingClass = parts.length > 2 ? parts[parts.length - 2] : null;

        String longrepr = longreprOf(test);
        String[] exception = parseException(longrepr);

        return new TestFailure(
                testFile,
                testName,
                enclosingClass,
                exception[0],
                exception[1],
                longrepr,
                lineNumber(longrepr, testFile),
                nodeId
        );
    }

    /** The failing phase's longrepr: call first, then setup, then teardown. */
    private static String longreprOf(JsonNode test) {
        for (String phase : new String[] { "call", "setup", "teardown" }) {
            JsonNode node = test.path(phase);
            if (!node.isObject()) continue;
            if (!TestOutcome.fromReport(node.path("outcome").asText("failed")).isFailure()) continue;
            JsonNode longrepr = node.path("longrepr");
            if (!longrepr.isMissingNode() && !longrepr.isNull()) {
                return longrepr.isTextual() ? longrepr.asText() : longrepr.toString();
            }
        }
        return "";
    }

    /**
     * {kind, message}: the last "E   Kind: msg" line; a bare "E   assert ..." line
     * is an AssertionError; otherwise the first line split at its first colon.
     */
    static String[] parseException(String longrepr) {
        String[] lines = longrepr.split("\n");

        for (int i = lines.length - 1; i >= 0; i--) {
            Matcher m = E_LINE_EXCEPTION.matcher(lines[i].strip());
            if (m.matches()) {
                return new String[] { m.group(1), m.group(2).strip() };
            }
        }
        for (String line : lines) {
            Matcher m = E_LINE_ASSERT.matcher(line.strip());
            if (m.matches()) {
                return new String[] { "AssertionError", m.group(1).strip() };
            }
        }

        String first = lines.length > 0 ? lines[0].strip() : "";
        int colon = first.indexOf(':');
        if (colon > 0) {
            return new String[] { first.substring(0, colon).strip(), first.substring(colon + 1).strip() };
        }
        return new String[] { "Unknown", first };
    }

    private static Integer lineNumber(String longrepr, String testFile) {
        if (!testFile.isEmpty()) {
            Matcher m = Pattern.compile(Pattern.quote(testFile) + ":(\\d+):").matcher(longrepr);
            if (m.find()) return Integer.parseInt(m.group(1));
        }
        Matcher m = LINE_WORD.matcher(longrepr);
        return m.find() ? Integer.parseInt(m.group(1)) : null;
    }

    private static String collectionErrors(JsonNode root) {
        StringBuilder detail = new StringBuilder();
        for (JsonNode collector : root.path("collectors")) {
            if (!"failed".equals(collector.path("outcome").asText())) continue;
            if (detail.length() > 0) detail.append("\n\n");
            detail.append("ERROR collecting ").append(collector.path("nodeid").asText("<root>")).append('\n');
            detail.append(collector.path("longrepr").asText(""));
        }
        return detail.toString().strip();
    }
}
