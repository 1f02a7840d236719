package com.suitemender.core.runner;

import com.suitemender.core.filesystem.FileSystemManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Runs pytest with the pytest-json-report plugin in the workspace root.
 *
 * The JSON report goes to a temporary file that is deleted after reading.
 * A missing report means pytest never got far enough to write it (plugin not
 * installed, interpreter missing), which is a RUNNER_ERROR carrying the
 * process output.
 */
@Component
public class PytestRunner implements TestRunner {

    private static final Logger log = LoggerFactory.getLogger(PytestRunner.class);

    private final Path                workingDirectory;
    private final String              pythonInterpreter;
    private final String              testsDirectory;
    private final int                 timeoutSeconds;
    private final TestRunReportParser reportParser;

    public PytestRunner(
            FileSystemManager fileSystem,
            TestRunReportParser reportParser,
            @Value("${suitemender.python.interpreter:python3}") String pythonInterpreter,
            @Value("${suitemender.tests.directory:tests}") String testsDirectory,
            @Value("${suitemender.runner.timeout-seconds:300}") int timeoutSeconds
    ) {
        this.workingDirectory  = fileSystem.getWorkspaceRoot();
        this.reportParser      = reportParser;
        this.pythonInterpreter = pythonInterpreter;
        this.testsDirectory    = testsDirectory;
        this.timeoutSeconds    = timeoutSeconds;

        log.info("[PytestRunner] Workspace: {}", workingDirectory);
        log.info("[PytestRunner] Python: {}", pythonInterpreter);
    }

    private String getPythonExecutable() {
        if (pythonInterpreter != null && !pythonInterpreter.isBlank()) {
            return pythonInterpreter;
        }
        return "python3";
    }

    @Override
    public TestRunReport runSuite() {
        return runPytest(testsDirectory);
    }

    @Override
    public TestRunReport runNode(String nodeId) {
        return runPytest(nodeId);
    }

    private TestRunReport runPytest(String target) {
        Path reportFile;
        try {
            reportFile = Files.createTempFile("suitemender_report_", ".json");
        } catch (IOException e) {
            log.error("[PytestRunner] Failed to create report file: {}", e.getMessage());
            return TestRunReport.notRunnable(RunStatus.RUNNER_ERROR, ProcessResult.NOT_STARTED,
                    "Failed to create report file: " + e.getMessage());
        }

        try {
            List<String> command = new ArrayList<>();
            command.add(getPythonExecutable());
            command.add("-m");
            command.add("pytest");
            command.add(target);
            command.add("--tb=long");
            command.add("--disable-warnings");
            command.add("-p");
            command.add("no:cacheprovider");
            command.add("--json-report");
            command.add("--json-report-file=" + reportFile);

            ProcessResult result = executeCommand(command, timeoutSeconds);

            if (result.timedOut()) {
                return TestRunReport.notRunnable(RunStatus.RUNNER_ERROR, result.getExitCode(),
                        "TIMEOUT after " + timeoutSeconds + " seconds\n" + result.getOutput());
            }
            if (result.getExitCode() == ProcessResult.NOT_STARTED) {
                return TestRunReport.notRunnable(RunStatus.RUNNER_ERROR, result.getExitCode(), result.getOutput());
            }

            String json = Files.exists(reportFile) ? Files.readString(reportFile, StandardCharsets.UTF_8) : "";
            if (json.isBlank()) {
                log.warn("[PytestRunner] No JSON report written (exit code {})", result.getExitCode());
                return TestRunReport.notRunnable(RunStatus.RUNNER_ERROR, result.getExitCode(),
                        "pytest wrote no JSON report; is pytest-json-report installed?\n" + result.getOutput());
            }
            return reportParser.parse(json);

        } catch (IOException e) {
            log.error("[PytestRunner] Failed to read report: {}", e.getMessage());
            return TestRunReport.notRunnable(RunStatus.RUNNER_ERROR, -1, "Failed to read report: " + e.getMessage());
        } finally {
            try {
                Files.deleteIfExists(reportFile);
            } catch (IOException e) {
                log.warn("[PytestRunner] Could not delete {}: {}", reportFile, e.getMessage());
            }
        }
    }

    private ProcessResult executeCommand(List<String> command, int timeoutSeconds) {

        long startTime = System.currentTimeMillis();
        log.info("[PytestRunner] Executing: {}", String.join(" ", command));

        try {
            ProcessBuilder builder = new ProcessBuilder(command);
            builder.directory(workingDirectory.toFile());
            // pytest interleaves stdout and stderr; merge at the OS level to keep order
            builder.redirectErrorStream(true);

            Process process = builder.start();

            StringBuilder output = new StringBuilder();

            Thread outThread = new Thread(() -> {
                try (BufferedReader reader = new BufferedReader(
                        new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8))) {
                    String line;
                    while ((line = reader.readLine()) != null) {
                        synchronized (output) {
                            output.append(line).append("\n");
                        }
                    }
                } catch (IOException e) {
                    log.warn("[PytestRunner] Error reading output: {}", e.getMessage());
                }
            });

            outThread.start();

            boolean finished = process.waitFor(timeoutSeconds, TimeUnit.SECONDS);

            if (!finished) {
                process.destroyForcibly();
                outThread.join(1000);
                log.warn("[PytestRunner] Process timed out after {} seconds", timeoutSeconds);
                synchronized (output) {
                    return new ProcessResult(ProcessResult.TIMED_OUT, output.toString(),
                            System.currentTimeMillis() - startTime);
                }
            }

            outThread.join(1000);

            int exitCode = process.exitValue();
            String merged;
            synchronized (output) {
                merged = output.toString();
            }

            log.info("[PytestRunner] Exit code: {}, Output length: {} chars", exitCode, merged.length());
            return new ProcessResult(exitCode, merged, System.currentTimeMillis() - startTime);

        } catch (IOException e) {
            log.error("[PytestRunner] Execution failed: {}", e.getMessage());
            return ProcessResult.notStarted("Python execution failed: " + e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("[PytestRunner] Interrupted while waiting for pytest");
            return ProcessResult.notStarted("Interrupted while waiting for pytest");
        }
    }
}
