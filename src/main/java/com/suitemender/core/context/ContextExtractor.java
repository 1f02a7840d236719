package com.suitemender.core.context;

import com.suitemender.core.filesystem.FileSystemManager;
import com.suitemender.core.filesystem.FileSystemManager.FileSystemException;
import com.suitemender.core.runner.TestFailure;
import com.suitemender.core.source.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Builds the code context for a model request.
 *
 * Failure-repair mode: follow the failing test's imports (only those its body
 * actually uses) to program files and excerpt their top-level definitions.
 * When nothing resolves, HTTP calls in the test body are matched against
 * indexed routes instead.
 *
 * Generation mode: every file containing a target, in full.
 *
 * Unreadable or unresolvable files make the bundle smaller; they never fail it.
 */
@Component
public class ContextExtractor {

    private static final Logger log = LoggerFactory.getLogger(ContextExtractor.class);

    //   client.get("/users/1")   await async_client.post('/items', json=...)
    private static final Pattern HTTP_CALL = Pattern.compile(
            "\\b\\w*client\\.(get|post|put|patch|delete|head|options)\\(\\s*[rbf]?[\"']([^\"'?]+)");

    private final FileSystemManager fileSystem;
    private final FrontEndRegistry  frontEnds;
    private final ModuleResolver    moduleResolver;

    public ContextExtractor(FileSystemManager fileSystem, FrontEndRegistry frontEnds, ModuleResolver moduleResolver) {
        this.fileSystem     = fileSystem;
        this.frontEnds      = frontEnds;
        this.moduleResolver = moduleResolver;
    }

    // ========================================================================
    // FAILURE-REPAIR MODE
    // ========================================================================

    public FailureContext forFailure(TestFailure failure, SymbolIndex index) {
        String testFile = failure.getTestFile();
        List<String> targets = List.of(failure.getTestName());

        Optional<LanguageFrontEnd> frontEnd = frontEnds.forPath(testFile);
        if (frontEnd.isEmpty()) {
            log.warn("[Context] No front end for {}", testFile);
            return new FailureContext(failure, "", "", ContextBundle.empty(targets));
        }

        String testText;
        try {
            testText = fileSystem.readFile(testFile);
        } catch (FileSystemException e) {
            log.warn("[Context] Cannot read test file {}: {}", testFile, e.getMessage());
            return new FailureContext(failure, "", "", ContextBundle.empty(targets));
        }

        // lenient: a test module with a syntax error still has imports worth following
        ParsedSource parsed = frontEnd.get().parse(testFile, testText);
        Optional<DefinitionSite> site = frontEnd.get()
                .findDefinition(parsed, failure.getTestName(), failure.getEnclosingClass());

        String testCode = site.map(DefinitionSite::getDecoratedText).orElse("");
        Set<String> referenced = site
                .map(s -> frontEnd.get().referencedIdentifiers(parsed, s))
                .orElse(null);

        List<ImportStatement> imports = frontEnd.get().extractImports(parsed);
        String importLines = imports.stream()
                .filter(i -> i.getOrigin() != ImportStatement.Origin.STRING_TARGET)
                .map(ImportStatement::toString)
                .distinct()
                .collect(Collectors.joining("\n"));

        Set<String> resolvedFiles = new LinkedHashSet<>();
        for (ImportStatement statement : imports) {
            if (!isUsed(statement, referenced, testCode)) continue;
            List<String> files = moduleResolver.resolve(statement, testFile);
            files.stream().filter(f -> !f.equals(testFile)).forEach(resolvedFiles::add);
        }

        if (resolvedFiles.isEmpty()) {
            resolvedFiles.addAll(filesForHttpCalls(testCode.isEmpty() ? testText : testCode, index));
        }

        Map<String, String> files    = new LinkedHashMap<>();
        Map<String, String> excerpts = new LinkedHashMap<>();
        for (String path : resolvedFiles) {
            try {
                String text = fileSystem.readFile(path);
                files.put(path, text);
                frontEnds.forPath(path).ifPresent(fe -> {
                    List<String> definitions = fe.extractTopLevelDefinitions(fe.parse(path, text));
                    if (!definitions.isEmpty()) {
                        excerpts.put(path, String.join("\n\n", definitions));
                    }
                });
            } catch (FileSystemException e) {
                log.warn("[Context] Skipping unreadable {}: {}", path, e.getMessage());
            }
        }

        ContextBundle bundle = ContextBundle.withExcerpts(targets, files, excerpts);
        log.info("[Context] {} → {}", failure.getNodeId(), files.keySet());
        return new FailureContext(failure, testCode, importLines, bundle);
    }

    /**
     * An import matters when the test body references the name it binds.
     * String targets count when their literal appears in the test. Without a
     * located test body every import counts.
     */
    private static boolean isUsed(ImportStatement statement, Set<String> referenced, String testCode) {
        if (referenced == null) return true;
        if (statement.getOrigin() == ImportStatement.Origin.STRING_TARGET) {
            return testCode.contains(statement.getBoundName());
        }
        if ("*".equals(statement.getImportedName())) return true;
        return statement.getBoundName() != null && referenced.contains(statement.getBoundName());
    }

    private Set<String> filesForHttpCalls(String code, SymbolIndex index) {
        Set<String> files = new LinkedHashSet<>();
        Matcher m = HTTP_CALL.matcher(code);
        while (m.find()) {
            String verb = m.group(1);
            String path = m.group(2);
            for (Route route : index.routesMatching(verb, path)) {
                log.info("[Context] {} {} handled by {}", verb.toUpperCase(Locale.ROOT), path, route.getHandlerKey());
                files.add(route.getFile());
            }
        }
        return files;
    }

    // ========================================================================
    // GENERATION MODE
    // ========================================================================

    public ContextBundle forTargets(List<SymbolKey> targets) {
        List<String> names = targets.stream().map(SymbolKey::getName).collect(Collectors.toList());
        Map<String, String> files = new LinkedHashMap<>();

        for (SymbolKey target : targets) {
            if (files.containsKey(target.getFile())) continue;
            try {
                files.put(target.getFile(), fileSystem.readFile(target.getFile()));
            } catch (FileSystemException e) {
                log.warn("[Context] Skipping unreadable {}: {}", target.getFile(), e.getMessage());
            }
        }
        return ContextBundle.of(names, files);
    }
}
