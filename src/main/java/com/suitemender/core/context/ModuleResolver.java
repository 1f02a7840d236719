package com.suitemender.core.context;

import com.suitemender.core.filesystem.FileSystemManager;
import com.suitemender.core.source.ImportStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;

/**
 * Maps Python module references to files under the workspace root.
 *
 * A module that is in the standard library list, or for which no candidate
 * file exists, is treated as external and resolves to nothing.
 */
@Component
public class ModuleResolver {

    private static final Logger log = LoggerFactory.getLogger(ModuleResolver.class);

    private static final List<String> SOURCE_ROOTS = List.of("", "src/");

    static final Set<String> STDLIB = Set.of(
            "__future__", "abc", "argparse", "array", "ast", "asyncio", "base64", "bisect",
            "builtins", "calendar", "collections", "concurrent", "contextlib", "contextvars",
            "copy", "csv", "dataclasses", "datetime", "decimal", "difflib", "email", "enum",
            "errno", "fnmatch", "fractions", "functools", "gc", "getpass", "glob", "gzip",
            "hashlib", "heapq", "hmac", "html", "http", "importlib", "inspect", "io",
            "ipaddress", "itertools", "json", "logging", "math", "mimetypes", "multiprocessing",
            "numbers", "operator", "os", "pathlib", "pickle", "platform", "pprint", "queue",
            "random", "re", "secrets", "select", "shlex", "shutil", "signal", "socket",
            "sqlite3", "ssl", "statistics", "string", "struct", "subprocess", "sys",
            "tempfile", "textwrap", "threading", "time", "timeit", "traceback", "types",
            "typing", "unittest", "urllib", "uuid", "warnings", "weakref", "xml", "zipfile",
            "zoneinfo"
    );

    private final FileSystemManager fileSystem;

    public ModuleResolver(FileSystemManager fileSystem) {
        this.fileSystem = fileSystem;
    }

    /**
     * Existing files the import refers to, in candidate order, without duplicates.
     *
     * @param importingFile root-relative path of the file containing the import,
     *                      used as the base for relative imports
     */
    public List<String> resolve(ImportStatement statement, String importingFile) {
        if (!statement.isRelative() && STDLIB.contains(statement.getTopLevelPackage())) {
            return List.of();
        }

        Set<String> found = new LinkedHashSet<>();
        if (statement.getOrigin() == ImportStatement.Origin.STRING_TARGET) {
            // patch("pkg.mod.Class.method"): the module is the longest prefix that exists
            String module = statement.getModule();
            while (!module.isEmpty() && found.isEmpty()) {
                addExisting(candidatesFor(module), found);
                int dot = module.lastIndexOf('.');
                module = dot == -1 ? "" : module.substring(0, dot);
            }
        } else {
            for (String candidate : candidatePaths(statement, importingFile)) {
                if (fileSystem.fileExists(candidate)) found.add(candidate);
            }
        }

        if (found.isEmpty()) {
            log.debug("[ModuleResolver] '{}' is external or unresolved", statement);
        }
        return new ArrayList<>(found);
    }

    /** Every path the import could point at, whether or not it exists. */
    List<String> candidatePaths(ImportStatement statement, String importingFile) {
        List<String> candidates = new ArrayList<>();
        String imported = statement.getImportedName();
        boolean submodulePossible = imported != null && !"*".equals(imported);

        if (statement.isRelative()) {
            String base = parentDirectory(importingFile, statement.getRelativeLevel());
            if (base == null) return candidates;
            String modulePath = toPath(statement.getModule());
            String prefix = modulePath.isEmpty() ? base : base + modulePath;
            if (!modulePath.isEmpty()) {
                candidates.add(prefix + ".py");
                candidates.add(prefix + "/__init__.py");
            } else {
                candidates.add(base + "__init__.py");
            }
            if (submodulePossible) {
                String sub = modulePath.isEmpty() ? base + imported : prefix + "/" + imported;
                candidates.add(sub + ".py");
                candidates.add(sub + "/__init__.py");
            }
            return candidates;
        }

        candidates.addAll(candidatesFor(statement.getModule()));
        if (submodulePossible) {
            candidates.addAll(candidatesFor(statement.getModule() + "." + imported));
        }
        return candidates;
    }

    private static List<String> candidatesFor(String dottedModule) {
        List<String> candidates = new ArrayList<>();
        String path = toPath(dottedModule);
        if (path.isEmpty()) return candidates;
        for (String root : SOURCE_ROOTS) {
            candidates.add(root + path + ".py");
            candidates.add(root + path + "/__init__.py");
        }
        return candidates;
    }

    private void addExisting(List<String> candidates, Set<String> into) {
        for (String candidate : candidates) {
            if (fileSystem.fileExists(candidate)) into.add(candidate);
        }
    }

    private static String toPath(String dottedModule) {
        return dottedModule.replace('.', '/');
    }

    /**
     * Directory (with trailing '/', or "" for the root) that a relative import
     * of the given level starts from. Level 1 is the importing file's own
     * directory. Null when the import climbs above the root.
     */
    static String parentDirectory(String file, int level) {
        List<String> segments = new ArrayList<>(Arrays.asList(file.replace('\\', '/').split("/")));
        segments.remove(segments.size() - 1);
        for (int i = 1; i < level; i++) {
            if (segments.isEmpty()) return null;
            segments.remove(segments.size() - 1);
        }
        return segments.isEmpty() ? "" : String.join("/", segments) + "/";
    }
}
