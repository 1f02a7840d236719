package com.suitemender.core.filesystem;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.*;
import java.util.*;
import java.util.function.Predicate;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Root-confined access to the Python project being repaired.
 *
 * Every path handed in or out is relative to the workspace root and uses '/'
 * separators. Paths that normalize outside the root are rejected.
 */
@Component
public class FileSystemManager {

    private static final Logger log = LoggerFactory.getLogger(FileSystemManager.class);

    private static final long MAX_FILE_SIZE = 10 * 1024 * 1024;

    private final Path workspaceRoot;

    public FileSystemManager(
            @Value("${suitemender.workspace.path:.}") String workspacePath
    ) {
        this.workspaceRoot = Paths.get(workspacePath).toAbsolutePath().normalize();
        try {
            if (!Files.exists(workspaceRoot)) {
                Files.createDirectories(workspaceRoot);
                log.info("[FileSystem] Created workspace: {}", workspaceRoot);
            }
        } catch (IOException e) {
            throw new IllegalStateException("Failed to initialize workspace: " + workspacePath, e);
        }
        log.info("[FileSystem] Workspace initialized: {}", workspaceRoot);
    }

    public Path getWorkspaceRoot() {
        return workspaceRoot;
    }

    // ================================================================
    // Snapshot / Restore
    // ================================================================

    /**
     * Captures the exact bytes of one file (or its absence) so that a failed
     * patch can put it back byte for byte.
     */
    public FileSnapshot snapshot(String relativePath) throws FileSystemException {
        Path target = resolveSafePath(relativePath);
        if (!Files.exists(target)) {
            return new FileSnapshot(relativePath, null);
        }
        try {
            checkSize(relativePath, Files.size(target));
            return new FileSnapshot(relativePath, Files.readAllBytes(target));
        } catch (IOException e) {
            throw new FileSystemException("Failed to snapshot file: " + relativePath, e);
        }
    }

    public void restore(FileSnapshot snapshot) throws FileSystemException {
        Path target = resolveSafePath(snapshot.getRelativePath());
        try {
            if (snapshot.existed()) {
                Files.write(target, snapshot.bytes);
                log.info("[FileSystem] Restored {} ({} bytes)", snapshot.getRelativePath(), snapshot.bytes.length);
            } else {
                Files.deleteIfExists(target);
                log.info("[FileSystem] Restore: deleted file created after snapshot '{}'", snapshot.getRelativePath());
            }
        } catch (IOException e) {
            throw new FileSystemException("Restore failed: " + snapshot.getRelativePath(), e);
        }
    }

    // ================================================================
    // Standard File Operations
    // ================================================================

    public String readFile(String relativePath) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        log.debug("[FileSystem] Reading file: {}", relativePath);
        try {
            checkSize(relativePath, Files.size(targetPath));
            return Files.readString(targetPath, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FileSystemException("Failed to read file: " + relativePath, e);
        }
    }

    public void writeFile(String relativePath, String content) throws FileSystemException {
        Path targetPath = resolveSafePath(relativePath);
        log.info("[FileSystem] Writing {} chars to {}", content.length(), relativePath);
        try {
            Path parent = targetPath.getParent();
            if (parent != null && !Files.exists(parent)) Files.createDirectories(parent);
            Files.writeString(targetPath, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new FileSystemException("Failed to write file: " + relativePath, e);
        }
    }

    /**
     * Relative paths of regular files under the root with the given extension,
     * sorted, excluding any path the filter rejects.
     */
    public List<String> listFiles(String extension, Predicate<String> include) throws FileSystemException {
        try (Stream<Path> paths = Files.walk(workspaceRoot)) {
            return paths
                    .filter(Files::isRegularFile)
                    .map(this::toRelative)
                    .filter(p -> p.endsWith(extension))
                    .filter(include)
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new FileSystemException("Failed to enumerate workspace files", e);
        }
    }

    public boolean fileExists(String relativePath) {
        try { return Files.isRegularFile(resolveSafePath(relativePath)); }
        catch (FileSystemException e) { return false; }
    }

    // ================================================================
    // Private helpers
    // ================================================================

    private Path resolveSafePath(String relativePath) throws FileSystemException {
        if (relativePath == null || relativePath.trim().isEmpty())
            throw new FileSystemException("Path cannot be empty");
        Path resolved = workspaceRoot.resolve(relativePath).normalize();
        if (!resolved.startsWith(workspaceRoot))
            throw new FileSystemException("Path traversal attempt detected: " + relativePath);
        return resolved;
    }

    private String toRelative(Path absolute) {
        return workspaceRoot.relativize(absolute).toString().replace('\\', '/');
    }

    private static void checkSize(String relativePath, long size) throws FileSystemException {
        if (size > MAX_FILE_SIZE)
            throw new FileSystemException("File too large: " + relativePath +
                    " (" + size + " bytes, max: " + MAX_FILE_SIZE + ")");
    }

    // ================================================================
    // Inner classes
    // ================================================================

    public static final class FileSnapshot {
        private final String relativePath;
        private final byte[] bytes;

        private FileSnapshot(String relativePath, byte[] bytes) {
            this.relativePath = relativePath;
            this.bytes        = bytes;
        }

        public String  getRelativePath() { return relativePath; }
        public boolean existed()         { return bytes != null; }

        public String getText() {
            return bytes == null ? "" : new String(bytes, StandardCharsets.UTF_8);
        }

        @Override public String toString() {
            return "FileSnapshot{" + relativePath + ", " + (bytes == null ? "absent" : bytes.length + " bytes") + "}";
        }
    }

    public static class FileSystemException extends Exception {
        public FileSystemException(String message)                  { super(message); }
        public FileSystemException(String message, Throwable cause) { super(message, cause); }
    }
}
