package com.suitemender.core.source;

/**
 * A source file could not be turned into a usable structural tree
 * (unreadable, or the tree contains syntax errors).
 */
public class SourceParseException extends Exception {

    private final String path;

    public SourceParseException(String path, String message) {
        super(path + ": " + message);
        this.path = path;
    }

    public SourceParseException(String path, String message, Throwable cause) {
        super(path + ": " + message, cause);
        this.path = path;
    }

    public String getPath() { return path; }
}
