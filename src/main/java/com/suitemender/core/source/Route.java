package com.suitemender.core.source;

/**
 * Route: HTTP endpoint declared by a decorated handler.
 *
 * method is upper-case (GET, POST, ...). path is the literal first argument of
 * the marker, exactly as written in the source.
 */
public final class Route {

    private final String handlerName;
    private final String file;
    private final String method;
    private final String path;

    public Route(String handlerName, String file, String method, String path) {
        this.handlerName = handlerName;
        this.file        = file;
        this.method      = method;
        this.path        = path;
    }

    public String getHandlerName() { return handlerName; }
    public String getFile()        { return file; }
    public String getMethod()      { return method; }
    public String getPath()        { return path; }

    public SymbolKey getHandlerKey() {
        return new SymbolKey(file, handlerName);
    }

    public boolean matches(String httpMethod, String requestPath) {
        return method.equalsIgnoreCase(httpMethod) && path.equals(requestPath);
    }

    @Override
    public String toString() {
        return method + " " + path + " -> " + file + "::" + handlerName;
    }
}
