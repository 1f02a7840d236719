package com.suitemender.core.source;

/**
 * Kinds of indexed definitions.
 *
 * FUNCTION: module-level or nested function (including functions inside functions)
 * METHOD:   function defined directly in a class body
 * CLASS:    class definition
 * ROUTE:    function decorated with an HTTP-verb marker (@app.get("/x"), @bp.route("/x"))
 */
public enum SymbolKind {
    FUNCTION,
    METHOD,
    CLASS,
    ROUTE
}
