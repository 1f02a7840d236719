package com.suitemender.core.source;

/**
 * One module reference found in a source file.
 *
 *   import a.b           → module "a.b",  importedName null,  boundName "a"
 *   import a.b as ab     → module "a.b",  importedName null,  boundName "ab"
 *   from a.b import c    → module "a.b",  importedName "c",   boundName "c"
 *   from ..m import c    → module "m",    relativeLevel 2
 *   patch("a.b.c")       → module "a.b",  origin STRING_TARGET, boundName = the literal "a.b.c"
 */
public final class ImportStatement {

    public enum Origin {
        IMPORT,
        FROM_IMPORT,
        STRING_TARGET
    }

    private final Origin origin;
    private final String module;
    private final String importedName;
    private final String boundName;
    private final int    relativeLevel;
    private final int    line;

    public ImportStatement(Origin origin, String module, String importedName,
                           String boundName, int relativeLevel, int line) {
        this.origin        = origin;
        this.module        = module != null ? module : "";
        this.importedName  = importedName;
        this.boundName     = boundName;
        this.relativeLevel = relativeLevel;
        this.line          = line;
    }

    public Origin getOrigin()        { return origin; }
    public String getModule()        { return module; }
    public String getImportedName()  { return importedName; }
    public String getBoundName()     { return boundName; }
    public int    getRelativeLevel() { return relativeLevel; }
    public int    getLine()          { return line; }

    public boolean isRelative() { return relativeLevel > 0; }

    /** First dotted segment of the module, e.g. "os" for "os.path". Empty for "from . import x". */
    public String getTopLevelPackage() {
        int dot = module.indexOf('.');
        return dot == -1 ? module : module.substring(0, dot);
    }

    @Override
    public String toString() {
        String dots = ".".repeat(Math.max(0, relativeLevel));
        return switch (origin) {
            case IMPORT        -> "import " + module + (boundName != null && !module.startsWith(boundName) ? " as " + boundName : "");
            case FROM_IMPORT   -> "from " + dots + module + " import " + importedName
                                    + (boundName != null && !boundName.equals(importedName) ? " as " + boundName : "");
            case STRING_TARGET -> "reference '" + boundName + "'";
        };
    }
}
