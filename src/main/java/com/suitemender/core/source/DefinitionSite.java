package com.suitemender.core.source;

/**
 * Location of one definition node inside a parsed file, as the patch engine and
 * the context extractor need it.
 *
 * definitionRange covers the def/class line through the end of the body.
 * decoratedRange additionally covers decorator lines above it; without
 * decorators both ranges are equal.
 */
public final class DefinitionSite {

    private final String    name;
    private final String    parentName;
    private final LineRange definitionRange;
    private final LineRange decoratedRange;
    private final int       indentColumn;
    private final String    text;
    private final String    decoratedText;

    public DefinitionSite(String name, String parentName, LineRange definitionRange,
                          LineRange decoratedRange, int indentColumn,
                          String text, String decoratedText) {
        this.name            = name;
        this.parentName      = parentName;
        this.definitionRange = definitionRange;
        this.decoratedRange  = decoratedRange;
        this.indentColumn    = indentColumn;
        this.text            = text;
        this.decoratedText   = decoratedText;
    }

    public String    getName()            { return name; }
    public String    getParentName()      { return parentName; }
    public LineRange getDefinitionRange() { return definitionRange; }
    public LineRange getDecoratedRange()  { return decoratedRange; }
    public int       getIndentColumn()    { return indentColumn; }
    public String    getText()            { return text; }
    public String    getDecoratedText()   { return decoratedText; }

    public boolean hasDecorators() {
        return !decoratedRange.equals(definitionRange);
    }

    @Override
    public String toString() {
        return "DefinitionSite{" + (parentName != null ? parentName + "." : "") + name
                + " " + decoratedRange + "}";
    }
}
