package com.suitemender.core.source;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Structural view of source files for one target language.
 *
 * Everything language-specific (grammar, definition node types, route
 * decorators, import syntax) sits behind this seam; the indexer, context
 * extractor and patch engine only see symbols, ranges and imports.
 */
public interface LanguageFrontEnd {

    /** File extension handled, including the dot (".py"). */
    String fileExtension();

    default boolean supports(String relativePath) {
        return relativePath != null && relativePath.endsWith(fileExtension());
    }

    /** Lenient parse. The result may carry syntax errors; check {@link ParsedSource#hasSyntaxErrors()}. */
    ParsedSource parse(String relativePath, String text);

    /** Strict parse: fails when the text does not form a clean tree. */
    default ParsedSource parseFile(String relativePath, String text) throws SourceParseException {
        ParsedSource parsed = parse(relativePath, text);
        if (parsed.hasSyntaxErrors()) {
            throw new SourceParseException(relativePath, "syntax errors in source");
        }
        return parsed;
    }

    default boolean isSyntaxValid(String text) {
        return !parse("<memory>", text).hasSyntaxErrors();
    }

    /** Functions, methods, classes and routes in source order (nested ones after their parent). */
    List<Symbol> extractSymbols(ParsedSource source);

    List<Route> extractRoutes(ParsedSource source);

    List<ImportStatement> extractImports(ParsedSource source);

    /** Every definition (at any depth) with the given short name, in source order. */
    List<DefinitionSite> findDefinitions(ParsedSource source, String name);

    /** Text of every module-level function or class definition, decorators included. */
    List<String> extractTopLevelDefinitions(ParsedSource source);

    /** Identifiers referenced inside the given definition, decorators included. */
    Set<String> referencedIdentifiers(ParsedSource source, DefinitionSite site);

    /**
     * Resolves a name to one definition. With several matches, prefers the one
     * whose parent is {@code enclosingName}; otherwise takes the first.
     */
    Optional<DefinitionSite> findDefinition(ParsedSource source, String name, String enclosingName);
}
