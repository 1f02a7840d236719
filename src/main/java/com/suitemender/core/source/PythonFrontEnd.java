package com.suitemender.core.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;
import org.treesitter.TSNode;
import org.treesitter.TSParser;
import org.treesitter.TSPoint;
import org.treesitter.TSTree;
import org.treesitter.TreeSitterPython;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * PythonFrontEnd: tree-sitter-python backed structural analysis.
 *
 * Classification of definitions:
 *   - decorated with an HTTP route marker      → ROUTE
 *   - class                                    → CLASS
 *   - function directly inside a class body    → METHOD
 *   - any other function (incl. nested)        → FUNCTION
 *
 * Route markers are attribute calls on any receiver whose attribute is an
 * HTTP verb ({@code @app.get("/p")}, {@code @router.post("/p")}) or
 * {@code route} ({@code @bp.route("/p", methods=["POST"])}, default GET).
 *
 * A TSParser is not thread-safe, so every parse uses its own instance.
 */
@Component
public class PythonFrontEnd implements LanguageFrontEnd {

    private static final Logger log = LoggerFactory.getLogger(PythonFrontEnd.class);

    private static final Set<String> HTTP_VERBS =
            Set.of("get", "post", "put", "patch", "delete", "head", "options");

    private static final Set<String> PATCH_CALLS     = Set.of("patch", "setattr");
    private static final Set<String> IMPORT_OR_SKIP  = Set.of("importorskip", "import_module");

    // ========================================================================
    // PARSING
    // ========================================================================

    @Override
    public String fileExtension() {
        return ".py";
    }

    @Override
    public ParsedSource parse(String relativePath, String text) {
        SourceText content = SourceText.of(text);
        TSParser parser = new TSParser();
        parser.setLanguage(new TreeSitterPython());
        TSTree tree = parser.parseString(null, content.text());
        ParsedSource parsed = new ParsedSource(relativePath, content, tree);
        if (parsed.hasSyntaxErrors()) {
            log.debug("[PythonFrontEnd] Syntax errors in {}", relativePath);
        }
        return parsed;
    }

    // ========================================================================
    // SYMBOLS AND ROUTES
    // ========================================================================

    @Override
    public List<Symbol> extractSymbols(ParsedSource source) {
        List<Symbol> symbols = new ArrayList<>();
        collectSymbols(source, source.getRoot(), null, false, 0, symbols);
        return symbols;
    }

    private void collectSymbols(ParsedSource source, TSNode container, String parentName,
                                boolean parentIsClass, int depth, List<Symbol> out) {
        for (int i = 0; i < container.getNamedChildCount(); i++) {
            TSNode child = container.getNamedChild(i);
            TSNode definition = child;
            List<TSNode> decorators = List.of();

            if ("decorated_definition".equals(child.getType())) {
                definition = child.getChildByFieldName("definition");
                decorators = decoratorsOf(child);
                if (definition == null || definition.isNull()) continue;
            }

            switch (definition.getType()) {
                case "function_definition" -> {
                    String name = source.textOf(definition.getChildByFieldName("name"));
                    SymbolKind kind = routeOf(source, decorators, name) != null
                            ? SymbolKind.ROUTE
                            : parentIsClass ? SymbolKind.METHOD : SymbolKind.FUNCTION;
                    out.add(new Symbol(
                            name,
                            source.getPath(),
                            kind,
                            startLine(definition),
                            endLine(definition),
                            countParameters(definition.getChildByFieldName("parameters")),
                            isAsync(definition),
                            parentName,
                            depth
                    ));
                    TSNode body = definition.getChildByFieldName("body");
                    if (body != null && !body.isNull()) {
                        collectSymbols(source, body, name, false, depth + 1, out);
                    }
                }
                case "class_definition" -> {
                    String name = source.textOf(definition.getChildByFieldName("name"));
                    out.add(new Symbol(
                            name,
                            source.getPath(),
                            SymbolKind.CLASS,
                            startLine(definition),
                            endLine(definition),
                            0,
                            false,
                            parentName,
                            depth
                    ));
                    TSNode body = definition.getChildByFieldName("body");
                    if (body != null && !body.isNull()) {
                        collectSymbols(source, body, name, true, depth + 1, out);
                    }
                }
                // if/try/with blocks at any level may hold definitions
                default -> collectSymbols(source, child, parentName, parentIsClass, depth, out);
            }
        }
    }

    @Override
    public List<Route> extractRoutes(ParsedSource source) {
        List<Route> routes = new ArrayList<>();
        collectRoutes(source, source.getRoot(), routes);
        return routes;
    }

    private void collectRoutes(ParsedSource source, TSNode node, List<Route> out) {
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if ("decorated_definition".equals(child.getType())) {
                TSNode definition = child.getChildByFieldName("definition");
                if (definition != null && !definition.isNull() && "function_definition".equals(definition.getType())) {
                    String name = source.textOf(definition.getChildByFieldName("name"));
                    Route route = routeOf(source, decoratorsOf(child), name);
                    if (route != null) out.add(route);
                }
            }
            collectRoutes(source, child, out);
        }
    }

    /** First decorator that marks an HTTP route, or null. */
    private Route routeOf(ParsedSource source, List<TSNode> decorators, String handlerName) {
        for (TSNode decorator : decorators) {
            TSNode call = firstNamedChild(decorator);
            if (call == null || !"call".equals(call.getType())) continue;

            TSNode function = call.getChildByFieldName("function");
            if (function == null || !"attribute".equals(function.getType())) continue;

            String marker = source.textOf(function.getChildByFieldName("attribute"));
            TSNode arguments = call.getChildByFieldName("arguments");
            String path = firstStringArgument(source, arguments);
            if (path == null) continue;

            if (HTTP_VERBS.contains(marker)) {
                return new Route(handlerName, source.getPath(), marker.toUpperCase(Locale.ROOT), path);
            }
            if ("route".equals(marker)) {
                String method = firstDeclaredMethod(source, arguments);
                return new Route(handlerName, source.getPath(), method, path);
            }
        }
        return null;
    }

    /** methods=["POST", ...] keyword of a route() marker; GET when absent. */
    private String firstDeclaredMethod(ParsedSource source, TSNode arguments) {
        for (int i = 0; i < arguments.getNamedChildCount(); i++) {
            TSNode arg = arguments.getNamedChild(i);
            if (!"keyword_argument".equals(arg.getType())) continue;
            if (!"methods".equals(source.textOf(arg.getChildByFieldName("name")))) continue;

            TSNode value = arg.getChildByFieldName("value");
            if (value == null || value.isNull()) continue;
            for (int j = 0; j < value.getNamedChildCount(); j++) {
                TSNode element = value.getNamedChild(j);
                if ("string".equals(element.getType())) {
                    return stringLiteralValue(source, element).toUpperCase(Locale.ROOT);
                }
            }
        }
        return "GET";
    }

    // ========================================================================
    // IMPORTS
    // ========================================================================

    @Override
    public List<ImportStatement> extractImports(ParsedSource source) {
        List<ImportStatement> imports = new ArrayList<>();
        collectImports(source, source.getRoot(), imports);
        return imports;
    }

    private void collectImports(ParsedSource source, TSNode node, List<ImportStatement> out) {
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            switch (child.getType()) {
                case "import_statement"      -> addPlainImports(source, child, out);
                case "import_from_statement" -> addFromImports(source, child, out);
                case "call"                  -> {
                    addStringTarget(source, child, out);
                    collectImports(source, child, out);
                }
                default                      -> collectImports(source, child, out);
            }
        }
    }

    private void addPlainImports(ParsedSource source, TSNode statement, List<ImportStatement> out) {
        int line = startLine(statement);
        for (int i = 0; i < statement.getNamedChildCount(); i++) {
            TSNode name = statement.getNamedChild(i);
            if ("dotted_name".equals(name.getType())) {
                String module = source.textOf(name);
                String bound = module.contains(".") ? module.substring(0, module.indexOf('.')) : module;
                out.add(new ImportStatement(ImportStatement.Origin.IMPORT, module, null, bound, 0, line));
            } else if ("aliased_import".equals(name.getType())) {
                String module = source.textOf(name.getChildByFieldName("name"));
                String alias  = source.textOf(name.getChildByFieldName("alias"));
                out.add(new ImportStatement(ImportStatement.Origin.IMPORT, module, null, alias, 0, line));
            }
        }
    }

    private void addFromImports(ParsedSource source, TSNode statement, List<ImportStatement> out) {
        int line = startLine(statement);
        TSNode moduleNode = statement.getChildByFieldName("module_name");
        if (moduleNode == null || moduleNode.isNull()) return;

        String module;
        int level = 0;
        if ("relative_import".equals(moduleNode.getType())) {
            String raw = source.textOf(moduleNode);
            while (level < raw.length() && raw.charAt(level) == '.') level++;
            module = raw.substring(level);
        } else {
            module = source.textOf(moduleNode);
        }

        for (int i = 0; i < statement.getNamedChildCount(); i++) {
            TSNode name = statement.getNamedChild(i);
            if (sameNode(name, moduleNode)) continue;
            switch (name.getType()) {
                case "dotted_name" -> {
                    String imported = source.textOf(name);
                    out.add(new ImportStatement(ImportStatement.Origin.FROM_IMPORT,
                            module, imported, imported, level, line));
                }
                case "aliased_import" -> {
                    String imported = source.textOf(name.getChildByFieldName("name"));
                    String alias    = source.textOf(name.getChildByFieldName("alias"));
                    out.add(new ImportStatement(ImportStatement.Origin.FROM_IMPORT,
                            module, imported, alias, level, line));
                }
                case "wildcard_import" -> out.add(new ImportStatement(ImportStatement.Origin.FROM_IMPORT,
                            module, "*", null, level, line));
                default -> { }
            }
        }
    }

    /**
     * Dotted string arguments that name code under test:
     *   patch("app.services.mailer.send")          → module app.services.mailer
     *   monkeypatch.setattr("app.config.DEBUG", 1) → module app.config
     *   pytest.importorskip("app.optional")        → module app.optional
     */
    private void addStringTarget(ParsedSource source, TSNode call, List<ImportStatement> out) {
        TSNode function = call.getChildByFieldName("function");
        if (function == null || function.isNull()) return;

        String callee = switch (function.getType()) {
            case "identifier" -> source.textOf(function);
            case "attribute"  -> source.textOf(function.getChildByFieldName("attribute"));
            default           -> "";
        };
        boolean patchLike  = PATCH_CALLS.contains(callee);
        boolean importLike = IMPORT_OR_SKIP.contains(callee);
        if (!patchLike && !importLike) return;

        String target = firstStringArgument(source, call.getChildByFieldName("arguments"));
        if (target == null || !target.matches("[A-Za-z_][\\w.]*\\.[A-Za-z_]\\w*")) return;

        String module = patchLike ? target.substring(0, target.lastIndexOf('.')) : target;
        out.add(new ImportStatement(ImportStatement.Origin.STRING_TARGET,
                module, null, target, 0, startLine(call)));
    }

    // ========================================================================
    // DEFINITIONS
    // ========================================================================

    @Override
    public List<DefinitionSite> findDefinitions(ParsedSource source, String name) {
        List<DefinitionSite> sites = new ArrayList<>();
        collectDefinitions(source, source.getRoot(), name, null, sites);
        return sites;
    }

    @Override
    public Optional<DefinitionSite> findDefinition(ParsedSource source, String name, String enclosingName) {
        List<DefinitionSite> candidates = findDefinitions(source, name);
        if (candidates.isEmpty()) return Optional.empty();
        if (candidates.size() == 1) return Optional.of(candidates.get(0));

        if (enclosingName != null) {
            for (DefinitionSite site : candidates) {
                if (enclosingName.equals(site.getParentName())) {
                    return Optional.of(site);
                }
            }
        }
        log.warn("[PythonFrontEnd] '{}' defined {} times in {}; using first at {}",
                name, candidates.size(), source.getPath(), candidates.get(0).getDecoratedRange());
        return Optional.of(candidates.get(0));
    }

    private void collectDefinitions(ParsedSource source, TSNode container, String wanted,
                                    String parentName, List<DefinitionSite> out) {
        for (int i = 0; i < container.getNamedChildCount(); i++) {
            TSNode child = container.getNamedChild(i);
            TSNode definition = "decorated_definition".equals(child.getType())
                    ? child.getChildByFieldName("definition")
                    : child;
            if (definition == null || definition.isNull()) continue;

            String type = definition.getType();
            if ("function_definition".equals(type) || "class_definition".equals(type)) {
                String name = source.textOf(definition.getChildByFieldName("name"));
                if (name.equals(wanted)) {
                    out.add(toSite(source, name, parentName, definition, child));
                }
                TSNode body = definition.getChildByFieldName("body");
                if (body != null && !body.isNull()) {
                    collectDefinitions(source, body, wanted, name, out);
                }
            } else {
                collectDefinitions(source, child, wanted, parentName, out);
            }
        }
    }

    private DefinitionSite toSite(ParsedSource source, String name, String parentName,
                                  TSNode definition, TSNode outer) {
        LineRange definitionRange = LineRange.inclusive(startLine(definition), endLine(definition));
        LineRange decoratedRange  = LineRange.inclusive(startLine(outer), endLine(outer));
        return new DefinitionSite(
                name,
                parentName,
                definitionRange,
                decoratedRange,
                outer.getStartPoint().getColumn(),
                source.textOf(definition),
                source.textOf(outer)
        );
    }

    @Override
    public List<String> extractTopLevelDefinitions(ParsedSource source) {
        List<String> definitions = new ArrayList<>();
        TSNode root = source.getRoot();
        for (int i = 0; i < root.getNamedChildCount(); i++) {
            TSNode child = root.getNamedChild(i);
            switch (child.getType()) {
                case "function_definition", "class_definition", "decorated_definition" ->
                        definitions.add(source.textOf(child));
                default -> { }
            }
        }
        return definitions;
    }

    @Override
    public Set<String> referencedIdentifiers(ParsedSource source, DefinitionSite site) {
        Set<String> identifiers = new LinkedHashSet<>();
        LineRange range = site.getDecoratedRange();
        collectIdentifiers(source, source.getRoot(), range, identifiers);
        return identifiers;
    }

    private void collectIdentifiers(ParsedSource source, TSNode node, LineRange range, Set<String> out) {
        int first = startLine(node);
        int last  = node.getEndPoint().getRow() + 1;
        if (last < range.getStart() || first > range.getLastLine()) return;

        if ("identifier".equals(node.getType()) && range.contains(first)) {
            out.add(source.textOf(node));
            return;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            collectIdentifiers(source, node.getNamedChild(i), range, out);
        }
    }

    // ========================================================================
    // NODE HELPERS
    // ========================================================================

    private static List<TSNode> decoratorsOf(TSNode decorated) {
        List<TSNode> decorators = new ArrayList<>();
        for (int i = 0; i < decorated.getNamedChildCount(); i++) {
            TSNode child = decorated.getNamedChild(i);
            if ("decorator".equals(child.getType())) decorators.add(child);
        }
        return decorators;
    }

    private static boolean isAsync(TSNode functionDefinition) {
        return functionDefinition.getChildCount() > 0
                && "async".equals(functionDefinition.getChild(0).getType());
    }

    /** Named parameters; *args, **kwargs and bare * or / separators do not count. */
    private static int countParameters(TSNode parameters) {
        if (parameters == null || parameters.isNull()) return 0;
        int count = 0;
        for (int i = 0; i < parameters.getNamedChildCount(); i++) {
            TSNode p = parameters.getNamedChild(i);
            switch (p.getType()) {
                case "identifier", "default_parameter", "typed_default_parameter" -> count++;
                case "typed_parameter" -> {
                    TSNode inner = firstNamedChild(p);
                    if (inner != null && "identifier".equals(inner.getType())) count++;
                }
                default -> { }
            }
        }
        return count;
    }

    private static String firstStringArgument(ParsedSource source, TSNode arguments) {
        if (arguments == null || arguments.isNull()) return null;
        TSNode first = firstNamedChild(arguments);
        if (first == null || !"string".equals(first.getType())) return null;
        return stringLiteralValue(source, first);
    }

    /** Contents of a plain string literal, without prefix and quotes. */
    static String stringLiteralValue(ParsedSource source, TSNode string) {
        StringBuilder value = new StringBuilder();
        for (int i = 0; i < string.getNamedChildCount(); i++) {
            TSNode part = string.getNamedChild(i);
            if ("string_content".equals(part.getType())) {
                value.append(source.textOf(part));
            }
        }
        return value.toString();
    }

    private static TSNode firstNamedChild(TSNode node) {
        if (node == null || node.isNull() || node.getNamedChildCount() == 0) return null;
        return node.getNamedChild(0);
    }

    private static boolean sameNode(TSNode a, TSNode b) {
        return a.getStartByte() == b.getStartByte()
                && a.getEndByte() == b.getEndByte()
                && a.getType().equals(b.getType());
    }

    private static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    /** Last line holding node text; a node ending at column 0 ends on the previous line. */
    private static int endLine(TSNode node) {
        TSPoint end = node.getEndPoint();
        int row = end.getRow();
        if (end.getColumn() == 0 && row > node.getStartPoint().getRow()) row--;
        return row + 1;
    }
}
