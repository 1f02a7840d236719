package com.suitemender.core.source;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class PythonFrontEndTest {

    private static final String MODULE = """
            import os
            from app.models import User as U
            from .helpers import build

            class Cart:
                def add(self, item, qty=1):
                    return item

                async def total(self, *args, **kwargs):
                    def inner():
                        pass
                    return 0

            @app.get("/items/{id}")
            def read_item(id):
                return id

            @bp.route("/orders", methods=["POST", "GET"])
            def create_order():
                pass

            def helper(a, b: int, c: str = "x"):
                pass
            """;

    private final PythonFrontEnd frontEnd = new PythonFrontEnd();

    @Test
    void testExtractsNestedSymbolsInDefinitionOrder() {
        ParsedSource parsed = frontEnd.parse("app/cart.py", MODULE);

        List<Symbol> symbols = frontEnd.extractSymbols(parsed);

        assertEquals(List.of("Cart", "add", "total", "inner", "read_item", "create_order", "helper"),
                symbols.stream().map(Symbol::getName).collect(Collectors.toList()));
    }

    @Test
    void testClassifiesKindsAndRanges() {
        List<Symbol> symbols = frontEnd.extractSymbols(frontEnd.parse("app/cart.py", MODULE));

        Symbol cart = symbols.get(0);
        assertEquals(SymbolKind.CLASS, cart.getKind());
        assertEquals(5, cart.getStartLine());
        assertEquals(12, cart.getEndLine());

        Symbol add = symbols.get(1);
        assertEquals(SymbolKind.METHOD, add.getKind());
        assertEquals("Cart", add.getParentName());
        assertEquals(6, add.getStartLine());
        assertEquals(7, add.getEndLine());
        assertEquals(3, add.getArgCount());
        assertTrue(cart.getRange().contains(add.getRange()));

        Symbol total = symbols.get(2);
        assertTrue(total.isAsync());
        assertEquals(1, total.getArgCount(), "*args and **kwargs are not counted");

        Symbol inner = symbols.get(3);
        assertEquals(SymbolKind.FUNCTION, inner.getKind());
        assertEquals("total", inner.getParentName());
        assertFalse(inner.isTopLevel());

        Symbol helper = symbols.get(6);
        assertEquals(SymbolKind.FUNCTION, helper.getKind());
        assertTrue(helper.isTopLevel());
        assertEquals(3, helper.getArgCount());
    }

    @Test
    void testRouteHandlersAreRoutes() {
        ParsedSource parsed = frontEnd.parse("app/api.py", MODULE);

        List<Symbol> symbols = frontEnd.extractSymbols(parsed);
        List<Route> routes = frontEnd.extractRoutes(parsed);

        assertEquals(SymbolKind.ROUTE, symbols.get(4).getKind());
        assertEquals(15, symbols.get(4).getStartLine(), "range starts at def, not at the decorator");

        assertEquals(2, routes.size());
        assertEquals("read_item", routes.get(0).getHandlerName());
        assertEquals("GET", routes.get(0).getMethod());
        assertEquals("/items/{id}", routes.get(0).getPath());

        assertEquals("create_order", routes.get(1).getHandlerName());
        assertEquals("POST", routes.get(1).getMethod());
        assertEquals("/orders", routes.get(1).getPath());
    }

    @Test
    void testExtractsImports() {
        List<ImportStatement> imports = frontEnd.extractImports(frontEnd.parse("app/cart.py", MODULE));

        assertEquals(3, imports.size());

        assertEquals("os", imports.get(0).getModule());
        assertEquals("os", imports.get(0).getBoundName());

        assertEquals("app.models", imports.get(1).getModule());
        assertEquals("User", imports.get(1).getImportedName());
        assertEquals("U", imports.get(1).getBoundName());

        assertEquals("helpers", imports.get(2).getModule());
        assertEquals(1, imports.get(2).getRelativeLevel());
        assertEquals("build", imports.get(2).getBoundName());
    }

    @Test
    void testExtractsStringTargetsOfPatchCalls() {
        String test = """
                from unittest.mock import patch

                def test_send(monkeypatch):
                    monkeypatch.setattr("app.config.DEBUG", True)
                    with patch("app.services.mailer.send") as send:
                        pass
                """;

        List<ImportStatement> targets = frontEnd.extractImports(frontEnd.parse("tests/test_mail.py", test))
                .stream()
                .filter(i -> i.getOrigin() == ImportStatement.Origin.STRING_TARGET)
                .collect(Collectors.toList());

        assertEquals(2, targets.size());
        assertEquals("app.config", targets.get(0).getModule());
        assertEquals("app.services.mailer", targets.get(1).getModule());
        assertEquals("app.services.mailer.send", targets.get(1).getBoundName());
    }

    @Test
    void testFindDefinitionPrefersEnclosingClass() {
        String test = """
                class TestA:
                    def test_it(self):
                        assert 1

                class TestB:
                    @pytest.mark.slow
                    def test_it(self):
                        assert 2
                """;
        ParsedSource parsed = frontEnd.parse("tests/test_x.py", test);

        assertEquals(2, frontEnd.findDefinitions(parsed, "test_it").size());

        Optional<DefinitionSite> site = frontEnd.findDefinition(parsed, "test_it", "TestB");
        assertTrue(site.isPresent());
        assertEquals("TestB", site.get().getParentName());
        assertEquals(LineRange.inclusive(7, 8), site.get().getDefinitionRange());
        assertEquals(LineRange.inclusive(6, 8), site.get().getDecoratedRange());
        assertEquals(4, site.get().getIndentColumn());
        assertTrue(site.get().hasDecorators());

        Optional<DefinitionSite> fallback = frontEnd.findDefinition(parsed, "test_it", null);
        assertEquals("TestA", fallback.get().getParentName());
    }

    @Test
    void testReferencedIdentifiersCoverOnlyTheDefinition() {
        String test = """
                from app.models import User, Order

                def test_user():
                    assert User("a").name == "a"

                def test_order():
                    assert Order()
                """;
        ParsedSource parsed = frontEnd.parse("tests/test_models.py", test);
        DefinitionSite site = frontEnd.findDefinitions(parsed, "test_user").get(0);

        Set<String> referenced = frontEnd.referencedIdentifiers(parsed, site);

        assertTrue(referenced.contains("User"));
        assertFalse(referenced.contains("Order"));
    }

    @Test
    void testTopLevelDefinitionsIncludeDecorators() {
        List<String> definitions = frontEnd.extractTopLevelDefinitions(frontEnd.parse("app/api.py", MODULE));

        assertEquals(4, definitions.size());
        assertTrue(definitions.get(1).startsWith("@app.get(\"/items/{id}\")"));
    }

    @Test
    void testSyntaxValidity() {
        assertTrue(frontEnd.isSyntaxValid("def ok():\n    return 1\n"));
        assertFalse(frontEnd.isSyntaxValid("def broken(:\n    return\n"));
        assertThrows(SourceParseException.class,
                () -> frontEnd.parseFile("app/broken.py", "class :\n"));
    }

    @Test
    void testNonAsciiTextKeepsNodeBoundaries() {
        String source = "GREETING = \"héllo ✓\"\n\ndef wave():\n    return GREETING\n";

        List<Symbol> symbols = frontEnd.extractSymbols(frontEnd.parse("app/i18n.py", source));

        assertEquals(1, symbols.size());
        assertEquals("wave", symbols.get(0).getName());
        assertEquals(3, symbols.get(0).getStartLine());
    }
}
