package com.suitemender.core.context;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class ContextBundleTest {

    @Test
    void testRendersLabelledBlocks() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("app/a.py", "def a():\n    pass\n");
        files.put("app/b.py", "def b():\n    pass");

        String rendered = ContextBundle.of(List.of("a"), files).render(10_000);

        assertTrue(rendered.startsWith("# ===== File: app/a.py =====\ndef a():"));
        assertTrue(rendered.contains("# ===== File: app/b.py =====\ndef b():\n    pass\n"));
    }

    @Test
    void testDropsWholeTrailingFilesToFitBudget() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("app/a.py", "x = 1\n");
        files.put("app/b.py", "y = 2\n".repeat(100));

        String rendered = ContextBundle.of(List.of(), files).render(100);

        assertTrue(rendered.contains("app/a.py"));
        assertFalse(rendered.contains("app/b.py"), "a file is either present in full or absent");
        assertFalse(rendered.contains(ContextBundle.TRUNCATION_MARKER));
    }

    @Test
    void testCutsOnlyAnOversizedFirstFile() {
        Map<String, String> files = new LinkedHashMap<>();
        files.put("app/huge.py", "z = 3\n".repeat(1000));
        files.put("app/small.py", "w = 4\n");

        String rendered = ContextBundle.of(List.of(), files).render(200);

        assertTrue(rendered.length() <= 200 + ContextBundle.TRUNCATION_MARKER.length());
        assertTrue(rendered.endsWith(ContextBundle.TRUNCATION_MARKER));
        assertFalse(rendered.contains("app/small.py"));
    }

    @Test
    void testExcerptsRenderInPlaceOfFullText() {
        Map<String, String> files = Map.of("app/a.py", "import os\n\nDEBUG = True\n\ndef a():\n    pass\n");
        Map<String, String> excerpts = Map.of("app/a.py", "def a():\n    pass");

        ContextBundle bundle = ContextBundle.withExcerpts(List.of("a"), files, excerpts);

        assertFalse(bundle.render(10_000).contains("DEBUG"));
        assertTrue(bundle.getFiles().get("app/a.py").contains("DEBUG"), "the full text is still held");
    }

    @Test
    void testEmptyBundleRendersNothing() {
        ContextBundle bundle = ContextBundle.empty(List.of("t"));

        assertTrue(bundle.isEmpty());
        assertEquals("", bundle.render(100));
    }
}
