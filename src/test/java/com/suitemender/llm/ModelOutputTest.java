package com.suitemender.llm;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ModelOutputTest {

    @Test
    void testExtractsFirstFencedBlock() {
        String text = """
                Sure, here is the fix:
                ```python
                def test_a():
                    assert True
                ```
                And another:
                ```python
                def test_b():
                    pass
                ```
                """;

        assertEquals("def test_a():\n    assert True", ModelOutput.extractCode(text));
    }

    @Test
    void testUnfencedTextDropsStrayFences() {
        assertEquals("def test_a():\n    pass", ModelOutput.extractCode("\n\ndef test_a():\n    pass\n```\n"));
        assertEquals("", ModelOutput.extractCode(null));
    }

    @Test
    void testJsonPrefersJsonFence() {
        String text = """
                ```python
                {"not": "this"}
                ```
                ```json
                {"classification": "code_defect"}
                ```
                """;

        assertEquals("{\"classification\": \"code_defect\"}", ModelOutput.extractJsonObject(text).orElseThrow());
    }

    @Test
    void testJsonFallsBackToOuterBraces() {
        assertEquals("{\"a\": {\"b\": 1}}",
                ModelOutput.extractJsonObject("Verdict: {\"a\": {\"b\": 1}} done").orElseThrow());
        assertTrue(ModelOutput.extractJsonObject("no object here").isEmpty());
        assertTrue(ModelOutput.extractJsonObject("  ").isEmpty());
    }
}
