package com.suitemender.core.source;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class SourceExclusionsTest {

    private final SourceExclusions exclusions = SourceExclusions.defaults();

    @Test
    void testProgramSourceIsIncluded() {
        assertTrue(exclusions.test("app/models.py"));
        assertTrue(exclusions.test("src/shop/cart.py"));
        assertTrue(exclusions.test("main.py"));
    }

    @Test
    void testTestDirectoriesAndModulesAreExcluded() {
        assertFalse(exclusions.test("tests/test_cart.py"));
        assertFalse(exclusions.test("app/test/helpers.py"));
        assertFalse(exclusions.test("app/test_utils/factory.py"));
        assertFalse(exclusions.test("app/test_models.py"));
        assertFalse(exclusions.test("app/models_test.py"));
        assertFalse(exclusions.test("conftest.py"));
    }

    @Test
    void testEnvironmentsCachesAndHiddenDirectoriesAreExcluded() {
        assertFalse(exclusions.test("venv/lib/site.py"));
        assertFalse(exclusions.test(".venv/lib/site.py"));
        assertFalse(exclusions.test("app/__pycache__/models.py"));
        assertFalse(exclusions.test(".git/hooks/pre_commit.py"));
        assertFalse(exclusions.test("build/lib/app.py"));
    }

    @Test
    void testServerEntryScriptsAreExcluded() {
        assertFalse(exclusions.test("wsgi.py"));
        assertFalse(exclusions.test("project/asgi.py"));
        assertFalse(exclusions.test("manage.py"));
    }

    @Test
    void testExtraSegments() {
        SourceExclusions custom = SourceExclusions.withExtraSegments(Set.of("specs"));

        assertFalse(custom.test("specs/cart_checks.py"));
        assertTrue(custom.test("app/cart.py"));
    }
}
