package com.suitemender.core.patch;

import com.suitemender.core.filesystem.FileSystemManager;
import com.suitemender.core.runner.TestFailure;
import com.suitemender.core.runner.TestRunReport;
import com.suitemender.core.runner.TestRunner;
import com.suitemender.core.source.DefinitionSite;
import com.suitemender.core.source.FrontEndRegistry;
import com.suitemender.core.source.LineRange;
import com.suitemender.core.source.PythonFrontEnd;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SymbolPatcherTest {

    private static final String CART_TESTS = """
            from app.cart import Cart


            class TestCart:
                def test_add(self):
                    cart = Cart()
                    cart.add("x")
                    assert cart.count == 2

                def test_empty(self):
                    assert Cart().count == 0
            """;

    @TempDir
    Path tempDir;

    private FileSystemManager fileSystem;
    private TestRunner        runner;
    private SymbolPatcher     patcher;

    @BeforeEach
    void setUp() throws Exception {
        fileSystem = new FileSystemManager(tempDir.toString());
        runner = mock(TestRunner.class);
        patcher = new SymbolPatcher(fileSystem, new FrontEndRegistry(List.of(new PythonFrontEnd())), runner, false);
        fileSystem.writeFile("tests/test_cart.py", CART_TESTS);
    }

    @Test
    void testReplacesMethodAndReindentsToClassBody() throws Exception {
        String replacement = """
                def test_add(self):
                    cart = Cart()
                    cart.add("x")
                    cart.add("y")

                    assert cart.count == 2
                """;

        PatchOutcome outcome = patcher.patch("tests/test_cart.py", "test_add", "TestCart", replacement, null);

        assertTrue(outcome.isSuccess());
        assertEquals("""
                from app.cart import Cart


                class TestCart:
                    def test_add(self):
                        cart = Cart()
                        cart.add("x")
                        cart.add("y")

                        assert cart.count == 2

                    def test_empty(self):
                        assert Cart().count == 0
                """, fileSystem.readFile("tests/test_cart.py"));
    }

    @Test
    void testUnparseableReplacementRestoresExactBytes() throws Exception {
        byte[] before = Files.readAllBytes(tempDir.resolve("tests/test_cart.py"));

        PatchOutcome outcome = patcher.patch("tests/test_cart.py", "test_add", "TestCart",
                "def test_add(self:\n    assert (", null);

        assertTrue(outcome.isApplied());
        assertFalse(outcome.isValidated());
        assertFalse(outcome.getFeedback().isEmpty());
        assertArrayEquals(before, Files.readAllBytes(tempDir.resolve("tests/test_cart.py")));
    }

    @Test
    void testReplacementMustDefineTheTarget() throws Exception {
        PatchOutcome outcome = patcher.patch("tests/test_cart.py", "test_add", "TestCart",
                "def test_other(self):\n    pass\n", null);

        assertFalse(outcome.isSuccess());
        assertTrue(outcome.getReason().contains("does not define"));
        assertEquals(CART_TESTS, fileSystem.readFile("tests/test_cart.py"));
    }

    @Test
    void testMissingDefinitionIsNotApplied() throws Exception {
        PatchOutcome outcome = patcher.patch("tests/test_cart.py", "test_remove", "TestCart",
                "def test_remove(self):\n    pass\n", null);

        assertFalse(outcome.isApplied());
        assertTrue(outcome.getReason().contains("not found"));
        assertEquals(CART_TESTS, fileSystem.readFile("tests/test_cart.py"));
    }

    @Test
    void testMissingFileAndEmptyReplacementAreNotApplied() {
        assertFalse(patcher.patch("tests/test_gone.py", "test_x", null, "def test_x():\n    pass", null).isApplied());
        assertFalse(patcher.patch("tests/test_cart.py", "test_add", null, "   \n", null).isApplied());
        assertFalse(patcher.patch("tests/cart.test.js", "test_add", null, "def test_add():\n    pass", null).isApplied());
    }

    @Test
    void testDecoratorsKeptUnlessReplacementBringsItsOwn() throws Exception {
        fileSystem.writeFile("tests/test_load.py", """
                import pytest


                @pytest.mark.slow
                def test_load():
                    assert load() == 1
                """);

        assertTrue(patcher.patch("tests/test_load.py", "test_load", null,
                "def test_load():\n    assert load() == 2\n", null).isSuccess());
        assertTrue(fileSystem.readFile("tests/test_load.py").contains("@pytest.mark.slow\ndef test_load():\n    assert load() == 2\n"));

        assertTrue(patcher.patch("tests/test_load.py", "test_load", null,
                "@pytest.mark.parametrize(\"n\", [1, 2])\ndef test_load(n):\n    assert load() == n\n", null).isSuccess());
        String patched = fileSystem.readFile("tests/test_load.py");
        assertFalse(patched.contains("@pytest.mark.slow"));
        assertTrue(patched.contains("@pytest.mark.parametrize(\"n\", [1, 2])\ndef test_load(n):"));
    }

    @Test
    void testAddedImportGoesAboveKeptDecorators() throws Exception {
        fileSystem.writeFile("tests/test_users.py", """
                import pytest


                @pytest.mark.django_db
                def test_user_creation():
                    user = User.objects.create(name="a")
                    assert user.pk
                """);

        PatchOutcome outcome = patcher.patch("tests/test_users.py", "test_user_creation", null, """
                from app.models import User

                def test_user_creation():
                    user = User.objects.create(name="a")
                    assert user.pk is not None
                """, null);

        assertTrue(outcome.isSuccess(), outcome.toString());
        assertEquals("""
                import pytest


                from app.models import User

                @pytest.mark.django_db
                def test_user_creation():
                    user = User.objects.create(name="a")
                    assert user.pk is not None
                """, fileSystem.readFile("tests/test_users.py"));
    }

    @Test
    void testAddedImportWithOwnDecoratorsReplacesOriginalOnes() {
        String original = "import pytest\n@pytest.mark.slow\ndef test_x():\n    assert x()\n";
        DefinitionSite site = new DefinitionSite("test_x", null, LineRange.inclusive(3, 4), LineRange.inclusive(2, 4),
                0, "def test_x():\n    assert x()", "@pytest.mark.slow\ndef test_x():\n    assert x()");

        String patched = SymbolPatcher.splice(original, site,
                "from app import x\n@pytest.mark.fast\ndef test_x():\n    assert x() == 1\n");

        assertEquals("import pytest\nfrom app import x\n@pytest.mark.fast\ndef test_x():\n    assert x() == 1\n", patched);
    }

    @Test
    void testMixedLineEndingsOutsideTheSpliceArePreserved() {
        String original = "import os\r\ndef f():\r\n    return 1\r\nLAST = 2\n";
        DefinitionSite site = new DefinitionSite("f", null, LineRange.inclusive(2, 3), LineRange.inclusive(2, 3),
                0, "def f():\r\n    return 1", "def f():\r\n    return 1");

        assertEquals("import os\r\ndef f():\r\n    return 2\r\nLAST = 2\n",
                SymbolPatcher.splice(original, site, "def f():\n    return 2"));

        String endsWithTarget = "import os\r\ndef f():\r\n    return 1\n";
        assertEquals("import os\r\ndef f():\r\n    return 2\r\n",
                SymbolPatcher.splice(endsWithTarget, site, "def f():\n    return 2"));
    }

    @Test
    void testSpliceAtEndOfFileWithoutTrailingNewline() {
        String original = "x = 1\ndef f():\n    return 1";
        DefinitionSite site = new DefinitionSite("f", null, LineRange.inclusive(2, 3), LineRange.inclusive(2, 3),
                0, "def f():\n    return 1", "def f():\n    return 1");

        assertEquals("x = 1\ndef f():\n    return 2", SymbolPatcher.splice(original, site, "def f():\n    return 2\n"));
    }

    @Test
    void testCrlfLineEndingsArePreserved() throws Exception {
        fileSystem.writeFile("tests/test_win.py", "import os\r\n\r\ndef test_cwd():\r\n    assert os.getcwd() == ''\r\n");

        PatchOutcome outcome = patcher.patch("tests/test_win.py", "test_cwd", null,
                "def test_cwd():\n    assert os.getcwd()\n", null);

        assertTrue(outcome.isSuccess());
        assertEquals("import os\r\n\r\ndef test_cwd():\r\n    assert os.getcwd()\r\n",
                fileSystem.readFile("tests/test_win.py"));
    }

    @Test
    void testStillFailingNodeRollsBackWithRunnerFeedback() throws Exception {
        SymbolPatcher verifying = new SymbolPatcher(fileSystem,
                new FrontEndRegistry(List.of(new PythonFrontEnd())), runner, true);
        TestFailure stillFailing = new TestFailure("tests/test_cart.py", "test_add", "TestCart",
                "AssertionError", "assert 1 == 2", "tests/test_cart.py:8: AssertionError", 8,
                "tests/test_cart.py::TestCart::test_add");
        when(runner.runNode("tests/test_cart.py::TestCart::test_add"))
                .thenReturn(TestRunReport.completed(1, 1, 0, List.of(stillFailing)));

        PatchOutcome outcome = verifying.patchTest(stillFailing,
                "def test_add(self):\n    assert Cart().add('x') is None\n");

        assertTrue(outcome.isApplied());
        assertFalse(outcome.isValidated());
        assertTrue(outcome.getFeedback().contains("AssertionError: assert 1 == 2"));
        assertEquals(CART_TESTS, fileSystem.readFile("tests/test_cart.py"));
    }

    @Test
    void testPassingNodeKeepsPatch() throws Exception {
        SymbolPatcher verifying = new SymbolPatcher(fileSystem,
                new FrontEndRegistry(List.of(new PythonFrontEnd())), runner, true);
        TestFailure failure = new TestFailure("tests/test_cart.py", "test_add", "TestCart",
                "AssertionError", "assert 1 == 2", "", 8, "tests/test_cart.py::TestCart::test_add");
        when(runner.runNode(failure.getNodeId())).thenReturn(TestRunReport.completed(0, 1, 1, List.of()));

        PatchOutcome outcome = verifying.patchTest(failure, "def test_add(self):\n    assert Cart() is not None\n");

        assertTrue(outcome.isSuccess());
        assertTrue(fileSystem.readFile("tests/test_cart.py").contains("assert Cart() is not None"));
        verify(runner).runNode(failure.getNodeId());
    }

    @Test
    void testSpliceReplacesOnlyDefinitionLines() {
        String original = "a = 1\ndef f():\n    return 1\nb = 2\n";
        DefinitionSite site = new DefinitionSite("f", null, LineRange.inclusive(2, 3), LineRange.inclusive(2, 3),
                0, "def f():\n    return 1", "def f():\n    return 1");

        assertEquals("a = 1\ndef f():\n    return 2\nb = 2\n",
                SymbolPatcher.splice(original, site, "def f():\n    return 2"));
    }

    @Test
    void testNormalizeIndentationShiftsBlockAndKeepsRelativeIndent() {
        List<String> lines = SymbolPatcher.normalizeIndentation(
                "\n        def test_x(self):\n            if ok:\n                pass\n   \n            done()\n\n", "    ");

        assertEquals(List.of(
                "    def test_x(self):",
                "        if ok:",
                "            pass",
                "",
                "        done()"), lines);
    }

    @Test
    void testWrittenContentUsesUtf8() throws Exception {
        patcher.patch("tests/test_cart.py", "test_empty", "TestCart",
                "def test_empty(self):\n    assert Cart().label == 'café'\n", null);

        String onDisk = new String(Files.readAllBytes(tempDir.resolve("tests/test_cart.py")), StandardCharsets.UTF_8);
        assertTrue(onDisk.contains("'café'"));
    }
}
