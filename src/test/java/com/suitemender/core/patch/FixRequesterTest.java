package com.suitemender.core.patch;

import com.suitemender.core.context.ContextBundle;
import com.suitemender.core.context.FailureContext;
import com.suitemender.core.runner.TestFailure;
import com.suitemender.llm.MockLLMClient;
import com.suitemender.llm.ModelRole;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class FixRequesterTest {

    private final MockLLMClient llm       = new MockLLMClient();
    private final FixRequester  requester = new FixRequester(llm, 120_000);

    private FailureContext context() {
        TestFailure failure = new TestFailure("tests/test_users.py", "test_create_user", null,
                "NameError", "name 'User' is not defined", "", 4, "tests/test_users.py::test_create_user");
        ContextBundle bundle = ContextBundle.of(List.of("User"),
                Map.of("app/models.py", "class User:\n    def __init__(self, name):\n        self.name = name\n"));
        return new FailureContext(failure, "def test_create_user():\n    assert User('a').name == 'a'",
                "import pytest", bundle);
    }

    @Test
    void testFirstAttemptPrompt() {
        String prompt = requester.buildPrompt(context(), "User is not imported", null, null);

        assertTrue(prompt.contains("FAILING TEST: tests/test_users.py::test_create_user"));
        assertTrue(prompt.contains("ERROR: NameError: name 'User' is not defined"));
        assertTrue(prompt.contains("DIAGNOSIS: User is not imported"));
        assertTrue(prompt.contains("import pytest"));
        assertTrue(prompt.contains("class User:"));
        assertFalse(prompt.contains("Previous fix attempt"));
        assertTrue(prompt.contains("`test_create_user`"));
    }

    @Test
    void testRetryPromptCarriesPreviousAttemptAndClippedFeedback() {
        String feedback = "E".repeat(FixRequester.MAX_FEEDBACK_CHARS + 500);

        String prompt = requester.buildPrompt(context(), "User is not imported",
                "def test_create_user():\n    pass", feedback);

        assertTrue(prompt.contains("## Previous fix attempt"));
        assertTrue(prompt.contains("def test_create_user():\n    pass"));
        assertTrue(prompt.contains("E".repeat(FixRequester.MAX_FEEDBACK_CHARS)));
        assertFalse(prompt.contains("E".repeat(FixRequester.MAX_FEEDBACK_CHARS + 1)));
        assertTrue(prompt.contains("The previous fix attempt failed. Try a different approach."));
    }

    @Test
    void testExtractsCodeFromFencedAnswer() {
        llm.enqueue(ModelRole.FIXER, "Here you go:\n```python\ndef test_create_user():\n    from app.models import User\n```\n");

        Optional<String> code = requester.requestFix(context(), "User is not imported", null, null);

        assertEquals("def test_create_user():\n    from app.models import User", code.orElseThrow());
    }

    @Test
    void testEmptyAnswerIsEmpty() {
        assertTrue(requester.requestFix(context(), "x", null, null).isEmpty());
    }
}
