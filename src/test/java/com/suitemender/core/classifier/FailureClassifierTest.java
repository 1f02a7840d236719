package com.suitemender.core.classifier;

import com.suitemender.core.context.ContextBundle;
import com.suitemender.core.context.FailureContext;
import com.suitemender.core.runner.TestFailure;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.*;

class FailureClassifierTest {

    private RuleClassifier     rules;
    private ModelClassifier    model;
    private FailureClassifier  classifier;
    private FailureContext     context;

    @BeforeEach
    void setUp() {
        rules = mock(RuleClassifier.class);
        model = mock(ModelClassifier.class);
        classifier = new FailureClassifier(rules, model);

        TestFailure failure = new TestFailure("tests/test_math.py", "test_divide", null,
                "ZeroDivisionError", "division by zero", "app/math.py:3: ZeroDivisionError", 3,
                "tests/test_math.py::test_divide");
        context = new FailureContext(failure, "def test_divide():\n    divide(1, 0)", "",
                ContextBundle.empty(List.of("divide")));
    }

    @Test
    void testRuleMatchNeverConsultsModel() {
        ClassificationResult ruled = ClassificationResult.testMistake("Undefined name in test", null, 0.95,
                ClassificationResult.Source.RULE);
        when(rules.classify(context.getFailure())).thenReturn(Optional.of(ruled));

        ClassificationResult result = classifier.classify(context);

        assertSame(ruled, result);
        verifyNoInteractions(model);
    }

    @Test
    void testInconclusiveRulesFallBackToModelWithHint() {
        when(rules.classify(context.getFailure())).thenReturn(Optional.empty());
        when(rules.codeDefectHint(context.getFailure())).thenReturn(Optional.of("a defect in the program"));
        ClassificationResult modelled = ClassificationResult.codeDefect("divide() does not guard zero", 0.8,
                ClassificationResult.Source.MODEL);
        when(model.classify(eq(context), anyString())).thenReturn(modelled);

        ClassificationResult result = classifier.classify(context);

        assertEquals(ClassificationResult.Kind.CODE_DEFECT, result.getKind());
        verify(model).classify(context, "a defect in the program");
    }

    @Test
    void testModelCalledWithoutHintWhenNoneApplies() {
        when(rules.classify(any())).thenReturn(Optional.empty());
        when(rules.codeDefectHint(any())).thenReturn(Optional.empty());
        when(model.classify(eq(context), isNull()))
                .thenReturn(ClassificationResult.unknown("undecided", ClassificationResult.Source.MODEL));

        ClassificationResult result = classifier.classify(context);

        assertEquals(ClassificationResult.Kind.UNKNOWN, result.getKind());
        verify(model).classify(context, null);
    }
}
