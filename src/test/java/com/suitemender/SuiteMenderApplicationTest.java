package com.suitemender;

import com.suitemender.controller.MenderController;
import com.suitemender.core.runner.TestRunner;
import com.suitemender.llm.LLMClient;
import com.suitemender.llm.MockLLMClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import static org.junit.jupiter.api.Assertions.*;

@SpringBootTest
@ActiveProfiles({"test", "mock"})
class SuiteMenderApplicationTest {

    @Autowired
    private LLMClient llmClient;

    @Autowired
    private TestRunner testRunner;

    @Autowired
    private MenderController controller;

    @Test
    void testContextWiresMockBackend() {
        assertInstanceOf(MockLLMClient.class, llmClient);
        assertNotNull(testRunner);
        assertNotNull(controller);
    }
}
