package com.suitemender.llm;

/**
 * What a model call is for. Drives the system prompt and sampling temperature.
 */
public enum ModelRole {

    /** Decides whether a failing test or the program under test is at fault. Answers in JSON. */
    CLASSIFIER,

    /** Rewrites one failing test definition. Answers with a fenced code block. */
    FIXER,

    /** Writes new tests for a shard of targets. Answers with a fenced code block. */
    GENERATOR
}
