package com.suitemender.config;

/**
 * UNIT:  functions, classes and route handlers, tested directly.
 * E2E:   route handlers only, tested through an HTTP test client.
 */
public enum GenerationMode {
    UNIT,
    E2E;

    /** Lower-case form used in generated file names. */
    public String slug() {
        return name().toLowerCase();
    }
}
