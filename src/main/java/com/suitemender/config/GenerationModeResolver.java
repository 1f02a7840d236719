package com.suitemender.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

@Component
public class GenerationModeResolver {

    private final GenerationMode mode;
    private final int            unitBatchSize;
    private final int            e2eBatchSize;

    public GenerationModeResolver(
        @Value("${suitemender.generation.mode:unit}") String mode,
        @Value("${suitemender.generation.unit-batch-size:50}") int unitBatchSize,
        @Value("${suitemender.generation.e2e-batch-size:20}") int e2eBatchSize
    ) {
        this.mode          = parse(mode);
        this.unitBatchSize = unitBatchSize;
        this.e2eBatchSize  = e2eBatchSize;
    }

    public static GenerationMode parse(String mode) {
        try {
            return GenerationMode.valueOf(mode.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown generation mode '" + mode + "' (expected unit or e2e)", e);
        }
    }

    public boolean isUnit() {
        return mode == GenerationMode.UNIT;
    }

    public boolean isE2E() {
        return mode == GenerationMode.E2E;
    }

    public GenerationMode getMode() {
        return mode;
    }

    public int batchSizeFor(GenerationMode generationMode) {
        return generationMode == GenerationMode.E2E ? e2eBatchSize : unitBatchSize;
    }
}
