package com.suitemender.controller;

import com.suitemender.config.GenerationMode;
import com.suitemender.config.GenerationModeResolver;
import com.suitemender.orchestrator.GenerationOrchestrator;
import com.suitemender.orchestrator.GenerationReport;
import com.suitemender.orchestrator.IterationReport;
import com.suitemender.orchestrator.RepairOrchestrator;

import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
@RequestMapping("/mender")
public class MenderController {

    private final RepairOrchestrator     repairOrchestrator;
    private final GenerationOrchestrator generationOrchestrator;
    private final GenerationModeResolver modeResolver;

    public MenderController(
            RepairOrchestrator repairOrchestrator,
            GenerationOrchestrator generationOrchestrator,
            GenerationModeResolver modeResolver
    ) {
        this.repairOrchestrator     = repairOrchestrator;
        this.generationOrchestrator = generationOrchestrator;
        this.modeResolver           = modeResolver;
    }

    @PostMapping("/repair")
    public ResponseEntity<IterationReport> runRepair() {

        IterationReport report = repairOrchestrator.run();

        return ResponseEntity.ok(report);
    }

    /**
     * Body (all optional): {"mode": "unit" | "e2e", "gap_focused": "true" | "false"}
     */
    @PostMapping("/generate")
    public ResponseEntity<GenerationReport> runGeneration(
            @RequestBody(required = false) Map<String, String> request
    ) {

        String modeValue  = request != null ? request.get("mode") : null;
        String gapFocused = request != null ? request.get("gap_focused") : null;

        GenerationMode mode;
        if (modeValue == null || modeValue.trim().isEmpty()) {
            mode = modeResolver.getMode();
        } else {
            try {
                mode = GenerationModeResolver.parse(modeValue);
            } catch (IllegalArgumentException e) {
                return ResponseEntity.badRequest().build();
            }
        }

        GenerationReport report = (gapFocused == null || gapFocused.trim().isEmpty())
                ? generationOrchestrator.run(mode)
                : generationOrchestrator.run(mode, Boolean.parseBoolean(gapFocused.trim()));

        return ResponseEntity.ok(report);
    }
}
