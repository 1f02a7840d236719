package com.suitemender.orchestrator;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.suitemender.config.GenerationMode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Outcome of one generation run.
 */
@JsonPropertyOrder({"mode", "gap_focused", "targets", "gaps", "shards", "conftest", "generated_files",
        "rejected", "aborted", "abort_reason"})
public final class GenerationReport {

    private final GenerationMode mode;
    private final boolean        gapFocused;
    private final List<String>   generatedFiles = new ArrayList<>();
    private int     targets;
    private int     gaps;
    private int     shards;
    private int     rejected;
    private String  conftest;
    private boolean aborted;
    private String  abortReason;

    public GenerationReport(GenerationMode mode, boolean gapFocused) {
        this.mode       = mode;
        this.gapFocused = gapFocused;
    }

    void setTargets(int targets) { this.targets = targets; }
    void setGaps(int gaps)       { this.gaps = gaps; }
    void setShards(int shards)   { this.shards = shards; }
    void setConftest(String path) { this.conftest = path; }

    void generated(String path) {
        generatedFiles.add(path);
    }

    void rejected() {
        rejected++;
    }

    void abort(String reason) {
        this.aborted     = true;
        this.abortReason = reason;
    }

    @JsonProperty("mode")            public String       getMode()           { return mode.slug(); }
    @JsonProperty("gap_focused")     public boolean      isGapFocused()      { return gapFocused; }
    @JsonProperty("targets")         public int          getTargets()        { return targets; }
    @JsonProperty("gaps")            public int          getGaps()           { return gaps; }
    @JsonProperty("shards")          public int          getShards()         { return shards; }
    /** Path of the conftest.py written for this run, null when none was written. */
    @JsonProperty("conftest")        public String       getConftest()       { return conftest; }
    @JsonProperty("rejected")        public int          getRejected()       { return rejected; }
    @JsonProperty("aborted")         public boolean      isAborted()         { return aborted; }
    @JsonProperty("abort_reason")    public String       getAbortReason()    { return abortReason; }

    @JsonProperty("generated_files")
    public List<String> getGeneratedFiles() {
        return Collections.unmodifiableList(generatedFiles);
    }

    @Override
    public String toString() {
        return "GenerationReport{" + mode.slug() + ", targets=" + targets + ", shards=" + shards
                + ", written=" + generatedFiles.size() + ", rejected=" + rejected
                + (aborted ? ", ABORTED: " + abortReason : "") + "}";
    }
}
