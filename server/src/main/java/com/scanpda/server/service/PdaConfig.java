package com.scanpda.server.service;

public class PdaConfig {
    public String grammarResource = "/ecg_grammar.json";
    // worker threads for batch analysis
    public int batchThreads = 4;
    public boolean verifyCompletion = true;
    public boolean includeTrace = true;

    public PdaConfig() {
    }

    public PdaConfig(String grammarResource, int batchThreads, boolean verifyCompletion, boolean includeTrace) {
        this.grammarResource = grammarResource;
        this.batchThreads = batchThreads;
        this.verifyCompletion = verifyCompletion;
        this.includeTrace = includeTrace;
    }

    public static PdaConfig defaults() {
        return new PdaConfig("/ecg_grammar.json", 4, true, true);
    }
}
