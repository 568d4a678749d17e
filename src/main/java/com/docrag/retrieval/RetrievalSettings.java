package com.docrag.retrieval;

import com.docrag.runtime.AppConfig;

public record RetrievalSettings(
        double textThreshold,
        double codeThreshold,
        int defaultTopK,
        int maxTopK,
        boolean lexicalBoost,
        int rerankCandidates,
        int contextTokenBudget) {

    public RetrievalSettings {
        if (maxTopK < 1) {
            throw new IllegalArgumentException("maxTopK must be at least 1: " + maxTopK);
        }
        if (rerankCandidates < 1) {
            throw new IllegalArgumentException("rerankCandidates must be at least 1: " + rerankCandidates);
        }
    }

    public static RetrievalSettings from(AppConfig.RetrievalConfig config) {
        return new RetrievalSettings(
                config.getTextThreshold(),
                config.getCodeThreshold(),
                config.getDefaultTopK(),
                config.getMaxTopK(),
                config.isLexicalBoost(),
                config.getRerankCandidates(),
                config.getContextTokenBudget());
    }

    public static RetrievalSettings defaults() {
        return from(new AppConfig.RetrievalConfig());
    }

    /**
     * Untagged queries use the more permissive of the two thresholds.
     */
    public double thresholdFor(ContentClass contentClass) {
        if (contentClass == null) {
            return Math.min(textThreshold, codeThreshold);
        }
        return switch (contentClass) {
            case CODE -> codeThreshold;
            case TEXT -> textThreshold;
        };
    }

    public int clampTopK(int requested) {
        int topK = requested <= 0 ? defaultTopK : requested;
        return Math.max(1, Math.min(topK, maxTopK));
    }
}
