package com.docrag.ingest;

import java.util.List;

/**
 * Splits raw document text into ordered chunks. Output is deterministic for a fixed input and
 * configuration.
 */
public class Chunker {
    private final int maxTokensPerChunk;
    private final int overlapTokens;
    private final TokenEstimator tokenEstimator;

    public Chunker(int maxTokensPerChunk, int overlapTokens, TokenEstimator tokenEstimator) {
        if (maxTokensPerChunk <= 0) {
            throw new IllegalArgumentException("maxTokensPerChunk must be positive: " + maxTokensPerChunk);
        }
        if (overlapTokens < 0 || overlapTokens >= maxTokensPerChunk) {
            throw new IllegalArgumentException("overlapTokens must be in [0, maxTokensPerChunk): " + overlapTokens);
        }
        this.maxTokensPerChunk = maxTokensPerChunk;
        this.overlapTokens = overlapTokens;
        this.tokenEstimator = tokenEstimator;
    }

    public List<TextChunk> split(String content, String fileExtension) throws UnsupportedFileTypeException {
        return split(content, ChunkingStrategy.forExtension(fileExtension));
    }

    public List<TextChunk> split(String content, ChunkingStrategy strategy) {
        int maxWords = tokenEstimator.wordsForTokens(maxTokensPerChunk);
        int overlapWords = tokenEstimator.wordsForTokens(overlapTokens);
        return switch (strategy) {
            case PLAIN_TEXT -> new PlainTextSplitter(maxWords, overlapWords, tokenEstimator).split(content);
            case MARKDOWN -> new MarkdownSplitter(maxWords, overlapWords, tokenEstimator).split(content);
        };
    }

    public TokenEstimator tokenEstimator() {
        return tokenEstimator;
    }
}
