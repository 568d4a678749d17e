package com.docrag.retrieval;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docrag.store.StoredChunk;

/**
 * Packs ranked chunks into a context block under a token budget. Chunks are taken in rank order
 * and packing stops at the first one that does not fit.
 */
public class ContextAssembler {
    private static final Logger log = LoggerFactory.getLogger(ContextAssembler.class);

    private final int defaultTokenBudget;

    public ContextAssembler(int defaultTokenBudget) {
        this.defaultTokenBudget = defaultTokenBudget;
    }

    public AssembledContext assemble(List<ScoredChunk> ranked) {
        return assemble(ranked, defaultTokenBudget);
    }

    public AssembledContext assemble(List<ScoredChunk> ranked, int tokenBudget) {
        List<String> blocks = new ArrayList<>();
        List<Long> cited = new ArrayList<>();
        int totalTokens = 0;
        for (ScoredChunk scored : ranked) {
            StoredChunk chunk = scored.chunk();
            if (totalTokens + chunk.tokenCount() > tokenBudget) {
                log.debug("Token budget {} reached after {} chunks", tokenBudget, cited.size());
                break;
            }
            blocks.add(referenceToken(chunk) + "\n" + chunk.chunkText());
            cited.add(chunk.id());
            totalTokens += chunk.tokenCount();
        }
        log.info("Assembled context from {} of {} chunks, totalTokens={}", cited.size(), ranked.size(), totalTokens);
        return new AssembledContext(String.join("\n\n", blocks), cited, totalTokens);
    }

    /**
     * {@code [doc_<chunkId> | <source>]}, stable for a stored chunk.
     */
    public static String referenceToken(StoredChunk chunk) {
        String source = chunk.sourceName() == null || chunk.sourceName().isBlank() ? "unknown" : chunk.sourceName();
        return "[doc_" + chunk.id() + " | " + source + "]";
    }
}
