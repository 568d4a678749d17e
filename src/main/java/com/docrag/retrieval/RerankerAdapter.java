package com.docrag.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Best-effort second pass over the vector candidates. Any provider failure leaves the candidate
 * list untouched; callers truncate to their final size either way.
 */
public class RerankerAdapter {
    private static final Logger log = LoggerFactory.getLogger(RerankerAdapter.class);

    private final RerankProvider provider;
    private final double threshold;

    public RerankerAdapter(RerankProvider provider, double threshold) {
        this.provider = provider;
        this.threshold = threshold;
    }

    public List<ScoredChunk> rerank(String query, List<ScoredChunk> candidates, int topK) {
        if (candidates.isEmpty()) {
            return candidates;
        }
        List<String> texts = candidates.stream().map(c -> c.chunk().chunkText()).toList();
        double[] scores;
        try {
            scores = provider.score(query, texts);
        } catch (RerankProviderException e) {
            log.warn("Reranking failed, keeping vector ranking: {}", e.getMessage());
            return candidates;
        } catch (RuntimeException e) {
            log.warn("Reranking failed unexpectedly, keeping vector ranking", e);
            return candidates;
        }
        if (scores == null || scores.length != candidates.size()) {
            log.warn("Reranker returned {} scores for {} candidates, keeping vector ranking",
                    scores == null ? 0 : scores.length, candidates.size());
            return candidates;
        }

        List<ScoredChunk> reranked = new ArrayList<>(candidates.size());
        for (int i = 0; i < candidates.size(); i++) {
            if (scores[i] >= threshold) {
                reranked.add(candidates.get(i).withScore(scores[i]));
            }
        }
        reranked.sort(Comparator.comparingDouble(ScoredChunk::score).reversed());
        List<ScoredChunk> out = reranked.size() > topK ? List.copyOf(reranked.subList(0, topK)) : List.copyOf(reranked);
        log.info("Reranked {} candidates, {} passed threshold {}, returning {}",
                candidates.size(), reranked.size(), threshold, out.size());
        return out;
    }
}
