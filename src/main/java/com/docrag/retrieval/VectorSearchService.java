package com.docrag.retrieval;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docrag.store.StoredChunk;
import com.docrag.store.VectorStore;

/**
 * Brute-force similarity search over every stored chunk. Scores are cosine similarity, optionally
 * boosted by keyword overlap, filtered by the content-class threshold and optionally reranked.
 * Search never throws; failures are logged and yield an empty result.
 */
public class VectorSearchService {
    private static final Logger log = LoggerFactory.getLogger(VectorSearchService.class);

    private final VectorStore vectorStore;
    private final RetrievalSettings settings;
    private final RerankerAdapter reranker;

    public VectorSearchService(VectorStore vectorStore, RetrievalSettings settings) {
        this(vectorStore, settings, null);
    }

    /**
     * @param reranker optional, {@code null} disables reranking regardless of the request flag
     */
    public VectorSearchService(VectorStore vectorStore, RetrievalSettings settings, RerankerAdapter reranker) {
        this.vectorStore = vectorStore;
        this.settings = settings;
        this.reranker = reranker;
    }

    public List<ScoredChunk> search(SearchRequest request) {
        try {
            return doSearch(request);
        } catch (RuntimeException e) {
            log.error("Vector search failed, returning no results", e);
            return List.of();
        }
    }

    private List<ScoredChunk> doSearch(SearchRequest request) {
        int topK = settings.clampTopK(request.topK());
        double threshold = settings.thresholdFor(request.contentClass());
        log.info("Starting vector search: topK={}, class={}, threshold={}, reranking={}",
                topK, request.contentClass() == null ? "any" : request.contentClass(), threshold, request.useReranking());

        List<StoredChunk> chunks = vectorStore.getAllChunks();
        if (chunks.isEmpty()) {
            log.info("No chunks stored, nothing to search");
            return List.of();
        }

        LexicalBooster booster = settings.lexicalBoost() && hasText(request.queryText())
                ? new LexicalBooster(request.queryText())
                : null;
        float[] query = request.queryEmbedding();
        int mismatches = 0;
        List<ScoredChunk> candidates = new ArrayList<>();
        for (StoredChunk chunk : chunks) {
            float[] embedding = chunk.embedding();
            if (!CosineSimilarity.dimensionsMatch(query, embedding)) {
                mismatches++;
            }
            double score = CosineSimilarity.compute(query, embedding);
            if (booster != null && booster.hasKeywords()) {
                score = booster.boost(score, chunk.chunkText());
            }
            if (score >= threshold) {
                candidates.add(new ScoredChunk(chunk, score));
            }
        }
        if (mismatches > 0) {
            log.warn("Vector dimension mismatch for {} of {} chunks (query dimension {}), scored as 0",
                    mismatches, chunks.size(), query == null ? 0 : query.length);
        }

        // List.sort is stable, so equal scores keep storage order.
        candidates.sort(Comparator.comparingDouble(ScoredChunk::score).reversed());
        log.info("{} of {} chunks passed threshold {}", candidates.size(), chunks.size(), threshold);

        List<ScoredChunk> results;
        if (request.useReranking() && reranker != null && hasText(request.queryText())) {
            List<ScoredChunk> pool = head(candidates, settings.rerankCandidates());
            results = head(reranker.rerank(request.queryText(), pool, topK), topK);
        } else {
            if (request.useReranking()) {
                log.warn("Reranking requested but {}; using vector ranking only",
                        reranker == null ? "no reranker is configured" : "the query text is empty");
            }
            results = head(candidates, topK);
        }

        if (log.isDebugEnabled()) {
            for (int i = 0; i < results.size(); i++) {
                ScoredChunk scored = results.get(i);
                log.debug("  {}. [doc_{}] score={} {}", i + 1, scored.chunk().id(),
                        String.format("%.4f", scored.score()), preview(scored.chunk().chunkText()));
            }
        }
        log.info("Vector search returned {} chunks", results.size());
        return results;
    }

    private static List<ScoredChunk> head(List<ScoredChunk> list, int limit) {
        return list.size() > limit ? List.copyOf(list.subList(0, limit)) : List.copyOf(list);
    }

    private static boolean hasText(String text) {
        return text != null && !text.isBlank();
    }

    private static String preview(String text) {
        String flat = text.replace('\n', ' ');
        return flat.length() > 100 ? flat.substring(0, 100) + "..." : flat;
    }
}
