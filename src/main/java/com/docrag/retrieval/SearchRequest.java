package com.docrag.retrieval;

/**
 * One similarity search. {@code queryText} is optional and only used by the lexical boost and the
 * reranker; {@code contentClass} may be {@code null} for an untagged query.
 */
public record SearchRequest(
        float[] queryEmbedding,
        String queryText,
        ContentClass contentClass,
        int topK,
        boolean useReranking) {

    public static SearchRequest of(float[] queryEmbedding, int topK) {
        return new SearchRequest(queryEmbedding, null, null, topK, false);
    }
}
