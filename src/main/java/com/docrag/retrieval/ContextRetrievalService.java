package com.docrag.retrieval;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docrag.embedding.EmbeddingProvider;
import com.docrag.embedding.EmbeddingProviderException;

/**
 * Query side entry point: embeds the query, searches and packs the result into a context block.
 * Any failure produces an empty context so the caller can answer without augmentation.
 */
public class ContextRetrievalService {
    private static final Logger log = LoggerFactory.getLogger(ContextRetrievalService.class);

    private final EmbeddingProvider embeddingProvider;
    private final String embeddingModel;
    private final VectorSearchService searchService;
    private final ContextAssembler assembler;
    private final RetrievalSettings settings;

    public ContextRetrievalService(EmbeddingProvider embeddingProvider,
            String embeddingModel,
            VectorSearchService searchService,
            ContextAssembler assembler,
            RetrievalSettings settings) {
        this.embeddingProvider = embeddingProvider;
        this.embeddingModel = embeddingModel;
        this.searchService = searchService;
        this.assembler = assembler;
        this.settings = settings;
    }

    public AssembledContext retrieveContext(String query, ContentClass contentClass, int topK, boolean useReranking) {
        if (query == null || query.isBlank()) {
            return AssembledContext.empty();
        }
        try {
            float[] queryEmbedding = embeddingProvider.embed(embeddingModel, query);
            SearchRequest request = new SearchRequest(queryEmbedding, query, contentClass, topK, useReranking);
            return assembler.assemble(searchService.search(request), settings.contextTokenBudget());
        } catch (EmbeddingProviderException e) {
            log.error("Failed to embed query ({}), continuing without context: {}", e.reason(), e.getMessage());
            return AssembledContext.empty();
        } catch (RuntimeException e) {
            log.error("Failed to retrieve context, continuing without it", e);
            return AssembledContext.empty();
        }
    }
}
