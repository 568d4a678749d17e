package com.docrag;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docrag.embedding.EmbeddingProvider;
import com.docrag.embedding.EmbeddingProviderException;
import com.docrag.embedding.EmbeddingProviders;
import com.docrag.ingest.Chunker;
import com.docrag.ingest.IngestionCoordinator;
import com.docrag.ingest.IngestionProgress;
import com.docrag.ingest.IngestionProgressTracker;
import com.docrag.ingest.IngestionService;
import com.docrag.ingest.IngestionStatus;
import com.docrag.ingest.TokenEstimator;
import com.docrag.retrieval.AssembledContext;
import com.docrag.retrieval.ContentClass;
import com.docrag.retrieval.ContextAssembler;
import com.docrag.retrieval.ContextRetrievalService;
import com.docrag.retrieval.CrossEncoderRerankProvider;
import com.docrag.retrieval.RerankerAdapter;
import com.docrag.retrieval.RetrievalSettings;
import com.docrag.retrieval.ScoredChunk;
import com.docrag.retrieval.SearchRequest;
import com.docrag.retrieval.VectorSearchService;
import com.docrag.runtime.AppConfig;
import com.docrag.runtime.AppConfigLoader;
import com.docrag.store.SqliteVectorStore;
import com.docrag.store.StoredDocument;
import com.docrag.store.VectorStore;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "doc-rag",
        mixinStandardHelpOptions = true,
        version = "doc-rag 0.1.0",
        description = "Ingest text and markdown documents and retrieve token-budgeted context for them.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);
    private static final long POLL_INTERVAL_MS = 100;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "application.yml")
    Path configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "retrieve")
    Mode mode;

    @Option(names = "--file", description = "Document to ingest (.txt, .md, .markdown)")
    Path file;

    @Option(names = "--name", description = "Display name stored with the ingested document")
    String displayName;

    @Option(names = "--query", description = "Query text used in retrieve and context modes")
    String query;

    @Option(names = "--top-k", description = "Top results to return (0 uses the configured default)", defaultValue = "0")
    int topK;

    @Option(names = "--content-class", description = "Query content class: code or text (default: untagged)")
    String contentClass;

    @Option(names = "--rerank", description = "Rerank candidates with the configured cross-encoder")
    Boolean rerank;

    @Option(names = "--document-id", description = "Document id for delete mode")
    Long documentId;

    enum Mode {
        ingest,
        retrieve,
        context,
        documents,
        delete
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        ContentClass queryClass;
        try {
            queryClass = ContentClass.parse(contentClass);
        } catch (IllegalArgumentException e) {
            log.error("Invalid --content-class: {}", e.getMessage());
            return 2;
        }

        AppConfig config = new AppConfigLoader().load(configPath);
        log.info("Starting doc-rag in {} mode", mode);
        log.info("Using config file: {}", configPath);

        VectorStore store = new SqliteVectorStore(Path.of(config.getStore().getDatabasePath()));
        TokenEstimator tokenEstimator = new TokenEstimator(config.getChunking().getWordsPerToken());

        return switch (mode) {
            case ingest -> runIngest(config, store, tokenEstimator);
            case retrieve -> runRetrieve(config, store, tokenEstimator, queryClass);
            case context -> runContext(config, store, tokenEstimator, queryClass);
            case documents -> runDocuments(store);
            case delete -> runDelete(store);
        };
    }

    private int runIngest(AppConfig config, VectorStore store, TokenEstimator tokenEstimator) throws InterruptedException {
        if (file == null) {
            log.error("--file is required in ingest mode");
            return 2;
        }
        AppConfig.IngestionConfig ingestion = config.getIngestion();
        Chunker chunker = new Chunker(
                config.getChunking().getMaxTokensPerChunk(),
                config.getChunking().getOverlapTokens(),
                tokenEstimator);
        IngestionService service = new IngestionService(
                chunker,
                EmbeddingProviders.fromConfig(config.getEmbedding(), tokenEstimator),
                store,
                config.getEmbedding().getModel(),
                ingestion.getMaxFileSizeBytes(),
                ingestion.getMaxCreateAttempts());
        IngestionProgressTracker tracker = new IngestionProgressTracker(Duration.ofMillis(ingestion.getProgressRetentionMs()));

        try (IngestionCoordinator coordinator = new IngestionCoordinator(service, tracker, ingestion.getWorkerThreads())) {
            String requestId = coordinator.submit(file, displayName);
            int lastReported = -1;
            while (true) {
                Optional<IngestionProgress> progress = coordinator.progress(requestId);
                if (progress.isEmpty()) {
                    log.error("Progress for ingestion {} is no longer available", requestId);
                    return 1;
                }
                IngestionProgress current = progress.get();
                if (current.percentage() != lastReported && current.total() > 0) {
                    lastReported = current.percentage();
                    log.info("Ingestion {}: {}/{} chunks ({}%)", requestId, current.current(), current.total(), lastReported);
                }
                if (current.status().isTerminal()) {
                    if (current.status() == IngestionStatus.COMPLETED) {
                        System.out.printf("Ingested %s as document %d%n", file.getFileName(), current.documentId());
                        return 0;
                    }
                    System.out.printf("Ingestion of %s failed: %s%n", file.getFileName(), current.error());
                    return 1;
                }
                Thread.sleep(POLL_INTERVAL_MS);
            }
        }
    }

    private int runRetrieve(AppConfig config, VectorStore store, TokenEstimator tokenEstimator, ContentClass queryClass) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in retrieve mode");
            return 2;
        }
        EmbeddingProvider embeddingProvider = EmbeddingProviders.fromConfig(config.getEmbedding(), tokenEstimator);
        float[] queryEmbedding;
        try {
            queryEmbedding = embeddingProvider.embed(config.getEmbedding().getModel(), query);
        } catch (EmbeddingProviderException e) {
            log.error("Failed to embed query ({}): {}", e.reason(), e.getMessage());
            return 1;
        }
        List<ScoredChunk> results = searchService(config, store).search(new SearchRequest(
                queryEmbedding, query, queryClass, topK, useReranking(config)));
        if (results.isEmpty()) {
            System.out.println("No matching chunks.");
        }
        for (int i = 0; i < results.size(); i++) {
            ScoredChunk result = results.get(i);
            System.out.printf("#%d %s score=%.4f%n%s%n%n",
                    i + 1,
                    ContextAssembler.referenceToken(result.chunk()),
                    result.score(),
                    result.chunk().chunkText());
        }
        return 0;
    }

    private int runContext(AppConfig config, VectorStore store, TokenEstimator tokenEstimator, ContentClass queryClass) {
        if (query == null || query.isBlank()) {
            log.error("--query is required in context mode");
            return 2;
        }
        RetrievalSettings settings = RetrievalSettings.from(config.getRetrieval());
        ContextRetrievalService service = new ContextRetrievalService(
                EmbeddingProviders.fromConfig(config.getEmbedding(), tokenEstimator),
                config.getEmbedding().getModel(),
                searchService(config, store),
                new ContextAssembler(settings.contextTokenBudget()),
                settings);
        AssembledContext context = service.retrieveContext(query, queryClass, topK, useReranking(config));
        if (context.isEmpty()) {
            System.out.println("No context found.");
            return 0;
        }
        System.out.println(context.text());
        System.out.printf("%nCited chunks: %s (%d tokens)%n", context.citedChunkIds(), context.totalTokens());
        return 0;
    }

    private int runDocuments(VectorStore store) {
        List<StoredDocument> documents = store.getAllDocuments();
        if (documents.isEmpty()) {
            System.out.println("No documents indexed.");
        }
        for (StoredDocument document : documents) {
            System.out.printf("%d\t%s\t%d chunks\t%d bytes\t%s%n",
                    document.id(),
                    document.displayName(),
                    document.totalChunks(),
                    document.fileSizeBytes(),
                    document.embeddingModel());
        }
        return 0;
    }

    private int runDelete(VectorStore store) {
        if (documentId == null) {
            log.error("--document-id is required in delete mode");
            return 2;
        }
        if (store.findById(documentId).isEmpty()) {
            System.out.printf("Document %d not found%n", documentId);
            return 1;
        }
        store.deleteDocument(documentId);
        System.out.printf("Deleted document %d%n", documentId);
        return 0;
    }

    private VectorSearchService searchService(AppConfig config, VectorStore store) {
        RetrievalSettings settings = RetrievalSettings.from(config.getRetrieval());
        AppConfig.RerankerConfig rerankerConfig = config.getReranker();
        RerankerAdapter reranker = null;
        if (useReranking(config)) {
            OkHttpClient httpClient = new OkHttpClient.Builder()
                    .connectTimeout(Duration.ofMillis(rerankerConfig.getConnectTimeoutMs()))
                    .readTimeout(Duration.ofMillis(rerankerConfig.getReadTimeoutMs()))
                    .build();
            reranker = new RerankerAdapter(
                    new CrossEncoderRerankProvider(httpClient, rerankerConfig.getBaseUrl(), rerankerConfig.getModel(),
                            rerankerConfig.getApiKey()),
                    rerankerConfig.getThreshold());
        }
        return new VectorSearchService(store, settings, reranker);
    }

    private boolean useReranking(AppConfig config) {
        return rerank != null ? rerank : config.getReranker().isEnabled();
    }
}
