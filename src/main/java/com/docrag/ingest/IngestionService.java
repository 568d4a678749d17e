package com.docrag.ingest;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.IntSummaryStatistics;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.docrag.embedding.EmbeddingProvider;
import com.docrag.embedding.EmbeddingProviderException;
import com.docrag.store.DuplicateDocumentException;
import com.docrag.store.NewDocument;
import com.docrag.store.VectorStore;
import com.docrag.store.VectorStoreException;

/**
 * Turns one file into a stored document with embedded chunks. Content already stored under the
 * same hash is replaced. Either every chunk is stored or the document is removed again.
 */
public class IngestionService {
    private static final Logger log = LoggerFactory.getLogger(IngestionService.class);

    private final Chunker chunker;
    private final EmbeddingProvider embeddingProvider;
    private final VectorStore vectorStore;
    private final String embeddingModel;
    private final long maxFileSizeBytes;
    private final int maxCreateAttempts;

    public IngestionService(Chunker chunker,
            EmbeddingProvider embeddingProvider,
            VectorStore vectorStore,
            String embeddingModel,
            long maxFileSizeBytes,
            int maxCreateAttempts) {
        this.chunker = chunker;
        this.embeddingProvider = embeddingProvider;
        this.vectorStore = vectorStore;
        this.embeddingModel = embeddingModel;
        this.maxFileSizeBytes = maxFileSizeBytes;
        this.maxCreateAttempts = Math.max(1, maxCreateAttempts);
    }

    public long ingest(Path file, IngestionProgressListener onProgress) throws IngestionException {
        return ingest(file, null, onProgress);
    }

    public long ingest(Path file, String displayName, IngestionProgressListener onProgress) throws IngestionException {
        IngestionProgressListener listener = onProgress == null ? IngestionProgressListener.NONE : onProgress;
        log.info("Starting document ingestion: {}", file);

        ChunkingStrategy strategy = validate(file);
        byte[] bytes = read(file);
        String content = decode(file, bytes);
        String fileHash = FileFingerprint.sha256(bytes);
        log.info("File loaded: {}, size={} bytes, hash={}", file.getFileName(), bytes.length, fileHash);

        removeExisting(fileHash);

        List<TextChunk> chunks = chunker.split(content, strategy);
        if (chunks.isEmpty()) {
            throw new IngestionException(IngestionException.Kind.EMPTY_FILE,
                    "File contains no indexable text: " + file.getFileName());
        }
        logChunkStatistics(strategy, chunks);

        NewDocument document = new NewDocument(
                file.getFileName().toString(),
                file.toAbsolutePath().toString(),
                displayName,
                fileHash,
                bytes.length,
                chunks.size(),
                embeddingModel);
        long documentId = createReplacing(document);

        try {
            embedAndStore(documentId, chunks, listener);
        } catch (IngestionException | RuntimeException e) {
            rollback(documentId, e);
            throw e;
        }
        log.info("Document ingested: id={}, name={}, chunks={}", documentId, document.displayName(), chunks.size());
        return documentId;
    }

    private ChunkingStrategy validate(Path file) throws IngestionException {
        if (!Files.exists(file)) {
            throw new IngestionException(IngestionException.Kind.FILE_NOT_FOUND, "File not found: " + file.toAbsolutePath());
        }
        if (!Files.isRegularFile(file) || !Files.isReadable(file)) {
            throw new IngestionException(IngestionException.Kind.UNREADABLE, "Cannot read file: " + file.toAbsolutePath());
        }
        long size;
        try {
            size = Files.size(file);
        } catch (IOException e) {
            throw new IngestionException(IngestionException.Kind.UNREADABLE, "Cannot read file size: " + file.toAbsolutePath(), e);
        }
        if (size == 0) {
            throw new IngestionException(IngestionException.Kind.EMPTY_FILE, "File is empty: " + file.getFileName());
        }
        if (size > maxFileSizeBytes) {
            throw new IngestionException(IngestionException.Kind.FILE_TOO_LARGE,
                    "File size %d bytes exceeds maximum allowed %d bytes".formatted(size, maxFileSizeBytes));
        }
        return ChunkingStrategy.forExtension(extension(file));
    }

    private static byte[] read(Path file) throws IngestionException {
        try {
            return Files.readAllBytes(file);
        } catch (IOException e) {
            throw new IngestionException(IngestionException.Kind.UNREADABLE, "Cannot read file: " + file.toAbsolutePath(), e);
        }
    }

    private static String decode(Path file, byte[] bytes) throws IngestionException {
        try {
            String content = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT)
                    .decode(ByteBuffer.wrap(bytes))
                    .toString();
            return content.startsWith("\uFEFF") ? content.substring(1) : content;
        } catch (CharacterCodingException e) {
            throw new IngestionException(IngestionException.Kind.UNREADABLE, "File is not valid UTF-8 text: " + file.getFileName(), e);
        }
    }

    private void removeExisting(String fileHash) throws IngestionException {
        try {
            vectorStore.findByHash(fileHash).ifPresent(existing -> {
                log.info("Document already exists, removing old index: {} (id={})", existing.fileName(), existing.id());
                vectorStore.deleteDocument(existing.id());
            });
        } catch (VectorStoreException e) {
            throw new IngestionException(IngestionException.Kind.STORAGE, "Failed to replace existing document: " + e.getMessage(), e);
        }
    }

    /**
     * The hash check above and this insert are separate statements, so a concurrent ingestion of
     * the same content may win the insert. The unique constraint turns that into a conflict, and
     * the loser replaces the winner's row.
     */
    private long createReplacing(NewDocument document) throws IngestionException {
        for (int attempt = 1; ; attempt++) {
            try {
                return vectorStore.createDocument(document);
            } catch (DuplicateDocumentException e) {
                if (attempt >= maxCreateAttempts) {
                    throw new IngestionException(IngestionException.Kind.STORAGE,
                            "Document with hash " + document.fileHash() + " kept reappearing after " + attempt + " attempts", e);
                }
                log.warn("Concurrent ingestion stored the same content (hash={}), replacing it (attempt {}/{})",
                        document.fileHash(), attempt, maxCreateAttempts);
                removeExisting(document.fileHash());
            } catch (VectorStoreException e) {
                throw new IngestionException(IngestionException.Kind.STORAGE, "Failed to create document: " + e.getMessage(), e);
            }
        }
    }

    private void embedAndStore(long documentId, List<TextChunk> chunks, IngestionProgressListener listener)
            throws IngestionException {
        int total = chunks.size();
        int dimension = -1;
        for (int index = 0; index < total; index++) {
            TextChunk chunk = chunks.get(index);
            log.debug("Processing chunk {}/{}: {} tokens", index + 1, total, chunk.estimatedTokens());

            float[] embedding = embed(chunk, index, total);
            if (dimension < 0) {
                dimension = embedding.length;
            } else if (embedding.length != dimension) {
                throw new IngestionException(IngestionException.Kind.EMBEDDING_PROVIDER,
                        "Embedding dimension changed from %d to %d at chunk %d".formatted(dimension, embedding.length, index));
            }

            try {
                vectorStore.saveChunk(documentId, index, chunk.text(), embedding, chunk.estimatedTokens());
            } catch (VectorStoreException e) {
                throw new IngestionException(IngestionException.Kind.STORAGE,
                        "Failed to store chunk %d of document %d: %s".formatted(index, documentId, e.getMessage()), e);
            }
            listener.onProgress(index + 1, total);
        }
    }

    private float[] embed(TextChunk chunk, int index, int total) throws IngestionException {
        float[] embedding;
        try {
            embedding = embeddingProvider.embed(embeddingModel, chunk.text());
        } catch (EmbeddingProviderException e) {
            throw new IngestionException(IngestionException.Kind.EMBEDDING_PROVIDER,
                    "Embedding failed for chunk %d/%d (%s): %s".formatted(index + 1, total, e.reason(), e.getMessage()), e);
        } catch (RuntimeException e) {
            throw new IngestionException(IngestionException.Kind.EMBEDDING_PROVIDER,
                    "Embedding failed for chunk %d/%d: %s".formatted(index + 1, total, e.getMessage()), e);
        }
        if (embedding == null || embedding.length == 0) {
            throw new IngestionException(IngestionException.Kind.EMBEDDING_PROVIDER,
                    "Embedding provider returned an empty vector for chunk " + (index + 1) + "/" + total);
        }
        return embedding;
    }

    private void rollback(long documentId, Exception failure) {
        log.error("Failed to process chunks, rolling back document {}", documentId, failure);
        try {
            vectorStore.deleteDocument(documentId);
        } catch (VectorStoreException e) {
            log.error("Failed to roll back document {}", documentId, e);
            failure.addSuppressed(e);
        }
    }

    private static void logChunkStatistics(ChunkingStrategy strategy, List<TextChunk> chunks) {
        IntSummaryStatistics stats = chunks.stream().mapToInt(TextChunk::estimatedTokens).summaryStatistics();
        log.info("Split document into {} chunks using {}", chunks.size(), strategy);
        log.info("Chunk token statistics: min={}, max={}, avg={}", stats.getMin(), stats.getMax(), (int) stats.getAverage());
    }

    private static String extension(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot < 0 ? "" : name.substring(dot + 1);
    }
}
