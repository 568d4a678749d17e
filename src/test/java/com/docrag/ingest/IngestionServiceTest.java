package com.docrag.ingest;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.docrag.embedding.EmbeddingProvider;
import com.docrag.embedding.EmbeddingProviderException;
import com.docrag.embedding.HashingEmbeddingProvider;
import com.docrag.store.DuplicateDocumentException;
import com.docrag.store.NewDocument;
import com.docrag.store.SqliteVectorStore;
import com.docrag.store.StoredChunk;
import com.docrag.store.StoredDocument;
import com.docrag.store.VectorStore;
import com.docrag.store.VectorStoreException;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestionServiceTest {
    private static final String MODEL = "test-embed";
    // 8 tokens -> 6 words per chunk, so each six-word line becomes its own chunk
    private static final String FOUR_CHUNKS = """
            one two three four five six
            seven eight nine ten eleven twelve
            thirteen fourteen fifteen sixteen seventeen eighteen
            nineteen twenty twentyone twentytwo twentythree twentyfour
            """;

    @TempDir
    Path tempDir;

    private SqliteVectorStore store;

    @BeforeEach
    void setUp() {
        store = new SqliteVectorStore(tempDir.resolve("db").resolve("embeddings.db"));
    }

    @Test
    void shouldStoreEveryChunkAndReportProgress() throws Exception {
        Path file = write("notes.txt", FOUR_CHUNKS);
        List<String> progress = new ArrayList<>();

        long id = service(new HashingEmbeddingProvider(32), store).ingest(file,
                (current, total) -> progress.add(current + "/" + total));

        StoredDocument document = store.findById(id).orElseThrow();
        assertEquals(4, document.totalChunks());
        assertEquals(4, store.countChunks(id));
        assertEquals(MODEL, document.embeddingModel());
        assertEquals("notes.txt", document.displayName());
        assertEquals(FileFingerprint.sha256(Files.readAllBytes(file)), document.fileHash());
        assertEquals(List.of("1/4", "2/4", "3/4", "4/4"), progress);

        List<StoredChunk> chunks = store.getChunksByDocument(id);
        assertEquals("one two three four five six", chunks.get(0).chunkText());
        assertEquals(8, chunks.get(0).tokenCount());
        assertEquals(32, chunks.get(0).embedding().length);
    }

    @Test
    void shouldReplaceDocumentWithIdenticalContent() throws Exception {
        Path first = write("first.txt", FOUR_CHUNKS);
        Path second = write("copy.txt", FOUR_CHUNKS);
        IngestionService service = service(new HashingEmbeddingProvider(32), store);

        long firstId = service.ingest(first, IngestionProgressListener.NONE);
        long secondId = service.ingest(second, IngestionProgressListener.NONE);

        assertNotEquals(firstId, secondId);
        assertTrue(store.findById(firstId).isEmpty());
        assertEquals(0, store.countChunks(firstId));
        assertEquals(1, store.getAllDocuments().size());
        assertEquals(4, store.countChunks(secondId));
        assertEquals(4, store.getAllChunks().size());
    }

    @Test
    void shouldRollBackWhenEmbeddingFailsOnAnyChunk() throws Exception {
        Path file = write("notes.txt", FOUR_CHUNKS);
        for (int failAt = 1; failAt <= 4; failAt++) {
            IngestionService service = service(new FailingOnCallProvider(failAt), store);

            IngestionException error = assertThrows(IngestionException.class,
                    () -> service.ingest(file, IngestionProgressListener.NONE));

            assertEquals(IngestionException.Kind.EMBEDDING_PROVIDER, error.kind());
            assertTrue(store.getAllDocuments().isEmpty(), "document left behind after failure at chunk " + failAt);
            assertTrue(store.getAllChunks().isEmpty(), "chunks left behind after failure at chunk " + failAt);
        }
    }

    @Test
    void shouldRollBackWhenEmbeddingDimensionChanges() throws Exception {
        Path file = write("notes.txt", FOUR_CHUNKS);
        AtomicInteger calls = new AtomicInteger();
        EmbeddingProvider shifting = (model, text) -> new float[calls.incrementAndGet() == 3 ? 16 : 8];

        IngestionException error = assertThrows(IngestionException.class,
                () -> service(shifting, store).ingest(file, IngestionProgressListener.NONE));

        assertEquals(IngestionException.Kind.EMBEDDING_PROVIDER, error.kind());
        assertTrue(error.getMessage().contains("dimension"));
        assertTrue(store.getAllDocuments().isEmpty());
    }

    @Test
    void shouldRollBackWhenChunkCannotBeStored() throws Exception {
        Path file = write("notes.txt", FOUR_CHUNKS);
        VectorStore failingSave = new ForwardingVectorStore(store) {
            @Override
            public void saveChunk(long documentId, int chunkIndex, String chunkText, float[] embedding, int tokenCount) {
                if (chunkIndex == 2) {
                    throw new VectorStoreException("disk full");
                }
                super.saveChunk(documentId, chunkIndex, chunkText, embedding, tokenCount);
            }
        };

        IngestionException error = assertThrows(IngestionException.class,
                () -> service(new HashingEmbeddingProvider(8), failingSave).ingest(file, IngestionProgressListener.NONE));

        assertEquals(IngestionException.Kind.STORAGE, error.kind());
        assertTrue(store.getAllDocuments().isEmpty());
        assertTrue(store.getAllChunks().isEmpty());
    }

    @Test
    void shouldRejectInvalidFilesBeforeStoringAnything() throws Exception {
        IngestionService service = new IngestionService(new Chunker(8, 0, new TokenEstimator()),
                new HashingEmbeddingProvider(8), store, MODEL, 64, 3);
        Files.createDirectories(tempDir.resolve("folder.txt"));

        assertKind(IngestionException.Kind.FILE_NOT_FOUND, service, tempDir.resolve("missing.txt"));
        assertKind(IngestionException.Kind.UNREADABLE, service, tempDir.resolve("folder.txt"));
        assertKind(IngestionException.Kind.EMPTY_FILE, service, write("empty.txt", ""));
        assertKind(IngestionException.Kind.EMPTY_FILE, service, write("blank.md", "  \n\n\t\n"));
        assertKind(IngestionException.Kind.FILE_TOO_LARGE, service, write("big.txt", "word ".repeat(20)));
        assertKind(IngestionException.Kind.UNREADABLE, service,
                Files.write(tempDir.resolve("latin1.txt"), new byte[] { 'c', 'a', 'f', (byte) 0xE9 }));

        IngestionException unsupported = assertThrows(IngestionException.class,
                () -> service.ingest(write("report.pdf", "content"), IngestionProgressListener.NONE));
        assertInstanceOf(UnsupportedFileTypeException.class, unsupported);
        assertEquals(IngestionException.Kind.UNSUPPORTED_FILE_TYPE, unsupported.kind());

        assertTrue(store.getAllDocuments().isEmpty());
    }

    @Test
    void shouldStripByteOrderMark() throws Exception {
        byte[] bom = { (byte) 0xEF, (byte) 0xBB, (byte) 0xBF };
        byte[] text = "hello world".getBytes(StandardCharsets.UTF_8);
        byte[] content = new byte[bom.length + text.length];
        System.arraycopy(bom, 0, content, 0, bom.length);
        System.arraycopy(text, 0, content, bom.length, text.length);
        Path file = Files.write(tempDir.resolve("bom.txt"), content);

        long id = service(new HashingEmbeddingProvider(8), store).ingest(file, IngestionProgressListener.NONE);

        assertEquals("hello world", store.getChunksByDocument(id).get(0).chunkText());
    }

    @Test
    void shouldUseDisplayNameAsCitationSource() throws Exception {
        Path file = write("upload-1234.md", "# Guide\n\nInstall the package first.\n");

        long id = service(new HashingEmbeddingProvider(8), store).ingest(file, "Install Guide.md", IngestionProgressListener.NONE);

        assertEquals("Install Guide.md", store.findById(id).orElseThrow().displayName());
        assertEquals("upload-1234.md", store.findById(id).orElseThrow().fileName());
        assertEquals("Install Guide.md", store.getChunksByDocument(id).get(0).sourceName());
    }

    @Test
    void shouldReplaceDocumentCreatedByConcurrentIngestion() throws Exception {
        Path file = write("notes.txt", FOUR_CHUNKS);
        VectorStore racing = new ForwardingVectorStore(store) {
            private boolean raced;

            @Override
            public long createDocument(NewDocument document) {
                if (!raced) {
                    raced = true;
                    delegate.createDocument(new NewDocument("other.txt", "/elsewhere/other.txt", null,
                            document.fileHash(), 1, 4, MODEL));
                }
                return super.createDocument(document);
            }
        };

        long id = service(new HashingEmbeddingProvider(8), racing).ingest(file, IngestionProgressListener.NONE);

        List<StoredDocument> documents = store.getAllDocuments();
        assertEquals(1, documents.size());
        assertEquals(id, documents.get(0).id());
        assertEquals("notes.txt", documents.get(0).fileName());
        assertEquals(4, store.countChunks(id));
    }

    @Test
    void shouldGiveUpAfterRepeatedHashConflicts() throws Exception {
        Path file = write("notes.txt", FOUR_CHUNKS);
        AtomicInteger attempts = new AtomicInteger();
        VectorStore alwaysConflicting = new ForwardingVectorStore(store) {
            @Override
            public long createDocument(NewDocument document) {
                attempts.incrementAndGet();
                throw new DuplicateDocumentException(document.fileHash(), null);
            }
        };

        IngestionException error = assertThrows(IngestionException.class,
                () -> service(new HashingEmbeddingProvider(8), alwaysConflicting).ingest(file, IngestionProgressListener.NONE));

        assertEquals(IngestionException.Kind.STORAGE, error.kind());
        assertEquals(3, attempts.get());
    }

    private IngestionService service(EmbeddingProvider provider, VectorStore vectorStore) {
        return new IngestionService(new Chunker(8, 0, new TokenEstimator()), provider, vectorStore, MODEL,
                10L * 1024 * 1024, 3);
    }

    private Path write(String name, String content) throws Exception {
        return Files.writeString(tempDir.resolve(name), content);
    }

    private static void assertKind(IngestionException.Kind expected, IngestionService service, Path file) {
        IngestionException error = assertThrows(IngestionException.class,
                () -> service.ingest(file, IngestionProgressListener.NONE));
        assertEquals(expected, error.kind(), error.getMessage());
    }

    private static final class FailingOnCallProvider implements EmbeddingProvider {
        private final int failOnCall;
        private int calls;

        FailingOnCallProvider(int failOnCall) {
            this.failOnCall = failOnCall;
        }

        @Override
        public float[] embed(String model, String text) throws EmbeddingProviderException {
            calls++;
            if (calls == failOnCall) {
                throw new EmbeddingProviderException(EmbeddingProviderException.Reason.UNREACHABLE, "connection refused");
            }
            return new float[] { 1f, 0f, 0f };
        }
    }
}
