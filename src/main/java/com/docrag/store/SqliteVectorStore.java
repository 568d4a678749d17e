package com.docrag.store;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.flywaydb.core.Flyway;
import org.flywaydb.core.api.FlywayException;
import org.flywaydb.core.api.output.MigrateResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.sqlite.SQLiteConfig;
import org.sqlite.SQLiteDataSource;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

/**
 * SQLite-backed store. Each operation opens its own connection, so statements are atomic on their
 * own and independent ingestions do not share connection state. Embeddings are stored as a binary
 * blob (authoritative) plus a JSON copy for inspection.
 */
public class SqliteVectorStore implements VectorStore {
    private static final Logger log = LoggerFactory.getLogger(SqliteVectorStore.class);
    static final String MIGRATION_LOCATION = "classpath:db/migration";
    private static final int SQLITE_CONSTRAINT = 19;
    private static final int BUSY_TIMEOUT_MS = 5000;

    private static final String DOCUMENT_COLUMNS = "id, file_name, file_path, display_name, file_hash, "
            + "file_size_bytes, total_chunks, embedding_model, created_at, updated_at";
    private static final String CHUNK_SELECT = "SELECT c.id, c.document_id, c.chunk_index, c.chunk_text, "
            + "c.embedding_blob, c.token_count, c.created_at, d.display_name "
            + "FROM document_chunks c JOIN documents d ON d.id = c.document_id ";

    private final SQLiteDataSource dataSource;
    private final ObjectMapper mapper = new ObjectMapper();

    public SqliteVectorStore(Path databasePath) {
        Path absolute = databasePath.toAbsolutePath();
        try {
            if (absolute.getParent() != null) {
                Files.createDirectories(absolute.getParent());
            }
        } catch (IOException e) {
            throw new VectorStoreException("Cannot create database directory for " + absolute, e);
        }
        SQLiteConfig config = new SQLiteConfig();
        config.enforceForeignKeys(true);
        config.setBusyTimeout(BUSY_TIMEOUT_MS);
        config.setJournalMode(SQLiteConfig.JournalMode.WAL);
        this.dataSource = new SQLiteDataSource(config);
        this.dataSource.setUrl("jdbc:sqlite:" + absolute);
        migrate();
        log.info("Vector store ready at {}", absolute);
    }

    @Override
    public Optional<StoredDocument> findByHash(String fileHash) {
        return findDocument("SELECT " + DOCUMENT_COLUMNS + " FROM documents WHERE file_hash = ?", fileHash);
    }

    @Override
    public Optional<StoredDocument> findById(long documentId) {
        return findDocument("SELECT " + DOCUMENT_COLUMNS + " FROM documents WHERE id = ?", documentId);
    }

    @Override
    public long createDocument(NewDocument document) {
        String sql = "INSERT INTO documents (file_name, file_path, display_name, file_hash, file_size_bytes, "
                + "total_chunks, embedding_model, created_at, updated_at) VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)";
        long now = System.currentTimeMillis();
        try (Connection connection = open(); PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, document.fileName());
            statement.setString(2, document.filePath());
            statement.setString(3, document.displayName());
            statement.setString(4, document.fileHash());
            statement.setLong(5, document.fileSizeBytes());
            statement.setInt(6, document.totalChunks());
            statement.setString(7, document.embeddingModel());
            statement.setLong(8, now);
            statement.setLong(9, now);
            statement.executeUpdate();
            long id = lastInsertId(connection);
            log.info("Created document: id={}, fileName={}, chunks={}", id, document.fileName(), document.totalChunks());
            return id;
        } catch (SQLException e) {
            if (isUniqueViolation(e)) {
                throw new DuplicateDocumentException(document.fileHash(), e);
            }
            throw new VectorStoreException("Failed to create document " + document.fileName(), e);
        }
    }

    @Override
    public void deleteDocument(long documentId) {
        try (Connection connection = open()) {
            connection.setAutoCommit(false);
            try (PreparedStatement chunks = connection.prepareStatement("DELETE FROM document_chunks WHERE document_id = ?");
                    PreparedStatement documents = connection.prepareStatement("DELETE FROM documents WHERE id = ?")) {
                chunks.setLong(1, documentId);
                int removedChunks = chunks.executeUpdate();
                documents.setLong(1, documentId);
                documents.executeUpdate();
                connection.commit();
                log.info("Deleted document id={} with {} chunks", documentId, removedChunks);
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to delete document " + documentId, e);
        }
    }

    @Override
    public void saveChunk(long documentId, int chunkIndex, String chunkText, float[] embedding, int tokenCount) {
        String sql = "INSERT INTO document_chunks (document_id, chunk_index, chunk_text, embedding_json, "
                + "embedding_blob, token_count, created_at) VALUES (?, ?, ?, ?, ?, ?, ?)";
        String embeddingJson;
        try {
            embeddingJson = mapper.writeValueAsString(embedding);
        } catch (JsonProcessingException e) {
            throw new VectorStoreException("Cannot serialize embedding for chunk " + chunkIndex, e);
        }
        try (Connection connection = open(); PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, documentId);
            statement.setInt(2, chunkIndex);
            statement.setString(3, chunkText);
            statement.setString(4, embeddingJson);
            statement.setBytes(5, EmbeddingCodec.encode(embedding));
            statement.setInt(6, tokenCount);
            statement.setLong(7, System.currentTimeMillis());
            statement.executeUpdate();
            log.debug("Saved chunk documentId={} chunkIndex={} tokens={}", documentId, chunkIndex, tokenCount);
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to save chunk " + chunkIndex + " of document " + documentId, e);
        }
    }

    @Override
    public List<StoredChunk> getChunksByDocument(long documentId) {
        return queryChunks(CHUNK_SELECT + "WHERE c.document_id = ? ORDER BY c.chunk_index", documentId);
    }

    @Override
    public List<StoredChunk> getAllChunks() {
        return queryChunks(CHUNK_SELECT + "ORDER BY c.document_id, c.chunk_index");
    }

    @Override
    public List<StoredDocument> getAllDocuments() {
        String sql = "SELECT " + DOCUMENT_COLUMNS + " FROM documents ORDER BY created_at DESC, id DESC";
        try (Connection connection = open();
                PreparedStatement statement = connection.prepareStatement(sql);
                ResultSet rs = statement.executeQuery()) {
            List<StoredDocument> out = new ArrayList<>();
            while (rs.next()) {
                out.add(toDocument(rs));
            }
            return out;
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to list documents", e);
        }
    }

    @Override
    public int countChunks(long documentId) {
        try (Connection connection = open();
                PreparedStatement statement = connection.prepareStatement(
                        "SELECT COUNT(*) FROM document_chunks WHERE document_id = ?")) {
            statement.setLong(1, documentId);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getInt(1) : 0;
            }
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to count chunks of document " + documentId, e);
        }
    }

    private Optional<StoredDocument> findDocument(String sql, Object key) {
        try (Connection connection = open(); PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setObject(1, key);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? Optional.of(toDocument(rs)) : Optional.empty();
            }
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to look up document by " + key, e);
        }
    }

    private List<StoredChunk> queryChunks(String sql, Object... params) {
        try (Connection connection = open(); PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < params.length; i++) {
                statement.setObject(i + 1, params[i]);
            }
            try (ResultSet rs = statement.executeQuery()) {
                List<StoredChunk> out = new ArrayList<>();
                while (rs.next()) {
                    out.add(new StoredChunk(
                            rs.getLong(1),
                            rs.getLong(2),
                            rs.getInt(3),
                            rs.getString(4),
                            EmbeddingCodec.decode(rs.getBytes(5)),
                            rs.getInt(6),
                            rs.getLong(7),
                            rs.getString(8)));
                }
                return out;
            }
        } catch (SQLException e) {
            throw new VectorStoreException("Failed to load chunks", e);
        }
    }

    private static StoredDocument toDocument(ResultSet rs) throws SQLException {
        return new StoredDocument(
                rs.getLong("id"),
                rs.getString("file_name"),
                rs.getString("file_path"),
                rs.getString("display_name"),
                rs.getString("file_hash"),
                rs.getLong("file_size_bytes"),
                rs.getInt("total_chunks"),
                rs.getString("embedding_model"),
                rs.getLong("created_at"),
                rs.getLong("updated_at"));
    }

    private static long lastInsertId(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery("SELECT last_insert_rowid()")) {
            if (!rs.next()) {
                throw new SQLException("last_insert_rowid() returned no row");
            }
            return rs.getLong(1);
        }
    }

    private static boolean isUniqueViolation(SQLException e) {
        String message = e.getMessage() == null ? "" : e.getMessage();
        return (e.getErrorCode() & 0xFF) == SQLITE_CONSTRAINT && message.contains("UNIQUE");
    }

    private Connection open() throws SQLException {
        return dataSource.getConnection();
    }

    private void migrate() {
        try {
            MigrateResult result = Flyway.configure()
                    .dataSource(dataSource)
                    .locations(MIGRATION_LOCATION)
                    .load()
                    .migrate();
            log.info("Schema migrations applied: {} (version {})", result.migrationsExecuted,
                    result.targetSchemaVersion == null ? "unchanged" : result.targetSchemaVersion);
        } catch (FlywayException e) {
            throw new VectorStoreException("Failed to migrate schema at " + dataSource.getUrl(), e);
        }
    }
}
