package io.strata.core.archive;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

public final class SqliteArchiveStore implements ArchiveStore {
    private final String jdbcUrl;

    public SqliteArchiveStore(Path dbPath) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        init();
    }

    @Override
    public synchronized void append(ArchiveChunk chunk) throws IOException {
        String sql = """
            INSERT INTO archive_chunks (
                chunk_id, owner_id, sequence, item_id, encoding, delta_payload, payload_digest,
                redacted_digest, salt, importance, created_at, previous_hash, content_hash, redacted
            )
            VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?, ?)
            ON CONFLICT(chunk_id) DO NOTHING
            """;
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                statement.setString(1, chunk.chunkId());
                statement.setString(2, chunk.ownerId());
                statement.setLong(3, chunk.sequence());
                statement.setString(4, chunk.itemId());
                statement.setString(5, chunk.encoding().name());
                statement.setString(6, chunk.deltaPayload());
                statement.setString(7, chunk.payloadDigest());
                statement.setString(8, chunk.redactedDigest());
                statement.setString(9, chunk.salt());
                statement.setDouble(10, chunk.importance());
                statement.setString(11, chunk.timestamp().toString());
                statement.setString(12, chunk.previousHash());
                statement.setString(13, chunk.contentHash());
                statement.setInt(14, chunk.redacted() ? 1 : 0);
                statement.executeUpdate();
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to append archive chunk " + chunk.chunkId(), e);
        }
    }

    @Override
    public synchronized List<ArchiveChunk> list(String ownerId) throws IOException {
        String sql = """
            SELECT chunk_id, owner_id, sequence, item_id, encoding, delta_payload, payload_digest,
                   redacted_digest, salt, importance, created_at, previous_hash, content_hash, redacted
            FROM archive_chunks
            WHERE owner_id = ?
            ORDER BY sequence ASC
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, ownerId);
            try (ResultSet resultSet = statement.executeQuery()) {
                List<ArchiveChunk> chunks = new ArrayList<>();
                while (resultSet.next()) {
                    chunks.add(new ArchiveChunk(
                        resultSet.getString("chunk_id"),
                        resultSet.getString("owner_id"),
                        resultSet.getLong("sequence"),
                        resultSet.getString("item_id"),
                        ChunkEncoding.valueOf(resultSet.getString("encoding")),
                        resultSet.getString("delta_payload"),
                        resultSet.getString("payload_digest"),
                        resultSet.getString("redacted_digest"),
                        resultSet.getString("salt"),
                        resultSet.getDouble("importance"),
                        Instant.parse(resultSet.getString("created_at")),
                        resultSet.getString("previous_hash"),
                        resultSet.getString("content_hash"),
                        resultSet.getInt("redacted") == 1
                    ));
                }
                return chunks;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to list archive chunks for owner " + ownerId, e);
        }
    }

    @Override
    public synchronized void rewriteBodies(String ownerId, List<ArchiveChunk> chunks) throws IOException {
        String sql = """
            UPDATE archive_chunks
            SET encoding = ?, delta_payload = ?, redacted = ?
            WHERE owner_id = ? AND chunk_id = ?
            """;
        try (Connection connection = openConnection()) {
            connection.setAutoCommit(false);
            try (PreparedStatement statement = connection.prepareStatement(sql)) {
                for (ArchiveChunk chunk : chunks) {
                    statement.setString(1, chunk.encoding().name());
                    statement.setString(2, chunk.deltaPayload());
                    statement.setInt(3, chunk.redacted() ? 1 : 0);
                    statement.setString(4, ownerId);
                    statement.setString(5, chunk.chunkId());
                    if (statement.executeUpdate() != 1) {
                        throw new SQLException("Unknown chunk " + chunk.chunkId());
                    }
                }
                connection.commit();
            } catch (SQLException e) {
                connection.rollback();
                throw e;
            }
        } catch (SQLException e) {
            throw new IOException("Failed to rewrite archive chunks for owner " + ownerId, e);
        }
    }

    @Override
    public synchronized List<String> owners() throws IOException {
        String sql = "SELECT DISTINCT owner_id FROM archive_chunks ORDER BY owner_id";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql);
             ResultSet resultSet = statement.executeQuery()) {
            List<String> owners = new ArrayList<>();
            while (resultSet.next()) {
                owners.add(resultSet.getString(1));
            }
            return owners;
        } catch (SQLException e) {
            throw new IOException("Failed to list archive owners", e);
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=FULL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS archive_chunks (
                chunk_id TEXT PRIMARY KEY,
                owner_id TEXT NOT NULL,
                sequence INTEGER NOT NULL,
                item_id TEXT,
                encoding TEXT NOT NULL,
                delta_payload TEXT NOT NULL,
                payload_digest TEXT NOT NULL,
                redacted_digest TEXT NOT NULL,
                salt TEXT NOT NULL,
                importance REAL NOT NULL,
                created_at TEXT NOT NULL,
                previous_hash TEXT,
                content_hash TEXT NOT NULL,
                redacted INTEGER NOT NULL DEFAULT 0,
                UNIQUE (owner_id, sequence)
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_archive_chunks_item
            ON archive_chunks(owner_id, item_id)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite archive store", e);
        }
    }
}
