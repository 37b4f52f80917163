package io.palaver.core.session;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

public final class SqliteSessionBackend implements SessionBackend {
    private final String jdbcUrl;
    private final Clock clock;

    public SqliteSessionBackend(Path dbPath) throws IOException {
        this(dbPath, Clock.systemUTC());
    }

    public SqliteSessionBackend(Path dbPath, Clock clock) throws IOException {
        if (dbPath == null) {
            throw new IllegalArgumentException("dbPath must not be null");
        }
        Files.createDirectories(dbPath.toAbsolutePath().getParent());
        this.jdbcUrl = "jdbc:sqlite:" + dbPath.toAbsolutePath();
        this.clock = clock;
        init();
    }

    @Override
    public Optional<String> read(String sessionId) {
        String sql = """
            SELECT document, expires_at
            FROM sessions
            WHERE id = ?
            """;
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            try (ResultSet resultSet = statement.executeQuery()) {
                if (!resultSet.next()) {
                    return Optional.empty();
                }
                long expiresAt = resultSet.getLong("expires_at");
                boolean expires = !resultSet.wasNull();
                if (expires && expiresAt <= clock.millis()) {
                    delete(connection, sessionId);
                    return Optional.empty();
                }
                return Optional.of(resultSet.getString("document"));
            }
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to read session " + sessionId, e);
        }
    }

    @Override
    public void write(String sessionId, String document, Duration ttl) {
        String sql = """
            INSERT INTO sessions (id, document, updated_at, expires_at)
            VALUES (?, ?, ?, ?)
            ON CONFLICT(id) DO UPDATE SET
                document = excluded.document,
                updated_at = excluded.updated_at,
                expires_at = excluded.expires_at
            """;
        Instant now = clock.instant();
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, sessionId);
            statement.setString(2, document);
            statement.setString(3, now.toString());
            if (ttl == null || ttl.isZero() || ttl.isNegative()) {
                statement.setNull(4, Types.INTEGER);
            } else {
                statement.setLong(4, now.plus(ttl).toEpochMilli());
            }
            statement.executeUpdate();
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to write session " + sessionId, e);
        }
    }

    @Override
    public void remove(String sessionId) {
        try (Connection connection = openConnection()) {
            delete(connection, sessionId);
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to remove session " + sessionId, e);
        }
    }

    @Override
    public boolean exists(String sessionId) {
        return read(sessionId).isPresent();
    }

    public int purgeExpired() {
        String sql = "DELETE FROM sessions WHERE expires_at IS NOT NULL AND expires_at <= ?";
        try (Connection connection = openConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setLong(1, clock.millis());
            return statement.executeUpdate();
        } catch (SQLException e) {
            throw new SessionStoreException("Failed to purge expired sessions", e);
        }
    }

    private void delete(Connection connection, String sessionId) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("DELETE FROM sessions WHERE id = ?")) {
            statement.setString(1, sessionId);
            statement.executeUpdate();
        }
    }

    private Connection openConnection() throws SQLException {
        Connection connection = DriverManager.getConnection(jdbcUrl);
        try (Statement statement = connection.createStatement()) {
            statement.execute("PRAGMA journal_mode=WAL;");
            statement.execute("PRAGMA synchronous=NORMAL;");
        }
        return connection;
    }

    private void init() throws IOException {
        String ddl = """
            CREATE TABLE IF NOT EXISTS sessions (
                id TEXT PRIMARY KEY,
                document TEXT NOT NULL,
                updated_at TEXT NOT NULL,
                expires_at INTEGER
            )
            """;
        String idx = """
            CREATE INDEX IF NOT EXISTS idx_sessions_expires_at
            ON sessions(expires_at)
            """;
        try (Connection connection = openConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(ddl);
            statement.execute(idx);
        } catch (SQLException e) {
            throw new IOException("Failed to initialize SQLite session store", e);
        }
    }
}
