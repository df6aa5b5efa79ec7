package sh.harold.uodm.store.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.pool.HikariPool;
import sh.harold.uodm.store.ConnectionException;
import sh.harold.uodm.store.DocumentKey;
import sh.harold.uodm.store.DocumentNotFoundException;
import sh.harold.uodm.store.DocumentSnapshot;
import sh.harold.uodm.store.DocumentStore;
import sh.harold.uodm.store.DuplicateNameException;
import sh.harold.uodm.store.FieldValues;
import sh.harold.uodm.store.StoreException;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Documents as JSON rows in a single {@code documents} table keyed by {@code (collection, name)}.
 * Field updates are applied in place with {@code JSON_SET}.
 */
public final class MySqlDocumentStore implements DocumentStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final String TABLE = "documents";
    private static final int DUPLICATE_ENTRY = 1062;
    private static final int MAX_LOCK_RETRIES = 3;
    private static final long LOCK_RETRY_BASE_DELAY_MS = 10;

    private final DataSource dataSource;
    private final ObjectMapper objectMapper;
    private final Logger logger;

    public MySqlDocumentStore(String jdbcUrl, String username, String password, int maxPoolSize, long connectionTimeoutMillis, Logger logger) {
        this(createDataSource(jdbcUrl, username, password, maxPoolSize, connectionTimeoutMillis), logger);
    }

    MySqlDocumentStore(DataSource dataSource, Logger logger) {
        this.dataSource = Objects.requireNonNull(dataSource, "dataSource");
        this.logger = logger != null ? logger : Logger.getLogger(MySqlDocumentStore.class.getName());
        this.objectMapper = new ObjectMapper();
        initialize();
    }

    private static DataSource createDataSource(String jdbcUrl, String username, String password, int maxPoolSize, long connectionTimeoutMillis) {
        Objects.requireNonNull(jdbcUrl, "jdbcUrl");
        HikariConfig config = new HikariConfig();
        config.setJdbcUrl(jdbcUrl);
        config.setUsername(username);
        config.setPassword(password);
        config.setDriverClassName("com.mysql.cj.jdbc.Driver");
        config.setConnectionTimeout(Math.max(1000L, connectionTimeoutMillis));
        config.setPoolName("uodm-documents");
        config.setMaximumPoolSize(Math.max(2, maxPoolSize));
        config.setMinimumIdle(Math.min(2, maxPoolSize));
        config.setConnectionTestQuery("SELECT 1");
        try {
            return new HikariDataSource(config);
        } catch (HikariPool.PoolInitializationException exception) {
            throw new ConnectionException("Failed to connect to " + jdbcUrl, exception);
        }
    }

    private void initialize() {
        String createTable = """
            CREATE TABLE IF NOT EXISTS %s (
                collection VARCHAR(191) NOT NULL,
                name VARCHAR(191) NOT NULL,
                data JSON NOT NULL,
                PRIMARY KEY (collection, name)
            ) ENGINE=InnoDB;
            """.formatted(TABLE);
        try (Connection connection = dataSource.getConnection();
             Statement statement = connection.createStatement()) {
            statement.execute(createTable);
        } catch (SQLException exception) {
            close();
            throw new ConnectionException("Failed to initialize MySQL store: " + exception.getMessage(), exception);
        }
    }

    @Override
    public Optional<DocumentSnapshot> load(DocumentKey key) {
        Objects.requireNonNull(key, "key");
        String sql = "SELECT data FROM " + TABLE + " WHERE collection = ? AND name = ?";
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, key.collection());
            statement.setString(2, key.name());
            try (ResultSet rs = statement.executeQuery()) {
                if (!rs.next()) {
                    return Optional.empty();
                }
                return Optional.of(new DocumentSnapshot(key, parse(rs.getString(1))));
            }
        } catch (SQLException exception) {
            logger.log(Level.WARNING, "[uodm] load failed for " + key, exception);
            throw new StoreException("Failed to read document " + key, exception);
        }
    }

    @Override
    public void insert(DocumentKey key, Map<String, Object> fields) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(fields, "fields");
        String sql = "INSERT INTO " + TABLE + " (collection, name, data) VALUES (?, ?, ?)";
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, key.collection());
            statement.setString(2, key.name());
            statement.setString(3, toJson(fields));
            statement.executeUpdate();
        } catch (SQLException exception) {
            if (isDuplicateEntry(exception)) {
                throw new DuplicateNameException(key, exception);
            }
            logger.log(Level.WARNING, "[uodm] insert failed for " + key, exception);
            throw new StoreException("Failed to insert document " + key, exception);
        }
    }

    @Override
    public void update(DocumentKey key, Map<String, Object> values) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(values, "values");
        if (values.isEmpty()) {
            if (load(key).isEmpty()) {
                throw new DocumentNotFoundException(key);
            }
            return;
        }
        StringBuilder expression = new StringBuilder("JSON_SET(data");
        List<String> parameters = new ArrayList<>();
        values.forEach((field, value) -> {
            expression.append(", ?, CAST(? AS JSON)");
            parameters.add(pathParam(field));
            parameters.add(toJsonValue(value));
        });
        expression.append(")");
        String sql = "UPDATE " + TABLE + " SET data = " + expression + " WHERE collection = ? AND name = ?";
        parameters.add(key.collection());
        parameters.add(key.name());

        for (int attempt = 0; ; attempt++) {
            try (Connection connection = dataSource.getConnection();
                 PreparedStatement statement = connection.prepareStatement(sql)) {
                int index = 1;
                for (String parameter : parameters) {
                    statement.setString(index++, parameter);
                }
                if (statement.executeUpdate() == 0) {
                    throw new DocumentNotFoundException(key);
                }
                return;
            } catch (SQLException exception) {
                if (attempt < MAX_LOCK_RETRIES && isRetryableLockFailure(exception)) {
                    delayRetry(attempt);
                    continue;
                }
                logger.log(Level.WARNING, "[uodm] update failed for " + key, exception);
                throw new StoreException("Failed to update document " + key, exception);
            }
        }
    }

    @Override
    public boolean delete(DocumentKey key) {
        Objects.requireNonNull(key, "key");
        String sql = "DELETE FROM " + TABLE + " WHERE collection = ? AND name = ?";
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, key.collection());
            statement.setString(2, key.name());
            return statement.executeUpdate() > 0;
        } catch (SQLException exception) {
            logger.log(Level.WARNING, "[uodm] delete failed for " + key, exception);
            throw new StoreException("Failed to delete document " + key, exception);
        }
    }

    @Override
    public List<DocumentSnapshot> find(String collection, Map<String, Object> criteria) {
        Objects.requireNonNull(collection, "collection");
        String sql = "SELECT name, data FROM " + TABLE + " WHERE collection = ?";
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, collection);
            List<DocumentSnapshot> snapshots = new ArrayList<>();
            try (ResultSet rs = statement.executeQuery()) {
                while (rs.next()) {
                    Map<String, Object> fields = parse(rs.getString(2));
                    if (FieldValues.matches(fields, criteria)) {
                        snapshots.add(new DocumentSnapshot(DocumentKey.of(collection, rs.getString(1)), fields));
                    }
                }
            }
            return List.copyOf(snapshots);
        } catch (SQLException exception) {
            logger.log(Level.WARNING, "[uodm] find failed for collection " + collection, exception);
            throw new StoreException("Failed to list documents for " + collection, exception);
        }
    }

    @Override
    public long count(String collection) {
        Objects.requireNonNull(collection, "collection");
        String sql = "SELECT COUNT(*) FROM " + TABLE + " WHERE collection = ?";
        try (Connection connection = dataSource.getConnection();
             PreparedStatement statement = connection.prepareStatement(sql)) {
            statement.setString(1, collection);
            try (ResultSet rs = statement.executeQuery()) {
                return rs.next() ? rs.getLong(1) : 0L;
            }
        } catch (SQLException exception) {
            logger.log(Level.WARNING, "[uodm] count failed for collection " + collection, exception);
            throw new StoreException("Failed to count documents for " + collection, exception);
        }
    }

    @Override
    public void close() {
        if (dataSource instanceof HikariDataSource hikari) {
            hikari.close();
        }
    }

    private boolean isDuplicateEntry(SQLException exception) {
        return exception instanceof SQLIntegrityConstraintViolationException
            || exception.getErrorCode() == DUPLICATE_ENTRY;
    }

    private boolean isRetryableLockFailure(SQLException exception) {
        if (exception == null) {
            return false;
        }
        int errorCode = exception.getErrorCode();
        if (errorCode == 1213 || errorCode == 1205) {
            return true;
        }
        if ("40001".equals(exception.getSQLState())) {
            return true;
        }
        SQLException next = exception.getNextException();
        if (next != null && next != exception) {
            return isRetryableLockFailure(next);
        }
        return false;
    }

    private void delayRetry(int attempt) {
        long delayMillis = LOCK_RETRY_BASE_DELAY_MS * (1L << attempt);
        try {
            Thread.sleep(delayMillis);
        } catch (InterruptedException interruptedException) {
            Thread.currentThread().interrupt();
        }
    }

    private String pathParam(String field) {
        String escaped = field
            .replace("\\", "\\\\")
            .replace("\"", "\\\"");
        return "$.\"" + escaped + "\"";
    }

    private Map<String, Object> parse(String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return new LinkedHashMap<>(objectMapper.readValue(json, MAP_TYPE));
        } catch (JsonProcessingException exception) {
            throw new StoreException("Failed to parse document JSON", exception);
        }
    }

    private String toJson(Map<String, Object> fields) {
        try {
            return objectMapper.writeValueAsString(fields);
        } catch (JsonProcessingException exception) {
            throw new StoreException("Failed to serialize document", exception);
        }
    }

    private String toJsonValue(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException exception) {
            throw new StoreException("Failed to serialize value", exception);
        }
    }
}
