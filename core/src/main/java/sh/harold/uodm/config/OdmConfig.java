package sh.harold.uodm.config;

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Objects;

public record OdmConfig(
    StoreConfig store,
    @JsonAlias("slow-operation-threshold") Duration slowOperationThreshold
) {

    private static final Duration DEFAULT_SLOW_THRESHOLD = Duration.ofMillis(250);

    public OdmConfig {
        Objects.requireNonNull(store, "store");
        if (slowOperationThreshold == null || slowOperationThreshold.isNegative() || slowOperationThreshold.isZero()) {
            slowOperationThreshold = DEFAULT_SLOW_THRESHOLD;
        }
    }

    public static OdmConfig inMemory() {
        return new OdmConfig(new StoreConfig(StoreType.NITRITE, null, null, null, null), null);
    }

    public static OdmConfig load(Path path) {
        Objects.requireNonNull(path, "path");
        try (InputStream input = Files.newInputStream(path)) {
            return read(input);
        } catch (IOException exception) {
            throw new IllegalStateException("Failed to load " + path, exception);
        }
    }

    public static OdmConfig fromResource(String resource) {
        Objects.requireNonNull(resource, "resource");
        try (InputStream input = OdmConfig.class.getClassLoader().getResourceAsStream(resource)) {
            if (input == null) {
                throw new IllegalStateException("Configuration resource not found: " + resource);
            }
            return read(input);
        } catch (IOException exception) {
            throw new IllegalStateException("Failed to load " + resource, exception);
        }
    }

    public static OdmConfig read(InputStream input) throws IOException {
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
            .registerModule(new SimpleModule().addDeserializer(Duration.class, new DurationDeserializer()));
        return mapper.readValue(input, OdmConfig.class);
    }

    public record StoreConfig(
        StoreType type,
        String path,
        String uri,
        String database,
        MysqlConfig mysql
    ) {
        public StoreConfig {
            if (type == null) {
                type = StoreType.NITRITE;
            }
            switch (type) {
                case JSON -> Objects.requireNonNull(path, "path is required for json stores");
                case MONGO -> {
                    Objects.requireNonNull(uri, "uri is required for mongo stores");
                    Objects.requireNonNull(database, "database is required for mongo stores");
                }
                case MYSQL -> Objects.requireNonNull(mysql, "mysql section is required for mysql stores");
                default -> {
                }
            }
        }

        public Path resolvedPath() {
            return path == null || path.isBlank() ? null : Path.of(path);
        }
    }

    public record MysqlConfig(
        String host,
        int port,
        String database,
        String username,
        String password,
        @JsonAlias("poolSize") int maxPoolSize,
        long connectionTimeoutMillis
    ) {
        public MysqlConfig {
            Objects.requireNonNull(host, "host");
            Objects.requireNonNull(database, "database");
            Objects.requireNonNull(username, "username");
            if (port <= 0) {
                port = 3306;
            }
            if (maxPoolSize <= 0) {
                maxPoolSize = 5;
            }
            if (connectionTimeoutMillis <= 0) {
                connectionTimeoutMillis = 3000L;
            }
        }

        public String jdbcUrl() {
            return "jdbc:mysql://" + host + ":" + port + "/" + database + "?useSSL=false&serverTimezone=UTC";
        }
    }
}
