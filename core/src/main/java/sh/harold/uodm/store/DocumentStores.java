package sh.harold.uodm.store;

import sh.harold.uodm.config.OdmConfig;
import sh.harold.uodm.store.impl.JsonDocumentStore;
import sh.harold.uodm.store.impl.MongoDocumentStore;
import sh.harold.uodm.store.impl.MySqlDocumentStore;
import sh.harold.uodm.store.impl.NitriteDocumentStore;

import java.util.Objects;
import java.util.logging.Logger;

public final class DocumentStores {

    private DocumentStores() {
    }

    /**
     * Opens the backend described by {@code config}.
     *
     * @throws ConnectionException if the backend cannot be reached or initialized
     */
    public static DocumentStore open(OdmConfig.StoreConfig config, Logger logger) {
        Objects.requireNonNull(config, "config");
        return switch (config.type()) {
            case NITRITE -> new NitriteDocumentStore(config.resolvedPath(), logger);
            case JSON -> new JsonDocumentStore(config.resolvedPath(), logger);
            case MONGO -> new MongoDocumentStore(config.uri(), config.database(), logger);
            case MYSQL -> new MySqlDocumentStore(
                config.mysql().jdbcUrl(),
                config.mysql().username(),
                config.mysql().password(),
                config.mysql().maxPoolSize(),
                config.mysql().connectionTimeoutMillis(),
                logger
            );
        };
    }
}
