package sh.harold.uodm;

import sh.harold.uodm.config.OdmConfig;
import sh.harold.uodm.metrics.StoreMetrics;
import sh.harold.uodm.store.DocumentKey;
import sh.harold.uodm.store.DocumentNotFoundException;
import sh.harold.uodm.store.DocumentSnapshot;
import sh.harold.uodm.store.DocumentStore;
import sh.harold.uodm.store.DocumentStores;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Owns one {@link DocumentStore} and routes every read and write issued by mapped documents.
 * Calls block until the store has answered.
 */
public final class StoreConnection implements AutoCloseable {

    private static final Duration DEFAULT_SLOW_THRESHOLD = Duration.ofMillis(250);

    private final DocumentStore store;
    private final Logger logger;
    private final long slowThresholdMillis;
    private final StoreMetrics metrics = new StoreMetrics();
    private final AtomicBoolean closed = new AtomicBoolean();

    public StoreConnection(DocumentStore store, Duration slowThreshold, Logger logger) {
        this.store = Objects.requireNonNull(store, "store");
        this.logger = logger != null ? logger : Logger.getLogger(StoreConnection.class.getName());
        this.slowThresholdMillis = (slowThreshold != null ? slowThreshold : DEFAULT_SLOW_THRESHOLD).toMillis();
    }

    /**
     * @throws sh.harold.uodm.store.ConnectionException if the configured store is unreachable
     */
    public static StoreConnection open(OdmConfig config) {
        Objects.requireNonNull(config, "config");
        Logger logger = Logger.getLogger("uodm");
        DocumentStore store = DocumentStores.open(config.store(), logger);
        logger.fine(() -> "[uodm] opened " + config.store().type().name().toLowerCase(Locale.ROOT) + " store");
        return new StoreConnection(store, config.slowOperationThreshold(), logger);
    }

    public static StoreConnection using(DocumentStore store) {
        return new StoreConnection(store, DEFAULT_SLOW_THRESHOLD, null);
    }

    public DocumentSnapshot load(String collection, String name) {
        DocumentKey key = DocumentKey.of(collection, name);
        return find(collection, name).orElseThrow(() -> new DocumentNotFoundException(key));
    }

    public Optional<DocumentSnapshot> find(String collection, String name) {
        DocumentKey key = DocumentKey.of(collection, name);
        return call("load", key, () -> store.load(key));
    }

    public void insert(String collection, String name, Map<String, Object> fields) {
        DocumentKey key = DocumentKey.of(collection, name);
        Objects.requireNonNull(fields, "fields");
        call("insert", key, () -> {
            store.insert(key, fields);
            return null;
        });
    }

    public void update(String collection, String name, String field, Object value) {
        Objects.requireNonNull(field, "field");
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(field, value);
        update(collection, name, values);
    }

    public void update(String collection, String name, Map<String, Object> values) {
        DocumentKey key = DocumentKey.of(collection, name);
        Objects.requireNonNull(values, "values");
        call("update", key, () -> {
            store.update(key, values);
            return null;
        });
    }

    public boolean delete(String collection, String name) {
        DocumentKey key = DocumentKey.of(collection, name);
        return call("delete", key, () -> store.delete(key));
    }

    public List<DocumentSnapshot> findAll(String collection, Map<String, Object> criteria) {
        Objects.requireNonNull(collection, "collection");
        Map<String, Object> copy = criteria == null ? Map.of() : new LinkedHashMap<>(criteria);
        return call("find", collection, collection + "/*", () -> store.find(collection, copy));
    }

    public long count(String collection) {
        Objects.requireNonNull(collection, "collection");
        return call("count", collection, collection + "/*", () -> store.count(collection));
    }

    public StoreMetrics metrics() {
        return metrics;
    }

    public boolean isOpen() {
        return !closed.get();
    }

    @Override
    public void close() {
        if (closed.compareAndSet(false, true)) {
            store.close();
        }
    }

    private <T> T call(String operation, DocumentKey key, Supplier<T> action) {
        return call(operation, key.collection(), key.toString(), action);
    }

    private <T> T call(String operation, String collection, String target, Supplier<T> action) {
        if (closed.get()) {
            throw new IllegalStateException("Connection is closed");
        }
        long startedAt = System.nanoTime();
        boolean succeeded = false;
        try {
            T result = action.get();
            succeeded = true;
            return result;
        } finally {
            long elapsedMillis = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startedAt);
            metrics.record(operation, collection, elapsedMillis, succeeded);
            if (elapsedMillis > slowThresholdMillis && logger.isLoggable(Level.INFO)) {
                logger.info("[uodm] slow " + operation + " for " + target + " in " + elapsedMillis + "ms");
            }
        }
    }
}
