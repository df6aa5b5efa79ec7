package sh.harold.uodm;

import sh.harold.uodm.config.OdmConfig;
import sh.harold.uodm.schema.Attribute;
import sh.harold.uodm.schema.Schema;
import sh.harold.uodm.store.DocumentKey;
import sh.harold.uodm.store.DocumentNotFoundException;
import sh.harold.uodm.store.DocumentSnapshot;
import sh.harold.uodm.store.DuplicateNameException;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;
import java.util.logging.Logger;

/**
 * Registry of live {@link MappedDocument}s for one {@link StoreConnection}. Every lookup of the
 * same collection and name returns the same instance until it is released.
 */
public final class Odm implements AutoCloseable {

    private final StoreConnection connection;
    private final Supplier<String> nameGenerator;
    private final Logger logger;
    private final Map<DocumentKey, MappedDocument> live = new ConcurrentHashMap<>();
    private final Map<String, Schema> schemas = new ConcurrentHashMap<>();

    public Odm(StoreConnection connection) {
        this(connection, () -> UUID.randomUUID().toString(), null);
    }

    public Odm(StoreConnection connection, Supplier<String> nameGenerator, Logger logger) {
        this.connection = Objects.requireNonNull(connection, "connection");
        this.nameGenerator = Objects.requireNonNull(nameGenerator, "nameGenerator");
        this.logger = logger != null ? logger : Logger.getLogger(Odm.class.getName());
    }

    public static Odm open(OdmConfig config) {
        return new Odm(StoreConnection.open(config));
    }

    public Odm register(Schema... schemas) {
        for (Schema schema : schemas) {
            registerSchema(schema);
        }
        return this;
    }

    public Optional<Schema> schema(String collection) {
        return Optional.ofNullable(schemas.get(collection));
    }

    /**
     * @throws DocumentNotFoundException if no such document is stored
     */
    public MappedDocument find(Schema schema, String name) {
        return getOrCreate(schema, name, null);
    }

    /**
     * Live instance, else the stored document, else a new one built from {@code defaultFields}.
     * A {@code null} map disables creation. Losing an insert race to another creator falls back
     * to loading the winner's document once.
     *
     * @throws DocumentNotFoundException if nothing is stored and {@code defaultFields} is null
     */
    public MappedDocument getOrCreate(Schema schema, String name, Map<String, Object> defaultFields) {
        registerSchema(schema);
        DocumentKey key = DocumentKey.of(schema.collection(), name);
        MappedDocument existing = live.get(key);
        if (existing != null) {
            return existing;
        }
        Optional<DocumentSnapshot> stored = connection.find(key.collection(), key.name());
        if (stored.isPresent()) {
            return publish(schema, stored.get(), false);
        }
        if (defaultFields == null) {
            throw new DocumentNotFoundException(key);
        }
        Map<String, Object> fields = initialFields(schema, defaultFields);
        try {
            connection.insert(key.collection(), key.name(), fields);
        } catch (DuplicateNameException exception) {
            logger.fine(() -> "[uodm] lost creation race for " + key + ", loading stored document");
            return publish(schema, connection.load(key.collection(), key.name()), false);
        }
        return publish(schema, new DocumentSnapshot(key, fields), false);
    }

    /**
     * Inserts a new document under a generated name.
     */
    public MappedDocument create(Schema schema, Map<String, Object> fields) {
        return create(schema, nameGenerator.get(), fields);
    }

    /**
     * @throws DuplicateNameException if {@code name} is taken
     */
    public MappedDocument create(Schema schema, String name, Map<String, Object> fields) {
        registerSchema(schema);
        DocumentKey key = DocumentKey.of(schema.collection(), name);
        Map<String, Object> initial = initialFields(schema, fields);
        connection.insert(key.collection(), key.name(), initial);
        return publish(schema, new DocumentSnapshot(key, initial), true);
    }

    /**
     * Documents whose attributes equal every criteria entry. Documents that are already live
     * come back as the live instance, with its cached fields.
     */
    public List<MappedDocument> findAll(Schema schema, Map<String, Object> criteria) {
        registerSchema(schema);
        Map<String, Object> stored = new LinkedHashMap<>();
        if (criteria != null) {
            criteria.forEach((field, value) -> {
                Attribute attribute = schema.attribute(field);
                stored.put(field, MappedDocument.storedValue(attribute, value));
            });
        }
        return connection.findAll(schema.collection(), stored).stream()
            .map(snapshot -> publish(schema, snapshot, false))
            .toList();
    }

    public boolean release(MappedDocument document) {
        Objects.requireNonNull(document, "document");
        if (live.remove(document.key(), document)) {
            document.detach();
            return true;
        }
        return false;
    }

    public boolean release(Schema schema, String name) {
        Objects.requireNonNull(schema, "schema");
        MappedDocument removed = live.remove(DocumentKey.of(schema.collection(), name));
        if (removed == null) {
            return false;
        }
        removed.detach();
        return true;
    }

    public void releaseAll() {
        for (DocumentKey key : List.copyOf(live.keySet())) {
            MappedDocument removed = live.remove(key);
            if (removed != null) {
                removed.detach();
            }
        }
    }

    /**
     * Deletes the stored document and releases its live instance.
     */
    public boolean delete(MappedDocument document) {
        Objects.requireNonNull(document, "document");
        if (document.odm() != this) {
            throw new IllegalArgumentException(document + " belongs to another registry");
        }
        return delete(document.schema(), document.name());
    }

    public boolean delete(Schema schema, String name) {
        registerSchema(schema);
        boolean deleted = connection.delete(schema.collection(), name);
        release(schema, name);
        return deleted;
    }

    public boolean isLive(Schema schema, String name) {
        Objects.requireNonNull(schema, "schema");
        return live.containsKey(DocumentKey.of(schema.collection(), name));
    }

    public int liveCount() {
        return live.size();
    }

    public StoreConnection connection() {
        return connection;
    }

    @Override
    public void close() {
        releaseAll();
        connection.close();
    }

    MappedDocument resolve(String field, String targetCollection, String name) {
        Schema target = schemas.get(targetCollection);
        if (target == null) {
            throw new IllegalStateException("No schema registered for collection " + targetCollection);
        }
        try {
            return find(target, name);
        } catch (DocumentNotFoundException exception) {
            throw new DanglingReferenceException(field, exception.key(), exception);
        }
    }

    private void registerSchema(Schema schema) {
        Objects.requireNonNull(schema, "schema");
        Schema existing = schemas.putIfAbsent(schema.collection(), schema);
        if (existing != null && !existing.equals(schema)) {
            throw new IllegalArgumentException("Collection " + schema.collection() + " is already mapped by " + existing);
        }
    }

    private Map<String, Object> initialFields(Schema schema, Map<String, Object> given) {
        Map<String, Object> stored = new LinkedHashMap<>();
        if (given != null) {
            given.forEach((field, value) -> {
                Attribute attribute = schema.attribute(field);
                stored.put(field, MappedDocument.storedValue(attribute, value));
            });
        }
        return schema.initialFields(stored);
    }

    private MappedDocument publish(Schema schema, DocumentSnapshot snapshot, boolean replace) {
        MappedDocument created = new MappedDocument(this, schema, snapshot);
        if (replace) {
            MappedDocument previous = live.put(snapshot.key(), created);
            if (previous != null) {
                previous.detach();
            }
            return created;
        }
        MappedDocument existing = live.putIfAbsent(snapshot.key(), created);
        return existing != null ? existing : created;
    }
}
