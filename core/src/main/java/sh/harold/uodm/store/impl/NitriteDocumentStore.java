package sh.harold.uodm.store.impl;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.dizitart.no2.Nitrite;
import org.dizitart.no2.collection.Document;
import org.dizitart.no2.collection.NitriteCollection;
import org.dizitart.no2.common.WriteResult;
import org.dizitart.no2.exceptions.NitriteException;
import org.dizitart.no2.exceptions.UniqueConstraintException;
import org.dizitart.no2.filters.Filter;
import org.dizitart.no2.filters.FluentFilter;
import org.dizitart.no2.index.IndexOptions;
import org.dizitart.no2.index.IndexType;
import org.dizitart.no2.mvstore.MVStoreModule;
import sh.harold.uodm.store.ConnectionException;
import sh.harold.uodm.store.DocumentKey;
import sh.harold.uodm.store.DocumentNotFoundException;
import sh.harold.uodm.store.DocumentSnapshot;
import sh.harold.uodm.store.DocumentStore;
import sh.harold.uodm.store.DuplicateNameException;
import sh.harold.uodm.store.FieldValues;
import sh.harold.uodm.store.StoreException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Embedded store on Nitrite. Each document is one Nitrite record holding the name, under a
 * unique index, and the fields serialized as JSON. Without a path the database lives in memory.
 */
public final class NitriteDocumentStore implements DocumentStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final String NAME_FIELD = "name";
    private static final String DATA_FIELD = "data";

    private final Nitrite database;
    private final ObjectMapper mapper;
    private final Logger logger;
    private final Set<String> indexedCollections = new HashSet<>();
    private final Object writeLock = new Object();

    public NitriteDocumentStore(Path databasePath) {
        this(databasePath, null);
    }

    public NitriteDocumentStore(Path databasePath, Logger logger) {
        this.logger = logger != null ? logger : Logger.getLogger(NitriteDocumentStore.class.getName());
        this.mapper = new ObjectMapper();
        try {
            if (databasePath == null) {
                this.database = Nitrite.builder().openOrCreate();
            } else {
                ensureParentDirectory(databasePath);
                MVStoreModule mvStore = MVStoreModule.withConfig()
                    .filePath(databasePath.toFile())
                    .build();
                this.database = Nitrite.builder()
                    .loadModule(mvStore)
                    .openOrCreate();
            }
        } catch (NitriteException exception) {
            throw new ConnectionException("Failed to open nitrite database " + (databasePath == null ? "(memory)" : databasePath), exception);
        }
    }

    public static NitriteDocumentStore inMemory() {
        return new NitriteDocumentStore(null, null);
    }

    @Override
    public Optional<DocumentSnapshot> load(DocumentKey key) {
        Objects.requireNonNull(key, "key");
        try {
            List<Document> matches = collection(key.collection()).find(byName(key)).toList();
            if (matches.isEmpty()) {
                return Optional.empty();
            }
            if (matches.size() > 1) {
                throw new StoreException("More than one document named " + key + ", possible store corruption");
            }
            return Optional.of(new DocumentSnapshot(key, decode(matches.get(0))));
        } catch (NitriteException exception) {
            logger.log(Level.WARNING, "[uodm] load failed for " + key, exception);
            throw new StoreException("Failed to load document " + key, exception);
        }
    }

    @Override
    public void insert(DocumentKey key, Map<String, Object> fields) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(fields, "fields");
        Document document = Document.createDocument(NAME_FIELD, key.name())
            .put(DATA_FIELD, encode(key, fields));
        try {
            collection(key.collection()).insert(document);
        } catch (UniqueConstraintException exception) {
            throw new DuplicateNameException(key, exception);
        } catch (NitriteException exception) {
            logger.log(Level.WARNING, "[uodm] insert failed for " + key, exception);
            throw new StoreException("Failed to insert document " + key, exception);
        }
    }

    @Override
    public void update(DocumentKey key, Map<String, Object> values) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(values, "values");
        synchronized (writeLock) {
            try {
                NitriteCollection collection = collection(key.collection());
                Document existing = collection.find(byName(key)).firstOrNull();
                if (existing == null) {
                    throw new DocumentNotFoundException(key);
                }
                Map<String, Object> merged = FieldValues.merge(decode(existing), values);
                WriteResult result = collection.update(byName(key), Document.createDocument(DATA_FIELD, encode(key, merged)));
                if (result.getAffectedCount() == 0) {
                    throw new DocumentNotFoundException(key);
                }
            } catch (NitriteException exception) {
                logger.log(Level.WARNING, "[uodm] update failed for " + key, exception);
                throw new StoreException("Failed to update document " + key, exception);
            }
        }
    }

    @Override
    public boolean delete(DocumentKey key) {
        Objects.requireNonNull(key, "key");
        synchronized (writeLock) {
            try {
                WriteResult result = collection(key.collection()).remove(byName(key));
                return result.getAffectedCount() > 0;
            } catch (NitriteException exception) {
                logger.log(Level.WARNING, "[uodm] delete failed for " + key, exception);
                throw new StoreException("Failed to delete document " + key, exception);
            }
        }
    }

    @Override
    public List<DocumentSnapshot> find(String collection, Map<String, Object> criteria) {
        Objects.requireNonNull(collection, "collection");
        try {
            return collection(collection).find()
                .toList()
                .stream()
                .map(document -> new DocumentSnapshot(
                    DocumentKey.of(collection, document.get(NAME_FIELD, String.class)),
                    decode(document)
                ))
                .filter(snapshot -> FieldValues.matches(snapshot.fields(), criteria))
                .toList();
        } catch (NitriteException exception) {
            logger.log(Level.WARNING, "[uodm] find failed for collection " + collection, exception);
            throw new StoreException("Failed to query collection " + collection, exception);
        }
    }

    @Override
    public long count(String collection) {
        Objects.requireNonNull(collection, "collection");
        try {
            return collection(collection).size();
        } catch (NitriteException exception) {
            logger.log(Level.WARNING, "[uodm] count failed for collection " + collection, exception);
            throw new StoreException("Failed to count collection " + collection, exception);
        }
    }

    @Override
    public void close() {
        if (!database.isClosed()) {
            database.close();
        }
    }

    private NitriteCollection collection(String name) {
        NitriteCollection collection = database.getCollection(name);
        synchronized (indexedCollections) {
            if (indexedCollections.add(name) && !collection.hasIndex(NAME_FIELD)) {
                collection.createIndex(IndexOptions.indexOptions(IndexType.UNIQUE), NAME_FIELD);
            }
        }
        return collection;
    }

    private Filter byName(DocumentKey key) {
        return FluentFilter.where(NAME_FIELD).eq(key.name());
    }

    private String encode(DocumentKey key, Map<String, Object> fields) {
        try {
            return mapper.writeValueAsString(fields);
        } catch (JsonProcessingException exception) {
            throw new StoreException("Failed to encode document " + key, exception);
        }
    }

    private Map<String, Object> decode(Document document) {
        String json = document.get(DATA_FIELD, String.class);
        if (json == null) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, MAP_TYPE);
        } catch (JsonProcessingException exception) {
            throw new StoreException("Corrupt document data for " + document.get(NAME_FIELD, String.class), exception);
        }
    }

    private void ensureParentDirectory(Path path) {
        Path parent = path.getParent();
        if (parent == null) {
            return;
        }
        try {
            Files.createDirectories(parent);
        } catch (IOException exception) {
            throw new ConnectionException("Failed to create storage directory " + parent, exception);
        }
    }
}
