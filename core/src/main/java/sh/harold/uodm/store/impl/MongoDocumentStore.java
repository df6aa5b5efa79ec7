package sh.harold.uodm.store.impl;

import com.mongodb.ErrorCategory;
import com.mongodb.MongoException;
import com.mongodb.MongoWriteException;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;
import com.mongodb.client.MongoCollection;
import com.mongodb.client.MongoDatabase;
import com.mongodb.client.model.Filters;
import com.mongodb.client.model.IndexOptions;
import com.mongodb.client.model.Indexes;
import com.mongodb.client.model.Updates;
import com.mongodb.client.result.UpdateResult;
import org.bson.Document;
import org.bson.conversions.Bson;
import sh.harold.uodm.store.ConnectionException;
import sh.harold.uodm.store.DocumentKey;
import sh.harold.uodm.store.DocumentNotFoundException;
import sh.harold.uodm.store.DocumentSnapshot;
import sh.harold.uodm.store.DocumentStore;
import sh.harold.uodm.store.DuplicateNameException;
import sh.harold.uodm.store.FieldValues;
import sh.harold.uodm.store.StoreException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * MongoDB store. Documents keep their fields at the top level next to {@code _name_}, which
 * carries a unique index; the driver-assigned {@code _id} is never read.
 */
public final class MongoDocumentStore implements DocumentStore {

    static final String NAME_FIELD = "_name_";
    private static final String ID_FIELD = "_id";

    private final MongoClient client;
    private final MongoDatabase database;
    private final Logger logger;
    private final Set<String> indexedCollections = ConcurrentHashMap.newKeySet();

    public MongoDocumentStore(String connectionString, String databaseName, Logger logger) {
        this(connect(connectionString), databaseName, logger);
    }

    private MongoDocumentStore(MongoClient client, String databaseName, Logger logger) {
        this(client, client.getDatabase(Objects.requireNonNull(databaseName, "databaseName")), logger);
        try {
            database.runCommand(new Document("ping", 1));
        } catch (MongoException exception) {
            client.close();
            throw new ConnectionException("MongoDB database " + databaseName + " is unreachable", exception);
        }
    }

    MongoDocumentStore(MongoClient client, MongoDatabase database, Logger logger) {
        this.client = client;
        this.database = Objects.requireNonNull(database, "database");
        this.logger = logger != null ? logger : Logger.getLogger(MongoDocumentStore.class.getName());
    }

    private static MongoClient connect(String connectionString) {
        Objects.requireNonNull(connectionString, "connectionString");
        try {
            return MongoClients.create(connectionString);
        } catch (IllegalArgumentException | MongoException exception) {
            throw new ConnectionException("Invalid MongoDB connection string", exception);
        }
    }

    @Override
    public Optional<DocumentSnapshot> load(DocumentKey key) {
        Objects.requireNonNull(key, "key");
        try {
            List<Document> matches = collection(key.collection())
                .find(byName(key))
                .limit(2)
                .into(new ArrayList<>());
            if (matches.isEmpty()) {
                return Optional.empty();
            }
            if (matches.size() > 1) {
                throw new StoreException("More than one document named " + key + ", possible store corruption");
            }
            return Optional.of(new DocumentSnapshot(key, fieldsOf(matches.get(0))));
        } catch (MongoException exception) {
            logger.log(Level.WARNING, "[uodm] load failed for " + key, exception);
            throw new StoreException("Failed to load document " + key, exception);
        }
    }

    @Override
    public void insert(DocumentKey key, Map<String, Object> fields) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(fields, "fields");
        Document document = new Document(NAME_FIELD, key.name());
        document.putAll(FieldValues.deepCopy(fields));
        try {
            collection(key.collection()).insertOne(document);
        } catch (MongoWriteException exception) {
            if (exception.getError().getCategory() == ErrorCategory.DUPLICATE_KEY) {
                throw new DuplicateNameException(key, exception);
            }
            logger.log(Level.WARNING, "[uodm] insert failed for " + key, exception);
            throw new StoreException("Failed to insert document " + key, exception);
        } catch (MongoException exception) {
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
        List<Bson> sets = new ArrayList<>();
        values.forEach((field, value) -> sets.add(Updates.set(field, FieldValues.deepCopyValue(value))));
        try {
            UpdateResult result = collection(key.collection()).updateOne(byName(key), Updates.combine(sets));
            if (result.getMatchedCount() == 0) {
                throw new DocumentNotFoundException(key);
            }
        } catch (MongoException exception) {
            logger.log(Level.WARNING, "[uodm] update failed for " + key, exception);
            throw new StoreException("Failed to update document " + key, exception);
        }
    }

    @Override
    public boolean delete(DocumentKey key) {
        Objects.requireNonNull(key, "key");
        try {
            return collection(key.collection()).deleteOne(byName(key)).getDeletedCount() > 0;
        } catch (MongoException exception) {
            logger.log(Level.WARNING, "[uodm] delete failed for " + key, exception);
            throw new StoreException("Failed to delete document " + key, exception);
        }
    }

    @Override
    public List<DocumentSnapshot> find(String collection, Map<String, Object> criteria) {
        Objects.requireNonNull(collection, "collection");
        Bson filter = Filters.empty();
        if (criteria != null && !criteria.isEmpty()) {
            List<Bson> filters = new ArrayList<>();
            criteria.forEach((field, value) -> filters.add(Filters.eq(field, value)));
            filter = Filters.and(filters);
        }
        try {
            List<DocumentSnapshot> snapshots = new ArrayList<>();
            for (Document document : collection(collection).find(filter).into(new ArrayList<>())) {
                String name = document.getString(NAME_FIELD);
                if (name == null) {
                    continue;
                }
                snapshots.add(new DocumentSnapshot(DocumentKey.of(collection, name), fieldsOf(document)));
            }
            return List.copyOf(snapshots);
        } catch (MongoException exception) {
            logger.log(Level.WARNING, "[uodm] find failed for collection " + collection, exception);
            throw new StoreException("Failed to query collection " + collection, exception);
        }
    }

    @Override
    public long count(String collection) {
        Objects.requireNonNull(collection, "collection");
        try {
            return collection(collection).countDocuments();
        } catch (MongoException exception) {
            logger.log(Level.WARNING, "[uodm] count failed for collection " + collection, exception);
            throw new StoreException("Failed to count collection " + collection, exception);
        }
    }

    @Override
    public void close() {
        if (client != null) {
            client.close();
        }
    }

    private MongoCollection<Document> collection(String name) {
        MongoCollection<Document> collection = database.getCollection(name);
        if (indexedCollections.add(name)) {
            try {
                collection.createIndex(Indexes.ascending(NAME_FIELD), new IndexOptions().unique(true));
            } catch (MongoException exception) {
                indexedCollections.remove(name);
                throw new StoreException("Failed to create unique name index on " + name, exception);
            }
        }
        return collection;
    }

    private Bson byName(DocumentKey key) {
        return Filters.eq(NAME_FIELD, key.name());
    }

    private Map<String, Object> fieldsOf(Document document) {
        Map<String, Object> fields = new LinkedHashMap<>();
        document.forEach((field, value) -> {
            if (!field.equals(ID_FIELD) && !field.equals(NAME_FIELD)) {
                fields.put(field, FieldValues.deepCopyValue(value));
            }
        });
        return fields;
    }
}
