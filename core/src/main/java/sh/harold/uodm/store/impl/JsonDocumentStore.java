package sh.harold.uodm.store.impl;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import sh.harold.uodm.store.ConnectionException;
import sh.harold.uodm.store.DocumentKey;
import sh.harold.uodm.store.DocumentNotFoundException;
import sh.harold.uodm.store.DocumentSnapshot;
import sh.harold.uodm.store.DocumentStore;
import sh.harold.uodm.store.DuplicateNameException;
import sh.harold.uodm.store.FieldValues;
import sh.harold.uodm.store.StoreException;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Stream;

/**
 * One JSON file per document under {@code basePath/collection/name.json}. New documents are
 * published with a hard link, which fails if the name is already taken.
 */
public final class JsonDocumentStore implements DocumentStore {

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };
    private static final String EXTENSION = ".json";

    private final Path basePath;
    private final ObjectMapper mapper;
    private final Logger logger;
    private final Map<DocumentKey, ReadWriteLock> documentLocks = new ConcurrentHashMap<>();

    public JsonDocumentStore(Path basePath) {
        this(basePath, null);
    }

    public JsonDocumentStore(Path basePath, Logger logger) {
        this.basePath = Objects.requireNonNull(basePath, "basePath");
        this.logger = logger != null ? logger : Logger.getLogger(JsonDocumentStore.class.getName());
        this.mapper = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);
        try {
            Files.createDirectories(basePath);
        } catch (IOException exception) {
            throw new ConnectionException("Unable to create storage directory: " + basePath, exception);
        }
    }

    @Override
    public Optional<DocumentSnapshot> load(DocumentKey key) {
        Objects.requireNonNull(key, "key");
        Path documentPath = documentPath(key);
        ReadWriteLock lock = lockFor(key);
        lock.readLock().lock();
        try {
            if (!Files.exists(documentPath)) {
                return Optional.empty();
            }
            return Optional.of(new DocumentSnapshot(key, read(documentPath)));
        } catch (IOException exception) {
            logger.log(Level.WARNING, "[uodm] load failed for " + key, exception);
            throw new StoreException("Failed to read document " + key, exception);
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public void insert(DocumentKey key, Map<String, Object> fields) {
        Objects.requireNonNull(key, "key");
        Map<String, Object> copy = FieldValues.deepCopy(Objects.requireNonNull(fields, "fields"));
        ReadWriteLock lock = lockFor(key);
        lock.writeLock().lock();
        Path tempPath = null;
        try {
            Path documentPath = documentPath(key);
            Files.createDirectories(documentPath.getParent());
            tempPath = writeTemp(key, copy);
            Files.createLink(documentPath, tempPath);
        } catch (FileAlreadyExistsException exception) {
            throw new DuplicateNameException(key, exception);
        } catch (IOException exception) {
            logger.log(Level.WARNING, "[uodm] insert failed for " + key, exception);
            throw new StoreException("Failed to insert document " + key, exception);
        } finally {
            deleteQuietly(tempPath);
            lock.writeLock().unlock();
        }
    }

    @Override
    public void update(DocumentKey key, Map<String, Object> values) {
        Objects.requireNonNull(key, "key");
        Objects.requireNonNull(values, "values");
        ReadWriteLock lock = lockFor(key);
        lock.writeLock().lock();
        Path tempPath = null;
        try {
            Path documentPath = documentPath(key);
            if (!Files.exists(documentPath)) {
                throw new DocumentNotFoundException(key);
            }
            Map<String, Object> merged = FieldValues.merge(read(documentPath), values);
            tempPath = writeTemp(key, merged);
            Files.move(tempPath, documentPath, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
            tempPath = null;
        } catch (IOException exception) {
            logger.log(Level.WARNING, "[uodm] update failed for " + key, exception);
            throw new StoreException("Failed to update document " + key, exception);
        } finally {
            deleteQuietly(tempPath);
            lock.writeLock().unlock();
        }
    }

    @Override
    public boolean delete(DocumentKey key) {
        Objects.requireNonNull(key, "key");
        ReadWriteLock lock = lockFor(key);
        lock.writeLock().lock();
        try {
            return Files.deleteIfExists(documentPath(key));
        } catch (IOException exception) {
            logger.log(Level.WARNING, "[uodm] delete failed for " + key, exception);
            throw new StoreException("Failed to delete document " + key, exception);
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public List<DocumentSnapshot> find(String collection, Map<String, Object> criteria) {
        Objects.requireNonNull(collection, "collection");
        Path collectionPath = collectionPath(collection);
        if (!Files.exists(collectionPath)) {
            return List.of();
        }
        List<DocumentSnapshot> snapshots = new ArrayList<>();
        try (DirectoryStream<Path> stream = Files.newDirectoryStream(collectionPath, "*" + EXTENSION)) {
            for (Path entry : stream) {
                String fileName = entry.getFileName().toString();
                DocumentKey key = DocumentKey.of(collection, fileName.substring(0, fileName.length() - EXTENSION.length()));
                ReadWriteLock lock = lockFor(key);
                lock.readLock().lock();
                try {
                    if (!Files.exists(entry)) {
                        continue;
                    }
                    Map<String, Object> fields = read(entry);
                    if (FieldValues.matches(fields, criteria)) {
                        snapshots.add(new DocumentSnapshot(key, fields));
                    }
                } finally {
                    lock.readLock().unlock();
                }
            }
        } catch (IOException exception) {
            logger.log(Level.WARNING, "[uodm] find failed for collection " + collection, exception);
            throw new StoreException("Failed to list documents for " + collection, exception);
        }
        return List.copyOf(snapshots);
    }

    @Override
    public long count(String collection) {
        Objects.requireNonNull(collection, "collection");
        Path collectionPath = collectionPath(collection);
        if (!Files.exists(collectionPath)) {
            return 0L;
        }
        try (Stream<Path> files = Files.list(collectionPath)) {
            return files
                .filter(path -> path.getFileName().toString().endsWith(EXTENSION))
                .count();
        } catch (IOException exception) {
            logger.log(Level.WARNING, "[uodm] count failed for collection " + collection, exception);
            throw new StoreException("Failed to count documents for " + collection, exception);
        }
    }

    @Override
    public void close() {
        // files are opened per call
    }

    private Map<String, Object> read(Path documentPath) throws IOException {
        return mapper.readValue(documentPath.toFile(), MAP_TYPE);
    }

    private Path writeTemp(DocumentKey key, Map<String, Object> fields) throws IOException {
        Path tempPath = Files.createTempFile(collectionPath(key.collection()), key.name() + ".", ".tmp");
        Files.writeString(tempPath, mapper.writeValueAsString(fields), StandardCharsets.UTF_8);
        return tempPath;
    }

    private void deleteQuietly(Path path) {
        if (path == null) {
            return;
        }
        try {
            Files.deleteIfExists(path);
        } catch (IOException exception) {
            logger.log(Level.FINE, "[uodm] could not remove temporary file " + path, exception);
        }
    }

    private Path documentPath(DocumentKey key) {
        try {
            return collectionPath(key.collection()).resolve(key.name() + EXTENSION);
        } catch (InvalidPathException exception) {
            throw new StoreException("Name is not usable as a file name: " + key, exception);
        }
    }

    private Path collectionPath(String collection) {
        try {
            return basePath.resolve(collection);
        } catch (InvalidPathException exception) {
            throw new StoreException("Collection is not usable as a directory name: " + collection, exception);
        }
    }

    private ReadWriteLock lockFor(DocumentKey key) {
        return documentLocks.computeIfAbsent(key, ignored -> new ReentrantReadWriteLock());
    }
}
