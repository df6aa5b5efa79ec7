package sh.harold.uodm.store;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Blocking access to a document backend. Documents are addressed by collection and name;
 * the backend must keep names unique per collection and apply each call to a single
 * document atomically.
 */
public interface DocumentStore extends AutoCloseable {

    /**
     * @throws StoreException if the backend holds more than one document with this name
     */
    Optional<DocumentSnapshot> load(DocumentKey key);

    /**
     * @throws DuplicateNameException if a document with this name already exists in the collection
     */
    void insert(DocumentKey key, Map<String, Object> fields);

    /**
     * Sets the given fields, leaving the others untouched.
     *
     * @throws DocumentNotFoundException if the document does not exist
     */
    void update(DocumentKey key, Map<String, Object> values);

    boolean delete(DocumentKey key);

    /**
     * Documents whose fields equal every entry of {@code criteria}. An empty map matches all.
     */
    List<DocumentSnapshot> find(String collection, Map<String, Object> criteria);

    long count(String collection);

    @Override
    void close();
}
