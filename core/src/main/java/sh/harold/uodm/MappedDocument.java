package sh.harold.uodm;

import sh.harold.uodm.schema.Attribute;
import sh.harold.uodm.schema.ImmutableAttributeException;
import sh.harold.uodm.schema.InvalidValueException;
import sh.harold.uodm.schema.Schema;
import sh.harold.uodm.store.DocumentKey;
import sh.harold.uodm.store.DocumentSnapshot;
import sh.harold.uodm.store.FieldValues;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Live handle on one stored document. Instances are handed out by {@link Odm}, which keeps at
 * most one per document. Reads are served from the fields cached at load time; every write
 * goes to the store before the cache changes.
 */
public final class MappedDocument {

    private final Odm odm;
    private final Schema schema;
    private final DocumentKey key;
    private final Object lock = new Object();
    private Map<String, Object> fields;
    private volatile boolean released;

    MappedDocument(Odm odm, Schema schema, DocumentSnapshot snapshot) {
        this.odm = Objects.requireNonNull(odm, "odm");
        this.schema = Objects.requireNonNull(schema, "schema");
        this.key = snapshot.key();
        this.fields = snapshot.copy();
    }

    public String name() {
        return key.name();
    }

    public Schema schema() {
        return schema;
    }

    public DocumentKey key() {
        return key;
    }

    /**
     * Cached value of {@code field}; reference attributes yield the target's name.
     */
    public Object get(String field) {
        schema.attribute(field);
        ensureLive();
        synchronized (lock) {
            if (fields.containsKey(field)) {
                return FieldValues.deepCopyValue(fields.get(field));
            }
        }
        return schema.fallback(field);
    }

    public <T> Optional<T> get(String field, Class<T> type) {
        Objects.requireNonNull(type, "type");
        Object value = get(field);
        if (type.isInstance(value)) {
            return Optional.of(type.cast(value));
        }
        return Optional.empty();
    }

    public void set(String field, Object value) {
        Objects.requireNonNull(field, "field");
        Map<String, Object> values = new LinkedHashMap<>();
        values.put(field, value);
        setAll(values);
    }

    /**
     * Validates every entry, then writes them in a single store update. An immutable attribute
     * can be set here only while it still holds its default.
     */
    public void setAll(Map<String, Object> values) {
        Objects.requireNonNull(values, "values");
        ensureLive();
        Map<String, Object> stored = new LinkedHashMap<>();
        values.forEach((field, value) -> {
            Attribute attribute = schema.attribute(field);
            stored.put(field, schema.validate(field, storedValue(attribute, value)));
        });
        if (stored.isEmpty()) {
            return;
        }
        synchronized (lock) {
            ensureLive();
            for (String field : stored.keySet()) {
                if (!schema.isWritable(field, fields.containsKey(field), fields.get(field))) {
                    throw new ImmutableAttributeException(field);
                }
            }
            odm.connection().update(key.collection(), key.name(), stored);
            fields = FieldValues.merge(fields, stored);
        }
    }

    public Optional<MappedDocument> reference(String field) {
        Attribute attribute = schema.attribute(field);
        if (!attribute.isReference()) {
            throw new IllegalArgumentException("Attribute " + field + " is not a reference");
        }
        Object target = get(field);
        if (target == null) {
            return Optional.empty();
        }
        return Optional.of(odm.resolve(field, attribute.targetCollection(), String.valueOf(target)));
    }

    /**
     * Replaces the cached fields with the stored ones.
     *
     * @throws sh.harold.uodm.store.DocumentNotFoundException if the document was deleted elsewhere
     */
    public void reload() {
        ensureLive();
        synchronized (lock) {
            DocumentSnapshot snapshot = odm.connection().load(key.collection(), key.name());
            fields = snapshot.copy();
        }
    }

    public Map<String, Object> snapshot() {
        synchronized (lock) {
            return FieldValues.deepCopy(fields);
        }
    }

    public boolean isReleased() {
        return released;
    }

    Odm odm() {
        return odm;
    }

    void detach() {
        released = true;
    }

    /**
     * Stored form of {@code value}: mapped documents assigned to a reference become their name.
     */
    static Object storedValue(Attribute attribute, Object value) {
        if (attribute.isReference() && value instanceof MappedDocument document) {
            if (!document.schema().collection().equals(attribute.targetCollection())) {
                throw new InvalidValueException(attribute.name(), "Attribute " + attribute.name() + " references "
                    + attribute.targetCollection() + ", not " + document.schema().collection());
            }
            return document.name();
        }
        return value;
    }

    private void ensureLive() {
        if (released) {
            throw new IllegalStateException("Document " + key + " has been released");
        }
    }

    @Override
    public String toString() {
        return "MappedDocument[" + key + "]";
    }
}
