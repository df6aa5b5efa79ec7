package sh.harold.uodm.schema;

import sh.harold.uodm.store.FieldValues;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Attribute table of one collection. Values handed to {@link #validate} and
 * {@link #initialFields} are raw store values: references are already names.
 */
public final class Schema {

    private final String collection;
    private final Map<String, Attribute> attributes;

    private Schema(String collection, Map<String, Attribute> attributes) {
        this.collection = collection;
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static Builder builder(String collection) {
        return new Builder(collection);
    }

    public String collection() {
        return collection;
    }

    public Map<String, Attribute> attributes() {
        return attributes;
    }

    public boolean has(String field) {
        return attributes.containsKey(field);
    }

    public Attribute attribute(String field) {
        Objects.requireNonNull(field, "field");
        Attribute attribute = attributes.get(field);
        if (attribute == null) {
            throw new UnknownAttributeException(collection, field);
        }
        return attribute;
    }

    /**
     * Checks the type of a write and returns the value to store.
     */
    public Object validate(String field, Object value) {
        return checkValue(attribute(field), value);
    }

    /**
     * Whether {@code field} still accepts a write. Immutable attributes take one write while
     * they hold no value or their default, and none once they hold anything else.
     *
     * @param present whether the document currently stores the field
     */
    public boolean isWritable(String field, boolean present, Object current) {
        Attribute attribute = attribute(field);
        if (attribute.mutable() || !present) {
            return true;
        }
        return FieldValues.valueEquals(current, attribute.hasDefault() ? attribute.defaultValue() : null);
    }

    /**
     * Fields of a new document: each attribute takes the given value, else its default.
     */
    public Map<String, Object> initialFields(Map<String, Object> given) {
        Map<String, Object> remaining = new LinkedHashMap<>(given == null ? Map.of() : given);
        Map<String, Object> fields = new LinkedHashMap<>();
        for (Attribute attribute : attributes.values()) {
            if (remaining.containsKey(attribute.name())) {
                fields.put(attribute.name(), checkValue(attribute, remaining.remove(attribute.name())));
            } else if (attribute.hasDefault()) {
                fields.put(attribute.name(), attribute.defaultValue());
            } else {
                throw new InvalidValueException(attribute.name(), "Attribute " + attribute.name() + " not given and no default available");
            }
        }
        if (!remaining.isEmpty()) {
            throw new UnknownAttributeException(collection, remaining.keySet().iterator().next());
        }
        return fields;
    }

    /**
     * Value to serve for {@code field} when the stored document lacks it.
     */
    public Object fallback(String field) {
        Attribute attribute = attribute(field);
        return attribute.hasDefault() ? attribute.defaultValue() : null;
    }

    private Object checkValue(Attribute attribute, Object value) {
        if (!attribute.type().accepts(value)) {
            String shown = value == null ? "null" : value.getClass().getSimpleName();
            throw new InvalidValueException(attribute.name(), "Attribute " + attribute.name() + " expects " + attribute.type() + " but got " + shown);
        }
        return FieldValues.deepCopyValue(value);
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Schema schema)) {
            return false;
        }
        return collection.equals(schema.collection) && attributes.equals(schema.attributes);
    }

    @Override
    public int hashCode() {
        return Objects.hash(collection, attributes);
    }

    @Override
    public String toString() {
        return "Schema[" + collection + ", " + attributes.keySet() + "]";
    }

    public static final class Builder {

        private final String collection;
        private final Map<String, Attribute> attributes = new LinkedHashMap<>();

        private Builder(String collection) {
            Objects.requireNonNull(collection, "collection");
            if (collection.isBlank() || collection.contains("/") || collection.contains("\\")) {
                throw new IllegalArgumentException("Invalid collection name: " + collection);
            }
            this.collection = collection;
        }

        public Builder immutable(String name, AttributeType type) {
            return add(Attribute.of(name, type, false));
        }

        public Builder immutable(String name, AttributeType type, Object defaultValue) {
            return add(Attribute.withDefault(name, type, false, defaultValue));
        }

        public Builder mutable(String name, AttributeType type) {
            return add(Attribute.of(name, type, true));
        }

        public Builder mutable(String name, AttributeType type, Object defaultValue) {
            return add(Attribute.withDefault(name, type, true, defaultValue));
        }

        public Builder reference(String name, String targetCollection, boolean mutable) {
            return add(Attribute.reference(name, targetCollection, mutable));
        }

        public Builder reference(String name, Schema target, boolean mutable) {
            Objects.requireNonNull(target, "target");
            return reference(name, target.collection(), mutable);
        }

        public Builder add(Attribute attribute) {
            Objects.requireNonNull(attribute, "attribute");
            if (attributes.putIfAbsent(attribute.name(), attribute) != null) {
                throw new IllegalArgumentException("Attribute already declared: " + attribute.name());
            }
            return this;
        }

        public Schema build() {
            return new Schema(collection, attributes);
        }
    }
}
