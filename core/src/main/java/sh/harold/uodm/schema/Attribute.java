package sh.harold.uodm.schema;

import sh.harold.uodm.store.FieldValues;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * One declared attribute. A reference attribute stores the name of a document in
 * {@code targetCollection} and has no default.
 */
public record Attribute(
    String name,
    AttributeType type,
    boolean mutable,
    boolean hasDefault,
    Object defaultValue,
    String targetCollection
) {

    private static final Pattern NAME_PATTERN = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    public Attribute {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
        if (!NAME_PATTERN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid attribute name: " + name);
        }
        if (type == AttributeType.REFERENCE) {
            Objects.requireNonNull(targetCollection, "targetCollection");
            if (hasDefault) {
                throw new IllegalArgumentException("Reference attribute " + name + " cannot have a default");
            }
        } else if (targetCollection != null) {
            throw new IllegalArgumentException("Only reference attributes have a target collection: " + name);
        }
        if (!hasDefault && defaultValue != null) {
            throw new IllegalArgumentException("Default value given for " + name + " without hasDefault");
        }
        if (hasDefault && !type.accepts(defaultValue)) {
            throw new IllegalArgumentException("Default for " + name + " is not a valid " + type + ": " + defaultValue);
        }
        defaultValue = FieldValues.deepCopyValue(defaultValue);
    }

    public static Attribute of(String name, AttributeType type, boolean mutable) {
        return new Attribute(name, type, mutable, false, null, null);
    }

    public static Attribute withDefault(String name, AttributeType type, boolean mutable, Object defaultValue) {
        return new Attribute(name, type, mutable, true, defaultValue, null);
    }

    public static Attribute reference(String name, String targetCollection, boolean mutable) {
        return new Attribute(name, AttributeType.REFERENCE, mutable, false, null, targetCollection);
    }

    public boolean isReference() {
        return type == AttributeType.REFERENCE;
    }

    @Override
    public Object defaultValue() {
        return FieldValues.deepCopyValue(defaultValue);
    }
}
