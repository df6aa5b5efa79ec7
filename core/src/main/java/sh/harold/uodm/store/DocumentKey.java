package sh.harold.uodm.store;

import java.util.Objects;

public record DocumentKey(String collection, String name) {

    public DocumentKey {
        Objects.requireNonNull(collection, "collection");
        Objects.requireNonNull(name, "name");
        if (collection.isBlank()) {
            throw new IllegalArgumentException("Collection cannot be blank");
        }
        if (name.isBlank()) {
            throw new IllegalArgumentException("Name cannot be blank");
        }
        if (collection.contains("/") || name.contains("/") || collection.contains("\\") || name.contains("\\")) {
            throw new IllegalArgumentException("Collection and name may not contain path separators");
        }
        if (hasControlCharacter(collection) || hasControlCharacter(name)) {
            throw new IllegalArgumentException("Collection and name may not contain control characters");
        }
        if (name.equals(".") || name.equals("..")) {
            throw new IllegalArgumentException("Name may not be a relative path: " + name);
        }
    }

    public static DocumentKey of(String collection, String name) {
        return new DocumentKey(collection, name);
    }

    private static boolean hasControlCharacter(String value) {
        return value.chars().anyMatch(Character::isISOControl);
    }

    @Override
    public String toString() {
        return collection + "/" + name;
    }
}
