package sh.harold.uodm.store;

import sh.harold.uodm.OdmException;

import java.util.Objects;

public final class DuplicateNameException extends OdmException {

    private final DocumentKey key;

    public DuplicateNameException(DocumentKey key) {
        this(key, null);
    }

    public DuplicateNameException(DocumentKey key, Throwable cause) {
        super("Document already exists: " + key.collection() + "/" + key.name(), cause);
        this.key = Objects.requireNonNull(key, "key");
    }

    public DocumentKey key() {
        return key;
    }
}
