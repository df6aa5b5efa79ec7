package sh.harold.uodm.store;

import sh.harold.uodm.OdmException;

import java.util.Objects;

public final class DocumentNotFoundException extends OdmException {

    private final DocumentKey key;

    public DocumentNotFoundException(DocumentKey key) {
        super("No such document: " + key.collection() + "/" + key.name());
        this.key = Objects.requireNonNull(key, "key");
    }

    public DocumentKey key() {
        return key;
    }
}
