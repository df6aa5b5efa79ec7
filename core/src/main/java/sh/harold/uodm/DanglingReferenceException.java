package sh.harold.uodm;

import sh.harold.uodm.store.DocumentKey;

import java.util.Objects;

public final class DanglingReferenceException extends OdmException {

    private final String field;
    private final DocumentKey target;

    public DanglingReferenceException(String field, DocumentKey target, Throwable cause) {
        super("Attribute " + field + " references missing document " + target.collection() + "/" + target.name(), cause);
        this.field = Objects.requireNonNull(field, "field");
        this.target = target;
    }

    public String field() {
        return field;
    }

    public DocumentKey target() {
        return target;
    }
}
