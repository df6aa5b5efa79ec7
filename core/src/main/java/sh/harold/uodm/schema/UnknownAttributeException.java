package sh.harold.uodm.schema;

import sh.harold.uodm.OdmException;

public final class UnknownAttributeException extends OdmException {

    private final String collection;
    private final String attribute;

    public UnknownAttributeException(String collection, String attribute) {
        super("Attribute " + attribute + " is not defined for collection " + collection);
        this.collection = collection;
        this.attribute = attribute;
    }

    public String collection() {
        return collection;
    }

    public String attribute() {
        return attribute;
    }
}
