package sh.harold.uodm.schema;

import sh.harold.uodm.OdmException;

public final class ImmutableAttributeException extends OdmException {

    private final String attribute;

    public ImmutableAttributeException(String attribute) {
        super("Attribute " + attribute + " is read-only");
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }
}
