package sh.harold.uodm.schema;

import sh.harold.uodm.OdmException;

public final class InvalidValueException extends OdmException {

    private final String attribute;

    public InvalidValueException(String attribute, String message) {
        super(message);
        this.attribute = attribute;
    }

    public String attribute() {
        return attribute;
    }
}
