package sh.harold.uodm.store;

import sh.harold.uodm.OdmException;

/**
 * Backend failure that is not covered by a more specific exception: I/O errors,
 * driver errors, or a store that holds more than one document with the same name.
 */
public class StoreException extends OdmException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
