package sh.harold.uodm.store;

/**
 * The store could not be opened: unreachable, misconfigured, or the credentials were rejected.
 */
public final class ConnectionException extends StoreException {

    public ConnectionException(String message) {
        super(message);
    }

    public ConnectionException(String message, Throwable cause) {
        super(message, cause);
    }
}
