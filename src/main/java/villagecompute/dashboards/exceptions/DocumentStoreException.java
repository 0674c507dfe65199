package villagecompute.dashboards.exceptions;

/**
 * Thrown when the document store cannot complete a read, write, listing or delete.
 *
 * <p>
 * Callers treat it as a typed write failure: in-memory state is left untouched. REST resources map it to 503 Service
 * Unavailable.
 */
public class DocumentStoreException extends RuntimeException {

    public DocumentStoreException(String message) {
        super(message);
    }

    public DocumentStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
