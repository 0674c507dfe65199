package villagecompute.dashboards.exceptions;

/**
 * Thrown when a widget definition or layout entry an operation depends on does not exist.
 *
 * <p>
 * Missing layout or widget documents on read are a normal initial state and never raise this exception. REST resources
 * map it to 404 Not Found.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
