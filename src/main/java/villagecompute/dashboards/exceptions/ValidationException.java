package villagecompute.dashboards.exceptions;

/**
 * Thrown when a request is structurally invalid or not permitted for the caller (bad reorder permutation, duplicate
 * layout ids, promotion by a restricted owner).
 *
 * <p>
 * Extends RuntimeException per project standards. REST resources map it to 400 Bad Request, or 403 Forbidden for
 * permission failures.
 */
public class ValidationException extends RuntimeException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
