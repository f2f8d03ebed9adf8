package ke.axle.crud.exceptions;

/**
 * Raised when a single-row lookup matches more than one record.
 */
public class MultipleResultsFound extends ServiceException {

    public MultipleResultsFound(String message) {
        super(message);
    }

    public MultipleResultsFound(String message, Throwable cause) {
        super(message, cause);
    }
}
