package ke.axle.crud.exceptions;

/**
 * Raised when a lookup that must resolve to a record finds none. The message
 * holds the formatted key or a description of the filter that failed.
 */
public class NotFound extends ServiceException {

    public NotFound(String message) {
        super(message);
    }

    public NotFound(String message, Throwable cause) {
        super(message, cause);
    }
}
