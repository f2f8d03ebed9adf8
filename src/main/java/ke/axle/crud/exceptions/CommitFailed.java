package ke.axle.crud.exceptions;

/**
 * Raised when the session fails to commit. The session has already been rolled
 * back when this is thrown; the store's failure is available as the cause.
 */
public class CommitFailed extends ServiceException {

    public CommitFailed(String message, Throwable cause) {
        super(message, cause);
    }
}
