package ke.axle.crud.exceptions;

/**
 * Base type of the errors raised by {@link ke.axle.crud.GenericRecordService}.
 */
public class ServiceException extends Exception {

    public ServiceException(String message) {
        super(message);
    }

    public ServiceException(String message, Throwable cause) {
        super(message, cause);
    }
}
