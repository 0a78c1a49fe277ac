package battetl.transform.service;

/**
 * Raised when a caller breaks a transform contract: a conversion names a
 * column that is not there, an unstructured file descriptor lacks required
 * roles, or a value that must be numeric or a timestamp cannot be parsed.
 *
 * Incomplete or unusual data never raises this; it is logged and left as
 * missing values instead.
 */
public class TransformValidationException extends IllegalArgumentException {

    public TransformValidationException(String message) {
        super(message);
    }

    public TransformValidationException(String message, Throwable cause) {
        super(message, cause);
    }
}
