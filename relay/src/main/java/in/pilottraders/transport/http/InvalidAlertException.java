package in.pilottraders.transport.http;

/**
 * Thrown when an alert submission body cannot be read as JSON.
 */
public class InvalidAlertException extends RuntimeException {

    public InvalidAlertException(String message) {
        super(message);
    }

    public InvalidAlertException(String message, Throwable cause) {
        super(message, cause);
    }
}
