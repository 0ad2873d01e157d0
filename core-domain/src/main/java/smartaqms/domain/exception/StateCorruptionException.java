package smartaqms.domain.exception;

/**
 * El ModelState persistido no es legible o su versión es incoherente.
 */
public class StateCorruptionException extends Exception {

    public StateCorruptionException(String message) {
        super(message);
    }

    public StateCorruptionException(String message, Throwable cause) {
        super(message, cause);
    }
}
