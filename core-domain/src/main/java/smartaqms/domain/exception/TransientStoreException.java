package smartaqms.domain.exception;

import lombok.Getter;

/**
 * El almacén no respondió dentro del presupuesto de reintentos (conexión caída, timeout).
 */
@Getter
public class TransientStoreException extends RuntimeException {

    private final int attempts;

    public TransientStoreException(String message, int attempts, Throwable cause) {
        super(message, cause);
        this.attempts = attempts;
    }
}
