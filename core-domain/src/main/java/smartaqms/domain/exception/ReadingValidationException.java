package smartaqms.domain.exception;

import lombok.Getter;

/**
 * Lectura malformada o fuera de rango. Se rechaza y se cuenta; nunca detiene la ingesta.
 */
@Getter
public class ReadingValidationException extends RuntimeException {

    private final String field;

    public ReadingValidationException(String field, String message) {
        super(message);
        this.field = field;
    }
}
