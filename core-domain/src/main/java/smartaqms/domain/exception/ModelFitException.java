package smartaqms.domain.exception;

/**
 * Un método analítico no pudo ajustarse sobre la ventana (pocas muestras, fallo numérico).
 * El ciclo lo omite y continúa en modo degradado.
 */
public class ModelFitException extends Exception {

    public ModelFitException(String message) {
        super(message);
    }
}
