package smartaqms.compute.api;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.bind.MissingServletRequestParameterException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import smartaqms.domain.exception.IllegalAlertTransitionException;
import smartaqms.domain.exception.ResourceNotFoundException;
import smartaqms.domain.exception.StateCorruptionException;
import smartaqms.domain.exception.TransientStoreException;

import java.time.LocalDateTime;
import java.util.Map;

@Slf4j
@RestControllerAdvice
public class GlobalExceptionHandler {

    /**
     * Peticiones mal formadas (cuerpo ilegible, parámetros inválidos, alta de estación incorrecta).
     * Log: WARN (es un error del cliente, no del sistema).
     */
    @ExceptionHandler({IllegalArgumentException.class, HttpMessageNotReadableException.class,
            MethodArgumentTypeMismatchException.class, MissingServletRequestParameterException.class})
    public ResponseEntity<Object> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return body(HttpStatus.BAD_REQUEST, "Bad Request", ex.getMessage());
    }

    @ExceptionHandler(ResourceNotFoundException.class)
    public ResponseEntity<Object> handleNotFound(ResourceNotFoundException ex) {
        log.warn("Resource not found: {}", ex.getMessage());
        return body(HttpStatus.NOT_FOUND, "Not Found", ex.getMessage());
    }

    /**
     * Transición de alerta no permitida (ej: reconocer una alerta ya resuelta).
     */
    @ExceptionHandler(IllegalAlertTransitionException.class)
    public ResponseEntity<Object> handleIllegalTransition(IllegalAlertTransitionException ex) {
        log.warn("Rejected alert transition: {}", ex.getMessage());
        return body(HttpStatus.CONFLICT, "Illegal Alert Transition", ex.getMessage());
    }

    @ExceptionHandler(StateCorruptionException.class)
    public ResponseEntity<Object> handleCorruptCheckpoint(StateCorruptionException ex) {
        log.error("Refused to recover from an unusable checkpoint: {}", ex.getMessage());
        return body(HttpStatus.CONFLICT, "Unusable Checkpoint", ex.getMessage());
    }

    /**
     * El almacén siguió sin responder tras agotar los reintentos. El cliente debe reenviar.
     */
    @ExceptionHandler(TransientStoreException.class)
    public ResponseEntity<Object> handleStoreUnavailable(TransientStoreException ex) {
        log.error("Store unavailable after {} attempts: {}", ex.getAttempts(), ex.getMessage());
        return body(HttpStatus.SERVICE_UNAVAILABLE, "Store Unavailable",
                "The store is temporarily unavailable. Retry the whole request.");
    }

    /**
     * Maneja todo lo demás (NullPointer, SQL connection failed, etc.).
     * Log: ERROR (Incluye StackTrace completo).
     */
    @ExceptionHandler(Exception.class)
    public ResponseEntity<Object> handleGeneralErrors(Exception ex) {
        log.error("Unexpected System Error occurred", ex);
        return body(HttpStatus.INTERNAL_SERVER_ERROR, "Internal Server Error",
                "An unexpected error occurred. Please contact support referencing this timestamp.");
    }

    private static ResponseEntity<Object> body(HttpStatus status, String error, String message) {
        return ResponseEntity.status(status).body(Map.of(
                "timestamp", LocalDateTime.now(),
                "status", status.value(),
                "error", error,
                "message", message == null ? "" : message
        ));
    }
}
