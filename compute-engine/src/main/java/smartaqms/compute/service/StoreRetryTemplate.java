package smartaqms.compute.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.stereotype.Component;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.domain.exception.TransientStoreException;

import java.time.Duration;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Ejecuta una unidad de trabajo transaccional contra el almacén con reintentos y backoff
 * exponencial acotado (base, 2·base, 4·base... hasta {@code max-delay}).
 * <p>
 * Cada intento es una transacción completa: un fallo a mitad hace rollback y el siguiente
 * intento recomputa todo. Agotados los intentos se lanza {@link TransientStoreException}.
 * Los errores no transitorios se propagan en el primer intento.
 */
@Slf4j
@Component
public class StoreRetryTemplate {

    /**
     * Espera entre intentos. Sustituible en tests para no dormir.
     */
    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    private final TransactionTemplate transactionTemplate;
    private final AqmsProperties.Store.Retry retry;
    private final Sleeper sleeper;

    @Autowired
    public StoreRetryTemplate(PlatformTransactionManager transactionManager, AqmsProperties properties) {
        this(new TransactionTemplate(transactionManager), properties.getStore().getRetry(),
                d -> Thread.sleep(d.toMillis()));
    }

    public StoreRetryTemplate(TransactionTemplate transactionTemplate, AqmsProperties.Store.Retry retry, Sleeper sleeper) {
        this.transactionTemplate = transactionTemplate;
        this.retry = retry;
        this.sleeper = sleeper;
    }

    public <T> T execute(String operation, Supplier<T> work) {
        return execute(operation, e -> false, work);
    }

    /**
     * @param alsoRetryable errores adicionales que el llamador considera reintentables
     *                      (ej: colisión de clave única con un alimentador concurrente)
     */
    public <T> T execute(String operation, Predicate<Throwable> alsoRetryable, Supplier<T> work) {
        int maxAttempts = Math.max(1, retry.getMaxAttempts());
        RuntimeException last = null;

        for (int attempt = 1; attempt <= maxAttempts; attempt++) {
            try {
                return transactionTemplate.execute(status -> work.get());
            } catch (RuntimeException e) {
                if (!isTransient(e) && !alsoRetryable.test(e)) {
                    throw e;
                }
                last = e;
                if (attempt == maxAttempts) {
                    break;
                }
                Duration delay = backoff(attempt);
                log.warn("{} failed (attempt {}/{}): {}. Retrying in {} ms",
                        operation, attempt, maxAttempts, e.getMessage(), delay.toMillis());
                try {
                    sleeper.sleep(delay);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw new TransientStoreException(operation + " interrupted while backing off", attempt, e);
                }
            }
        }

        log.error("{} gave up after {} attempts", operation, maxAttempts, last);
        throw new TransientStoreException(operation + " failed after " + maxAttempts + " attempts", maxAttempts, last);
    }

    /**
     * Retardo tras el intento {@code attempt} (1-based).
     */
    Duration backoff(int attempt) {
        long base = retry.getBaseDelay().toMillis();
        long exponential = base * (1L << Math.min(attempt - 1, 20));
        return Duration.ofMillis(Math.min(exponential, retry.getMaxDelay().toMillis()));
    }

    static boolean isTransient(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof TransientDataAccessException
                    || t instanceof RecoverableDataAccessException
                    || t instanceof DataAccessResourceFailureException
                    || t instanceof CannotCreateTransactionException) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
