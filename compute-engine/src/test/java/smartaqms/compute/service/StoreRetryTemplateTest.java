package smartaqms.compute.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.SimpleTransactionStatus;
import org.springframework.transaction.support.TransactionTemplate;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.domain.exception.TransientStoreException;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

@ExtendWith(MockitoExtension.class)
class StoreRetryTemplateTest {

    @Mock
    private PlatformTransactionManager transactionManager;

    private final List<Duration> sleeps = new ArrayList<>();
    private StoreRetryTemplate template;

    @BeforeEach
    void setUp() {
        lenient().when(transactionManager.getTransaction(any())).thenReturn(new SimpleTransactionStatus());
        AqmsProperties.Store.Retry retry = new AqmsProperties.Store.Retry();
        retry.setMaxAttempts(3);
        retry.setBaseDelay(Duration.ofMillis(200));
        retry.setMaxDelay(Duration.ofMillis(300));
        template = new StoreRetryTemplate(new TransactionTemplate(transactionManager), retry, sleeps::add);
    }

    @Test
    @DisplayName("Fallo transitorio seguido de éxito: se reintenta y devuelve el resultado")
    void transientFailure_thenSuccess() {
        AtomicInteger calls = new AtomicInteger();

        String result = template.execute("op", () -> {
            if (calls.incrementAndGet() == 1) {
                throw new DataAccessResourceFailureException("connection reset");
            }
            return "ok";
        });

        assertEquals("ok", result);
        assertEquals(2, calls.get());
        assertThat(sleeps).containsExactly(Duration.ofMillis(200));
        verify(transactionManager, times(1)).rollback(any());
    }

    @Test
    @DisplayName("Intentos agotados: TransientStoreException con backoff exponencial acotado")
    void exhaustedAttempts_throwTransientStoreException() {
        AtomicInteger calls = new AtomicInteger();

        TransientStoreException e = assertThrows(TransientStoreException.class, () -> template.execute("op", () -> {
            calls.incrementAndGet();
            throw new DataAccessResourceFailureException("down");
        }));

        assertEquals(3, calls.get());
        assertEquals(3, e.getAttempts());
        assertThat(e.getCause()).isInstanceOf(DataAccessResourceFailureException.class);
        assertThat(sleeps).containsExactly(Duration.ofMillis(200), Duration.ofMillis(300));
    }

    @Test
    @DisplayName("Error no transitorio: se propaga en el primer intento salvo que el llamador lo declare reintentable")
    void nonTransientErrors_propagateUnlessDeclared() {
        AtomicInteger calls = new AtomicInteger();
        assertThrows(DataIntegrityViolationException.class, () -> template.execute("op", () -> {
            calls.incrementAndGet();
            throw new DataIntegrityViolationException("duplicate key");
        }));
        assertEquals(1, calls.get());

        calls.set(0);
        Integer result = template.execute("op", ex -> ex instanceof DataIntegrityViolationException, () -> {
            if (calls.incrementAndGet() < 3) {
                throw new DataIntegrityViolationException("concurrent insert");
            }
            return 7;
        });
        assertEquals(7, result);
        assertEquals(3, calls.get());
    }

    @Test
    @DisplayName("Causa transitoria anidada se reconoce en la cadena de causas")
    void isTransient_walksCauseChain() {
        assertTrue(StoreRetryTemplate.isTransient(new RuntimeException(new DataAccessResourceFailureException("x"))));
        assertFalse(StoreRetryTemplate.isTransient(new IllegalStateException("bug")));
    }
}
