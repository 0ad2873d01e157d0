package smartaqms.compute.service;

import lombok.extern.slf4j.Slf4j;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Ejecuta un ciclo analítico por tick con semántica skip-if-busy.
 * <p>
 * Si el ciclo anterior sigue en marcha, el tick se descarta (nunca se solapan dos ciclos del
 * mismo tipo). Cada ciclo tiene un tiempo máximo: al superarlo se abandona (se cancela e
 * interrumpe) y se registra como ciclo degradado, sin reintentarlo. La marca de ocupado solo
 * la libera el propio ciclo al terminar de verdad.
 */
@Slf4j
public class PeriodicCycleRunner {

    private final String name;
    private final Runnable cycle;
    private final Duration timeout;
    private final ExecutorService worker;
    private final MetricsRecorder metrics;

    private final AtomicBoolean busy = new AtomicBoolean(false);

    public PeriodicCycleRunner(String name, Runnable cycle, Duration timeout, ExecutorService worker,
                               MetricsRecorder metrics) {
        this.name = name;
        this.cycle = cycle;
        this.timeout = timeout;
        this.worker = worker;
        this.metrics = metrics;
    }

    /**
     * @return true si el ciclo se ejecutó y terminó a tiempo
     */
    public boolean tick() {
        if (!busy.compareAndSet(false, true)) {
            log.warn("Skipping {} tick: previous cycle still running", name);
            metrics.recordSkippedTick(name);
            return false;
        }

        AtomicBoolean started = new AtomicBoolean(false);
        Future<?> future;
        try {
            future = worker.submit(() -> {
                started.set(true);
                try {
                    cycle.run();
                } finally {
                    busy.set(false);
                }
            });
        } catch (RejectedExecutionException e) {
            busy.set(false);
            log.warn("{} worker rejected the cycle: {}", name, e.getMessage());
            return false;
        }

        try {
            future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            return true;
        } catch (TimeoutException e) {
            boolean cancelled = future.cancel(true);
            if (cancelled && !started.get()) {
                // Nunca llegó a ejecutarse: nadie más liberará la marca
                busy.set(false);
            }
            metrics.recordDegradedCycle(name, "cycle exceeded " + timeout + " and was abandoned");
            return false;
        } catch (ExecutionException e) {
            log.error("{} cycle failed", name, e.getCause());
            metrics.recordDegradedCycle(name, "cycle failed: " + e.getCause());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    public boolean isBusy() {
        return busy.get();
    }

    public String getName() {
        return name;
    }
}
