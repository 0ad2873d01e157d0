package smartaqms.compute.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.SystemMetricEntity;
import smartaqms.compute.repository.SystemMetricRepository;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Observador pasivo de ingesta, detección y clasificación.
 * <p>
 * Los productores solo tocan contadores/timers de Micrometer (no bloqueantes). En cada tick
 * {@link #flush()} vuelca una fila {@code system_metrics} por métrica. Ningún método
 * propaga errores: un fallo de registro se loguea y se descarta.
 */
@Slf4j
@Component
public class MetricsRecorder {

    // Nombres de las filas system_metrics
    public static final String INGEST_THROUGHPUT = "ingest_throughput";
    public static final String INGEST_LATENCY = "ingest_latency";
    public static final String INGEST_FAILURES = "ingest_failures";
    public static final String INGEST_REJECTED = "ingest_rejected";
    public static final String LATE_READINGS = "late_readings";
    public static final String DETECTOR_CYCLE_DURATION = "detector_cycle_duration";
    public static final String CLASSIFIER_CYCLE_DURATION = "classifier_cycle_duration";
    public static final String DEGRADED_CYCLES = "degraded_cycles";
    public static final String SKIPPED_TICKS = "skipped_ticks";
    public static final String ANOMALY_COUNT = "anomaly_count";
    public static final String ALERTS_SUPPRESSED = "alerts_suppressed";
    public static final String MODEL_ACCURACY = "stream_model_accuracy";
    public static final String MODEL_VERSION = "model_version";
    public static final String UPTIME = "uptime";

    // Nombres de los meters de Micrometer
    static final String METER_INGEST_READINGS = "aqms.ingest.readings";
    static final String METER_INGEST_LATENCY = "aqms.ingest.latency";
    static final String METER_INGEST_FAILURES = "aqms.ingest.failures";
    static final String METER_DETECTOR_DURATION = "aqms.detector.cycle.duration";
    static final String METER_CLASSIFIER_DURATION = "aqms.classifier.cycle.duration";
    static final String METER_DEGRADED = "aqms.cycles.degraded";
    static final String METER_SKIPPED = "aqms.cycles.skipped";
    static final String METER_ANOMALIES = "aqms.detector.anomalies";
    static final String METER_ALERTS = "aqms.alerts";
    static final String METER_LATE = "aqms.readings.late";

    private final MeterRegistry registry;
    private final SystemMetricRepository metricRepository;
    private final AqmsProperties properties;
    private final Clock clock;

    private final Counter accepted;
    private final Counter rejected;
    private final Counter duplicates;
    private final Counter ingestFailures;
    private final Timer ingestLatency;
    private final Timer detectorDuration;
    private final Timer classifierDuration;
    private final Counter anomalies;
    private final Counter alertsRaised;
    private final Counter alertsSuppressed;

    private final Instant startedAt;
    private final AtomicLong modelVersion = new AtomicLong();
    private final AtomicReference<Double> accuracy = new AtomicReference<>(Double.NaN);
    private final AtomicLong lastDetectorCycleMs = new AtomicLong(-1);
    private final AtomicLong lastClassifierCycleMs = new AtomicLong(-1);

    // Ventana de throughput entre flushes
    private double acceptedAtLastFlush;
    private Instant lastFlushAt;

    public MetricsRecorder(MeterRegistry registry, SystemMetricRepository metricRepository,
                           AqmsProperties properties, Clock clock) {
        this.registry = registry;
        this.metricRepository = metricRepository;
        this.properties = properties;
        this.clock = clock;
        this.startedAt = clock.instant();
        this.lastFlushAt = startedAt;

        this.accepted = registry.counter(METER_INGEST_READINGS, "outcome", "accepted");
        this.rejected = registry.counter(METER_INGEST_READINGS, "outcome", "rejected");
        this.duplicates = registry.counter(METER_INGEST_READINGS, "outcome", "duplicate");
        this.ingestFailures = registry.counter(METER_INGEST_FAILURES);
        this.ingestLatency = registry.timer(METER_INGEST_LATENCY);
        this.detectorDuration = registry.timer(METER_DETECTOR_DURATION);
        this.classifierDuration = registry.timer(METER_CLASSIFIER_DURATION);
        this.anomalies = registry.counter(METER_ANOMALIES);
        this.alertsRaised = registry.counter(METER_ALERTS, "outcome", "raised");
        this.alertsSuppressed = registry.counter(METER_ALERTS, "outcome", "suppressed");

        registry.gauge("aqms.classifier.model.version", modelVersion);
        registry.gauge("aqms.classifier.accuracy", accuracy, ref -> ref.get());
        registry.gauge("aqms.uptime.seconds", this, r -> r.uptime().getSeconds());
    }

    // --- Productores ---

    public void recordIngest(int acceptedCount, int rejectedCount, int duplicateCount, Duration latency) {
        safely("ingest", () -> {
            accepted.increment(acceptedCount);
            rejected.increment(rejectedCount);
            duplicates.increment(duplicateCount);
            ingestLatency.record(latency);
        });
    }

    public void recordIngestFailure() {
        safely("ingest failure", ingestFailures::increment);
    }

    public void recordDetectorCycle(Duration duration, int anomalyCount) {
        safely("detector cycle", () -> {
            detectorDuration.record(duration);
            lastDetectorCycleMs.set(duration.toMillis());
            anomalies.increment(anomalyCount);
        });
    }

    public void recordClassifierCycle(Duration duration, double prequentialAccuracy, long version) {
        safely("classifier cycle", () -> {
            classifierDuration.record(duration);
            lastClassifierCycleMs.set(duration.toMillis());
            if (!Double.isNaN(prequentialAccuracy)) {
                accuracy.set(prequentialAccuracy);
            }
            modelVersion.set(version);
        });
    }

    public void recordModelVersion(long version) {
        safely("model version", () -> modelVersion.set(version));
    }

    public void recordDegradedCycle(String task, String reason) {
        safely("degraded cycle", () -> {
            registry.counter(METER_DEGRADED, "task", task).increment();
            log.warn("Degraded {} cycle: {}", task, reason);
        });
    }

    public void recordSkippedTick(String task) {
        safely("skipped tick", () -> registry.counter(METER_SKIPPED, "task", task).increment());
    }

    /**
     * Lecturas que llegaron por detrás de una marca de agua: rechazadas en la ingesta
     * ({@code source = ingest}) o detectadas al confirmar una ventana ({@code source = window}).
     */
    public void recordLateReadings(String source, int count) {
        safely("late readings", () -> {
            registry.counter(METER_LATE, "source", source).increment(count);
            log.warn("{} late reading(s) detected at {}", count, source);
        });
    }

    public void recordAlertRaised() {
        safely("alert raised", alertsRaised::increment);
    }

    public void recordAlertSuppressed() {
        safely("alert suppressed", alertsSuppressed::increment);
    }

    // --- Lectura ---

    public double ingestFailureCount() {
        return ingestFailures.count();
    }

    public double degradedCycleCount() {
        return sum(METER_DEGRADED);
    }

    public double lateReadingCount() {
        return sum(METER_LATE);
    }

    public double skippedTickCount() {
        return sum(METER_SKIPPED);
    }

    public long modelVersion() {
        return modelVersion.get();
    }

    public Duration uptime() {
        return Duration.between(startedAt, clock.instant());
    }

    // --- Volcado ---

    @Scheduled(fixedDelayString = "${aqms.metrics.interval:PT30S}", initialDelayString = "${aqms.metrics.interval:PT30S}")
    public void scheduledFlush() {
        if (properties.getScheduling().isEnabled()) {
            flush();
        }
    }

    /**
     * Escribe una fila por métrica. Devuelve las filas escritas (vacío si el almacén falló).
     */
    public List<SystemMetricEntity> flush() {
        List<SystemMetricEntity> rows;
        try {
            rows = snapshot();
        } catch (RuntimeException e) {
            log.warn("Metric snapshot failed, dropping this tick: {}", e.getMessage());
            return List.of();
        }
        try {
            metricRepository.saveAll(rows);
            log.debug("Recorded {} system metrics", rows.size());
            return rows;
        } catch (RuntimeException e) {
            log.warn("Failed to persist {} system metrics, dropping them: {}", rows.size(), e.getMessage());
            return List.of();
        }
    }

    synchronized List<SystemMetricEntity> snapshot() {
        Instant now = clock.instant();
        LocalDateTime recordedAt = LocalDateTime.ofInstant(now, clock.getZone());

        double acceptedTotal = accepted.count();
        double seconds = Math.max(Duration.between(lastFlushAt, now).toMillis() / 1000.0, 1.0e-3);
        double throughput = (acceptedTotal - acceptedAtLastFlush) / seconds;
        acceptedAtLastFlush = acceptedTotal;
        lastFlushAt = now;

        List<SystemMetricEntity> rows = new ArrayList<>();
        rows.add(row(INGEST_THROUGHPUT, throughput, "readings/s", recordedAt));
        rows.add(row(INGEST_LATENCY, ingestLatency.mean(TimeUnit.MILLISECONDS), "ms", recordedAt));
        rows.add(row(INGEST_FAILURES, ingestFailures.count(), "count", recordedAt));
        rows.add(row(INGEST_REJECTED, rejected.count(), "count", recordedAt));
        if (lastDetectorCycleMs.get() >= 0) {
            rows.add(row(DETECTOR_CYCLE_DURATION, lastDetectorCycleMs.get(), "ms", recordedAt));
        }
        if (lastClassifierCycleMs.get() >= 0) {
            rows.add(row(CLASSIFIER_CYCLE_DURATION, lastClassifierCycleMs.get(), "ms", recordedAt));
        }
        rows.add(row(DEGRADED_CYCLES, degradedCycleCount(), "count", recordedAt));
        rows.add(row(SKIPPED_TICKS, skippedTickCount(), "count", recordedAt));
        rows.add(row(LATE_READINGS, lateReadingCount(), "count", recordedAt));
        rows.add(row(ANOMALY_COUNT, anomalies.count(), "count", recordedAt));
        rows.add(row(ALERTS_SUPPRESSED, alertsSuppressed.count(), "count", recordedAt));
        Double acc = accuracy.get();
        if (acc != null && !acc.isNaN()) {
            rows.add(row(MODEL_ACCURACY, acc, "ratio", recordedAt));
        }
        rows.add(row(MODEL_VERSION, modelVersion.get(), "version", recordedAt));
        rows.add(row(UPTIME, uptime().getSeconds(), "s", recordedAt));
        return rows;
    }

    private static SystemMetricEntity row(String name, double value, String unit, LocalDateTime at) {
        return SystemMetricEntity.builder()
                .metricName(name)
                .metricValue(value)
                .metricUnit(unit)
                .recordedAt(at)
                .build();
    }

    private double sum(String meterName) {
        return registry.find(meterName).counters().stream().mapToDouble(Counter::count).sum();
    }

    private static void safely(String what, Runnable action) {
        try {
            action.run();
        } catch (RuntimeException e) {
            log.warn("Failed to record {} metric: {}", what, e.getMessage());
        }
    }
}
