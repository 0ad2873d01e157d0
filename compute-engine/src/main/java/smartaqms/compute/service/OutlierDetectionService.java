package smartaqms.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import smartaqms.analytics.detector.AnomalyVerdict;
import smartaqms.analytics.detector.DetectionWindow;
import smartaqms.analytics.detector.EnsembleOutcome;
import smartaqms.analytics.detector.EnsembleScorer;
import smartaqms.analytics.detector.FeatureBaseline;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.ReadingEntity;
import smartaqms.compute.repository.ReadingRepository;
import smartaqms.compute.repository.StationRepository;
import smartaqms.domain.alert.DetectionMethod;
import smartaqms.domain.exception.TransientStoreException;
import smartaqms.domain.reading.Quantity;
import smartaqms.domain.window.WindowConsumer;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Ciclo periódico de detección de anomalías, zona a zona.
 * <p>
 * Por zona: lecturas nuevas de todas sus estaciones (filtradas por calidad), línea base móvil
 * de la zona a partir del histórico previo, ensemble estadístico + densidad, límites fijos y,
 * por último, alertas a través del {@link AlertManager}. La marca de agua del detector se
 * confirma después de crear las alertas; reprocesar una lectura nunca duplica su alerta.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class OutlierDetectionService {

    public static final String TASK = "detector";
    public static final String MULTIVARIATE_ANOMALY = "MULTIVARIATE_ANOMALY";

    private static final Comparator<AlertCandidate> MOST_SEVERE_FIRST = Comparator
            .comparing(AlertCandidate::severity).reversed()
            .thenComparing(Comparator.comparingDouble(AlertCandidate::score).reversed())
            .thenComparingLong(AlertCandidate::readingId);

    private final StationRepository stationRepository;
    private final ReadingRepository readingRepository;
    private final WindowReader windowReader;
    private final EnsembleScorer ensembleScorer;
    private final HardLimitRules hardLimitRules;
    private final AlertManager alertManager;
    private final StoreRetryTemplate storeRetry;
    private final MetricsRecorder metrics;
    private final AqmsProperties properties;

    public DetectionCycleReport runCycle() {
        long startNanos = System.nanoTime();
        List<String> zones = stationRepository.findActiveZones();
        List<String> degraded = new ArrayList<>();
        int scored = 0;
        int anomalies = 0;
        int alerts = 0;

        for (String zone : zones) {
            if (Thread.currentThread().isInterrupted()) {
                log.warn("Detector cycle interrupted before zone {}", zone);
                degraded.add(zone);
                break;
            }
            try {
                ZoneOutcome outcome = processZone(zone);
                scored += outcome.scored();
                anomalies += outcome.anomalies();
                alerts += outcome.alerts();
                if (outcome.degradedReason() != null) {
                    degraded.add(zone);
                    metrics.recordDegradedCycle(TASK, zone + ": " + outcome.degradedReason());
                }
            } catch (TransientStoreException | DataAccessException e) {
                degraded.add(zone);
                metrics.recordDegradedCycle(TASK, zone + ": store unavailable (" + e.getMessage() + ")");
            }
        }

        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        metrics.recordDetectorCycle(duration, anomalies);
        log.info("Detector cycle: {} zones, {} readings scored, {} anomalies, {} alerts raised in {} ms{}",
                zones.size(), scored, anomalies, alerts, duration.toMillis(),
                degraded.isEmpty() ? "" : " (degraded: " + degraded + ")");
        return new DetectionCycleReport(zones.size(), scored, anomalies, alerts, List.copyOf(degraded),
                duration.toMillis());
    }

    private ZoneOutcome processZone(String zone) {
        AqmsProperties.Detector cfg = properties.getDetector();
        List<ReadingWindow> windows = windowReader.readZone(WindowConsumer.OUTLIER_DETECTOR, zone, cfg.getWindow());
        if (windows.stream().allMatch(ReadingWindow::isEmpty)) {
            log.debug("Zone {}: nothing new", zone);
            return ZoneOutcome.IDLE;
        }

        List<ReadingEntity> all = new ArrayList<>();
        windows.forEach(w -> all.addAll(w.readings()));
        all.sort(Comparator.comparing(ReadingEntity::getTimestamp).thenComparing(ReadingEntity::getId));

        List<ReadingEntity> scoredReadings = all.stream()
                .filter(r -> r.getQualityScore() >= cfg.getMinQuality())
                .toList();

        List<AlertCandidate> candidates = new ArrayList<>();
        for (ReadingEntity reading : all) {
            candidates.addAll(hardLimitRules.evaluate(reading, zone));
        }

        String degradedReason = null;
        int anomalyCount = 0;
        if (!scoredReadings.isEmpty()) {
            double[][] features = new double[scoredReadings.size()][];
            for (int i = 0; i < features.length; i++) {
                features[i] = scoredReadings.get(i).coreVector();
            }
            FeatureBaseline baseline = baselineFor(zone, windows, scoredReadings.get(0).getTimestamp(), features);

            EnsembleOutcome outcome = ensembleScorer.evaluate(
                    new DetectionWindow(features, baseline, Quantity.coreResolution()));
            if (outcome.isDegraded()) {
                degradedReason = "skipped " + outcome.skipped();
            }
            for (AnomalyVerdict verdict : outcome.anomalies()) {
                anomalyCount++;
                candidates.add(toCandidate(scoredReadings.get(verdict.index()), zone, verdict));
            }
        }

        candidates.sort(MOST_SEVERE_FIRST);
        int raised = 0;
        for (AlertCandidate candidate : candidates) {
            if (alertManager.raise(candidate).isPresent()) {
                raised++;
            }
        }

        storeRetry.execute("Commit detector watermarks for " + zone, () -> {
            windows.forEach(windowReader::commit);
            return null;
        });

        log.debug("Zone {}: {} new readings, {} scored, {} anomalies, {} alerts",
                zone, all.size(), scoredReadings.size(), anomalyCount, raised);
        return new ZoneOutcome(scoredReadings.size(), anomalyCount, raised, degradedReason);
    }

    /**
     * Media/desviación de la zona en el periodo anterior a la primera lectura nueva. Con
     * histórico insuficiente se usa la propia ventana.
     */
    private FeatureBaseline baselineFor(String zone, List<ReadingWindow> windows, LocalDateTime firstNew,
                                        double[][] windowFeatures) {
        AqmsProperties.Detector cfg = properties.getDetector();
        LocalDateTime from = firstNew.minus(cfg.getBaselinePeriod());
        List<String> stationIds = windows.stream().map(ReadingWindow::stationId).toList();

        List<ReadingEntity> history = readingRepository.findHistory(
                stationIds,
                WindowReader.partitionsBetween(from, firstNew),
                from,
                firstNew,
                cfg.getMinQuality(),
                PageRequest.of(0, cfg.getBaselineMaxSamples()));

        if (history.size() < cfg.getMinSamples()) {
            log.debug("Zone {}: {} historical samples, baseline taken from the window itself", zone, history.size());
            return FeatureBaseline.of(windowFeatures);
        }
        double[][] rows = new double[history.size()][];
        for (int i = 0; i < rows.length; i++) {
            rows[i] = history.get(i).coreVector();
        }
        return FeatureBaseline.of(rows);
    }

    private static AlertCandidate toCandidate(ReadingEntity reading, String zone, AnomalyVerdict verdict) {
        String type;
        String detail;
        if (verdict.dominantFeature() >= 0 && verdict.method() != DetectionMethod.DENSITY) {
            Quantity q = Quantity.core().get(verdict.dominantFeature());
            type = q.getCode() + "_ANOMALY";
            detail = String.format("%s = %.2f %s", q.getCode(), reading.valueOf(q), q.getUnit());
        } else {
            type = MULTIVARIATE_ANOMALY;
            detail = "combinación de magnitudes poco densa";
        }
        return AlertCandidate.builder()
                .readingId(reading.getId())
                .stationId(reading.getStationId())
                .zone(zone)
                .alertType(type)
                .severity(verdict.severity())
                .method(verdict.method())
                .score(verdict.score())
                .message(String.format("Anomalía (%s) en %s: %s, puntuación %.2f",
                        verdict.method(), reading.getStationId(), detail, verdict.score()))
                .build();
    }

    private record ZoneOutcome(int scored, int anomalies, int alerts, String degradedReason) {
        static final ZoneOutcome IDLE = new ZoneOutcome(0, 0, 0, null);
    }
}
