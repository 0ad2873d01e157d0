package smartaqms.compute.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import smartaqms.analytics.ReadingSample;
import smartaqms.analytics.classifier.ClassDistribution;
import smartaqms.analytics.classifier.ClassifierFeatures;
import smartaqms.analytics.classifier.LabeledSample;
import smartaqms.analytics.classifier.ModelState;
import smartaqms.analytics.classifier.SoftmaxClassifier;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.PredictionEntity;
import smartaqms.compute.entity.ReadingEntity;
import smartaqms.compute.repository.PredictionRepository;
import smartaqms.compute.repository.ReadingRepository;
import smartaqms.compute.repository.StationRepository;
import smartaqms.domain.exception.ModelFitException;
import smartaqms.domain.exception.StateCorruptionException;
import smartaqms.domain.exception.TransientStoreException;
import smartaqms.domain.prediction.AqiCategory;
import smartaqms.domain.window.WindowConsumer;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Ciclo periódico del clasificador online: actualización incremental del modelo con las
 * lecturas nuevas y una predicción por lectura.
 * <p>
 * El {@link ModelState} en memoria solo lo sustituye este servicio, bajo {@code cycleLock}, y
 * solo después de que la transacción que guarda predicciones, checkpoint y marcas de agua haya
 * confirmado. Si el commit falla, el siguiente ciclo reprocesa las mismas lecturas con el
 * mismo estado y obtiene exactamente el mismo resultado.
 */
@Slf4j
@Service
public class OnlineClassifierService {

    public static final String TASK = "classifier";

    private final StationRepository stationRepository;
    private final ReadingRepository readingRepository;
    private final PredictionRepository predictionRepository;
    private final WindowReader windowReader;
    private final ModelStateStore stateStore;
    private final SoftmaxClassifier classifier;
    private final StoreRetryTemplate storeRetry;
    private final MetricsRecorder metrics;
    private final AqmsProperties properties;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();
    private volatile ModelState state;

    public OnlineClassifierService(StationRepository stationRepository,
                                   ReadingRepository readingRepository,
                                   PredictionRepository predictionRepository,
                                   WindowReader windowReader,
                                   ModelStateStore stateStore,
                                   SoftmaxClassifier classifier,
                                   StoreRetryTemplate storeRetry,
                                   MetricsRecorder metrics,
                                   AqmsProperties properties,
                                   Clock clock) {
        this.stationRepository = stationRepository;
        this.readingRepository = readingRepository;
        this.predictionRepository = predictionRepository;
        this.windowReader = windowReader;
        this.stateStore = stateStore;
        this.classifier = classifier;
        this.storeRetry = storeRetry;
        this.metrics = metrics;
        this.properties = properties;
        this.clock = clock;
    }

    public ClassifierCycleReport runCycle() {
        cycleLock.lock();
        try {
            return doCycle();
        } finally {
            cycleLock.unlock();
        }
    }

    private ClassifierCycleReport doCycle() {
        long startNanos = System.nanoTime();
        ModelState current = ensureLoaded();

        List<ReadingWindow> windows = new ArrayList<>();
        Map<String, String> zoneByStation = new HashMap<>();
        for (String zone : stationRepository.findActiveZones()) {
            for (ReadingWindow w : windowReader.readZone(WindowConsumer.ONLINE_CLASSIFIER, zone,
                    properties.getClassifier().getWindow())) {
                windows.add(w);
                zoneByStation.put(w.stationId(), zone);
            }
        }

        List<ReadingEntity> batch = new ArrayList<>();
        windows.forEach(w -> batch.addAll(w.readings()));
        if (!batch.isEmpty()) {
            // Una ventana retenida por lecturas tardías vuelve a traer lecturas ya predichas
            Set<Long> predicted = new HashSet<>(predictionRepository.findExistingReadingIds(
                    batch.stream().map(ReadingEntity::getId).toList()));
            if (!predicted.isEmpty()) {
                batch.removeIf(r -> predicted.contains(r.getId()));
                log.debug("Classifier cycle: {} re-read readings already predicted", predicted.size());
            }
        }
        if (batch.isEmpty()) {
            if (windows.stream().anyMatch(w -> !w.isEmpty())) {
                storeRetry.execute("Commit classifier watermarks", () -> {
                    windows.forEach(windowReader::commit);
                    return null;
                });
            }
            log.debug("Classifier cycle: no new readings, model stays at v{}", current.getVersion());
            return ClassifierCycleReport.idle(current.getVersion());
        }
        batch.sort(Comparator.comparing(ReadingEntity::getTimestamp).thenComparing(ReadingEntity::getId));

        // 1. Características
        List<ReadingSample> samples = new ArrayList<>(batch.size());
        for (ReadingEntity r : batch) {
            samples.add(toSample(r, zoneByStation.get(r.getStationId())));
        }
        double[][] features = ClassifierFeatures.assemble(samples, previousReadings(batch, zoneByStation));

        List<LabeledSample> training = new ArrayList<>();
        double minQuality = properties.getClassifier().getMinTrainingQuality();
        for (int i = 0; i < batch.size(); i++) {
            if (batch.get(i).getQualityScore() >= minQuality) {
                training.add(new LabeledSample(features[i], AqiCategory.fromPm25(batch.get(i).getPm25()).ordinal()));
            }
        }

        // 2. Precisión prequential del modelo previo, luego actualización incremental
        double accuracy = classifier.accuracy(current, training);
        ModelState next = current;
        Long seed = null;
        if (!training.isEmpty()) {
            seed = classifier.shuffleSeedFor(current);
            try {
                next = rebaseVersion(classifier.update(current, training, seed));
                log.info("Classifier update v{} -> v{} on {} samples (shuffle seed {})",
                        current.getVersion(), next.getVersion(), training.size(), seed);
            } catch (ModelFitException e) {
                metrics.recordDegradedCycle(TASK, "update skipped: " + e.getMessage());
                next = current;
                seed = null;
            }
        }

        // 3. Puntuación del lote con el modelo resultante
        List<ClassDistribution> distributions = classifier.predictAll(next, features);

        // 4. Predicciones + checkpoint + marcas de agua, todo o nada
        final ModelState committed = next;
        int written;
        try {
            written = storeRetry.execute("Classifier commit v" + committed.getVersion(), () -> {
                int n = writePredictions(batch, distributions, committed.getVersion());
                if (committed != current) {
                    stateStore.checkpoint(committed);
                }
                windows.forEach(windowReader::commit);
                return n;
            });
        } catch (TransientStoreException e) {
            metrics.recordDegradedCycle(TASK, "commit failed, state kept at v" + current.getVersion());
            return new ClassifierCycleReport(batch.size(), 0, current.getVersion(), current.getVersion(),
                    accuracy, seed, false);
        }

        // 5. Solo tras el commit se publica el nuevo estado
        state = committed;
        Duration duration = Duration.ofNanos(System.nanoTime() - startNanos);
        metrics.recordClassifierCycle(duration, accuracy, committed.getVersion());
        log.info("Classifier cycle: {} readings, {} predictions, prequential accuracy {}, model v{} in {} ms",
                batch.size(), written, Double.isNaN(accuracy) ? "n/a" : String.format("%.3f", accuracy),
                committed.getVersion(), duration.toMillis());
        return new ClassifierCycleReport(batch.size(), written, current.getVersion(), committed.getVersion(),
                accuracy, seed, true);
    }

    /**
     * Restaura un checkpoint anterior y lo hace activo. Las siguientes versiones continúan por
     * encima de la máxima ya escrita.
     */
    public ModelState recoverTo(long version) throws StateCorruptionException {
        cycleLock.lock();
        try {
            ModelState restored = stateStore.load(version, ClassifierFeatures.FEATURE_COUNT, AqiCategory.count());
            storeRetry.execute("Recover model to v" + version, () -> {
                stateStore.pointTo(version);
                return null;
            });
            state = restored;
            metrics.recordModelVersion(version);
            log.warn("Model state recovered to checkpoint v{}", version);
            return restored;
        } finally {
            cycleLock.unlock();
        }
    }

    public ModelState currentState() {
        cycleLock.lock();
        try {
            return ensureLoaded();
        } finally {
            cycleLock.unlock();
        }
    }

    /**
     * Carga perezosa del estado persistido. Sin checkpoint: arranque en frío. Con checkpoint
     * corrupto: estado por defecto seguro, nunca los pesos corruptos.
     */
    private ModelState ensureLoaded() {
        ModelState loaded = state;
        if (loaded != null) {
            return loaded;
        }
        int f = ClassifierFeatures.FEATURE_COUNT;
        int c = AqiCategory.count();
        try {
            loaded = stateStore.loadActive(f, c).orElse(null);
            if (loaded == null) {
                log.info("No model checkpoint found, cold-starting classifier at v0");
                loaded = ModelState.initial(f, c, 0);
            } else {
                log.info("Classifier resumed from checkpoint v{} ({} samples seen)",
                        loaded.getVersion(), loaded.getSamplesSeen());
            }
        } catch (StateCorruptionException e) {
            long safeVersion = stateStore.maxVersion();
            log.error("!!! PERSISTED MODEL STATE IS CORRUPTED: {}. Refusing to use it; starting from a safe "
                    + "default at v{}. Use the recovery endpoint to restore an earlier checkpoint.",
                    e.getMessage(), safeVersion, e);
            metrics.recordDegradedCycle(TASK, "model state corrupted");
            loaded = ModelState.initial(f, c, safeVersion);
        }
        metrics.recordModelVersion(loaded.getVersion());
        state = loaded;
        return loaded;
    }

    /**
     * Tras una recuperación, version + 1 puede existir ya como checkpoint: se sube por encima
     * de la máxima escrita para que las versiones nunca se repitan.
     */
    private ModelState rebaseVersion(ModelState updated) {
        long max = stateStore.maxVersion();
        if (updated.getVersion() > max) {
            return updated;
        }
        return updated.toBuilder().version(max + 1).build();
    }

    private int writePredictions(List<ReadingEntity> batch, List<ClassDistribution> distributions, long version) {
        List<Long> ids = batch.stream().map(ReadingEntity::getId).toList();
        Set<Long> existing = new HashSet<>(predictionRepository.findExistingReadingIds(ids));
        LocalDateTime now = LocalDateTime.now(clock);

        List<PredictionEntity> rows = new ArrayList<>();
        for (int i = 0; i < batch.size(); i++) {
            ReadingEntity reading = batch.get(i);
            if (existing.contains(reading.getId())) {
                continue;
            }
            ClassDistribution d = distributions.get(i);
            double[] p = d.probabilities();
            rows.add(PredictionEntity.builder()
                    .readingId(reading.getId())
                    .stationId(reading.getStationId())
                    .category(d.category())
                    .confidence(d.confidence())
                    .probGood(p[AqiCategory.GOOD.ordinal()])
                    .probModerate(p[AqiCategory.MODERATE.ordinal()])
                    .probUnhealthy(p[AqiCategory.UNHEALTHY.ordinal()])
                    .probHazardous(p[AqiCategory.HAZARDOUS.ordinal()])
                    .modelVersion(version)
                    .createdAt(now)
                    .build());
        }
        predictionRepository.saveAll(rows);
        return rows.size();
    }

    private Map<String, ReadingSample> previousReadings(List<ReadingEntity> batch, Map<String, String> zoneByStation) {
        Map<String, LocalDateTime> firstByStation = new HashMap<>();
        for (ReadingEntity r : batch) {
            firstByStation.putIfAbsent(r.getStationId(), r.getTimestamp());
        }
        Map<String, ReadingSample> previous = new HashMap<>();
        firstByStation.forEach((stationId, first) -> readingRepository
                .findFirstByStationIdAndTimestampLessThanOrderByTimestampDescIdDesc(stationId, first)
                .ifPresent(r -> previous.put(stationId, toSample(r, zoneByStation.get(stationId)))));
        return previous;
    }

    private static ReadingSample toSample(ReadingEntity r, String zone) {
        return new ReadingSample(r.getId(), r.getStationId(), zone, r.getTimestamp(), r.coreVector());
    }
}
