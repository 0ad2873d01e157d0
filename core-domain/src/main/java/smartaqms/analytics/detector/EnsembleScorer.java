package smartaqms.analytics.detector;

import lombok.extern.slf4j.Slf4j;
import smartaqms.config.DetectorConfig;
import smartaqms.domain.alert.DetectionMethod;
import smartaqms.domain.exception.ModelFitException;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Ensemble cerrado de detectores (estadístico + densidad) con regla de fusión fija:
 * una lectura es anómala si CUALQUIER método la marca, y su puntuación es el máximo
 * normalizado de los métodos que se pudieron ejecutar.
 * <p>
 * Si un método no puede ajustarse se omite y el ciclo queda degradado; los demás deciden solos.
 */
@Slf4j
public class EnsembleScorer {

    private final List<AnomalyDetector> detectors;

    public EnsembleScorer(DetectorConfig config) {
        this(List.of(new ZScoreDetector(config), new IsolationForestDetector(config)));
    }

    EnsembleScorer(List<AnomalyDetector> detectors) {
        this.detectors = List.copyOf(detectors);
    }

    public EnsembleOutcome evaluate(DetectionWindow window) {
        Map<DetectionMethod, String> skipped = new EnumMap<>(DetectionMethod.class);
        if (window.isEmpty()) {
            return new EnsembleOutcome(List.of(), skipped);
        }

        List<DetectorResult> results = new ArrayList<>(detectors.size());
        for (AnomalyDetector detector : detectors) {
            try {
                results.add(detector.score(window));
            } catch (ModelFitException e) {
                log.warn("Detector {} skipped for this window: {}", detector.method(), e.getMessage());
                skipped.put(detector.method(), e.getMessage());
            }
        }

        List<AnomalyVerdict> verdicts = new ArrayList<>(window.size());
        for (int i = 0; i < window.size(); i++) {
            verdicts.add(fuse(i, results));
        }
        return new EnsembleOutcome(verdicts, skipped);
    }

    private static AnomalyVerdict fuse(int index, List<DetectorResult> results) {
        double maxScore = 0.0;
        int dominantFeature = -1;
        boolean statistical = false;
        boolean density = false;

        for (DetectorResult result : results) {
            maxScore = Math.max(maxScore, result.normalizedScores()[index]);
            if (result.method() == DetectionMethod.STATISTICAL) {
                dominantFeature = result.dominantFeatures()[index];
                statistical = result.isFlagged(index);
            } else if (result.method() == DetectionMethod.DENSITY) {
                density = result.isFlagged(index);
            }
        }

        DetectionMethod method = null;
        if (statistical && density) {
            method = DetectionMethod.ENSEMBLE;
        } else if (statistical) {
            method = DetectionMethod.STATISTICAL;
        } else if (density) {
            method = DetectionMethod.DENSITY;
        }
        return new AnomalyVerdict(index, method != null, maxScore, method, dominantFeature);
    }
}
