package smartaqms.analytics.detector;

import smartaqms.domain.alert.DetectionMethod;
import smartaqms.domain.exception.ModelFitException;

/**
 * Capacidad común de los métodos del ensemble: puntuar cada lectura de una ventana.
 */
public interface AnomalyDetector {

    DetectionMethod method();

    /**
     * @throws ModelFitException si el método no puede ajustarse sobre esta ventana; el
     *                           ensemble lo omite en este ciclo
     */
    DetectorResult score(DetectionWindow window) throws ModelFitException;
}
