package smartaqms.domain.alert;

/**
 * Origen de una alerta. STATISTICAL y DENSITY son los dos métodos del ensemble;
 * ENSEMBLE indica que ambos marcaron la lectura; RULE son los límites fijos.
 */
public enum DetectionMethod {
    STATISTICAL, DENSITY, ENSEMBLE, RULE
}
