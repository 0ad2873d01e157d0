package smartaqms.domain.alert;

/**
 * Severidad de una alerta, ordenada de menor a mayor.
 * <p>
 * Se deriva de la puntuación normalizada máxima (1.0 = umbral de detección) mediante
 * umbrales fijos, de modo que la severidad es monótona no decreciente en la puntuación.
 */
public enum AlertSeverity {
    LOW, MODERATE, HIGH, CRITICAL;

    public static final double MODERATE_FROM = 1.5;
    public static final double HIGH_FROM = 2.0;
    public static final double CRITICAL_FROM = 3.0;

    public static AlertSeverity fromNormalizedScore(double score) {
        if (Double.isNaN(score)) return LOW;
        if (score >= CRITICAL_FROM) return CRITICAL;
        if (score >= HIGH_FROM) return HIGH;
        if (score >= MODERATE_FROM) return MODERATE;
        return LOW;
    }

    public boolean isAtLeast(AlertSeverity other) {
        return this.compareTo(other) >= 0;
    }
}
