package smartaqms.domain.alert;

/**
 * Ciclo de vida de una alerta.
 * <pre>
 * OPEN -> ACKNOWLEDGED -> RESOLVED
 * OPEN -> RESOLVED
 * </pre>
 * RESOLVED es terminal.
 */
public enum AlertStatus {
    OPEN, ACKNOWLEDGED, RESOLVED;

    public boolean canTransitionTo(AlertStatus target) {
        switch (this) {
            case OPEN:
                return target == ACKNOWLEDGED || target == RESOLVED;
            case ACKNOWLEDGED:
                return target == RESOLVED;
            case RESOLVED:
            default:
                return false;
        }
    }
}
