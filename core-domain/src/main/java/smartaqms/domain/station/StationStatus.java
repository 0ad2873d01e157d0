package smartaqms.domain.station;

public enum StationStatus {
    ACTIVE, MAINTENANCE, RETIRED;

    /**
     * Una estación retirada deja de aceptar lecturas; en mantenimiento sigue emitiendo.
     */
    public boolean acceptsReadings() {
        return this != RETIRED;
    }
}
