package smartaqms.compute.config;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Contrato de esquema versionado que el motor exige al almacén relacional.
 * <p>
 * Lo leen también los consumidores externos (dashboard, mapas). Cualquier cambio de tablas,
 * columnas, claves únicas o claves foráneas debe subir {@link #VERSION}.
 */
public final class SchemaContract {

    public static final int VERSION = 4;

    /**
     * Tabla -> columnas obligatorias.
     */
    public static final Map<String, Set<String>> TABLES = tables();

    /**
     * Tabla -> conjuntos de columnas que deben estar cubiertos por un índice único.
     */
    public static final Map<String, List<Set<String>>> UNIQUE_KEYS = Map.of(
            "readings", List.of(Set.of("station_id", "sensor_id", "ts")),
            "alerts", List.of(Set.of("reading_id", "alert_type")),
            "predictions", List.of(Set.of("reading_id")),
            "model_checkpoints", List.of(Set.of("version"))
    );

    /**
     * Referencias obligatorias: ninguna lectura, alerta, predicción o métrica puede apuntar a
     * una estación o lectura inexistente.
     */
    public static final List<ForeignKey> FOREIGN_KEYS = List.of(
            new ForeignKey("readings", "station_id", "stations", "station_id"),
            new ForeignKey("alerts", "reading_id", "readings", "reading_id"),
            new ForeignKey("alerts", "station_id", "stations", "station_id"),
            new ForeignKey("predictions", "reading_id", "readings", "reading_id"),
            new ForeignKey("predictions", "station_id", "stations", "station_id"),
            new ForeignKey("system_metrics", "station_id", "stations", "station_id")
    );

    public record ForeignKey(String table, String column, String referencedTable, String referencedColumn) {
        @Override
        public String toString() {
            return table + "." + column + " -> " + referencedTable + "." + referencedColumn;
        }
    }

    private SchemaContract() {
    }

    private static Map<String, Set<String>> tables() {
        Map<String, Set<String>> t = new LinkedHashMap<>();
        t.put("stations", Set.of("station_id", "name", "zone", "status", "lat", "lon", "created_at", "last_seen_at"));
        t.put("readings", Set.of("reading_id", "station_id", "sensor_id", "ts", "partition_key",
                "pm25", "pm10", "co2", "no2", "o3", "temperature", "humidity", "wind_speed",
                "wind_direction", "pressure", "quality_score", "status"));
        t.put("alerts", Set.of("alert_id", "reading_id", "station_id", "zone", "alert_type", "severity", "status",
                "detection_method", "anomaly_score", "message", "cooldown_key", "created_at",
                "acknowledged_at", "resolved_at"));
        t.put("predictions", Set.of("prediction_id", "reading_id", "station_id", "category", "confidence",
                "prob_good", "prob_moderate", "prob_unhealthy", "prob_hazardous", "model_version", "created_at"));
        t.put("system_metrics", Set.of("metric_id", "metric_name", "metric_value", "metric_unit", "station_id",
                "recorded_at"));
        t.put("model_checkpoints", Set.of("checkpoint_id", "version", "payload", "checksum", "created_at"));
        t.put("model_pointer", Set.of("pointer_id", "version", "updated_at"));
        t.put("watermarks", Set.of("consumer", "station_id", "last_ts", "last_reading_id", "updated_at"));
        return t;
    }
}
