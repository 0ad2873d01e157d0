package smartaqms.compute.entity;

import jakarta.persistence.*;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import lombok.*;
import smartaqms.domain.reading.Quantity;
import smartaqms.domain.reading.ReadingStatus;

import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Lectura persistida. Inmutable una vez escrita: no expone setters.
 * <p>
 * Los límites {@code @DecimalMin/@DecimalMax} replican {@link Quantity} y Hibernate los
 * traduce a restricciones CHECK en la DDL. {@code partitionKey} ("yyyy-MM") es la partición
 * temporal lógica por la que se podan las consultas de ventana.
 */
@Entity
@Table(name = "readings",
        uniqueConstraints = @UniqueConstraint(name = "uk_readings_natural_key",
                columnNames = {"station_id", "sensor_id", "ts"}),
        indexes = {
                @Index(name = "idx_readings_partition", columnList = "partition_key"),
                @Index(name = "idx_readings_station_ts", columnList = "station_id, ts, reading_id")
        })
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReadingEntity {

    public static final DateTimeFormatter PARTITION_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM");

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "reading_id")
    private Long id;

    @Column(name = "station_id", nullable = false, length = 64, updatable = false)
    private String stationId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "station_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_readings_station"))
    @com.fasterxml.jackson.annotation.JsonIgnore
    private StationEntity station;

    @Column(name = "sensor_id", nullable = false, length = 64, updatable = false)
    private String sensorId;

    @Column(name = "ts", nullable = false, updatable = false)
    private LocalDateTime timestamp;

    @Column(name = "partition_key", nullable = false, length = 7, updatable = false)
    private String partitionKey;

    // --- Magnitudes core (obligatorias) ---
    @DecimalMin("0.0") @DecimalMax("1000.0")
    @Column(nullable = false, updatable = false)
    private Double pm25;

    @DecimalMin("0.0") @DecimalMax("10000.0")
    @Column(nullable = false, updatable = false)
    private Double co2;

    @DecimalMin("-60.0") @DecimalMax("60.0")
    @Column(nullable = false, updatable = false)
    private Double temperature;

    @DecimalMin("0.0") @DecimalMax("100.0")
    @Column(nullable = false, updatable = false)
    private Double humidity;

    @DecimalMin("0.0") @DecimalMax("75.0")
    @Column(name = "wind_speed", nullable = false, updatable = false)
    private Double windSpeed;

    // --- Magnitudes opcionales ---
    @DecimalMin("0.0") @DecimalMax("1000.0")
    @Column(updatable = false)
    private Double pm10;

    @DecimalMin("0.0") @DecimalMax("10.0")
    @Column(updatable = false)
    private Double no2;

    @DecimalMin("0.0") @DecimalMax("10.0")
    @Column(updatable = false)
    private Double o3;

    @DecimalMin("0.0") @DecimalMax("360.0")
    @Column(name = "wind_direction", updatable = false)
    private Double windDirection;

    @DecimalMin("800.0") @DecimalMax("1100.0")
    @Column(updatable = false)
    private Double pressure;

    @DecimalMin("0.0") @DecimalMax("1.0")
    @Column(name = "quality_score", nullable = false, updatable = false)
    private Double qualityScore;

    @Column(nullable = false, length = 16, updatable = false)
    @Enumerated(EnumType.STRING)
    private ReadingStatus status;

    @PrePersist
    protected void onCreate() {
        if (this.partitionKey == null && this.timestamp != null) {
            this.partitionKey = partitionOf(this.timestamp);
        }
        if (this.status == null && this.pm25 != null && this.co2 != null) {
            this.status = ReadingStatus.of(this.pm25, this.co2);
        }
    }

    public static String partitionOf(LocalDateTime timestamp) {
        return PARTITION_FORMAT.format(timestamp);
    }

    public Double valueOf(Quantity quantity) {
        switch (quantity) {
            case PM25: return pm25;
            case PM10: return pm10;
            case CO2: return co2;
            case NO2: return no2;
            case O3: return o3;
            case TEMPERATURE: return temperature;
            case HUMIDITY: return humidity;
            case WIND_SPEED: return windSpeed;
            case WIND_DIRECTION: return windDirection;
            case PRESSURE: return pressure;
            default: throw new IllegalArgumentException("Unknown quantity " + quantity);
        }
    }

    /**
     * Vector core en el orden de {@link Quantity#core()}.
     */
    public double[] coreVector() {
        List<Quantity> core = Quantity.core();
        double[] v = new double[core.size()];
        for (int i = 0; i < v.length; i++) {
            v[i] = valueOf(core.get(i));
        }
        return v;
    }
}
