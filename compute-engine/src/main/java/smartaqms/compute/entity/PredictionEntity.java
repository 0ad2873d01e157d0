package smartaqms.compute.entity;

import jakarta.persistence.*;
import lombok.*;
import smartaqms.domain.prediction.AqiCategory;

import java.time.LocalDateTime;

/**
 * Predicción del clasificador para una lectura (1:1, única por {@code reading_id}). Inmutable.
 */
@Entity
@Table(name = "predictions",
        uniqueConstraints = @UniqueConstraint(name = "uk_predictions_reading", columnNames = "reading_id"),
        indexes = @Index(name = "idx_predictions_station", columnList = "station_id, created_at"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class PredictionEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "prediction_id")
    private Long id;

    @Column(name = "reading_id", nullable = false, updatable = false)
    private Long readingId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "reading_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_predictions_reading"))
    @com.fasterxml.jackson.annotation.JsonIgnore
    private ReadingEntity reading;

    @Column(name = "station_id", nullable = false, length = 64, updatable = false)
    private String stationId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "station_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_predictions_station"))
    @com.fasterxml.jackson.annotation.JsonIgnore
    private StationEntity station;

    @Column(nullable = false, length = 16, updatable = false)
    @Enumerated(EnumType.STRING)
    private AqiCategory category;

    @Column(nullable = false, updatable = false)
    private double confidence;

    // Distribución completa, una columna por clase
    @Column(name = "prob_good", nullable = false, updatable = false)
    private double probGood;

    @Column(name = "prob_moderate", nullable = false, updatable = false)
    private double probModerate;

    @Column(name = "prob_unhealthy", nullable = false, updatable = false)
    private double probUnhealthy;

    @Column(name = "prob_hazardous", nullable = false, updatable = false)
    private double probHazardous;

    @Column(name = "model_version", nullable = false, updatable = false)
    private long modelVersion;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
    }

    public double[] probabilities() {
        return new double[]{probGood, probModerate, probUnhealthy, probHazardous};
    }
}
