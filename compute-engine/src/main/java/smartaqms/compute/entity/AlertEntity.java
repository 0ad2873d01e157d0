package smartaqms.compute.entity;

import jakarta.persistence.*;
import lombok.*;
import smartaqms.domain.alert.AlertSeverity;
import smartaqms.domain.alert.AlertStatus;
import smartaqms.domain.alert.DetectionMethod;

import java.time.LocalDateTime;

/**
 * Alerta sobre una lectura concreta. La severidad se fija al crearla; solo el
 * {@link smartaqms.compute.service.AlertManager} cambia su estado.
 */
@Entity
@Table(name = "alerts",
        uniqueConstraints = @UniqueConstraint(name = "uk_alerts_reading_type",
                columnNames = {"reading_id", "alert_type"}),
        indexes = {
                @Index(name = "idx_alerts_cooldown", columnList = "cooldown_key, alert_type, status, created_at"),
                @Index(name = "idx_alerts_created", columnList = "created_at")
        })
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class AlertEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "alert_id", length = 36)
    private String id;

    @Column(name = "reading_id", nullable = false, updatable = false)
    private Long readingId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "reading_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_alerts_reading"))
    @com.fasterxml.jackson.annotation.JsonIgnore
    @ToString.Exclude
    private ReadingEntity reading;

    @Column(name = "station_id", nullable = false, length = 64, updatable = false)
    private String stationId;

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "station_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_alerts_station"))
    @com.fasterxml.jackson.annotation.JsonIgnore
    @ToString.Exclude
    private StationEntity station;

    @Column(nullable = false, length = 64, updatable = false)
    private String zone;

    @Column(name = "alert_type", nullable = false, length = 50, updatable = false)
    private String alertType; // ej: "PM25_ANOMALY", "CO2_LIMIT"

    @Setter(AccessLevel.NONE)
    @Column(nullable = false, length = 16, updatable = false)
    @Enumerated(EnumType.STRING)
    private AlertSeverity severity;

    @Column(nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private AlertStatus status;

    @Column(name = "detection_method", nullable = false, length = 16, updatable = false)
    @Enumerated(EnumType.STRING)
    private DetectionMethod detectionMethod;

    @Column(name = "anomaly_score", nullable = false, updatable = false)
    private double anomalyScore;

    @Column(nullable = false, length = 512, updatable = false)
    private String message;

    /**
     * Clave de ámbito del cooldown ("zone:Industrial" o "station:ST001").
     */
    @Column(name = "cooldown_key", nullable = false, length = 80, updatable = false)
    private String cooldownKey;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Column(name = "acknowledged_at")
    private LocalDateTime acknowledgedAt;

    @Column(name = "resolved_at")
    private LocalDateTime resolvedAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        if (this.status == null) {
            this.status = AlertStatus.OPEN;
        }
    }
}
