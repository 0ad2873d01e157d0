package smartaqms.compute.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

@Entity
@Table(name = "system_metrics",
        indexes = @Index(name = "idx_metrics_name_time", columnList = "metric_name, recorded_at"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SystemMetricEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "metric_id")
    private Long id;

    @Column(name = "metric_name", nullable = false, length = 80)
    private String metricName;

    @Column(name = "metric_value", nullable = false)
    private double metricValue;

    @Column(name = "metric_unit", length = 32)
    private String metricUnit;

    @Column(name = "station_id", length = 64)
    private String stationId; // null = métrica global

    @ManyToOne(fetch = FetchType.LAZY)
    @JoinColumn(name = "station_id", insertable = false, updatable = false,
            foreignKey = @ForeignKey(name = "fk_system_metrics_station"))
    @com.fasterxml.jackson.annotation.JsonIgnore
    private StationEntity station;

    @Column(name = "recorded_at", nullable = false)
    private LocalDateTime recordedAt;
}
