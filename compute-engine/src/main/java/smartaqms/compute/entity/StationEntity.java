package smartaqms.compute.entity;

import jakarta.persistence.*;
import lombok.*;
import smartaqms.domain.station.StationStatus;

import java.time.LocalDateTime;

/**
 * Estación de medida. Solo cambian {@code status} y {@code lastSeenAt} tras el alta.
 */
@Entity
@Table(name = "stations", indexes = @Index(name = "idx_stations_zone", columnList = "zone"))
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
@ToString
public class StationEntity {

    @Id
    @Column(name = "station_id", length = 64)
    private String id; // código amigable, ej: "ST003"

    @Column(nullable = false)
    private String name;

    @Column(nullable = false, length = 64)
    private String zone;

    @Setter
    @Column(nullable = false, length = 16)
    @Enumerated(EnumType.STRING)
    private StationStatus status;

    @Column(name = "lat", nullable = false)
    private double latitude;

    @Column(name = "lon", nullable = false)
    private double longitude;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;

    @Setter
    @Column(name = "last_seen_at")
    private LocalDateTime lastSeenAt;

    @PrePersist
    protected void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = LocalDateTime.now();
        }
        if (this.status == null) {
            this.status = StationStatus.ACTIVE;
        }
    }
}
