package smartaqms.compute.entity;

import jakarta.persistence.*;
import lombok.*;
import smartaqms.domain.window.WindowConsumer;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * Marca de agua por (consumidor, estación): última lectura ya procesada, como par (ts, id).
 */
@Entity
@Table(name = "watermarks")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class WatermarkEntity {

    @EmbeddedId
    private Key key;

    @Column(name = "last_ts", nullable = false)
    private LocalDateTime lastTimestamp;

    @Column(name = "last_reading_id", nullable = false)
    private long lastReadingId;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;

    @Embeddable
    @Getter
    @NoArgsConstructor
    @AllArgsConstructor
    @EqualsAndHashCode
    @ToString
    public static class Key implements Serializable {

        @Column(nullable = false, length = 32)
        @Enumerated(EnumType.STRING)
        private WindowConsumer consumer;

        @Column(name = "station_id", nullable = false, length = 64)
        private String stationId;
    }
}
