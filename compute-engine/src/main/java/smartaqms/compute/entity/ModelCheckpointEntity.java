package smartaqms.compute.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Checkpoint inmutable de un ModelState serializado. Se escribe siempre una fila nueva;
 * el estado activo lo decide {@link ModelPointerEntity}.
 */
@Entity
@Table(name = "model_checkpoints")
@Getter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelCheckpointEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "checkpoint_id")
    private Long id;

    @Column(nullable = false, unique = true, updatable = false)
    private long version;

    @Column(nullable = false, length = 65535, updatable = false)
    private String payload; // JSON del ModelState

    /**
     * SHA-256 hex del payload, para detectar checkpoints corruptos.
     */
    @Column(nullable = false, length = 64, updatable = false)
    private String checksum;

    @Column(name = "created_at", nullable = false, updatable = false)
    private LocalDateTime createdAt;
}
