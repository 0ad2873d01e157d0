package smartaqms.compute.entity;

import jakarta.persistence.*;
import lombok.*;

import java.time.LocalDateTime;

/**
 * Puntero (fila única) a la versión de checkpoint activa.
 */
@Entity
@Table(name = "model_pointer")
@Getter
@Setter
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ModelPointerEntity {

    public static final String ACTIVE = "active";

    @Id
    @Column(name = "pointer_id", length = 16)
    private String id;

    @Column(nullable = false)
    private long version;

    @Column(name = "updated_at", nullable = false)
    private LocalDateTime updatedAt;
}
