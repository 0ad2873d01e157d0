package smartaqms.domain.dto.reading;

import lombok.Builder;

import java.util.List;

/**
 * Resultado de un lote. Los duplicados (reenvíos ya persistidos) no cuentan como rechazos.
 */
@Builder
public record IngestResultDTO(
        int accepted,
        int rejected,
        int duplicates,
        List<RejectionDTO> rejections
) {
    public static IngestResultDTO empty() {
        return new IngestResultDTO(0, 0, 0, List.of());
    }
}
