package smartaqms.domain.dto.reading;

public record RejectionDTO(
        int index,
        String stationId,
        String field,
        String reason
) {}
