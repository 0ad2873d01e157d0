package smartaqms.domain.dto.station;

public record StationCreationDTO(
        String id,   // código amigable, ej: "ST003"
        String name,
        String zone,
        double latitude,
        double longitude
) {}
