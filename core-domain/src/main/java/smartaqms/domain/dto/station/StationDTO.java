package smartaqms.domain.dto.station;

import lombok.Builder;
import smartaqms.domain.station.StationStatus;

import java.time.LocalDateTime;

@Builder
public record StationDTO(
        String id,
        String name,
        String zone,
        StationStatus status,
        double latitude,
        double longitude,
        LocalDateTime createdAt,
        LocalDateTime lastSeenAt
) {}
