package smartaqms.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import smartaqms.compute.entity.StationEntity;
import smartaqms.compute.repository.StationRepository;
import smartaqms.domain.dto.station.StationCreationDTO;
import smartaqms.domain.exception.ResourceNotFoundException;
import smartaqms.domain.station.StationStatus;

import java.util.List;

@Slf4j
@Service
@RequiredArgsConstructor
public class StationService {

    private final StationRepository stationRepository;

    /**
     * Alta de una estación. La identidad y la zona no cambian después.
     */
    @Transactional
    public StationEntity register(StationCreationDTO dto) {
        if (dto.id() == null || dto.id().isBlank()) {
            throw new IllegalArgumentException("Station id is required");
        }
        if (dto.zone() == null || dto.zone().isBlank()) {
            throw new IllegalArgumentException("Station zone is required");
        }
        if (Math.abs(dto.latitude()) > 90.0 || Math.abs(dto.longitude()) > 180.0) {
            throw new IllegalArgumentException("Invalid coordinates " + dto.latitude() + ", " + dto.longitude());
        }
        if (stationRepository.existsById(dto.id())) {
            throw new IllegalArgumentException("Station already exists: " + dto.id());
        }
        StationEntity station = stationRepository.save(StationEntity.builder()
                .id(dto.id())
                .name(dto.name() == null || dto.name().isBlank() ? dto.id() : dto.name())
                .zone(dto.zone())
                .status(StationStatus.ACTIVE)
                .latitude(dto.latitude())
                .longitude(dto.longitude())
                .build());
        log.info("Registered station {} in zone {}", station.getId(), station.getZone());
        return station;
    }

    @Transactional
    public StationEntity changeStatus(String stationId, StationStatus status) {
        StationEntity station = get(stationId);
        if (station.getStatus() == StationStatus.RETIRED && status != StationStatus.RETIRED) {
            throw new IllegalArgumentException("Station " + stationId + " is retired");
        }
        log.info("Station {} {} -> {}", stationId, station.getStatus(), status);
        station.setStatus(status);
        return stationRepository.save(station);
    }

    public StationEntity get(String stationId) {
        return stationRepository.findById(stationId)
                .orElseThrow(() -> new ResourceNotFoundException("Station not found: " + stationId));
    }

    public List<StationEntity> list(String zone) {
        if (zone != null && !zone.isBlank()) {
            return stationRepository.findByZoneOrderByIdAsc(zone);
        }
        return stationRepository.findAll();
    }
}
