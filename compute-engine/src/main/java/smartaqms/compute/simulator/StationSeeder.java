package smartaqms.compute.simulator;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.context.annotation.Profile;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;
import smartaqms.compute.repository.StationRepository;
import smartaqms.compute.service.StationService;
import smartaqms.domain.dto.station.StationCreationDTO;

import java.util.List;

/**
 * Alta de la red de estaciones de demostración cuando el almacén está vacío.
 */
@Slf4j
@Component
@Profile("simulator")
@Order(10)
@RequiredArgsConstructor
public class StationSeeder implements ApplicationRunner {

    static final List<StationCreationDTO> DEMO_STATIONS = List.of(
            new StationCreationDTO("ST001", "Downtown Central", "Downtown", 40.7128, -74.0060),
            new StationCreationDTO("ST002", "Uptown Residential", "Uptown", 40.7870, -73.9754),
            new StationCreationDTO("ST003", "Industrial Zone", "Industrial", 40.6782, -73.9442),
            new StationCreationDTO("ST004", "Harbor Waterfront", "Harbor", 40.7003, -74.0122),
            new StationCreationDTO("ST005", "Central Park", "Park", 40.7712, -73.9742),
            new StationCreationDTO("ST006", "Industrial East", "Industrial", 40.6810, -73.9300)
    );

    private final StationRepository stationRepository;
    private final StationService stationService;

    @Override
    public void run(ApplicationArguments args) {
        if (stationRepository.count() > 0) {
            log.info("Simulator: {} stations already registered, skipping seed", stationRepository.count());
            return;
        }
        DEMO_STATIONS.forEach(stationService::register);
        log.info("Simulator: seeded {} demo stations", DEMO_STATIONS.size());
    }
}
