package smartaqms.compute.simulator;

import lombok.extern.slf4j.Slf4j;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.TaskScheduler;
import smartaqms.compute.AbstractStoreIntegrationTest;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.service.ReadingIngestor;
import smartaqms.compute.service.StationService;
import smartaqms.domain.dto.reading.IngestResultDTO;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

@Slf4j
class SyntheticReadingFeederTest extends AbstractStoreIntegrationTest {

    @Autowired
    private ReadingIngestor ingestor;
    @Autowired
    private StationService stationService;
    @Autowired
    private TaskScheduler taskScheduler;
    @Autowired
    private AqmsProperties properties;

    @Test
    @DisplayName("Simulador: siembra la red de demostración y genera lotes que pasan la validación")
    void seededNetwork_producesValidBatches() throws Exception {
        StationSeeder seeder = new StationSeeder(stationRepository, stationService);
        seeder.run(null);
        seeder.run(null);
        assertEquals(StationSeeder.DEMO_STATIONS.size(), stationRepository.count());

        SyntheticReadingFeeder feeder = new SyntheticReadingFeeder(ingestor, stationRepository, taskScheduler,
                properties, clock);
        IngestResultDTO result = feeder.feedBatch();
        log.info("Synthetic batch: {} accepted, {} rejected", result.accepted(), result.rejected());

        assertEquals(0, result.rejected());
        assertThat(result.accepted()).isPositive().isLessThanOrEqualTo(properties.getIngest().getBatchSize());
        assertEquals(result.accepted(), readingRepository.count());
    }
}
