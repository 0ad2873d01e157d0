package smartaqms.compute.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import smartaqms.compute.repository.ReadingRepository;
import smartaqms.compute.service.ReadingIngestor;
import smartaqms.domain.dto.reading.IngestResultDTO;
import smartaqms.domain.dto.reading.ReadingDTO;
import smartaqms.domain.dto.reading.ReadingSubmissionDTO;

import java.util.List;

@RestController
@RequestMapping("/api/readings")
@RequiredArgsConstructor
@Tag(name = "Lecturas", description = "Ingesta por lotes y consulta de lecturas")
public class ReadingController {

    private final ReadingIngestor ingestor;
    private final ReadingRepository readingRepository;

    /**
     * Los rechazos parciales no son error: se devuelven en el cuerpo con 200.
     * Solo un almacén caído tras los reintentos responde 503 y el lote debe reenviarse entero.
     */
    @PostMapping("/batch")
    @Operation(summary = "Ingerir un lote de lecturas (idempotente por estación+sensor+timestamp)")
    public IngestResultDTO ingest(@RequestBody List<ReadingSubmissionDTO> batch) {
        return ingestor.ingest(batch);
    }

    @GetMapping("/station/{stationId}")
    @Operation(summary = "Últimas 100 lecturas de una estación")
    public List<ReadingDTO> latest(@PathVariable String stationId) {
        return readingRepository.findTop100ByStationIdOrderByTimestampDesc(stationId).stream()
                .map(ApiMapper::toDto)
                .toList();
    }
}
