package smartaqms.compute.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.web.bind.annotation.*;
import smartaqms.compute.repository.PredictionRepository;
import smartaqms.domain.dto.prediction.PredictionDTO;
import smartaqms.domain.exception.ResourceNotFoundException;

import java.util.List;

@RestController
@RequestMapping("/api/predictions")
@RequiredArgsConstructor
@Tag(name = "Predicciones", description = "Categoría AQI estimada por lectura")
public class PredictionController {

    private final PredictionRepository predictionRepository;

    @GetMapping("/reading/{readingId}")
    @Operation(summary = "Predicción de una lectura")
    public PredictionDTO byReading(@PathVariable Long readingId) {
        return predictionRepository.findByReadingId(readingId)
                .map(ApiMapper::toDto)
                .orElseThrow(() -> new ResourceNotFoundException("No prediction for reading " + readingId));
    }

    @GetMapping("/station/{stationId}")
    @Operation(summary = "Últimas predicciones de una estación")
    public List<PredictionDTO> byStation(@PathVariable String stationId,
                                         @RequestParam(defaultValue = "50") int limit) {
        return predictionRepository.findByStationIdOrderByCreatedAtDesc(stationId, PageRequest.of(0, limit))
                .stream()
                .map(ApiMapper::toDto)
                .toList();
    }
}
