package smartaqms.compute.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.data.domain.PageRequest;
import org.springframework.web.bind.annotation.*;
import smartaqms.compute.repository.SystemMetricRepository;
import smartaqms.domain.dto.metric.SystemMetricDTO;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/metrics")
@RequiredArgsConstructor
@Tag(name = "Métricas", description = "Métricas de sistema registradas periódicamente")
public class MetricsController {

    private final SystemMetricRepository metricRepository;
    private final Clock clock;

    @GetMapping
    @Operation(summary = "Métricas recientes, opcionalmente de un nombre concreto")
    public List<SystemMetricDTO> recent(@RequestParam(required = false) String name,
                                        @RequestParam(defaultValue = "60") int minutes,
                                        @RequestParam(defaultValue = "500") int limit) {
        PageRequest page = PageRequest.of(0, limit);
        var rows = name != null && !name.isBlank()
                ? metricRepository.findByMetricNameOrderByRecordedAtDesc(name, page)
                : metricRepository.findByRecordedAtAfterOrderByRecordedAtDesc(
                        LocalDateTime.now(clock).minusMinutes(minutes), page);
        return rows.stream().map(ApiMapper::toDto).toList();
    }
}
