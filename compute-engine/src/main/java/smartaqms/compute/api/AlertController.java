package smartaqms.compute.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.web.bind.annotation.*;
import smartaqms.compute.repository.AlertRepository;
import smartaqms.compute.service.AlertManager;
import smartaqms.domain.alert.AlertStatus;
import smartaqms.domain.dto.PaginatedResponse;
import smartaqms.domain.dto.alert.AlertDTO;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;

@Slf4j
@RestController
@RequestMapping("/api/alerts")
@RequiredArgsConstructor
@Tag(name = "Alertas", description = "Alertas generadas por el detector y su ciclo de vida")
public class AlertController {

    private final AlertRepository alertRepository;
    private final AlertManager alertManager;
    private final Clock clock;

    @GetMapping
    @Operation(summary = "Obtener alertas paginadas por fecha (opcionalmente filtradas por estado)")
    public PaginatedResponse<AlertDTO> getAlerts(
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime start,
            @RequestParam(required = false) @DateTimeFormat(iso = DateTimeFormat.ISO.DATE_TIME) LocalDateTime end,
            @RequestParam(required = false) List<AlertStatus> status,
            @RequestParam(defaultValue = "0") int page,
            @RequestParam(defaultValue = "10") int size) {

        if (end == null)
            end = LocalDateTime.now(clock);
        if (start == null)
            start = end.minusMonths(1);

        log.debug("Fetching alerts between {} and {} page={} status={}", start, end, page, status);
        PageRequest pageable = PageRequest.of(page, size, Sort.by("createdAt").descending());
        var entities = status == null || status.isEmpty()
                ? alertRepository.findByCreatedAtBetween(start, end, pageable)
                : alertRepository.findByCreatedAtBetweenAndStatusIn(start, end, status, pageable);

        return ApiMapper.toPage(entities.map(ApiMapper::toDto));
    }

    @GetMapping("/active")
    @Operation(summary = "Obtener alertas activas (OPEN y ACKNOWLEDGED)")
    public List<AlertDTO> getActiveAlerts() {
        return alertRepository.findByStatusInOrderByCreatedAtDesc(List.of(AlertStatus.OPEN, AlertStatus.ACKNOWLEDGED))
                .stream()
                .map(ApiMapper::toDto)
                .toList();
    }

    @PostMapping("/{id}/ack")
    @Operation(summary = "Reconocer (Acknowledge) una alerta")
    public AlertDTO acknowledgeAlert(@PathVariable String id) {
        return ApiMapper.toDto(alertManager.acknowledge(id));
    }

    @PostMapping("/{id}/resolve")
    @Operation(summary = "Resolver una alerta")
    public AlertDTO resolveAlert(@PathVariable String id) {
        return ApiMapper.toDto(alertManager.resolve(id));
    }
}
