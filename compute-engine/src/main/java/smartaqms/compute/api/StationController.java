package smartaqms.compute.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import smartaqms.compute.service.StationService;
import smartaqms.domain.dto.station.StationCreationDTO;
import smartaqms.domain.dto.station.StationDTO;
import smartaqms.domain.station.StationStatus;

import java.util.List;

@RestController
@RequestMapping("/api/stations")
@RequiredArgsConstructor
@Tag(name = "Estaciones", description = "Alta y estado de las estaciones de medida")
public class StationController {

    private final StationService stationService;

    @GetMapping
    @Operation(summary = "Listar estaciones (opcionalmente de una zona)")
    public List<StationDTO> list(@RequestParam(required = false) String zone) {
        return stationService.list(zone).stream().map(ApiMapper::toDto).toList();
    }

    @GetMapping("/{id}")
    @Operation(summary = "Obtener una estación")
    public StationDTO get(@PathVariable String id) {
        return ApiMapper.toDto(stationService.get(id));
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    @Operation(summary = "Registrar una estación")
    public StationDTO register(@RequestBody StationCreationDTO dto) {
        return ApiMapper.toDto(stationService.register(dto));
    }

    @PutMapping("/{id}/status")
    @Operation(summary = "Cambiar el estado de una estación (ACTIVE, MAINTENANCE, RETIRED)")
    public StationDTO changeStatus(@PathVariable String id, @RequestParam StationStatus status) {
        return ApiMapper.toDto(stationService.changeStatus(id, status));
    }
}
