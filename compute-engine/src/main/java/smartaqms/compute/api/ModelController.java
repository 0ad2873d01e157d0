package smartaqms.compute.api;

import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import lombok.RequiredArgsConstructor;
import org.springframework.web.bind.annotation.*;
import smartaqms.analytics.classifier.ModelState;
import smartaqms.compute.service.ModelStateStore;
import smartaqms.compute.service.OnlineClassifierService;
import smartaqms.domain.dto.model.ModelInfoDTO;
import smartaqms.domain.exception.StateCorruptionException;

@RestController
@RequestMapping("/api/model")
@RequiredArgsConstructor
@Tag(name = "Modelo", description = "Versión del clasificador online y recuperación de checkpoints")
public class ModelController {

    private final OnlineClassifierService classifierService;
    private final ModelStateStore stateStore;

    @GetMapping
    @Operation(summary = "Versión activa del modelo y checkpoints recientes")
    public ModelInfoDTO info() {
        return toInfo(classifierService.currentState());
    }

    @PostMapping("/recover/{version}")
    @Operation(summary = "Restaurar explícitamente un checkpoint anterior")
    public ModelInfoDTO recover(@PathVariable long version) throws StateCorruptionException {
        return toInfo(classifierService.recoverTo(version));
    }

    private ModelInfoDTO toInfo(ModelState state) {
        return new ModelInfoDTO(state.getVersion(), state.getSamplesSeen(), state.getStepCount(),
                stateStore.recentVersions());
    }
}
