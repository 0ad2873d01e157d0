package smartaqms.domain.dto.model;

import java.util.List;

/**
 * Vista de solo lectura del estado del clasificador. Los pesos no se exponen.
 */
public record ModelInfoDTO(
        long version,
        long samplesSeen,
        long stepCount,
        List<Long> recentCheckpoints
) {}
