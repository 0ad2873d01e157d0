package smartaqms.compute.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import smartaqms.analytics.classifier.ModelState;
import smartaqms.compute.entity.ModelCheckpointEntity;
import smartaqms.compute.entity.ModelPointerEntity;
import smartaqms.compute.repository.ModelCheckpointRepository;
import smartaqms.compute.repository.ModelPointerRepository;
import smartaqms.domain.exception.StateCorruptionException;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.time.Clock;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;

/**
 * Persistencia atómica de {@link ModelState}: se escribe un checkpoint nuevo (inmutable, con
 * checksum) y después se mueve el puntero activo, ambos en la transacción del llamador. Un
 * fallo a mitad deja el puntero en el checkpoint anterior, nunca en un estado a medias.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class ModelStateStore {

    private final ModelCheckpointRepository checkpointRepository;
    private final ModelPointerRepository pointerRepository;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    /**
     * Estado apuntado por el puntero activo, o vacío si nunca se guardó ninguno.
     *
     * @throws StateCorruptionException si el puntero existe pero su checkpoint no es fiable
     */
    public Optional<ModelState> loadActive(int featureCount, int classCount) throws StateCorruptionException {
        Optional<ModelPointerEntity> pointer = pointerRepository.findById(ModelPointerEntity.ACTIVE);
        if (pointer.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(load(pointer.get().getVersion(), featureCount, classCount));
    }

    public ModelState load(long version, int featureCount, int classCount) throws StateCorruptionException {
        ModelCheckpointEntity checkpoint = checkpointRepository.findByVersion(version)
                .orElseThrow(() -> new StateCorruptionException("No checkpoint for model version " + version));

        if (!calculateHash(checkpoint.getPayload()).equals(checkpoint.getChecksum())) {
            throw new StateCorruptionException("Checksum mismatch for model version " + version);
        }
        ModelState state;
        try {
            state = objectMapper.readValue(checkpoint.getPayload(), ModelState.class);
        } catch (JsonProcessingException | RuntimeException e) {
            throw new StateCorruptionException("Unreadable checkpoint for model version " + version, e);
        }
        if (state == null || state.getVersion() != version) {
            throw new StateCorruptionException("Checkpoint " + version + " holds version "
                    + (state == null ? "null" : state.getVersion()));
        }
        state.validate(featureCount, classCount);
        return state;
    }

    /**
     * Escribe el checkpoint y mueve el puntero. Debe ejecutarse dentro de una transacción.
     */
    public void checkpoint(ModelState state) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(state);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize model version " + state.getVersion(), e);
        }
        LocalDateTime now = LocalDateTime.now(clock);
        checkpointRepository.save(ModelCheckpointEntity.builder()
                .version(state.getVersion())
                .payload(payload)
                .checksum(calculateHash(payload))
                .createdAt(now)
                .build());
        pointTo(state.getVersion());
        log.debug("Checkpointed model version {} ({} chars)", state.getVersion(), payload.length());
    }

    /**
     * Mueve el puntero activo a un checkpoint existente. Debe ejecutarse dentro de una transacción.
     */
    public void pointTo(long version) {
        ModelPointerEntity pointer = pointerRepository.findById(ModelPointerEntity.ACTIVE)
                .orElseGet(() -> ModelPointerEntity.builder().id(ModelPointerEntity.ACTIVE).build());
        pointer.setVersion(version);
        pointer.setUpdatedAt(LocalDateTime.now(clock));
        pointerRepository.save(pointer);
    }

    /**
     * Versión más alta jamás escrita (0 si no hay checkpoints).
     */
    public long maxVersion() {
        Long max = checkpointRepository.findMaxVersion();
        return max == null ? 0L : max;
    }

    public List<Long> recentVersions() {
        return checkpointRepository.findTop20ByOrderByVersionDesc().stream()
                .map(ModelCheckpointEntity::getVersion)
                .toList();
    }

    private static String calculateHash(String input) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            byte[] encodedhash = digest.digest(input.getBytes(StandardCharsets.UTF_8));
            return bytesToHex(encodedhash);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException(e);
        }
    }

    private static String bytesToHex(byte[] hash) {
        StringBuilder hexString = new StringBuilder(2 * hash.length);
        for (byte b : hash) {
            String hex = Integer.toHexString(0xff & b);
            if (hex.length() == 1) {
                hexString.append('0');
            }
            hexString.append(hex);
        }
        return hexString.toString();
    }
}
