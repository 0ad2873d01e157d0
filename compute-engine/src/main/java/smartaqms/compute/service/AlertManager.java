package smartaqms.compute.service;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.transaction.support.TransactionTemplate;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.AlertEntity;
import smartaqms.compute.repository.AlertRepository;
import smartaqms.domain.alert.AlertStatus;
import smartaqms.domain.exception.IllegalAlertTransitionException;
import smartaqms.domain.exception.ResourceNotFoundException;

import java.time.Clock;
import java.time.LocalDateTime;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Dueño del ciclo de vida de las alertas.
 * <p>
 * Creación: la comprobación de cooldown y la inserción forman una unidad atómica. Se serializan
 * por (ámbito, tipo) con un cerrojo en memoria y se confirman en una transacción propia antes
 * de soltarlo, de modo que dos ciclos concurrentes nunca abren dos alertas para la misma clave.
 * <p>
 * Transiciones: {@code OPEN -> ACKNOWLEDGED -> RESOLVED} y {@code OPEN -> RESOLVED}. La
 * resolución es siempre externa (operador o política fuera del motor).
 */
@Slf4j
@Service
public class AlertManager {

    private final AlertRepository alertRepository;
    private final AqmsProperties properties;
    private final MetricsRecorder metrics;
    private final Clock clock;
    private final TransactionTemplate requiresNew;

    /**
     * Un cerrojo por (clave de cooldown, tipo de alerta). Los tipos salen de un conjunto cerrado
     * (anomalía por magnitud core y límites fijos), así que el mapa queda acotado por
     * zonas (o estaciones, según el ámbito) x tipos. Las entradas no se eliminan nunca: un hilo
     * puede seguir sincronizado sobre el objeto.
     */
    private final ConcurrentMap<String, Object> locks = new ConcurrentHashMap<>();

    public AlertManager(AlertRepository alertRepository, AqmsProperties properties, MetricsRecorder metrics,
                        Clock clock, PlatformTransactionManager transactionManager) {
        this.alertRepository = alertRepository;
        this.properties = properties;
        this.metrics = metrics;
        this.clock = clock;
        this.requiresNew = new TransactionTemplate(transactionManager);
        this.requiresNew.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Crea la alerta salvo que ya exista una para la misma lectura y tipo, o una OPEN con la
     * misma clave de cooldown creada dentro del periodo de cooldown.
     *
     * @return la alerta creada, o vacío si se suprimió
     */
    public Optional<AlertEntity> raise(AlertCandidate candidate) {
        String scopeKey = cooldownKey(candidate);
        Object lock = locks.computeIfAbsent(scopeKey + "|" + candidate.alertType(), k -> new Object());
        synchronized (lock) {
            try {
                return requiresNew.execute(status -> insertUnlessCoolingDown(candidate, scopeKey));
            } catch (DataIntegrityViolationException e) {
                log.debug("Alert {} for reading {} already stored", candidate.alertType(), candidate.readingId());
                return Optional.empty();
            }
        }
    }

    private Optional<AlertEntity> insertUnlessCoolingDown(AlertCandidate candidate, String scopeKey) {
        if (alertRepository.existsByReadingIdAndAlertType(candidate.readingId(), candidate.alertType())) {
            return Optional.empty();
        }
        LocalDateTime now = LocalDateTime.now(clock);
        LocalDateTime cutoff = now.minus(properties.getAlert().getCooldown());
        if (alertRepository.existsByCooldownKeyAndAlertTypeAndStatusAndCreatedAtAfter(
                scopeKey, candidate.alertType(), AlertStatus.OPEN, cutoff)) {
            metrics.recordAlertSuppressed();
            log.debug("Suppressed {} for {} (reading {}): open alert within cooldown",
                    candidate.alertType(), scopeKey, candidate.readingId());
            return Optional.empty();
        }

        AlertEntity alert = AlertEntity.builder()
                .readingId(candidate.readingId())
                .stationId(candidate.stationId())
                .zone(candidate.zone())
                .alertType(candidate.alertType())
                .severity(candidate.severity())
                .status(AlertStatus.OPEN)
                .detectionMethod(candidate.method())
                .anomalyScore(candidate.score())
                .message(candidate.message())
                .cooldownKey(scopeKey)
                .createdAt(now)
                .build();
        AlertEntity saved = alertRepository.saveAndFlush(alert);
        metrics.recordAlertRaised();
        log.info("Alert generated for station {} ({}): [{}] {}", candidate.stationId(), candidate.alertType(),
                candidate.severity(), candidate.message());
        return Optional.of(saved);
    }

    @Transactional
    public AlertEntity acknowledge(String alertId) {
        AlertEntity alert = find(alertId);
        transition(alert, AlertStatus.ACKNOWLEDGED);
        alert.setAcknowledgedAt(LocalDateTime.now(clock));
        return alertRepository.save(alert);
    }

    @Transactional
    public AlertEntity resolve(String alertId) {
        AlertEntity alert = find(alertId);
        transition(alert, AlertStatus.RESOLVED);
        alert.setResolvedAt(LocalDateTime.now(clock));
        return alertRepository.save(alert);
    }

    String cooldownKey(AlertCandidate candidate) {
        if (properties.getAlert().getCooldownScope() == AqmsProperties.Alert.CooldownScope.STATION) {
            return "station:" + candidate.stationId();
        }
        return "zone:" + candidate.zone();
    }

    int lockCount() {
        return locks.size();
    }

    private AlertEntity find(String alertId) {
        return alertRepository.findById(alertId)
                .orElseThrow(() -> new ResourceNotFoundException("Alert not found: " + alertId));
    }

    private static void transition(AlertEntity alert, AlertStatus target) {
        if (!alert.getStatus().canTransitionTo(target)) {
            throw new IllegalAlertTransitionException(alert.getId(), alert.getStatus(), target);
        }
        log.info("Alert {} {} -> {}", alert.getId(), alert.getStatus(), target);
        alert.setStatus(target);
    }
}
