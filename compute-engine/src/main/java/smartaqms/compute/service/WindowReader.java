package smartaqms.compute.service;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;
import smartaqms.compute.config.AqmsProperties;
import smartaqms.compute.entity.ReadingEntity;
import smartaqms.compute.entity.StationEntity;
import smartaqms.compute.entity.WatermarkEntity;
import smartaqms.compute.repository.ReadingRepository;
import smartaqms.compute.repository.StationRepository;
import smartaqms.compute.repository.WatermarkRepository;
import smartaqms.domain.exception.ResourceNotFoundException;
import smartaqms.domain.station.StationStatus;
import smartaqms.domain.window.WindowConsumer;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;

/**
 * Calcula las lecturas "nuevas desde el último ciclo" por (consumidor, estación).
 * <p>
 * Una lectura entra en la ventana si su (ts, id) es estrictamente posterior a la marca de agua
 * del consumidor, su ts cae dentro de la duración móvil y no está en el futuro. Las marcas solo
 * avanzan con {@link #commit(ReadingWindow)}, que el consumidor llama dentro de la misma
 * transacción en la que persiste sus resultados.
 * <p>
 * Una lectura confirmada por otra transacción después de leer la ventana pero con una clave
 * dentro de su rango no está en la ventana. {@code commit} la detecta y deja la marca justo
 * antes de ella para que el siguiente ciclo la recoja.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class WindowReader {

    private final ReadingRepository readingRepository;
    private final StationRepository stationRepository;
    private final WatermarkRepository watermarkRepository;
    private final MetricsRecorder metrics;
    private final AqmsProperties properties;
    private final Clock clock;

    public ReadingWindow read(WindowConsumer consumer, String stationId, Duration trailing) {
        StationEntity station = stationRepository.findById(stationId)
                .orElseThrow(() -> new ResourceNotFoundException("Station not found: " + stationId));
        return read(consumer, station, trailing, LocalDateTime.now(clock));
    }

    /**
     * Ventanas de todas las estaciones no retiradas de una zona, en orden de estación.
     */
    public List<ReadingWindow> readZone(WindowConsumer consumer, String zone, Duration trailing) {
        LocalDateTime now = LocalDateTime.now(clock);
        List<ReadingWindow> windows = new ArrayList<>();
        for (StationEntity station : stationRepository.findByZoneOrderByIdAsc(zone)) {
            if (station.getStatus() != StationStatus.RETIRED) {
                windows.add(read(consumer, station, trailing, now));
            }
        }
        return windows;
    }

    private ReadingWindow read(WindowConsumer consumer, StationEntity station, Duration trailing, LocalDateTime now) {
        LocalDateTime windowStart = now.minus(trailing);
        WatermarkEntity watermark = watermarkRepository
                .findById(new WatermarkEntity.Key(consumer, station.getId()))
                .orElse(null);

        LocalDateTime afterTs;
        long afterId;
        if (watermark != null && !watermark.getLastTimestamp().isBefore(windowStart)) {
            afterTs = watermark.getLastTimestamp();
            afterId = watermark.getLastReadingId();
        } else {
            // Sin marca o marca más antigua que la ventana: desde el inicio de la ventana, inclusive
            afterTs = windowStart;
            afterId = Long.MIN_VALUE;
        }

        List<ReadingEntity> readings = readingRepository.findWindow(
                station.getId(),
                partitionsBetween(afterTs, now),
                afterTs,
                afterId,
                now,
                PageRequest.of(0, properties.getWindow().getMaxReadings()));

        log.debug("Window {} / {}: {} new readings after ({}, {})",
                consumer, station.getId(), readings.size(), afterTs, afterId);
        return new ReadingWindow(consumer, station.getId(), station.getZone(), windowStart, afterTs, afterId,
                readings);
    }

    /**
     * Avanza la marca de agua al último elemento de la ventana. Nunca retrocede: si la marca
     * guardada ya es posterior (o igual) se deja como está. Si aparecieron lecturas tardías
     * dentro del rango leído, solo avanza hasta la última lectura de la ventana anterior a ellas.
     *
     * @return true si la marca avanzó
     */
    public boolean commit(ReadingWindow window) {
        ReadingEntity last = window.last();
        if (last == null) {
            return false;
        }
        List<ReadingEntity> stragglers = readingRepository.findStragglers(
                window.stationId(),
                partitionsBetween(window.afterTs(), last.getTimestamp()),
                window.afterTs(),
                window.afterId(),
                last.getTimestamp(),
                last.getId(),
                window.readings().stream().map(ReadingEntity::getId).toList());
        if (!stragglers.isEmpty()) {
            ReadingEntity first = stragglers.get(0);
            metrics.recordLateReadings("window", stragglers.size());
            log.warn("Window {} / {}: {} reading(s) committed behind the read cursor, first at ({}, {});"
                            + " holding the watermark before it",
                    window.consumer(), window.stationId(), stragglers.size(), first.getTimestamp(), first.getId());
            last = lastBefore(window.readings(), first);
            if (last == null) {
                return false;
            }
        }

        WatermarkEntity.Key key = new WatermarkEntity.Key(window.consumer(), window.stationId());
        WatermarkEntity current = watermarkRepository.findById(key).orElse(null);

        if (current != null && !isAfter(last.getTimestamp(), last.getId(),
                current.getLastTimestamp(), current.getLastReadingId())) {
            log.debug("Watermark {} not advanced: ({}, {}) is not after ({}, {})", key,
                    last.getTimestamp(), last.getId(), current.getLastTimestamp(), current.getLastReadingId());
            return false;
        }

        WatermarkEntity next = current != null ? current : WatermarkEntity.builder().key(key).build();
        next.setLastTimestamp(last.getTimestamp());
        next.setLastReadingId(last.getId());
        next.setUpdatedAt(LocalDateTime.now(clock));
        watermarkRepository.save(next);
        return true;
    }

    public LocalDateTime watermarkOf(WindowConsumer consumer, String stationId) {
        return watermarkRepository.findById(new WatermarkEntity.Key(consumer, stationId))
                .map(WatermarkEntity::getLastTimestamp)
                .orElse(null);
    }

    private static ReadingEntity lastBefore(List<ReadingEntity> readings, ReadingEntity bound) {
        ReadingEntity result = null;
        for (ReadingEntity r : readings) {
            if (!isAfter(bound.getTimestamp(), bound.getId(), r.getTimestamp(), r.getId())) {
                break;
            }
            result = r;
        }
        return result;
    }

    private static boolean isAfter(LocalDateTime ts, long id, LocalDateTime otherTs, long otherId) {
        return ts.isAfter(otherTs) || (ts.isEqual(otherTs) && id > otherId);
    }

    /**
     * Claves de partición ("yyyy-MM") que abarca [from, to].
     */
    static List<String> partitionsBetween(LocalDateTime from, LocalDateTime to) {
        List<String> keys = new ArrayList<>();
        YearMonth month = YearMonth.from(from);
        YearMonth last = YearMonth.from(to.isBefore(from) ? from : to);
        while (!month.isAfter(last)) {
            keys.add(ReadingEntity.partitionOf(month.atDay(1).atStartOfDay()));
            month = month.plusMonths(1);
        }
        return keys;
    }
}
