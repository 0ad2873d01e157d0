package smartaqms.compute.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import smartaqms.compute.entity.ReadingEntity;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface ReadingRepository extends JpaRepository<ReadingEntity, Long> {

    List<ReadingKeyView> findByStationIdInAndTimestampBetween(Collection<String> stationIds,
                                                              LocalDateTime from, LocalDateTime to);

    boolean existsByStationIdAndSensorIdAndTimestamp(String stationId, String sensorId, LocalDateTime timestamp);

    /**
     * Lecturas de una estación posteriores al cursor (ts, id), podadas por partición y
     * ordenadas por (ts, id). El límite lo impone el {@link Pageable}.
     */
    @Query("SELECT r FROM ReadingEntity r WHERE r.stationId = :stationId"
            + " AND r.partitionKey IN :partitions"
            + " AND (r.timestamp > :afterTs OR (r.timestamp = :afterTs AND r.id > :afterId))"
            + " AND r.timestamp <= :until"
            + " ORDER BY r.timestamp ASC, r.id ASC")
    List<ReadingEntity> findWindow(@Param("stationId") String stationId,
                                   @Param("partitions") Collection<String> partitions,
                                   @Param("afterTs") LocalDateTime afterTs,
                                   @Param("afterId") long afterId,
                                   @Param("until") LocalDateTime until,
                                   Pageable pageable);

    /**
     * Histórico de calidad suficiente de un conjunto de estaciones en [from, to), para líneas base.
     */
    /**
     * Lecturas con clave dentro de ((afterTs, afterId), (lastTs, lastId)) que no estaban en la
     * ventana leída: confirmadas por otra transacción después de la lectura.
     */
    @Query("SELECT r FROM ReadingEntity r WHERE r.stationId = :stationId"
            + " AND r.partitionKey IN :partitions"
            + " AND (r.timestamp > :afterTs OR (r.timestamp = :afterTs AND r.id > :afterId))"
            + " AND (r.timestamp < :lastTs OR (r.timestamp = :lastTs AND r.id < :lastId))"
            + " AND r.id NOT IN :seenIds"
            + " ORDER BY r.timestamp ASC, r.id ASC")
    List<ReadingEntity> findStragglers(@Param("stationId") String stationId,
                                       @Param("partitions") Collection<String> partitions,
                                       @Param("afterTs") LocalDateTime afterTs,
                                       @Param("afterId") long afterId,
                                       @Param("lastTs") LocalDateTime lastTs,
                                       @Param("lastId") long lastId,
                                       @Param("seenIds") Collection<Long> seenIds);

    @Query("SELECT r FROM ReadingEntity r WHERE r.stationId IN :stationIds"
            + " AND r.partitionKey IN :partitions"
            + " AND r.timestamp >= :from AND r.timestamp < :to"
            + " AND r.qualityScore >= :minQuality"
            + " ORDER BY r.timestamp DESC")
    List<ReadingEntity> findHistory(@Param("stationIds") Collection<String> stationIds,
                                    @Param("partitions") Collection<String> partitions,
                                    @Param("from") LocalDateTime from,
                                    @Param("to") LocalDateTime to,
                                    @Param("minQuality") double minQuality,
                                    Pageable pageable);

    Optional<ReadingEntity> findFirstByStationIdAndTimestampLessThanOrderByTimestampDescIdDesc(String stationId,
                                                                                             LocalDateTime before);

    List<ReadingEntity> findTop100ByStationIdOrderByTimestampDesc(String stationId);

    long countByStationId(String stationId);
}
