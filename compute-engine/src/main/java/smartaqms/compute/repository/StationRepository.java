package smartaqms.compute.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import smartaqms.compute.entity.StationEntity;
import smartaqms.domain.station.StationStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface StationRepository extends JpaRepository<StationEntity, String> {

    List<StationEntity> findByZoneOrderByIdAsc(String zone);

    List<StationEntity> findByStatusInOrderByIdAsc(Collection<StationStatus> statuses);

    @Query("SELECT DISTINCT s.zone FROM StationEntity s WHERE s.status <> smartaqms.domain.station.StationStatus.RETIRED ORDER BY s.zone")
    List<String> findActiveZones();

    /**
     * Avanza el last-seen solo hacia delante.
     */
    @Modifying
    @Query("UPDATE StationEntity s SET s.lastSeenAt = :seen WHERE s.id = :id AND (s.lastSeenAt IS NULL OR s.lastSeenAt < :seen)")
    int advanceLastSeen(@Param("id") String id, @Param("seen") LocalDateTime seen);
}
