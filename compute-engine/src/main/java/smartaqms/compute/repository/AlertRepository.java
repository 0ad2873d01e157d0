package smartaqms.compute.repository;

import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import smartaqms.compute.entity.AlertEntity;
import smartaqms.domain.alert.AlertStatus;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;

@Repository
public interface AlertRepository extends JpaRepository<AlertEntity, String> {

    boolean existsByCooldownKeyAndAlertTypeAndStatusAndCreatedAtAfter(String cooldownKey, String alertType,
                                                                      AlertStatus status, LocalDateTime after);

    boolean existsByReadingIdAndAlertType(Long readingId, String alertType);

    List<AlertEntity> findByStatusInOrderByCreatedAtDesc(Collection<AlertStatus> statuses);

    List<AlertEntity> findByStationIdOrderByCreatedAtDesc(String stationId);

    List<AlertEntity> findByAlertTypeAndStatus(String alertType, AlertStatus status);

    long countByStatus(AlertStatus status);

    Page<AlertEntity> findByCreatedAtBetween(LocalDateTime start, LocalDateTime end, Pageable pageable);

    Page<AlertEntity> findByCreatedAtBetweenAndStatusIn(LocalDateTime start, LocalDateTime end,
                                                       Collection<AlertStatus> statuses, Pageable pageable);
}
