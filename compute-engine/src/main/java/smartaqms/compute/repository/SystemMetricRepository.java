package smartaqms.compute.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import smartaqms.compute.entity.SystemMetricEntity;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface SystemMetricRepository extends JpaRepository<SystemMetricEntity, Long> {

    List<SystemMetricEntity> findByMetricNameOrderByRecordedAtDesc(String metricName, Pageable pageable);

    List<SystemMetricEntity> findByRecordedAtAfterOrderByRecordedAtDesc(LocalDateTime after, Pageable pageable);
}
