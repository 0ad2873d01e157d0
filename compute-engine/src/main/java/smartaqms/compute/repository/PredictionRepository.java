package smartaqms.compute.repository;

import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import smartaqms.compute.entity.PredictionEntity;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface PredictionRepository extends JpaRepository<PredictionEntity, Long> {

    Optional<PredictionEntity> findByReadingId(Long readingId);

    @Query("SELECT p.readingId FROM PredictionEntity p WHERE p.readingId IN :readingIds")
    List<Long> findExistingReadingIds(@Param("readingIds") Collection<Long> readingIds);

    List<PredictionEntity> findByStationIdOrderByCreatedAtDesc(String stationId, Pageable pageable);

    long countByReadingId(Long readingId);
}
