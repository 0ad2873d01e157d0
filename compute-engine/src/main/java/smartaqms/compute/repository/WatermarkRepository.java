package smartaqms.compute.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import smartaqms.compute.entity.WatermarkEntity;
import smartaqms.domain.window.WindowConsumer;

import java.util.Collection;
import java.util.List;

@Repository
public interface WatermarkRepository extends JpaRepository<WatermarkEntity, WatermarkEntity.Key> {

    List<WatermarkEntity> findByKeyConsumer(WindowConsumer consumer);

    List<WatermarkEntity> findByKeyStationIdIn(Collection<String> stationIds);
}
