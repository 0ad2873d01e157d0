package smartaqms.compute.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;
import smartaqms.compute.entity.ModelCheckpointEntity;

import java.util.List;
import java.util.Optional;

@Repository
public interface ModelCheckpointRepository extends JpaRepository<ModelCheckpointEntity, Long> {

    Optional<ModelCheckpointEntity> findByVersion(long version);

    /**
     * Versión máxima escrita, o null si no hay ninguna.
     */
    @Query("SELECT MAX(c.version) FROM ModelCheckpointEntity c")
    Long findMaxVersion();

    List<ModelCheckpointEntity> findTop20ByOrderByVersionDesc();
}
