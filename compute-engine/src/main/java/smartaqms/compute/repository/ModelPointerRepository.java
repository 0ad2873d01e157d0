package smartaqms.compute.repository;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;
import smartaqms.compute.entity.ModelPointerEntity;

@Repository
public interface ModelPointerRepository extends JpaRepository<ModelPointerEntity, String> {
}
