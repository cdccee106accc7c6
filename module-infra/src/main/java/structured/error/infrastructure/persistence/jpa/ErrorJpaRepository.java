package structured.error.infrastructure.persistence.jpa;

import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;
import structured.error.infrastructure.persistence.entity.ErrorJpaEntity;

/**
 * Spring Data JPA Repository for the error catalog.
 *
 * <p>Read through {@link structured.error.infrastructure.catalog.CachingErrorCatalog}; nothing
 * else queries this table at runtime.
 */
public interface ErrorJpaRepository extends JpaRepository<ErrorJpaEntity, Integer> {

  List<ErrorJpaEntity> findAllByOrderByErrorIdAsc();
}
