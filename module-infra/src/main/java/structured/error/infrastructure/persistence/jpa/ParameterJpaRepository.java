package structured.error.infrastructure.persistence.jpa;

import org.springframework.data.jpa.repository.JpaRepository;
import structured.error.infrastructure.persistence.entity.ParameterJpaEntity;

/** Spring Data JPA Repository for runtime parameters (primary key = parameter name). */
public interface ParameterJpaRepository extends JpaRepository<ParameterJpaEntity, String> {}
