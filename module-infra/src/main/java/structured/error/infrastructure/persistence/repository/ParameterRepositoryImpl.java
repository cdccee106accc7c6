package structured.error.infrastructure.persistence.repository;

import java.util.Optional;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;
import structured.error.core.port.out.ParameterPort;
import structured.error.infrastructure.persistence.entity.ParameterJpaEntity;
import structured.error.infrastructure.persistence.jpa.ParameterJpaRepository;

/**
 * Implementation of {@link ParameterPort}.
 *
 * <p>Parameters are read on every frame without caching so an operator's change takes effect on
 * the next call.
 */
@Repository
@Transactional(readOnly = true)
public class ParameterRepositoryImpl implements ParameterPort {

  private final ParameterJpaRepository jpaRepo;

  public ParameterRepositoryImpl(ParameterJpaRepository jpaRepo) {
    this.jpaRepo = jpaRepo;
  }

  @Override
  public Optional<String> findValue(String parameterName) {
    if (parameterName == null) {
      return Optional.empty();
    }
    return jpaRepo.findById(parameterName).map(ParameterJpaEntity::getParameterValue);
  }
}
