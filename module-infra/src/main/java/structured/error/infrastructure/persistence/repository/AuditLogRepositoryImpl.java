package structured.error.infrastructure.persistence.repository;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Optional;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Propagation;
import org.springframework.transaction.annotation.Transactional;
import structured.error.core.domain.model.AuditEntry;
import structured.error.core.port.out.AuditLogPort;
import structured.error.infrastructure.persistence.entity.AuditLogJpaEntity;
import structured.error.infrastructure.persistence.jpa.AuditLogJpaRepository;

/**
 * Implementation of {@link AuditLogPort}.
 *
 * <p><b>Transactional:</b> every write runs in its own transaction ({@code REQUIRES_NEW}) so an
 * audit row survives the rollback of the frame that wrote it.
 */
@Repository
@Transactional(propagation = Propagation.REQUIRES_NEW)
public class AuditLogRepositoryImpl implements AuditLogPort {

  private final AuditLogJpaRepository jpaRepo;

  public AuditLogRepositoryImpl(AuditLogJpaRepository jpaRepo) {
    this.jpaRepo = jpaRepo;
  }

  @Override
  public long insert(String procedureName, String inputData, LocalDateTime startTime) {
    AuditLogJpaEntity saved =
        jpaRepo.save(new AuditLogJpaEntity(procedureName, inputData, startTime));
    return saved.getId();
  }

  @Override
  public boolean complete(long id, String outputData, LocalDateTime endTime) {
    return jpaRepo.complete(id, outputData, endTime) > 0;
  }

  @Override
  public boolean fail(long id, String errorMessage, LocalDateTime endTime) {
    return jpaRepo.fail(id, errorMessage, endTime) > 0;
  }

  @Override
  @Transactional(readOnly = true)
  public Optional<AuditEntry> findById(long id) {
    return jpaRepo.findById(id).map(AuditLogJpaEntity::toDomain);
  }

  /** 호출 측 트랜잭션에 참여 (퍼지 프레임이 실패하면 삭제도 롤백) */
  @Override
  @Transactional(propagation = Propagation.REQUIRED)
  public int purge(LocalDateTime cutoff, int limit) {
    if (limit <= 0) {
      throw new IllegalArgumentException("limit must be positive, got: " + limit);
    }
    List<Long> ids = jpaRepo.findPurgeableIds(cutoff, PageRequest.of(0, limit));
    if (ids.isEmpty()) {
      return 0;
    }
    return jpaRepo.deleteAllByIdIn(ids);
  }
}
