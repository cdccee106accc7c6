package structured.error.infrastructure.persistence.jpa;

import java.time.LocalDateTime;
import java.util.List;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import structured.error.infrastructure.persistence.entity.AuditLogJpaEntity;

/**
 * Spring Data JPA Repository for the audit log.
 *
 * <p>This is an INTERNAL repository interface used only by infrastructure layer. Core code uses
 * {@link structured.error.core.port.out.AuditLogPort} instead.
 *
 * @see structured.error.infrastructure.persistence.repository.AuditLogRepositoryImpl
 */
public interface AuditLogJpaRepository extends JpaRepository<AuditLogJpaEntity, Long> {

  /**
   * Close an open entry normally.
   *
   * @return 1 if closed, 0 if missing or already closed
   */
  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE AuditLogJpaEntity a SET a.outputData = :outputData, a.endTime = :endTime "
          + "WHERE a.id = :id AND a.endTime IS NULL")
  int complete(
      @Param("id") Long id,
      @Param("outputData") String outputData,
      @Param("endTime") LocalDateTime endTime);

  /**
   * Close an open entry with an error.
   *
   * @return 1 if closed, 0 if missing or already closed
   */
  @Modifying(clearAutomatically = true)
  @Query(
      "UPDATE AuditLogJpaEntity a SET a.errorMessage = :errorMessage, a.endTime = :endTime "
          + "WHERE a.id = :id AND a.endTime IS NULL")
  int fail(
      @Param("id") Long id,
      @Param("errorMessage") String errorMessage,
      @Param("endTime") LocalDateTime endTime);

  /**
   * Ids of entries started before the cutoff that are still open or ended before it.
   *
   * @param pageable batch limit (first page only)
   */
  @Query(
      "SELECT a.id FROM AuditLogJpaEntity a "
          + "WHERE a.startTime < :cutoff AND (a.endTime IS NULL OR a.endTime < :cutoff) "
          + "ORDER BY a.id ASC")
  List<Long> findPurgeableIds(@Param("cutoff") LocalDateTime cutoff, Pageable pageable);

  @Modifying(clearAutomatically = true)
  @Query("DELETE FROM AuditLogJpaEntity a WHERE a.id IN :ids")
  int deleteAllByIdIn(@Param("ids") List<Long> ids);
}
