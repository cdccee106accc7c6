package structured.error.infrastructure.catalog;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import lombok.extern.slf4j.Slf4j;
import org.springframework.transaction.support.TransactionTemplate;
import structured.error.core.catalog.ErrorCatalogSnapshot;
import structured.error.core.domain.model.ErrorDefinition;
import structured.error.core.port.out.ErrorCatalog;
import structured.error.infrastructure.persistence.entity.ErrorJpaEntity;
import structured.error.infrastructure.persistence.jpa.ErrorJpaRepository;

/**
 * 에러 카탈로그 캐시 (Caffeine L1)
 *
 * <h3>Snapshot Strategy</h3>
 *
 * <ul>
 *   <li>errors 테이블 전체를 하나의 {@link ErrorCatalogSnapshot}으로 적재
 *   <li>{@code refreshAfter} 경과 후 다음 조회에서 재적재 (expireAfterWrite)
 *   <li>조회 경로는 스냅샷만 읽으므로 DB 왕복 없음
 * </ul>
 *
 * <p>적재 실패 시 예외가 호출자에게 전파됩니다. 카탈로그 없이 만든 메시지는 모두 내장 템플릿이 되므로 조용히 빈 스냅샷으로 대체하지
 * 않습니다.
 */
@Slf4j
public class CachingErrorCatalog implements ErrorCatalog {

  private static final String CACHE_KEY = "errorCatalog";

  private final ErrorJpaRepository errorRepository;
  private final TransactionTemplate readOnlyTransactionTemplate;
  private final Cache<String, ErrorCatalogSnapshot> snapshotCache;

  public CachingErrorCatalog(
      ErrorJpaRepository errorRepository,
      TransactionTemplate readOnlyTransactionTemplate,
      Duration refreshAfter) {
    this.errorRepository = errorRepository;
    this.readOnlyTransactionTemplate = readOnlyTransactionTemplate;
    this.snapshotCache =
        Caffeine.newBuilder().expireAfterWrite(refreshAfter).maximumSize(1).recordStats().build();
  }

  @Override
  public Optional<ErrorDefinition> find(String ownerProcedure, String errorName) {
    return snapshot().find(ownerProcedure, errorName);
  }

  public ErrorCatalogSnapshot snapshot() {
    return snapshotCache.get(CACHE_KEY, key -> load());
  }

  /** 다음 조회에서 강제 재적재 */
  public void invalidate() {
    snapshotCache.invalidate(CACHE_KEY);
  }

  private ErrorCatalogSnapshot load() {
    List<ErrorDefinition> definitions =
        readOnlyTransactionTemplate.execute(
            status ->
                errorRepository.findAllByOrderByErrorIdAsc().stream()
                    .map(ErrorJpaEntity::toDomain)
                    .toList());
    ErrorCatalogSnapshot snapshot =
        ErrorCatalogSnapshot.of(definitions == null ? List.of() : definitions);
    log.info("[ErrorCatalog] Loaded {} error definitions", snapshot.size());
    return snapshot;
  }
}
