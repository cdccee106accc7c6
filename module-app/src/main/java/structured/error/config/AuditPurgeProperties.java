package structured.error.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

/**
 * 감사 로그 퍼지 설정
 *
 * <pre>{@code
 * scheduler:
 *   audit-purge:
 *     enabled: true          # AuditLogPurgeScheduler 등록 여부
 *     cron: "0 0 3 * * *"    # 매일 03:00
 *     batch-size: 100        # 한 번에 삭제할 최대 건수
 * }</pre>
 *
 * <p>보존 기간은 설정 파일이 아니라 parameters 테이블의 {@code PurgePeriod}에서 읽습니다.
 */
@ConfigurationProperties(prefix = "scheduler.audit-purge")
public record AuditPurgeProperties(
    @DefaultValue("true") boolean enabled,
    @DefaultValue("0 0 3 * * *") String cron,
    @DefaultValue("100") int batchSize) {

  public AuditPurgeProperties {
    if (batchSize <= 0) {
      throw new IllegalArgumentException(
          "scheduler.audit-purge.batch-size must be positive, got: " + batchSize);
    }
  }
}
