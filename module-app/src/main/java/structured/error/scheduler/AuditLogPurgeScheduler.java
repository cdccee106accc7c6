package structured.error.scheduler;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import structured.error.global.error.exception.StructuredErrorException;
import structured.error.service.MaintenanceService;

/**
 * 감사 로그 퍼지 스케줄러
 *
 * <p>실패는 이미 감사 로그와 구조화 에러로 기록되므로 여기서는 로그만 남기고 다음 주기를 기다립니다.
 */
@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(
    name = "scheduler.audit-purge.enabled",
    havingValue = "true",
    matchIfMissing = true)
public class AuditLogPurgeScheduler {

  private final MaintenanceService maintenanceService;

  @Scheduled(cron = "${scheduler.audit-purge.cron:0 0 3 * * *}", zone = "UTC")
  public void purge() {
    try {
      maintenanceService.purgeAuditLog();
    } catch (StructuredErrorException e) {
      log.error("[Scheduler] Audit log purge failed: {}", e.getMessage());
    }
  }
}
