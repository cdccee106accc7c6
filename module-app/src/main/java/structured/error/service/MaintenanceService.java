package structured.error.service;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import structured.error.config.AuditPurgeProperties;
import structured.error.core.audit.AuditRetentionPolicy;
import structured.error.core.port.out.AuditLogPort;
import structured.error.frame.FrameDefinition;
import structured.error.frame.FrameExecutor;

/**
 * 유지보수 작업
 *
 * <p>보존 기간이 지난 감사 로그를 배치 단위로 삭제합니다. 다른 프레임과 똑같이 감사/디스패치 대상입니다.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MaintenanceService {

  public static final FrameDefinition FRAME = FrameDefinition.write("MaintenanceUpdates");

  private final FrameExecutor frameExecutor;
  private final AuditLogPort auditLogPort;
  private final AuditRetentionPolicy retentionPolicy;
  private final AuditPurgeProperties properties;

  /**
   * 감사 로그 1회 퍼지
   *
   * @return 삭제 건수
   */
  public int purgeAuditLog() {
    int batchSize = properties.batchSize();
    return frameExecutor.execute(
        FRAME,
        Map.of("batchSize", batchSize),
        context -> {
          int deleted = auditLogPort.purge(retentionPolicy.cutoff(), batchSize);
          log.info("[Maintenance] Purged {} audit log entries", deleted);
          return deleted;
        });
  }
}
