package structured.error.service;

import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;
import structured.error.core.domain.model.AuditEntry;
import structured.error.core.port.out.AuditLogPort;
import structured.error.frame.FrameDefinition;
import structured.error.frame.FrameExecutor;

/** 감사 로그 조회 */
@Service
@RequiredArgsConstructor
public class AuditLogService {

  public static final FrameDefinition FRAME = FrameDefinition.read("AuditLogGet");
  public static final String NOT_FOUND = "NotFound";

  private final FrameExecutor frameExecutor;
  private final AuditLogPort auditLogPort;

  /** 없으면 카탈로그 에러 {@code AuditLogGet/NotFound} */
  public AuditEntry getAuditLog(long id) {
    return frameExecutor.execute(
        FRAME,
        Map.of("id", id),
        context ->
            auditLogPort
                .findById(id)
                .orElseThrow(() -> context.signal(NOT_FOUND, Map.of("EntityId", id))));
  }
}
