package structured.error.controller.dto;

import java.time.LocalDateTime;
import structured.error.core.domain.model.AuditEntry;

/** 감사 로그 조회 응답 */
public record AuditLogResponse(
    Long id,
    String procedureName,
    String inputData,
    String outputData,
    String errorMessage,
    LocalDateTime startTime,
    LocalDateTime endTime,
    boolean open) {

  public static AuditLogResponse from(AuditEntry entry) {
    return new AuditLogResponse(
        entry.id(),
        entry.procedureName(),
        entry.inputData(),
        entry.outputData(),
        entry.errorMessage(),
        entry.startTime(),
        entry.endTime(),
        entry.isOpen());
  }
}
