package structured.error.controller;

import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import structured.error.controller.dto.AuditLogResponse;
import structured.error.service.AuditLogService;

/**
 * 감사 로그 API
 *
 * <ul>
 *   <li>GET /api/v1/audit-logs/{id} - 감사 엔트리 조회 (없으면 AuditLogGet/NotFound)
 * </ul>
 */
@RestController
@RequestMapping("/api/v1/audit-logs")
@RequiredArgsConstructor
public class AuditLogController {

  private final AuditLogService auditLogService;

  @GetMapping("/{id}")
  public ResponseEntity<AuditLogResponse> getAuditLog(@PathVariable long id) {
    return ResponseEntity.ok(AuditLogResponse.from(auditLogService.getAuditLog(id)));
  }
}
