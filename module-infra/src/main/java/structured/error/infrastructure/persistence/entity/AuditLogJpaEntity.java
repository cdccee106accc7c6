package structured.error.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import java.time.LocalDateTime;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import structured.error.core.domain.model.AuditEntry;

/**
 * 프레임 호출 감사 로그
 *
 * <p>종료 컬럼(output_data, error_message, end_time)은 조건부 UPDATE로만 갱신되므로 setter를 두지 않습니다.
 */
@Entity
@Table(
    name = "audit_log",
    indexes = {@Index(name = "idx_audit_log_start_time", columnList = "start_time")})
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class AuditLogJpaEntity {

  @Id
  @GeneratedValue(strategy = GenerationType.IDENTITY)
  @Column(name = "audit_log_id")
  private Long id;

  @Column(name = "procedure_name", nullable = false, length = 255)
  private String procedureName;

  @Column(name = "input_data", columnDefinition = "TEXT")
  private String inputData;

  @Column(name = "output_data", columnDefinition = "TEXT")
  private String outputData;

  @Column(name = "error_message", columnDefinition = "TEXT")
  private String errorMessage;

  @Column(name = "start_time", nullable = false, updatable = false)
  private LocalDateTime startTime;

  @Column(name = "end_time")
  private LocalDateTime endTime;

  public AuditLogJpaEntity(String procedureName, String inputData, LocalDateTime startTime) {
    this.procedureName = procedureName;
    this.inputData = inputData;
    this.startTime = startTime;
  }

  public AuditEntry toDomain() {
    return AuditEntry.restore(
        id, procedureName, inputData, outputData, errorMessage, startTime, endTime);
  }
}
