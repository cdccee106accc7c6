package structured.error.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;
import structured.error.core.domain.model.ErrorDefinition;

/** 에러 카탈로그 테이블. 배포 시 시드되고 런타임에는 읽기만 합니다. */
@Entity
@Table(
    name = "errors",
    uniqueConstraints =
        @UniqueConstraint(
            name = "uk_errors_procedure_error",
            columnNames = {"procedure_name", "error_name"}))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ErrorJpaEntity {

  @Id
  @Column(name = "error_id", nullable = false)
  private Integer errorId;

  @Column(name = "procedure_name", nullable = false, length = 128)
  private String procedureName;

  @Column(name = "error_name", nullable = false, length = 128)
  private String errorName;

  @Column(name = "user_message", nullable = false, length = 1024)
  private String userMessage;

  @Column(name = "developer_message", length = 1024)
  private String developerMessage;

  public ErrorJpaEntity(
      Integer errorId,
      String procedureName,
      String errorName,
      String userMessage,
      String developerMessage) {
    this.errorId = errorId;
    this.procedureName = procedureName;
    this.errorName = errorName;
    this.userMessage = userMessage;
    this.developerMessage = developerMessage;
  }

  public ErrorDefinition toDomain() {
    return new ErrorDefinition(errorId, procedureName, errorName, userMessage, developerMessage);
  }
}
