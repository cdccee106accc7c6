package structured.error.infrastructure.persistence.entity;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

/** 런타임 파라미터 (AuditReadLog, AuditWriteLog, DebugMode, PurgePeriod) */
@Entity
@Table(name = "parameters")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class ParameterJpaEntity {

  @Id
  @Column(name = "parameter_name", nullable = false, length = 255)
  private String parameterName;

  @Column(name = "parameter_value", columnDefinition = "TEXT")
  private String parameterValue;

  @Column(name = "parameter_description", columnDefinition = "TEXT")
  private String parameterDescription;

  public ParameterJpaEntity(
      String parameterName, String parameterValue, String parameterDescription) {
    this.parameterName = parameterName;
    this.parameterValue = parameterValue;
    this.parameterDescription = parameterDescription;
  }
}
