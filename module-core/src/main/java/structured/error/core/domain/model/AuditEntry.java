package structured.error.core.domain.model;

import java.time.LocalDateTime;

/**
 * 프레임 호출 감사 엔트리
 *
 * <p>순수 도메인 - JPA 의존 없음. endTime은 정상 종료({@code end}) 또는 실패({@code fail}) 중 하나로 정확히 한 번 설정됩니다.
 */
public record AuditEntry(
    Long id,
    String procedureName,
    String inputData,
    String outputData,
    String errorMessage,
    LocalDateTime startTime,
    LocalDateTime endTime) {

  /** 영속 레이어 복원 전용 */
  public static AuditEntry restore(
      Long id,
      String procedureName,
      String inputData,
      String outputData,
      String errorMessage,
      LocalDateTime startTime,
      LocalDateTime endTime) {
    return new AuditEntry(
        id, procedureName, inputData, outputData, errorMessage, startTime, endTime);
  }

  public boolean isOpen() {
    return endTime == null;
  }

  public boolean isFailed() {
    return endTime != null && errorMessage != null;
  }
}
