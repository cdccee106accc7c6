package structured.error.core.domain.model;

import java.util.Map;

/**
 * 전파 엔진 설정 스냅샷
 *
 * @param maxMessageLength 인코딩된 트리의 최대 길이 (기본 2047)
 * @param handlerName 디스패처 자신의 프로시저 이름이자 공통 에러의 소유자 (기본 "ErrorHandler")
 * @param userDefinedThreshold 카탈로그 기반 신호로 간주할 최소 에러 번호 (기본 50000)
 * @param hostFailureCodes 저수준 실패 번호 → 종류
 */
public record PropagationSettings(
    int maxMessageLength,
    String handlerName,
    int userDefinedThreshold,
    Map<Integer, HostFailureKind> hostFailureCodes) {

  public static final int DEFAULT_MAX_MESSAGE_LENGTH = 2047;
  public static final String DEFAULT_HANDLER_NAME = "ErrorHandler";
  public static final int DEFAULT_USER_DEFINED_THRESHOLD = 50000;
  public static final int INDEX_VIOLATION_NUMBER = 2601;
  public static final int DEADLOCK_NUMBER = 1205;

  public PropagationSettings {
    if (maxMessageLength <= 0) {
      throw new IllegalArgumentException(
          "maxMessageLength must be positive, got: " + maxMessageLength);
    }
    if (handlerName == null || handlerName.isBlank()) {
      throw new IllegalArgumentException("handlerName must not be blank");
    }
    hostFailureCodes = hostFailureCodes == null ? Map.of() : Map.copyOf(hostFailureCodes);
  }

  public static PropagationSettings defaults() {
    return new PropagationSettings(
        DEFAULT_MAX_MESSAGE_LENGTH,
        DEFAULT_HANDLER_NAME,
        DEFAULT_USER_DEFINED_THRESHOLD,
        Map.of(
            INDEX_VIOLATION_NUMBER, HostFailureKind.INDEX_VIOLATION,
            DEADLOCK_NUMBER, HostFailureKind.DEADLOCK));
  }
}
