package structured.error.core.domain.model;

/**
 * 디스패처의 실패 분류 (평가 순서 = 선언 순서, 첫 일치 적용)
 */
public enum FailureClassification {
  /** 디스패처 자신이 재신호한 실패를 상위 프레임에서 다시 보는 경우 */
  REENTRY,
  /** 카탈로그 기반 신호 (사용자 정의 번호 이상) */
  USER_DEFINED,
  /** 잘 알려진 저수준 실패 (유니크 제약 위반, 데드락) */
  KNOWN_HOST_FAILURE,
  /** 그 외 모든 저수준 실패 */
  UNKNOWN_HOST_FAILURE
}
