package structured.error.core.domain.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/** 잘 알려진 저수준 실패 종류와 카탈로그 에러 이름 */
@Getter
@RequiredArgsConstructor
public enum HostFailureKind {
  INDEX_VIOLATION("IndexViolation"),
  DEADLOCK("Deadlock");

  private final String errorName;

  /** 카탈로그 에러 이름으로 조회 (설정 바인딩용) */
  public static HostFailureKind fromErrorName(String errorName) {
    for (HostFailureKind kind : values()) {
      if (kind.errorName.equalsIgnoreCase(errorName) || kind.name().equalsIgnoreCase(errorName)) {
        return kind;
      }
    }
    throw new IllegalArgumentException("Unknown host failure kind: " + errorName);
  }
}
