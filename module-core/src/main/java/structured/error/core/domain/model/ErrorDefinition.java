package structured.error.core.domain.model;

import java.util.Objects;

/**
 * 에러 카탈로그의 한 행
 *
 * <p>(ownerProcedure, errorName)이 유일 키이며 errorId는 전역 유일합니다. 런타임에는 읽기 전용입니다.
 */
public record ErrorDefinition(
    int errorId,
    String ownerProcedure,
    String errorName,
    String userMessageTemplate,
    String developerMessageTemplate) {

  public ErrorDefinition {
    Objects.requireNonNull(ownerProcedure, "ownerProcedure");
    Objects.requireNonNull(errorName, "errorName");
    Objects.requireNonNull(userMessageTemplate, "userMessageTemplate");
  }
}
