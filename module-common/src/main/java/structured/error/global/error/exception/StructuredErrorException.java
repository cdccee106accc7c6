package structured.error.global.error.exception;

import lombok.Getter;
import structured.error.global.error.CommonErrorCode;
import structured.error.global.error.exception.base.ServerBaseException;

/**
 * 프레임 경계를 넘어 전파되는 구조화 에러
 *
 * <p>{@link #getMessage()}는 인코딩된 에러 트리(예: {@code <E N="1002" M="..." P="ErrorHandler"/>}) 그 자체이며,
 * 상위 프레임은 이 텍스트를 다시 해석하여 컨텍스트를 덧붙입니다.
 *
 * <h3>신호 속성</h3>
 *
 * <ul>
 *   <li><b>errorNumber</b>: 카탈로그 기반 신호는 항상 {@link #USER_DEFINED_ERROR_NUMBER}
 *   <li><b>severity / state</b>: 최초 실패의 값을 전파 내내 유지
 *   <li><b>procedure / line</b>: 신호를 발생시킨 프로시저와 라인
 * </ul>
 */
@Getter
public class StructuredErrorException extends ServerBaseException {

  public static final int USER_DEFINED_ERROR_NUMBER = 50000;
  public static final int DEFAULT_SEVERITY = 16;
  public static final int DEFAULT_STATE = 1;

  private final int errorNumber;
  private final int severity;
  private final int state;
  private final String procedure;
  private final Integer line;

  public StructuredErrorException(
      String encodedTree, int errorNumber, int severity, int state, String procedure, Integer line) {
    super(CommonErrorCode.STRUCTURED_ERROR, encodedTree);
    this.errorNumber = errorNumber;
    this.severity = severity;
    this.state = state;
    this.procedure = procedure;
    this.line = line;
  }

  /** 프레임 본문에서 카탈로그 에러를 직접 발생시킬 때 사용 */
  public static StructuredErrorException raise(String encodedTree, String procedure, Integer line) {
    return new StructuredErrorException(
        encodedTree, USER_DEFINED_ERROR_NUMBER, DEFAULT_SEVERITY, DEFAULT_STATE, procedure, line);
  }
}
