package structured.error.core.domain.model;

import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import structured.error.global.error.exception.StructuredErrorException;

/**
 * 포착된 실패 상태
 *
 * <p>롤백 등 정리 작업이 원본 예외 정보를 덮어쓰기 전에 캡처해 두었다가 디스패처에 넘기기 위한 값입니다.
 *
 * @param errorNumber 실패 번호 (구조화 신호는 50000, 저수준 실패는 벤더 코드, 알 수 없으면 0)
 * @param message 원본 메시지 (구조화 신호라면 인코딩된 트리)
 * @param procedure 실패를 발생시킨 프로시저 (없으면 빈 문자열)
 * @param line 실패 라인
 * @param severity 재신호에 그대로 쓰일 심각도
 * @param state 재신호에 그대로 쓰일 상태값
 * @param trailing 재구성된 트리 뒤에 덧붙일 추가 자식
 */
public record FailureSnapshot(
    int errorNumber,
    String message,
    String procedure,
    Integer line,
    int severity,
    int state,
    List<ErrorChild> trailing) {

  public FailureSnapshot {
    procedure = procedure == null ? "" : procedure;
    trailing = trailing == null ? List.of() : List.copyOf(trailing);
  }

  /**
   * 예외로부터 실패 상태 캡처
   *
   * <ul>
   *   <li>{@link StructuredErrorException} → 신호 속성 그대로
   *   <li>원인 체인에 {@link SQLException}이 있으면 → 벤더 에러 코드
   *   <li>그 외 → 번호 0
   * </ul>
   *
   * @param failure 포착한 예외
   * @param currentProcedure 저수준 실패의 발생 프로시저로 기록할 현재 프레임 이름
   */
  public static FailureSnapshot capture(Throwable failure, String currentProcedure) {
    if (failure instanceof StructuredErrorException signal) {
      return new FailureSnapshot(
          signal.getErrorNumber(),
          signal.getMessage(),
          signal.getProcedure(),
          signal.getLine(),
          signal.getSeverity(),
          signal.getState(),
          List.of());
    }
    SQLException sql = findSqlException(failure);
    int number = sql != null ? sql.getErrorCode() : 0;
    String message = sql != null ? sql.getMessage() : messageOf(failure);
    return new FailureSnapshot(
        number,
        message,
        currentProcedure,
        lineOf(failure),
        StructuredErrorException.DEFAULT_SEVERITY,
        StructuredErrorException.DEFAULT_STATE,
        List.of());
  }

  /** 추가 자식을 덧붙인 새 스냅샷 */
  public FailureSnapshot withTrailing(ErrorChild child) {
    List<ErrorChild> copy = new ArrayList<>(trailing);
    copy.add(child);
    return new FailureSnapshot(errorNumber, message, procedure, line, severity, state, copy);
  }

  private static SQLException findSqlException(Throwable failure) {
    Throwable current = failure;
    while (current != null) {
      if (current instanceof SQLException sql) {
        return sql;
      }
      if (current.getCause() == current) {
        return null;
      }
      current = current.getCause();
    }
    return null;
  }

  private static String messageOf(Throwable failure) {
    String message = failure.getMessage();
    return message != null ? message : failure.getClass().getName();
  }

  private static Integer lineOf(Throwable failure) {
    StackTraceElement[] trace = failure.getStackTrace();
    if (trace.length == 0 || trace[0].getLineNumber() <= 0) {
      return null;
    }
    return trace[0].getLineNumber();
  }
}
