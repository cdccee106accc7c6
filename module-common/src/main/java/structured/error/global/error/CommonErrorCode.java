package structured.error.global.error;

import lombok.AllArgsConstructor;
import lombok.Getter;
import org.springframework.http.HttpStatus;

@Getter
@AllArgsConstructor
public enum CommonErrorCode implements ErrorCode {
  // === Client Errors (4xx) ===
  INVALID_INPUT_VALUE("C001", "잘못된 입력값입니다: %s", HttpStatus.BAD_REQUEST),
  INVALID_ERROR_TREE("C002", "구조화 에러 메시지 형식이 올바르지 않습니다: %s", HttpStatus.BAD_REQUEST),

  // === Server Errors (5xx) ===
  INTERNAL_SERVER_ERROR("S001", "서버 내부 오류가 발생했습니다.", HttpStatus.INTERNAL_SERVER_ERROR),
  // 메시지 자체가 인코딩된 에러 트리이므로 포맷 없이 그대로 전달
  STRUCTURED_ERROR("S002", "%s", HttpStatus.INTERNAL_SERVER_ERROR);

  private final String code;
  private final String message;
  private final HttpStatus status;
}
