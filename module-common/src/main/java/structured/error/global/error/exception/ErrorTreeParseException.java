package structured.error.global.error.exception;

import structured.error.global.error.CommonErrorCode;
import structured.error.global.error.exception.base.ClientBaseException;

/** 인코딩된 에러 트리 텍스트를 해석할 수 없을 때 발생 */
public class ErrorTreeParseException extends ClientBaseException {

  public ErrorTreeParseException(String reason) {
    super(CommonErrorCode.INVALID_ERROR_TREE, reason);
  }

  public ErrorTreeParseException(String reason, Throwable cause) {
    super(CommonErrorCode.INVALID_ERROR_TREE, cause, reason);
  }
}
