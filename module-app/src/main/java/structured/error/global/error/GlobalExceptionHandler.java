package structured.error.global.error;

import java.time.LocalDateTime;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;
import structured.error.core.codec.ErrorTreeCodec;
import structured.error.core.domain.model.ErrorDefinition;
import structured.error.core.domain.model.ErrorNode;
import structured.error.core.domain.model.PropagationSettings;
import structured.error.global.error.dto.ErrorResponse;
import structured.error.global.error.exception.StructuredErrorException;
import structured.error.global.error.exception.base.BaseException;
import structured.error.infrastructure.catalog.CachingErrorCatalog;

@Slf4j
@RestControllerAdvice
@RequiredArgsConstructor
public class GlobalExceptionHandler {

  private final CachingErrorCatalog errorCatalog;
  private final PropagationSettings propagationSettings;

  /**
   * 프레임에서 전파된 구조화 에러
   *
   * <p>루트 노드의 code/사용자 메시지를 응답 본문으로, 인코딩된 전체 트리를 detail로 전달합니다. 루트 에러가 프레임 소유 정의이면 400,
   * 핸들러 소유(시스템 실패)이거나 카탈로그에 없으면 500입니다.
   */
  @ExceptionHandler(StructuredErrorException.class)
  protected ResponseEntity<ErrorResponse> handleStructuredError(StructuredErrorException e) {
    ErrorNode root = ErrorTreeCodec.tryDecode(e.getMessage()).orElse(null);
    if (root == null) {
      log.error("Structured Error without tree: {}", e.getMessage());
      return ErrorResponse.toResponseEntity(e);
    }
    HttpStatus status =
        isFrameOwned(root) ? HttpStatus.BAD_REQUEST : HttpStatus.INTERNAL_SERVER_ERROR;
    log.warn(
        "Structured Error: {} | Procedure: {} | Status: {}",
        root.code(),
        e.getProcedure(),
        status.value());
    ErrorResponse body =
        ErrorResponse.builder()
            .status(status.value())
            .code(Integer.toString(root.code()))
            .message(root.userMessage())
            .detail(e.getMessage())
            .timestamp(LocalDateTime.now())
            .build();
    return ResponseEntity.status(status).body(body);
  }

  @ExceptionHandler(BaseException.class)
  protected ResponseEntity<ErrorResponse> handleBaseException(BaseException e) {
    log.warn("Business Exception: {} | Message: {}", e.getErrorCode().getCode(), e.getMessage());
    return ErrorResponse.toResponseEntity(e);
  }

  @ExceptionHandler(MethodArgumentTypeMismatchException.class)
  protected ResponseEntity<ErrorResponse> handleTypeMismatch(
      MethodArgumentTypeMismatchException e) {
    log.warn("Invalid Input: {} = {}", e.getName(), e.getValue());
    CommonErrorCode errorCode = CommonErrorCode.INVALID_INPUT_VALUE;
    ErrorResponse body =
        ErrorResponse.builder()
            .status(errorCode.getStatusCode())
            .code(errorCode.getCode())
            .message(String.format(errorCode.getMessage(), e.getName()))
            .timestamp(LocalDateTime.now())
            .build();
    return ResponseEntity.status(errorCode.getStatus()).body(body);
  }

  @ExceptionHandler(Exception.class)
  protected ResponseEntity<ErrorResponse> handleException(Exception e) {
    log.error("Unexpected System Failure: ", e);
    return ErrorResponse.toResponseEntity(CommonErrorCode.INTERNAL_SERVER_ERROR);
  }

  private boolean isFrameOwned(ErrorNode root) {
    return errorCatalog
        .snapshot()
        .findById(root.code())
        .map(ErrorDefinition::ownerProcedure)
        .filter(owner -> !owner.equals(propagationSettings.handlerName()))
        .isPresent();
  }
}
