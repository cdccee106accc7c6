package structured.error.global.error.dto;

import java.time.LocalDateTime;
import org.springframework.http.ResponseEntity;
import structured.error.global.error.ErrorCode;
import structured.error.global.error.exception.base.BaseException;

public record ErrorResponse(
    int status, String code, String message, String detail, LocalDateTime timestamp) {

  public static ErrorResponseBuilder builder() {
    return new ErrorResponseBuilder();
  }

  public static class ErrorResponseBuilder {
    private Integer status;
    private String code;
    private String message;
    private String detail;
    private LocalDateTime timestamp;

    public ErrorResponseBuilder status(int status) {
      this.status = status;
      return this;
    }

    public ErrorResponseBuilder code(String code) {
      this.code = code;
      return this;
    }

    public ErrorResponseBuilder message(String message) {
      this.message = message;
      return this;
    }

    public ErrorResponseBuilder detail(String detail) {
      this.detail = detail;
      return this;
    }

    public ErrorResponseBuilder timestamp(LocalDateTime timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public ErrorResponse build() {
      return new ErrorResponse(
          status != null ? status : 500,
          code != null ? code : "E000",
          message != null ? message : "Unknown error",
          detail,
          timestamp != null ? timestamp : LocalDateTime.now());
    }
  }

  /**
   * BaseException으로부터 응답 생성 (동적 메시지 포함)
   *
   * <p>e.getMessage()를 통해 동적으로 가공된 메시지를 전달합니다.
   */
  public static ResponseEntity<ErrorResponse> toResponseEntity(BaseException e) {
    ErrorResponse body =
        ErrorResponse.builder()
            .status(e.getErrorCode().getStatusCode())
            .code(e.getErrorCode().getCode())
            .message(e.getMessage())
            .timestamp(LocalDateTime.now())
            .build();
    return ResponseEntity.status(body.status()).body(body);
  }

  /**
   * ErrorCode로부터 응답 생성 (정적 메시지)
   *
   * <p>ErrorCode Enum에 정의된 기본 메시지를 사용하며, 상세한 에러 내용은 보안을 위해 숨깁니다.
   */
  public static ResponseEntity<ErrorResponse> toResponseEntity(ErrorCode errorCode) {
    ErrorResponse body =
        ErrorResponse.builder()
            .status(errorCode.getStatusCode())
            .code(errorCode.getCode())
            .message(errorCode.getMessage())
            .timestamp(LocalDateTime.now())
            .build();
    return ResponseEntity.status(body.status()).body(body);
  }
}
