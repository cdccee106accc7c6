package structured.error.global.error.exception;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import structured.error.global.error.CommonErrorCode;

@DisplayName("StructuredErrorException 단위 테스트")
class StructuredErrorExceptionTest {

  @Test
  @DisplayName("인코딩된 트리는 포맷 문자(%)가 있어도 그대로 메시지가 된다")
  void message_is_encoded_tree_verbatim() {
    String tree = "<E N=\"1\" M=\"100% failed\" P=\"Proc\"/>";

    StructuredErrorException e = StructuredErrorException.raise(tree, "Proc", 12);

    assertThat(e.getMessage()).isEqualTo(tree);
    assertThat(e.getErrorCode()).isEqualTo(CommonErrorCode.STRUCTURED_ERROR);
  }

  @Test
  @DisplayName("raise()는 사용자 정의 번호와 기본 severity/state를 사용한다")
  void raise_uses_user_defined_number() {
    StructuredErrorException e = StructuredErrorException.raise("<E/>", "Proc", null);

    assertThat(e.getErrorNumber()).isEqualTo(StructuredErrorException.USER_DEFINED_ERROR_NUMBER);
    assertThat(e.getSeverity()).isEqualTo(StructuredErrorException.DEFAULT_SEVERITY);
    assertThat(e.getState()).isEqualTo(StructuredErrorException.DEFAULT_STATE);
    assertThat(e.getProcedure()).isEqualTo("Proc");
    assertThat(e.getLine()).isNull();
  }

  @Test
  @DisplayName("ErrorTreeParseException은 원인을 보존한다")
  void parse_exception_keeps_cause() {
    IllegalStateException cause = new IllegalStateException("boom");

    ErrorTreeParseException e = new ErrorTreeParseException("unexpected EOF", cause);

    assertThat(e.getCause()).isSameAs(cause);
    assertThat(e.getMessage()).contains("unexpected EOF");
  }
}
