package structured.error.frame;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.catchThrowableOfType;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.BDDMockito.then;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import structured.error.core.catalog.ErrorLookup;
import structured.error.core.domain.model.ContextNode;
import structured.error.core.domain.model.ErrorChild;
import structured.error.global.error.exception.StructuredErrorException;

@ExtendWith(MockitoExtension.class)
class FrameContextTest {

  private static final String ENCODED = "<E N=\"1200\" M=\"not found\" P=\"AuditLogGet\"/>";

  @Mock private ErrorLookup errorLookup;

  @Test
  @DisplayName("signal은 카탈로그 메시지로 사용자 정의 에러를 던진다")
  void signal_raisesCatalogError() {
    given(errorLookup.lookupMessage(eq("AuditLogGet"), eq("NotFound"), anyList()))
        .willReturn(ENCODED);
    FrameContext context = new FrameContext("AuditLogGet", 3, errorLookup);
    Map<String, Object> tokens = new LinkedHashMap<>();
    tokens.put("EntityId", 10);
    tokens.put("Ignored", null);

    StructuredErrorException signal =
        catchThrowableOfType(
            () -> context.signal("NotFound", tokens), StructuredErrorException.class);

    assertThat(signal.getMessage()).isEqualTo(ENCODED);
    assertThat(signal.getErrorNumber())
        .isEqualTo(StructuredErrorException.USER_DEFINED_ERROR_NUMBER);
    assertThat(signal.getProcedure()).isEqualTo("AuditLogGet");
    assertThat(signal.getLine()).isPositive();

    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<ErrorChild>> captor = ArgumentCaptor.forClass(List.class);
    then(errorLookup).should().lookupMessage(eq("AuditLogGet"), eq("NotFound"), captor.capture());
    assertThat(captor.getValue())
        .containsExactly(ContextNode.builder().put("EntityId", 10).build());
  }

  @Test
  @DisplayName("토큰 없이 signal하면 컨텍스트 없이 조회한다")
  void signal_withoutTokens() {
    given(errorLookup.lookupMessage("Job", "Failed", List.of())).willReturn(ENCODED);
    FrameContext context = new FrameContext("Job", 1, errorLookup);

    StructuredErrorException signal =
        catchThrowableOfType(() -> context.signal("Failed"), StructuredErrorException.class);

    assertThat(signal.getProcedure()).isEqualTo("Job");
  }

  @Test
  @DisplayName("토큰 맵이 null이면 빈 컨텍스트로 신호한다")
  void signal_nullTokens() {
    given(errorLookup.lookupMessage(eq("Job"), eq("Failed"), anyList())).willReturn(ENCODED);
    FrameContext context = new FrameContext("Job", 1, errorLookup);

    StructuredErrorException signal =
        catchThrowableOfType(
            () -> context.signal("Failed", (Map<String, ?>) null), StructuredErrorException.class);

    assertThat(signal.getMessage()).isEqualTo(ENCODED);
    @SuppressWarnings("unchecked")
    ArgumentCaptor<List<ErrorChild>> captor = ArgumentCaptor.forClass(List.class);
    then(errorLookup).should().lookupMessage(eq("Job"), eq("Failed"), captor.capture());
    assertThat(captor.getValue()).containsExactly(ContextNode.empty());
  }
}
