package structured.error.frame;

import java.util.List;
import java.util.Map;
import lombok.Getter;
import structured.error.core.catalog.ErrorLookup;
import structured.error.core.domain.model.ContextNode;
import structured.error.core.domain.model.ErrorChild;
import structured.error.global.error.exception.StructuredErrorException;

/** 실행 중인 프레임 정보와 카탈로그 에러 신호 */
@Getter
public final class FrameContext {

  private static final StackWalker STACK_WALKER = StackWalker.getInstance();

  private final String procedureName;
  private final int procedureId;
  private final ErrorLookup errorLookup;

  FrameContext(String procedureName, int procedureId, ErrorLookup errorLookup) {
    this.procedureName = procedureName;
    this.procedureId = procedureId;
    this.errorLookup = errorLookup;
  }

  public StructuredErrorException signal(String errorName) {
    throw signal(errorName, List.of());
  }

  /**
   * 이 프레임이 소유한 카탈로그 에러 발생
   *
   * <p>항상 던집니다. {@code throw context.signal(...)} 또는 {@code orElseThrow(() -> context.signal(...))}
   * 형태로 사용하세요.
   *
   * @param errorName 카탈로그 에러 이름
   * @param tokens 치환 토큰 (T 노드로 기록됨, null 값은 생략, null 맵은 토큰 없음)
   */
  public StructuredErrorException signal(String errorName, Map<String, ?> tokens) {
    ContextNode.Builder context = ContextNode.builder();
    if (tokens != null) {
      tokens.forEach(context::put);
    }
    throw signal(errorName, List.of(context.build()));
  }

  /** 하위 에러 노드나 첨부를 포함해 신호 */
  public StructuredErrorException signal(String errorName, List<ErrorChild> children) {
    String message = errorLookup.lookupMessage(procedureName, errorName, children);
    throw StructuredErrorException.raise(message, procedureName, callerLine());
  }

  /** signal을 호출한 프레임 본문 라인 */
  private static Integer callerLine() {
    return STACK_WALKER.walk(
        frames ->
            frames
                .filter(frame -> !frame.getClassName().equals(FrameContext.class.getName()))
                .findFirst()
                .map(StackWalker.StackFrame::getLineNumber)
                .filter(line -> line > 0)
                .orElse(null));
  }
}
